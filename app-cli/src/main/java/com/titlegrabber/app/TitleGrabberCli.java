package com.titlegrabber.app;

import com.titlegrabber.app.logging.LogSetup;
import com.titlegrabber.core.model.GrabConfig;
import com.titlegrabber.core.model.GrabStats;
import com.titlegrabber.core.service.TitleGrabService;
import com.titlegrabber.core.util.YamlConfigLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Callable;

/**
 * CLI 진입점. 값 우선순위: 옵션 → 환경 변수 → YAML(-c 또는 ./title-grabber.yml) → 기본값.
 * 종료 코드: 0 성공, 1 파일 시스템 오류, 2 사용법 오류.
 */
@Command(name = "title-grabber",
        mixinStandardHelpOptions = true,
        version = "title-grabber 0.1.0",
        description = "Grabs page & article titles from lists of URLs contained in files passed in as arguments")
public class TitleGrabberCli implements Callable<Integer> {

    private static final Logger LOG = LoggerFactory.getLogger(TitleGrabberCli.class);

    static final Set<String> TRUE_VALS = Set.of("1", "t", "true", "True", "TRUE");

    @Parameters(arity = "1..*", paramLabel = "FILE",
            description = "1 or more files containing URLs (1 per line)")
    List<Path> files;

    @Option(names = {"-o", "--output"}, paramLabel = "FILE",
            description = "Output file (defaults to out.csv)")
    Path output;

    @Option(names = {"-c", "--config"}, paramLabel = "YAML",
            description = "Config file (defaults to ./title-grabber.yml when present)")
    Path config;

    @Option(names = {"-d", "--debug"},
            description = "Log to STDOUT instead of to a file in the CWD. Defaults to the value of the DEBUG env var or false")
    boolean debug;

    @Option(names = "--connect-timeout", paramLabel = "SECONDS", defaultValue = "${env:CONNECT_TIMEOUT}",
            description = "HTTP connect timeout. Defaults to the value of the CONNECT_TIMEOUT env var or 10")
    Long connectTimeout;

    @Option(names = "--read-timeout", paramLabel = "SECONDS", defaultValue = "${env:READ_TIMEOUT}",
            description = "HTTP read timeout. Defaults to the value of the READ_TIMEOUT env var or 15")
    Long readTimeout;

    @Option(names = "--max-redirects", paramLabel = "N", defaultValue = "${env:MAX_REDIRECTS}",
            description = "Max. # of HTTP redirects to follow. Defaults to the value of the MAX_REDIRECTS env var or 5")
    Integer maxRedirects;

    @Option(names = {"-r", "--max-retries"}, paramLabel = "N", defaultValue = "${env:MAX_RETRIES}",
            description = "Max. # of times to retry failed HTTP reqs. Defaults to the value of the MAX_RETRIES env var or 3")
    Integer maxRetries;

    @Option(names = {"-t", "--max-threads"}, paramLabel = "N", defaultValue = "${env:MAX_THREADS}",
            description = "Max. # of threads to use. Defaults to the value of the MAX_THREADS env var or the # of logical processors")
    Integer maxThreads;

    @Override
    public Integer call() {
        GrabConfig cfg;
        try {
            cfg = resolveConfig();
        } catch (IOException e) {
            // 설정 파일 없음/형식 오류
            System.err.println("Error: " + e.getMessage());
            return CommandLine.ExitCode.SOFTWARE;
        } catch (IllegalArgumentException e) {
            // 검증 실패는 사용법 오류로 취급
            System.err.println("Error: " + e.getMessage());
            return CommandLine.ExitCode.USAGE;
        }
        LogSetup.init(cfg.isDebug());

        // 전역 uncaught 핸들러
        Thread.setDefaultUncaughtExceptionHandler((t, e) ->
                LOG.error("Uncaught exception in {}", t.getName(), e));

        try {
            GrabStats.Snapshot s = new TitleGrabService(cfg).run();
            LOG.info("Done: {} cached, {} fetched, {} failed", s.cacheHits, s.fetched, s.failed);
            return CommandLine.ExitCode.OK;
        } catch (IOException e) {
            LOG.error("Run aborted", e);
            System.err.println("Error: " + e.getMessage());
            return CommandLine.ExitCode.SOFTWARE;
        }
    }

    /** YAML → 환경 변수/옵션 순서로 덮어쓰기 */
    GrabConfig resolveConfig() throws IOException {
        GrabConfig cfg = (config != null) ? YamlConfigLoader.load(config) : YamlConfigLoader.loadDefault();

        if (connectTimeout != null) cfg.setConnectTimeoutSeconds(connectTimeout);
        if (readTimeout != null) cfg.setReadTimeoutSeconds(readTimeout);
        if (maxRedirects != null) cfg.setMaxRedirects(maxRedirects);
        if (maxRetries != null) cfg.setMaxRetries(maxRetries);
        if (maxThreads != null) cfg.setMaxThreads(maxThreads);
        if (output != null) cfg.setOutputPath(output);
        if (debug || isTrue(System.getenv("DEBUG"))) cfg.setDebug(true);

        cfg.setInputPaths(files);
        cfg.validate();
        return cfg;
    }

    static boolean isTrue(String v) {
        return v != null && TRUE_VALS.contains(v.trim());
    }

    public static void main(String[] args) {
        int code = new CommandLine(new TitleGrabberCli()).execute(args);
        System.exit(code);
    }
}

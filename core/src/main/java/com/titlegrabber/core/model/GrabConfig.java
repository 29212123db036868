package com.titlegrabber.core.model;

import com.titlegrabber.core.permalink.PermalinkProfile;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * 실행 설정 (title-grabber.yml / CLI / ENV 매핑 대상). 값 보관만 한다.
 * 파이프라인은 생성 시점에 값을 복사하므로 실행 중 변경은 반영되지 않는다.
 */
public final class GrabConfig {

    public static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(10);
    public static final Duration DEFAULT_READ_TIMEOUT = Duration.ofSeconds(15);
    public static final int DEFAULT_MAX_REDIRECTS = 5;
    public static final int DEFAULT_MAX_RETRIES = 3;
    public static final Path DEFAULT_OUTPUT = Path.of("out.csv");

    // ---------- 필드 ----------
    private Duration connectTimeout = DEFAULT_CONNECT_TIMEOUT;
    private Duration readTimeout = DEFAULT_READ_TIMEOUT;
    private int maxRedirects = DEFAULT_MAX_REDIRECTS;
    private int maxRetries = DEFAULT_MAX_RETRIES;
    private int maxThreads = Runtime.getRuntime().availableProcessors();
    private List<Path> inputPaths = List.of();
    private Path outputPath = DEFAULT_OUTPUT;
    private boolean debug = false;                 // 로그 상세도만 영향
    private PermalinkProfile permalink = PermalinkProfile.twitter();

    // ---------- getters ----------
    public Duration getConnectTimeout() { return connectTimeout; }
    public Duration getReadTimeout() { return readTimeout; }
    public int getMaxRedirects() { return maxRedirects; }
    public int getMaxRetries() { return maxRetries; }
    public int getMaxThreads() { return maxThreads; }
    public List<Path> getInputPaths() { return inputPaths; }
    public Path getOutputPath() { return outputPath; }
    public boolean isDebug() { return debug; }
    public PermalinkProfile getPermalink() { return permalink; }

    /** 첫 시도 + 재시도 */
    public int getMaxAttempts() { return maxRetries + 1; }

    // ---------- fluent setters ----------
    public GrabConfig setConnectTimeoutSeconds(long s) { this.connectTimeout = Duration.ofSeconds(Math.max(1, s)); return this; }
    public GrabConfig setReadTimeoutSeconds(long s) { this.readTimeout = Duration.ofSeconds(Math.max(1, s)); return this; }
    public GrabConfig setMaxRedirects(int v) { this.maxRedirects = Math.max(0, v); return this; }
    public GrabConfig setMaxRetries(int v) { this.maxRetries = Math.max(0, v); return this; }
    public GrabConfig setMaxThreads(int v) { this.maxThreads = Math.max(1, v); return this; }
    public GrabConfig setInputPaths(List<Path> v) { this.inputPaths = (v == null ? List.of() : List.copyOf(v)); return this; }
    public GrabConfig setOutputPath(Path v) { this.outputPath = v; return this; }
    public GrabConfig setDebug(boolean v) { this.debug = v; return this; }
    public GrabConfig setPermalink(PermalinkProfile v) {
        this.permalink = (v != null ? v : PermalinkProfile.twitter());
        return this;
    }

    // ---------- validate ----------
    public void validate() {
        if (inputPaths == null || inputPaths.isEmpty())
            throw new IllegalArgumentException("at least 1 input file is required");
        Objects.requireNonNull(outputPath, "outputPath");
        requirePositive(connectTimeout, "connectTimeout");
        requirePositive(readTimeout, "readTimeout");
        if (maxRedirects < 0) throw new IllegalArgumentException("maxRedirects must be >= 0");
        if (maxRetries < 0) throw new IllegalArgumentException("maxRetries must be >= 0");
        if (maxThreads < 1) throw new IllegalArgumentException("maxThreads must be >= 1");
        Objects.requireNonNull(permalink, "permalink");
    }

    private static void requirePositive(Duration d, String name) {
        if (d == null || d.isNegative() || d.isZero())
            throw new IllegalArgumentException(name + " must be > 0");
    }

    public static GrabConfig defaults() { return new GrabConfig(); }
}

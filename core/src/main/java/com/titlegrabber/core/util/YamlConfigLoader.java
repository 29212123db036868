package com.titlegrabber.core.util;

import com.titlegrabber.core.model.GrabConfig;
import com.titlegrabber.core.permalink.PermalinkProfile;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;
import java.util.function.Consumer;
import java.util.function.IntConsumer;
import java.util.function.LongConsumer;
import java.util.regex.Pattern;

/**
 * title-grabber.yml을 읽어 GrabConfig로 변환. (입력 파일 목록은 CLI에서만 받음)
 *
 * 예상 YAML 키:
 * connectTimeout: 10      # 초
 * readTimeout: 15         # 초
 * maxRedirects: 5
 * maxRetries: 3
 * maxThreads: 8
 * output: "out.csv"
 * debug: false
 *
 * # 퍼머링크 규칙(옵션, 누락 키는 twitter 기본값)
 * permalink:
 *   hosts: ["twitter.com", "www.twitter.com"]
 *   origin: "https://twitter.com"
 *   containerSelector: ".permalink-tweet-container"
 *   textLinkSelector: ".js-tweet-text-container a"
 *   quoteLinkSelector: ".QuoteTweet-container a[href]"
 *   statusPattern: "^/.+/status/\\d+$"
 */
public final class YamlConfigLoader {

    public static final String DEFAULT_FILE = "title-grabber.yml";

    private YamlConfigLoader() {}

    /** 작업 디렉터리의 title-grabber.yml. 없으면 기본값 */
    public static GrabConfig loadDefault() throws IOException {
        Path p = Path.of(DEFAULT_FILE);
        return Files.exists(p) ? load(p) : GrabConfig.defaults();
    }

    public static GrabConfig load(Path yamlPath) throws IOException {
        Objects.requireNonNull(yamlPath, "yamlPath");
        if (!Files.exists(yamlPath)) {
            throw new IOException("config not found at: " + yamlPath.toAbsolutePath());
        }
        try (InputStream in = Files.newInputStream(yamlPath)) {
            LoaderOptions opts = new LoaderOptions();
            Yaml yaml = new Yaml(new SafeConstructor(opts));
            Object root = yaml.load(in);

            GrabConfig cfg = GrabConfig.defaults();

            if (!(root instanceof Map<?, ?> map)) {
                // 비어있거나 단순 스칼라면 defaults 유지
                return cfg;
            }

            // 1) 평면 키
            setLong(map, "connectTimeout", cfg::setConnectTimeoutSeconds);
            setLong(map, "readTimeout", cfg::setReadTimeoutSeconds);
            setInt(map, "maxRedirects", cfg::setMaxRedirects);
            setInt(map, "maxRetries", cfg::setMaxRetries);
            setInt(map, "maxThreads", cfg::setMaxThreads);
            setPath(map, "output", cfg::setOutputPath);
            setBoolean(map, "debug", cfg::setDebug);

            // 2) permalink.*
            Map<String, Object> pl = getMap(map, "permalink");
            if (pl != null) {
                cfg.setPermalink(permalinkOf(pl, cfg.getPermalink()));
            }
            return cfg;
        } catch (RuntimeException e) {
            // 문법 오류/타입 오류는 설정 파일 문제로 보고
            throw new IOException("invalid config " + yamlPath + ": " + e.getMessage(), e);
        }
    }

    private static PermalinkProfile permalinkOf(Map<String, Object> pl, PermalinkProfile base) {
        Set<String> hosts = base.hosts();
        List<String> hostList = stringList(pl.get("hosts"));
        if (!hostList.isEmpty()) hosts = new LinkedHashSet<>(hostList);

        URI origin = base.origin();
        Object o = pl.get("origin");
        if (o != null) origin = URI.create(String.valueOf(o).trim());

        Pattern status = base.statusPath();
        Object sp = pl.get("statusPattern");
        if (sp != null) {
            // 잘못된 정규식(PatternSyntaxException)은 설정 오류로 보고
            status = Pattern.compile(String.valueOf(sp));
        }

        return new PermalinkProfile(
                hosts,
                origin,
                stringOr(pl, "containerSelector", base.containerSelector()),
                stringOr(pl, "textLinkSelector", base.textLinkSelector()),
                stringOr(pl, "quoteLinkSelector", base.quoteLinkSelector()),
                status);
    }

    // ------------ helpers ------------
    @SuppressWarnings("unchecked")
    private static Map<String, Object> getMap(Map<?, ?> map, String key) {
        Object v = map.get(key);
        if (v instanceof Map<?, ?> m) return (Map<String, Object>) m;
        return null;
    }

    private static String stringOr(Map<?, ?> map, String key, String def) {
        Object v = map.get(key);
        if (v == null) return def;
        String s = String.valueOf(v).trim();
        return s.isEmpty() ? def : s;
    }

    private static List<String> stringList(Object v) {
        if (v == null) return List.of();
        List<String> out = new ArrayList<>();
        if (v instanceof List<?> list) {
            for (Object o : list) if (o != null && !String.valueOf(o).isBlank()) out.add(String.valueOf(o).trim());
            return out;
        }
        // "a,b,c" 형태 지원
        for (String p : String.valueOf(v).split("\\s*,\\s*")) if (!p.isBlank()) out.add(p.trim());
        return out;
    }

    private static void setBoolean(Map<?, ?> map, String key, Consumer<Boolean> setter) {
        Object v = map.get(key);
        if (v instanceof Boolean b) setter.accept(b);
        else if (v != null) setter.accept(Boolean.parseBoolean(String.valueOf(v)));
    }

    private static void setInt(Map<?, ?> map, String key, IntConsumer setter) {
        Object v = map.get(key);
        if (v instanceof Number n) setter.accept(n.intValue());
        else if (v != null) setter.accept(Integer.parseInt(String.valueOf(v).trim()));
    }

    private static void setLong(Map<?, ?> map, String key, LongConsumer setter) {
        Object v = map.get(key);
        if (v instanceof Number n) setter.accept(n.longValue());
        else if (v != null) setter.accept(Long.parseLong(String.valueOf(v).trim()));
    }

    private static void setPath(Map<?, ?> map, String key, Consumer<Path> setter) {
        Object v = map.get(key);
        if (v != null) setter.accept(Path.of(String.valueOf(v)));
    }
}

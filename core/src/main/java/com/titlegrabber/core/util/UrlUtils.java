package com.titlegrabber.core.util;

import java.net.URI;
import java.util.Locale;
import java.util.Optional;

/** URI 파싱/호스트 판정 유틸 */
public final class UrlUtils {
    private UrlUtils(){}

    /** 절대 http(s) URL로 파싱. 실패/상대경로/기타 스킴이면 empty. */
    public static Optional<URI> parseHttp(String raw) {
        if (raw == null) return Optional.empty();
        String s = raw.trim();
        if (s.isEmpty()) return Optional.empty();
        try {
            URI u = URI.create(s);
            if (!isHttp(u) || u.getHost() == null) return Optional.empty();
            return Optional.of(u);
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }

    /** base 기준 상대경로 해석. 실패 시 empty. */
    public static Optional<URI> resolve(URI base, String ref) {
        if (base == null || ref == null || ref.isBlank()) return Optional.empty();
        try {
            URI u = base.resolve(ref.trim());
            if (!isHttp(u) || u.getHost() == null) return Optional.empty();
            return Optional.of(u);
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }

    /** "http://" 또는 "https://"로 시작하는지(대소문자 무시) */
    public static boolean looksAbsolute(String raw) {
        if (raw == null) return false;
        String u = raw.trim().toLowerCase(Locale.ROOT);
        return u.startsWith("http://") || u.startsWith("https://");
    }

    public static boolean isHttp(URI u) {
        String s = (u == null ? null : u.getScheme());
        return s != null && (s.equalsIgnoreCase("http") || s.equalsIgnoreCase("https"));
    }

    /** 호스트 소문자. 없으면 "" */
    public static String host(URI u) {
        String h = (u == null ? null : u.getHost());
        return h == null ? "" : h.toLowerCase(Locale.ROOT);
    }

    /** 경로 세그먼트 수(빈 세그먼트 제외). "/a/b" → 2, "/" → 0 */
    public static int pathSegments(URI u) {
        String p = (u == null ? null : u.getPath());
        if (p == null || p.isEmpty()) return 0;
        int n = 0;
        for (String seg : p.split("/")) if (!seg.isEmpty()) n++;
        return n;
    }
}

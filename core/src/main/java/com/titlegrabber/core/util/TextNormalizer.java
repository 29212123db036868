package com.titlegrabber.core.util;

import java.util.regex.Pattern;

/**
 * 타이틀 문자열 정규화.
 * - 앞뒤 공백 제거
 * - 공백 문자(개행 포함) 2개 이상 연속 구간 → 공백 1개
 * 단일 공백/개행은 그대로 둔다. 이미 정규화된 문자열에 다시 적용해도 결과가 같다.
 */
public final class TextNormalizer {
    private TextNormalizer() {}

    private static final Pattern WS_RUN = Pattern.compile("\\s{2,}");

    public static String squish(String s) {
        if (s == null) return "";
        String t = s.strip();
        if (t.isEmpty()) return "";
        return WS_RUN.matcher(t).replaceAll(" ");
    }
}

package com.titlegrabber.core.input;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 입력 파일 스캐너: 줄마다 첫 번째 URL 모양 문자열 하나만 뽑는다.
 * 한 줄에 URL이 여러 개여도 첫 번째만 사용(의도된 동작).
 */
public final class UrlScanner {
    private UrlScanner() {}

    static final Pattern URL_RE = Pattern.compile("https?://\\S+");

    /** 후보 URL 처리 콜백. 싱크 기록 실패는 IOException으로 전파 */
    @FunctionalInterface
    public interface UrlHandler {
        void accept(String url) throws IOException;
    }

    public static Optional<String> firstUrl(String line) {
        if (line == null || line.isEmpty()) return Optional.empty();
        Matcher m = URL_RE.matcher(line);
        return m.find() ? Optional.of(m.group()) : Optional.empty();
    }

    /** 파일 순서/줄 순서대로 handler 호출. 파일 열기 실패는 IOException. */
    public static void scan(Path file, UrlHandler handler) throws IOException {
        // 잘못된 UTF-8 바이트는 치환 문자로 대체(InputStreamReader 기본 동작)
        try (BufferedReader r = new BufferedReader(
                new InputStreamReader(Files.newInputStream(file), StandardCharsets.UTF_8))) {
            String line;
            while ((line = r.readLine()) != null) {
                Optional<String> url = firstUrl(line);
                if (url.isPresent()) handler.accept(url.get());
            }
        }
    }
}

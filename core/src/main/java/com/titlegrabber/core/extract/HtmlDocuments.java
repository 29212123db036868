package com.titlegrabber.core.extract;

import com.titlegrabber.core.model.FetchedPage;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.Charset;
import java.util.Locale;

/** 응답 바이트 → jsoup Document. 문자셋은 Content-Type 우선, 없으면 jsoup 자동 감지. */
public final class HtmlDocuments {
    private HtmlDocuments() {}

    public static Document parse(FetchedPage page) throws IOException {
        String charset = charsetOf(page.getContentType());
        return Jsoup.parse(new ByteArrayInputStream(page.getBody()), charset, page.getFinalUrl().toString());
    }

    /** "text/html; charset=ISO-8859-1" → "ISO-8859-1". 미지원/누락이면 null(자동 감지). */
    static String charsetOf(String contentType) {
        if (contentType == null) return null;
        for (String part : contentType.split(";")) {
            String p = part.trim();
            if (p.toLowerCase(Locale.ROOT).startsWith("charset=")) {
                String cs = p.substring("charset=".length()).trim().replace("\"", "").replace("'", "");
                try {
                    return Charset.isSupported(cs) ? cs : null;
                } catch (IllegalArgumentException e) {
                    return null;
                }
            }
        }
        return null;
    }
}

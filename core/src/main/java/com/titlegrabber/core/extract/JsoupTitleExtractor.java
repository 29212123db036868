package com.titlegrabber.core.extract;

import com.titlegrabber.core.api.ITitleExtractor;
import com.titlegrabber.core.model.PageTitles;
import com.titlegrabber.core.util.TextNormalizer;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.TextNode;

import java.util.ArrayList;
import java.util.List;

/**
 * 기본 JSoup 기반 제목 추출기.
 * - page_title: 첫 title 요소의 텍스트
 * - article_title: article 계열 컨테이너 안의 첫 h1, 없으면 문서 전체의 첫 h1
 *   (텍스트 노드들을 공백 하나로 이어 붙임)
 */
public class JsoupTitleExtractor implements ITitleExtractor {

    static final String ARTICLE_H1 = "article h1, [role=article] h1";

    @Override
    public PageTitles extract(Document doc) {
        if (doc == null) return PageTitles.EMPTY;

        Element title = doc.selectFirst("title");
        String pageTitle = (title == null) ? "" : TextNormalizer.squish(title.text());

        Element h1 = doc.selectFirst(ARTICLE_H1);
        if (h1 == null) h1 = doc.selectFirst("h1");
        String articleTitle = (h1 == null) ? "" : TextNormalizer.squish(joinTextNodes(h1));

        return new PageTitles(pageTitle, articleTitle);
    }

    private static String joinTextNodes(Element el) {
        List<String> parts = new ArrayList<>();
        el.traverse((node, depth) -> {
            if (node instanceof TextNode tn) {
                String t = tn.getWholeText();
                if (!t.isBlank()) parts.add(t);
            }
        });
        return String.join(" ", parts);
    }
}

package com.titlegrabber.core.api;

import com.titlegrabber.core.model.PageTitles;
import org.jsoup.nodes.Document;

/** HTML 문서에서 페이지/기사 제목을 뽑는다. */
public interface ITitleExtractor {
    PageTitles extract(Document doc);
}

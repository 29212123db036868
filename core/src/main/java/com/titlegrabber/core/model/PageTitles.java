package com.titlegrabber.core.model;

/** 추출 결과. 둘 다 정규화 완료 상태이며 없으면 "". */
public record PageTitles(String pageTitle, String articleTitle) {
    public static final PageTitles EMPTY = new PageTitles("", "");

    public PageTitles {
        pageTitle = (pageTitle == null) ? "" : pageTitle;
        articleTitle = (articleTitle == null) ? "" : articleTitle;
    }
}

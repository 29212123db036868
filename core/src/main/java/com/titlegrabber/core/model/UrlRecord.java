package com.titlegrabber.core.model;

import java.util.Objects;

/**
 * 출력 한 행: url, end_url, page_title, article_title.
 * 제목이 없으면 null 대신 빈 문자열로 보관한다.
 */
public final class UrlRecord {
    private final String url;
    private final String endUrl;
    private final String pageTitle;
    private final String articleTitle;

    public UrlRecord(String url, String endUrl, String pageTitle, String articleTitle) {
        this.url = Objects.requireNonNull(url, "url");
        this.endUrl = (endUrl == null) ? "" : endUrl;
        this.pageTitle = (pageTitle == null) ? "" : pageTitle;
        this.articleTitle = (articleTitle == null) ? "" : articleTitle;
    }

    public String getUrl() { return url; }
    public String getEndUrl() { return endUrl; }
    public String getPageTitle() { return pageTitle; }
    public String getArticleTitle() { return articleTitle; }

    /** 캐시 대상 여부: 제목 둘 중 하나라도 있어야 함 */
    public boolean hasAnyTitle() {
        return !pageTitle.isEmpty() || !articleTitle.isEmpty();
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof UrlRecord r)) return false;
        return url.equals(r.url) && endUrl.equals(r.endUrl)
                && pageTitle.equals(r.pageTitle) && articleTitle.equals(r.articleTitle);
    }

    @Override public int hashCode() {
        return Objects.hash(url, endUrl, pageTitle, articleTitle);
    }

    @Override public String toString() {
        return "UrlRecord{url=" + url + ", endUrl=" + endUrl
                + ", pageTitle=" + pageTitle + ", articleTitle=" + articleTitle + '}';
    }
}

package com.titlegrabber.core.output;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.titlegrabber.core.model.UrlRecord;

/** CSV 바인딩 DTO (url,end_url,page_title,article_title) */
@JsonPropertyOrder({"url", "end_url", "page_title", "article_title"})
@JsonIgnoreProperties(ignoreUnknown = true)
public final class CsvRow {
    @JsonProperty("url") public String url;
    @JsonProperty("end_url") public String endUrl;
    @JsonProperty("page_title") public String pageTitle;
    @JsonProperty("article_title") public String articleTitle;

    public CsvRow() {}

    static CsvRow of(UrlRecord r) {
        CsvRow row = new CsvRow();
        row.url = r.getUrl();
        row.endUrl = r.getEndUrl();
        row.pageTitle = r.getPageTitle();
        row.articleTitle = r.getArticleTitle();
        return row;
    }

    /** url이 비어 있으면 null */
    public UrlRecord toRecord() {
        if (url == null || url.isBlank()) return null;
        return new UrlRecord(url, endUrl, pageTitle, articleTitle);
    }
}

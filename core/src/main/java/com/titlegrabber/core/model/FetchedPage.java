package com.titlegrabber.core.model;

import java.net.URI;
import java.util.Objects;

/**
 * 단일 URL 페치 결과(리다이렉트 추적 완료 상태).
 * statusCode -1 = 전송 오류/타임아웃(응답 없음). 이 경우 finalUrl은 마지막으로 시도한 위치.
 */
public final class FetchedPage {
    public static final int NO_RESPONSE = -1;

    private final URI requestedUrl;
    private final URI finalUrl;
    private final int statusCode;
    private final byte[] body;
    private final String contentType;
    private final int attempts;
    private final String error;

    private FetchedPage(Builder b) {
        this.requestedUrl = b.requestedUrl;
        this.finalUrl = (b.finalUrl == null) ? b.requestedUrl : b.finalUrl;
        this.statusCode = b.statusCode;
        this.body = (b.body == null) ? new byte[0] : b.body;
        this.contentType = b.contentType;
        this.attempts = Math.max(1, b.attempts);
        this.error = b.error;
    }

    public URI getRequestedUrl() { return requestedUrl; }
    public URI getFinalUrl() { return finalUrl; }
    public int getStatusCode() { return statusCode; }
    public byte[] getBody() { return body; }
    public String getContentType() { return contentType; }
    /** 재시도 포함 실제 요청 횟수(1 이상) */
    public int getAttempts() { return attempts; }
    /** 전송 오류 설명(없으면 null) */
    public String getError() { return error; }

    public boolean isSuccess() { return statusCode >= 200 && statusCode < 300; }
    public boolean hasResponse() { return statusCode != NO_RESPONSE; }

    /** 재시도 횟수만 바꾼 복사본 */
    public FetchedPage withAttempts(int attempts) {
        return builder().requestedUrl(requestedUrl).finalUrl(finalUrl).statusCode(statusCode)
                .body(body).contentType(contentType).attempts(attempts).error(error).build();
    }

    public static Builder builder() { return new Builder(); }

    public static final class Builder {
        private URI requestedUrl;
        private URI finalUrl;
        private int statusCode = NO_RESPONSE;
        private byte[] body;
        private String contentType;
        private int attempts = 1;
        private String error;

        public Builder requestedUrl(URI v) { this.requestedUrl = v; return this; }
        public Builder finalUrl(URI v) { this.finalUrl = v; return this; }
        public Builder statusCode(int v) { this.statusCode = v; return this; }
        public Builder body(byte[] v) { this.body = v; return this; }
        public Builder contentType(String v) { this.contentType = v; return this; }
        public Builder attempts(int v) { this.attempts = v; return this; }
        public Builder error(String v) { this.error = v; return this; }

        public FetchedPage build() {
            Objects.requireNonNull(requestedUrl, "requestedUrl");
            return new FetchedPage(this);
        }
    }
}

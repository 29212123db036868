package com.titlegrabber.core.http;

import java.time.Duration;

/**
 * 전송 오류(-1)/타임아웃/5xx에서만 재시도. 4xx 등은 즉시 종료.
 * 지연은 선형: attempt × base (기본 1초 → 1s, 2s, 3s ...).
 * 총 시도 = maxRetries + 1.
 */
public final class LinearBackoffRetryPolicy implements RetryPolicy {
    private final int maxAttempts;
    private final Duration base;

    public LinearBackoffRetryPolicy(int maxRetries) { this(maxRetries, Duration.ofSeconds(1)); }

    public LinearBackoffRetryPolicy(int maxRetries, Duration base) {
        this.maxAttempts = Math.max(0, maxRetries) + 1;
        this.base = (base == null || base.isNegative()) ? Duration.ZERO : base;
    }

    @Override public boolean shouldRetry(int statusCode, int attempt) {
        if (attempt >= maxAttempts) return false;
        return isRetryable(statusCode);
    }

    @Override public Duration nextDelay(int attempt) {
        return base.multipliedBy(Math.max(1, attempt));
    }

    @Override public int maxAttempts() { return maxAttempts; }

    public static boolean isRetryable(int statusCode) {
        return statusCode == -1 || (statusCode >= 500 && statusCode < 600);
    }
}

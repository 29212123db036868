package com.titlegrabber.core.http;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class LinearBackoffRetryPolicyTest {

    @Test
    void shouldRetry_only_on_minus1_or_5xx_and_stop_after_maxRetries() {
        var p = new LinearBackoffRetryPolicy(3);

        assertEquals(4, p.maxAttempts(), "maxAttempts = maxRetries + 1");

        int[] retryables = {-1, 500, 502, 503, 504, 599};
        for (int sc : retryables) {
            assertTrue(p.shouldRetry(sc, 1), "retry after 1st failure for " + sc);
            assertTrue(p.shouldRetry(sc, 3), "retry after 3rd failure for " + sc);
            assertFalse(p.shouldRetry(sc, 4), "must stop at attempt=4 for " + sc);
        }

        int[] terminal = {200, 204, 301, 302, 400, 401, 403, 404, 410, 429};
        for (int sc : terminal) {
            assertFalse(p.shouldRetry(sc, 1), "must not retry for " + sc);
        }
    }

    @Test
    void zero_retries_means_single_attempt() {
        var p = new LinearBackoffRetryPolicy(0);
        assertEquals(1, p.maxAttempts());
        assertFalse(p.shouldRetry(503, 1));
        assertFalse(p.shouldRetry(-1, 1));

        // 음수는 0으로 취급
        assertEquals(1, new LinearBackoffRetryPolicy(-5).maxAttempts());
    }

    @Test
    void backoff_is_linear_in_attempt_number() {
        var p = new LinearBackoffRetryPolicy(3);
        assertEquals(Duration.ofSeconds(1), p.nextDelay(1));
        assertEquals(Duration.ofSeconds(2), p.nextDelay(2));
        assertEquals(Duration.ofSeconds(3), p.nextDelay(3));

        var fast = new LinearBackoffRetryPolicy(3, Duration.ofMillis(10));
        assertEquals(Duration.ofMillis(20), fast.nextDelay(2));
    }
}

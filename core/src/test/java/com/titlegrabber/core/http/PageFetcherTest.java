package com.titlegrabber.core.http;

import com.titlegrabber.core.api.GrabObserver;
import com.titlegrabber.core.model.FetchedPage;
import com.titlegrabber.core.model.GrabConfig;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class PageFetcherTest {

    private static final URI URL = URI.create("https://example.com/page1");

    private final RecordingSleeper sleeper = new RecordingSleeper();
    private final List<Integer> retriedStatuses = new CopyOnWriteArrayList<>();

    private final GrabObserver observer = new GrabObserver() {
        @Override public void onRetry(URI url, int status, int attempt, Duration delay) {
            retriedStatuses.add(status);
        }
    };

    private PageFetcher fetcher(GrabConfig cfg, PageFetcher.HttpSender sender) {
        return new PageFetcher(cfg, sender, new LinearBackoffRetryPolicy(cfg.getMaxRetries()), sleeper, observer);
    }

    @Test
    @DisplayName("max_retries=2: 3번 연속 503이면 실패, 지연은 1s → 2s")
    void gives_up_after_max_retries_plus_one_attempts() {
        GrabConfig cfg = GrabConfig.defaults().setMaxRetries(2);
        AtomicInteger calls = new AtomicInteger();

        FetchedPage page = fetcher(cfg, req -> {
            calls.incrementAndGet();
            return FakeResponse.status(503);
        }).fetch(URL);

        assertThat(page.isSuccess()).isFalse();
        assertThat(page.getStatusCode()).isEqualTo(503);
        assertThat(page.getAttempts()).isEqualTo(3);
        assertThat(calls.get()).isEqualTo(3);
        assertThat(sleeper.sleeps).containsExactly(Duration.ofSeconds(1), Duration.ofSeconds(2));
        assertThat(retriedStatuses).containsExactly(503, 503);
    }

    @Test
    @DisplayName("max_retries=2: 두 번 실패 후 세 번째 성공이면 성공")
    void succeeds_on_last_allowed_attempt() {
        GrabConfig cfg = GrabConfig.defaults().setMaxRetries(2);
        AtomicInteger calls = new AtomicInteger();

        FetchedPage page = fetcher(cfg, req -> {
            int n = calls.incrementAndGet();
            if (n == 1) throw new HttpTimeoutException("request timed out");
            if (n == 2) return FakeResponse.status(500);
            return FakeResponse.html("<title>ok</title>");
        }).fetch(URL);

        assertThat(page.isSuccess()).isTrue();
        assertThat(page.getAttempts()).isEqualTo(3);
        assertThat(new String(page.getBody(), StandardCharsets.UTF_8)).contains("<title>ok</title>");
        assertThat(page.getContentType()).startsWith("text/html");
        assertThat(retriedStatuses).containsExactly(-1, 500);
    }

    @Test
    void client_errors_are_terminal() {
        GrabConfig cfg = GrabConfig.defaults().setMaxRetries(3);
        AtomicInteger calls = new AtomicInteger();

        for (int sc : new int[]{404, 429}) {
            calls.set(0);
            FetchedPage page = fetcher(cfg, req -> {
                calls.incrementAndGet();
                return FakeResponse.status(sc);
            }).fetch(URL);

            assertThat(page.getStatusCode()).isEqualTo(sc);
            assertThat(page.getAttempts()).isEqualTo(1);
            assertThat(calls.get()).isEqualTo(1);
        }
        assertThat(sleeper.sleeps).isEmpty();
    }

    @Test
    @DisplayName("전송 예외는 status -1로 매핑되고 재시도 대상")
    void transport_error_maps_to_no_response() {
        GrabConfig cfg = GrabConfig.defaults().setMaxRetries(1);

        FetchedPage page = fetcher(cfg, req -> {
            throw new IOException("connection refused");
        }).fetch(URL);

        assertThat(page.hasResponse()).isFalse();
        assertThat(page.getStatusCode()).isEqualTo(FetchedPage.NO_RESPONSE);
        assertThat(page.getError()).contains("connection refused");
        assertThat(page.getAttempts()).isEqualTo(2);
        assertThat(sleeper.sleeps).containsExactly(Duration.ofSeconds(1));
    }

    @Test
    @DisplayName("리다이렉트(상대 Location 포함)를 따라가고 최종 URL을 기록")
    void follows_redirects_and_records_final_url() {
        GrabConfig cfg = GrabConfig.defaults().setMaxRedirects(5);
        List<URI> requested = new ArrayList<>();

        FetchedPage page = fetcher(cfg, req -> {
            requested.add(req.uri());
            switch (req.uri().getPath()) {
                case "/page1": return FakeResponse.redirect(301, "/moved");
                case "/moved": return FakeResponse.redirect(302, "https://www.example.org/final");
                default: return FakeResponse.html("<title>final</title>");
            }
        }).fetch(URL);

        assertThat(page.isSuccess()).isTrue();
        assertThat(page.getRequestedUrl()).isEqualTo(URL);
        assertThat(page.getFinalUrl()).isEqualTo(URI.create("https://www.example.org/final"));
        assertThat(requested).containsExactly(
                URL,
                URI.create("https://example.com/moved"),
                URI.create("https://www.example.org/final"));
    }

    @Test
    @DisplayName("리다이렉트 hop 수가 상한을 넘으면 실패(재시도 없음)")
    void redirect_limit_is_exact_hop_count() {
        GrabConfig cfg = GrabConfig.defaults().setMaxRedirects(2);
        AtomicInteger calls = new AtomicInteger();

        FetchedPage page = fetcher(cfg, req -> {
            calls.incrementAndGet();
            return FakeResponse.redirect(302, "/loop" + calls.get());
        }).fetch(URL);

        assertThat(page.isSuccess()).isFalse();
        assertThat(page.getStatusCode()).isEqualTo(302);
        assertThat(page.getError()).isEqualTo("too many redirects");
        // 최초 요청 1 + hop 2
        assertThat(calls.get()).isEqualTo(3);
        assertThat(page.getAttempts()).isEqualTo(1);
    }

    @Test
    void zero_redirects_allowed_stops_at_first_redirect() {
        GrabConfig cfg = GrabConfig.defaults().setMaxRedirects(0);
        AtomicInteger calls = new AtomicInteger();

        FetchedPage page = fetcher(cfg, req -> {
            calls.incrementAndGet();
            return FakeResponse.redirect(301, "https://example.com/elsewhere");
        }).fetch(URL);

        assertThat(page.getStatusCode()).isEqualTo(301);
        assertThat(calls.get()).isEqualTo(1);
    }

    @Test
    void sends_user_agent_and_read_timeout() {
        GrabConfig cfg = GrabConfig.defaults().setReadTimeoutSeconds(7);
        List<String> agents = new ArrayList<>();
        List<Duration> timeouts = new ArrayList<>();

        fetcher(cfg, req -> {
            agents.add(req.headers().firstValue("User-Agent").orElse(""));
            timeouts.add(req.timeout().orElse(null));
            return FakeResponse.html("<title>x</title>");
        }).fetch(URL);

        assertThat(agents).containsExactly(PageFetcher.USER_AGENT);
        assertThat(timeouts).containsExactly(Duration.ofSeconds(7));
    }
}

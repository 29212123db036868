package com.titlegrabber.core.http;

import com.titlegrabber.core.api.GrabObserver;
import com.titlegrabber.core.api.IPageFetcher;
import com.titlegrabber.core.model.FetchedPage;
import com.titlegrabber.core.model.GrabConfig;
import com.titlegrabber.core.util.Sleeper;
import com.titlegrabber.core.util.UrlUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * HttpClient 래퍼: connect/read 타임아웃, 리다이렉트 상한, 재시도/백오프.
 * - 리다이렉트는 직접 추적(클라이언트는 Redirect.NEVER) → maxRedirects가 정확한 hop 수
 * - 예외(전송 오류/타임아웃)는 status -1로 매핑
 * - HttpClient는 스레드 세이프이므로 워커 전체가 공유
 */
public class PageFetcher implements IPageFetcher {

    private static final Logger LOG = LoggerFactory.getLogger(PageFetcher.class);

    static final String USER_AGENT = "TitleGrabber/0.1 (+https://github.com/title-grabber)";
    static final String ACCEPT = "text/html,application/xhtml+xml,application/xml;q=0.9,*/*;q=0.8";

    /** 테스트/모킹용 송신 훅 */
    @FunctionalInterface
    public interface HttpSender {
        HttpResponse<byte[]> send(HttpRequest req) throws Exception;
    }

    private final Duration readTimeout;
    private final int maxRedirects;
    private final HttpSender sender;
    private final RetryPolicy policy;
    private final Sleeper sleeper;
    private final GrabObserver observer;

    public PageFetcher(GrabConfig config, GrabObserver observer) {
        this(config, clientSender(config), new LinearBackoffRetryPolicy(config.getMaxRetries()),
                Sleeper.THREAD, observer);
    }

    /** DI/테스트용 */
    public PageFetcher(GrabConfig config, HttpSender sender, RetryPolicy policy,
                       Sleeper sleeper, GrabObserver observer) {
        Objects.requireNonNull(config, "config");
        this.readTimeout = Objects.requireNonNull(config.getReadTimeout(), "readTimeout");
        this.maxRedirects = config.getMaxRedirects();
        this.sender = Objects.requireNonNull(sender, "sender");
        this.policy = Objects.requireNonNull(policy, "policy");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
        this.observer = (observer != null) ? observer : GrabObserver.NONE;
    }

    private static HttpSender clientSender(GrabConfig config) {
        HttpClient client = HttpClient.newBuilder()
                .followRedirects(HttpClient.Redirect.NEVER)
                .connectTimeout(config.getConnectTimeout())
                .build();
        return req -> client.send(req, HttpResponse.BodyHandlers.ofByteArray());
    }

    /** 재시도 포함 버전: -1/5xx에서만 재시도, 선형 백오프 */
    @Override
    public FetchedPage fetch(URI url) {
        Objects.requireNonNull(url, "url");
        int attempt = 1;
        while (true) {
            FetchedPage page = fetchOnce(url);
            observer.onAttempt(url, page.getStatusCode(), attempt);

            if (page.isSuccess() || !policy.shouldRetry(page.getStatusCode(), attempt)) {
                return page.withAttempts(attempt);
            }

            Duration delay = policy.nextDelay(attempt);
            LOG.warn("GET {} [{}] - Retry: {}", url, describe(page), attempt);
            observer.onRetry(url, page.getStatusCode(), attempt, delay);
            try {
                sleeper.sleep(delay);
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                return page.withAttempts(attempt);
            }
            attempt++;
        }
    }

    /** 단일 시도(리다이렉트 추적 포함). 예외 시 status -1. */
    public FetchedPage fetchOnce(URI url) {
        URI current = url;
        int hops = 0;
        while (true) {
            HttpResponse<byte[]> resp;
            try {
                HttpRequest req = HttpRequest.newBuilder(current)
                        .timeout(readTimeout)
                        .header("User-Agent", USER_AGENT)
                        .header("Accept", ACCEPT)
                        .GET()
                        .build();
                resp = sender.send(req);
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                return noResponse(url, current, "interrupted");
            } catch (Exception e) {
                return noResponse(url, current, e.toString());
            }

            int sc = resp.statusCode();
            if (isRedirect(sc)) {
                final URI base = current;
                Optional<URI> next = resp.headers().firstValue("Location")
                        .flatMap(loc -> UrlUtils.resolve(base, loc));
                if (next.isPresent()) {
                    if (hops >= maxRedirects) {
                        LOG.debug("GET {} - too many redirects (>{})", url, maxRedirects);
                        return FetchedPage.builder()
                                .requestedUrl(url).finalUrl(current).statusCode(sc)
                                .error("too many redirects")
                                .build();
                    }
                    hops++;
                    current = next.get();
                    continue;
                }
            }

            return FetchedPage.builder()
                    .requestedUrl(url)
                    .finalUrl(current)
                    .statusCode(sc)
                    .body(resp.body())
                    .contentType(resp.headers().firstValue("Content-Type").orElse(null))
                    .build();
        }
    }

    private static FetchedPage noResponse(URI requested, URI current, String error) {
        return FetchedPage.builder()
                .requestedUrl(requested)
                .finalUrl(current)
                .statusCode(FetchedPage.NO_RESPONSE)
                .error(error)
                .build();
    }

    static boolean isRedirect(int sc) {
        return sc == 301 || sc == 302 || sc == 303 || sc == 307 || sc == 308;
    }

    static String describe(FetchedPage page) {
        return page.hasResponse() ? String.valueOf(page.getStatusCode()) : String.valueOf(page.getError());
    }
}

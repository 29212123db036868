package com.titlegrabber.core.service;

import com.titlegrabber.core.api.GrabObserver;
import com.titlegrabber.core.model.GrabStats;
import com.titlegrabber.core.model.UrlRecord;
import com.titlegrabber.core.util.EventLog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.nio.file.Path;
import java.time.Duration;

/** 기본 관측기: SLF4J 텍스트 로그 + JSON 이벤트(EventLog) */
public final class LoggingGrabObserver implements GrabObserver {

    private static final Logger LOG = LoggerFactory.getLogger(TitleGrabService.class);
    private static final EventLog EVENTS = EventLog.get(TitleGrabService.class);

    @Override public void onFileStart(Path file) {
        LOG.info("FILE: {}", file);
    }

    @Override public void onCacheHit(String url) {
        LOG.debug("Cached: {}", url);
    }

    @Override public void onAttempt(URI url, int statusCode, int attempt) {
        LOG.debug("GET {} - [{}] attempt #{}", url, statusCode, attempt);
    }

    @Override public void onRetry(URI url, int statusCode, int attempt, Duration delay) {
        EVENTS.warn("retry",
                "url", String.valueOf(url),
                "status", statusCode,
                "attempt", attempt,
                "delayMs", delay.toMillis());
    }

    @Override public void onGiveUp(String url, String reason) {
        LOG.warn("GET {} - [{}]", url, reason);
        EVENTS.warn("give-up", "url", url, "reason", reason);
    }

    @Override public void onRecord(UrlRecord r) {
        EVENTS.debug("record",
                "url", r.getUrl(),
                "endUrl", r.getEndUrl(),
                "pageTitle", r.getPageTitle(),
                "articleTitle", r.getArticleTitle());
    }

    @Override public void onFinished(GrabStats.Snapshot s) {
        LOG.info("Grab done. cached={}, fetched={}, failed={}, duplicates={}, attempts={}, retries={}, maxObservedCC={}",
                s.cacheHits, s.fetched, s.failed, s.duplicates, s.attemptsTotal, s.retriesTotal, s.maxObservedConcurrency);
        EVENTS.info("grab-done",
                "cached", s.cacheHits,
                "fetched", s.fetched,
                "failed", s.failed,
                "duplicates", s.duplicates,
                "attempts", s.attemptsTotal,
                "retries", s.retriesTotal,
                "maxObservedCC", s.maxObservedConcurrency);
    }
}

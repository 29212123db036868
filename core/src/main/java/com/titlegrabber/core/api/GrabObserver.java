package com.titlegrabber.core.api;

import com.titlegrabber.core.model.GrabStats;
import com.titlegrabber.core.model.UrlRecord;

import java.net.URI;
import java.nio.file.Path;
import java.time.Duration;

/**
 * 파이프라인 관측 훅. 전역 로거 대신 주입해서 쓴다.
 * 워커 스레드에서 동시에 호출될 수 있으므로 구현은 스레드 세이프해야 한다.
 */
public interface GrabObserver {
    default void onFileStart(Path file) {}
    default void onCacheHit(String url) {}
    /** 응답 1건(리다이렉트 추적 완료) 수신 또는 전송 실패(status -1) */
    default void onAttempt(URI url, int statusCode, int attempt) {}
    default void onRetry(URI url, int statusCode, int attempt, Duration delay) {}
    /** 해당 URL은 행 없이 종료(캐시되지 않으므로 다음 실행에서 재시도) */
    default void onGiveUp(String url, String reason) {}
    default void onRecord(UrlRecord record) {}
    default void onFinished(GrabStats.Snapshot stats) {}

    GrabObserver NONE = new GrabObserver() {};
}

package com.titlegrabber.core.util;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/** 재시도 대기 추상화. 테스트에서는 기록만 하는 구현으로 교체한다. */
@FunctionalInterface
public interface Sleeper {
    void sleep(Duration d) throws InterruptedException;

    /** 호출한 워커 스레드만 멈춘다. 0 이하 지연은 즉시 반환 */
    Sleeper THREAD = d -> {
        if (d != null && !d.isNegative() && !d.isZero()) TimeUnit.MILLISECONDS.sleep(d.toMillis());
    };
}

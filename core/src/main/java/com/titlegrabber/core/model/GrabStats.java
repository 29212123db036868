package com.titlegrabber.core.model;

import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/** 런타임 텔레메트리 누적기 (스레드 세이프). */
public final class GrabStats {
    private final AtomicLong attemptsTotal = new AtomicLong(0);   // HTTP 시도(재시도, 2차 페치 포함)
    private final AtomicLong retriesTotal  = new AtomicLong(0);
    private final AtomicInteger cacheHits  = new AtomicInteger(0);
    private final AtomicInteger fetched    = new AtomicInteger(0); // 행이 만들어진 비캐시 URL
    private final AtomicInteger failed     = new AtomicInteger(0); // "레코드 없음" 신호
    private final AtomicInteger duplicates = new AtomicInteger(0);
    private final AtomicInteger maxObservedConcurrency = new AtomicInteger(0);

    public void addAttempts(int attempts) {
        attemptsTotal.addAndGet(attempts);
        retriesTotal.addAndGet(Math.max(0, attempts - 1));
    }
    public void cacheHit()   { cacheHits.incrementAndGet(); }
    public void fetched()    { fetched.incrementAndGet(); }
    public void failed()     { failed.incrementAndGet(); }
    public void duplicate()  { duplicates.incrementAndGet(); }

    /** 현재 동시 실행 수를 관측하여 최대값 갱신 */
    public void observeConcurrency(int current) {
        maxObservedConcurrency.accumulateAndGet(current, Math::max);
    }

    public Snapshot snapshot() {
        return new Snapshot(attemptsTotal.get(), retriesTotal.get(), cacheHits.get(),
                fetched.get(), failed.get(), duplicates.get(), maxObservedConcurrency.get());
    }

    /** 불변 스냅샷 DTO */
    public static final class Snapshot {
        public final long attemptsTotal;
        public final long retriesTotal;
        public final int cacheHits;
        public final int fetched;
        public final int failed;
        public final int duplicates;
        public final int maxObservedConcurrency;

        public Snapshot(long attempts, long retries, int cacheHits, int fetched,
                        int failed, int duplicates, int maxCC) {
            this.attemptsTotal = attempts;
            this.retriesTotal = retries;
            this.cacheHits = cacheHits;
            this.fetched = fetched;
            this.failed = failed;
            this.duplicates = duplicates;
            this.maxObservedConcurrency = maxCC;
        }
    }
}

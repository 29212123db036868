package com.titlegrabber.core.service;

import java.util.concurrent.CancellationException;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 고정 크기 워커 풀 (submit / join).
 * - 동시 실행 상한 = size, 대기열도 size로 제한
 * - 포화 시 submit은 자리가 날 때까지 블록(역압)
 * - submittedCount: 실제로 접수된 작업 수(결과 채널 드레인 횟수)
 */
public final class WorkerPool implements AutoCloseable {

    private final ThreadPoolExecutor exec;
    private final AtomicInteger submitted = new AtomicInteger(0);

    public WorkerPool(int size, String threadPrefix) {
        int n = Math.max(1, size);
        this.exec = new ThreadPoolExecutor(
                n, n,
                0L, TimeUnit.MILLISECONDS,
                new LinkedBlockingQueue<>(n),
                new NamedThreadFactory(threadPrefix),
                (r, e) -> {
                    if (e.isShutdown()) throw new RejectedExecutionException("pool is shut down");
                    try { e.getQueue().put(r); }
                    catch (InterruptedException ie) {
                        Thread.currentThread().interrupt();
                        throw new RejectedExecutionException("Interrupted while enqueueing", ie);
                    }
                }
        );
    }

    /** 작업 접수. 포화 상태면 블록. 접수된 경우에만 카운트 증가. */
    public void submit(Runnable task) {
        exec.execute(task);
        submitted.incrementAndGet();
    }

    public int submittedCount() {
        return submitted.get();
    }

    /** 접수된 작업이 모두 끝날 때까지 대기(전체 join). 이후 submit 불가. */
    public void join() {
        exec.shutdown();
        try {
            while (!exec.awaitTermination(1, TimeUnit.SECONDS)) {
                // 파이프라인 수준 타임아웃 없음: 요청별 타임아웃에 의존
            }
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            exec.shutdownNow();
            throw new CancellationException("Interrupted while waiting for workers");
        }
    }

    @Override
    public void close() {
        if (!exec.isTerminated()) exec.shutdownNow();
    }

    static final class NamedThreadFactory implements ThreadFactory {
        private final String prefix;
        private final AtomicInteger seq = new AtomicInteger(1);
        NamedThreadFactory(String prefix) { this.prefix = prefix; }
        @Override public Thread newThread(Runnable r) {
            Thread t = new Thread(r, prefix + "-" + seq.getAndIncrement());
            t.setDaemon(true);
            return t;
        }
    }
}

package com.titlegrabber.core.http;

import java.time.Duration;

/** 실패한 페치를 다시 시도할지, 얼마나 기다릴지 결정 */
public interface RetryPolicy {
    /** attempt: 방금 끝난 시도 번호(1부터). false면 그 결과로 종료 */
    boolean shouldRetry(int statusCode, int attempt);
    /** attempt번째 실패 뒤 대기 시간 */
    Duration nextDelay(int attempt);
    /** 첫 시도 + 재시도 전체 상한 */
    int maxAttempts();
}

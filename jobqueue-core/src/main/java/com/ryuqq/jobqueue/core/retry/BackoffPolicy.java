package com.ryuqq.jobqueue.core.retry;

import java.time.Duration;
import java.time.Instant;

/**
 * 실패한 Job의 재시도 지연 계산기.
 *
 * <p><strong>알고리즘:</strong></p>
 * <pre>
 * delaySeconds = round((2^retryCount * (10 - retryCount / 1.5)) / 2)
 * </pre>
 *
 * <p>retryCount는 증가 전 값을 사용합니다. 반올림은 0에서 멀어지는 방향이며,
 * 결과는 0 이상으로 제한됩니다 (retryCount ≥ 15이면 0).</p>
 *
 * <p><strong>예시:</strong></p>
 * <ul>
 *   <li>retryCount=0: 5s</li>
 *   <li>retryCount=1: 9s</li>
 *   <li>retryCount=2: 17s</li>
 *   <li>retryCount=3: 32s</li>
 *   <li>retryCount=10: 1707s</li>
 * </ul>
 *
 * <p>Jitter가 없으므로 같은 retryCount에 대해 항상 같은 값을 반환합니다.</p>
 *
 * @author JobQueue Team
 * @since 1.0.0
 */
public class BackoffPolicy {

    /**
     * 이 값 이상의 retryCount에서는 지연이 0이 됩니다 (10 - n/1.5 ≤ 0).
     */
    private static final int ZERO_DELAY_FROM = 15;

    /**
     * 재시도 지연 시간 계산 (초).
     *
     * <p>(2^n * (10 - n/1.5)) / 2 = 2^n * (15 - n) / 3 이므로 정수 연산으로 계산합니다.
     * 분모가 3이어서 소수부가 정확히 .5인 경우는 없습니다.</p>
     *
     * @param retryCount 증가 전 retry_count (0 이상)
     * @return 지연 시간 (초, 0 이상)
     * @throws IllegalArgumentException retryCount가 음수인 경우
     */
    public long delaySeconds(int retryCount) {
        if (retryCount < 0) {
            throw new IllegalArgumentException(
                "retryCount must be non-negative (current: " + retryCount + ")"
            );
        }
        if (retryCount >= ZERO_DELAY_FROM) {
            return 0L;
        }
        long numerator = (1L << retryCount) * (ZERO_DELAY_FROM - retryCount);
        return (numerator + 1) / 3;
    }

    /**
     * 재시도 지연 시간 계산.
     *
     * @param retryCount 증가 전 retry_count
     * @return 지연 시간
     */
    public Duration delay(int retryCount) {
        return Duration.ofSeconds(delaySeconds(retryCount));
    }

    /**
     * 다음 실행 가능 시각 계산.
     *
     * @param now 현재 시각
     * @param retryCount 증가 전 retry_count
     * @return now + delay
     */
    public Instant nextRunAt(Instant now, int retryCount) {
        return now.plus(delay(retryCount));
    }
}

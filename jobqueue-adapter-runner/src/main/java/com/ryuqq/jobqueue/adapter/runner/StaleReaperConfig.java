package com.ryuqq.jobqueue.adapter.runner;

/**
 * StaleProcessingReaper 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>timeoutThresholdMs: PROCESSING으로 머물 수 있는 최대 시간 (기본 600000ms = 10분)</li>
 *   <li>batchSize: 한 번에 처리할 Job 수 (기본 50)</li>
 * </ul>
 *
 * <p>진행 중인 HTTP 요청이 남아있는 Job은 시간이 지나도 정리하지 않습니다.</p>
 *
 * @author JobQueue Team
 * @since 1.0.0
 * @param timeoutThresholdMs 타임아웃 임계값 (밀리초, 양수)
 * @param batchSize 배치 크기 (1 이상)
 */
public record StaleReaperConfig(
    long timeoutThresholdMs,
    int batchSize
) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: timeoutThresholdMs=600000ms (10분), batchSize=50</p>
     */
    public StaleReaperConfig() {
        this(600000, 50);
    }

    public StaleReaperConfig {
        if (timeoutThresholdMs <= 0) {
            throw new IllegalArgumentException(
                "timeoutThresholdMs must be positive (current: " + timeoutThresholdMs + ")"
            );
        }
        if (batchSize <= 0) {
            throw new IllegalArgumentException(
                "batchSize must be positive (current: " + batchSize + ")"
            );
        }
    }

    /**
     * timeoutThresholdMs만 변경한 새 인스턴스 생성.
     */
    public StaleReaperConfig withTimeoutThresholdMs(long timeoutThresholdMs) {
        return new StaleReaperConfig(timeoutThresholdMs, batchSize);
    }

    /**
     * batchSize만 변경한 새 인스턴스 생성.
     */
    public StaleReaperConfig withBatchSize(int batchSize) {
        return new StaleReaperConfig(timeoutThresholdMs, batchSize);
    }
}

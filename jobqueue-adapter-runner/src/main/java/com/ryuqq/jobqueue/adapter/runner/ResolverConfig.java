package com.ryuqq.jobqueue.adapter.runner;

/**
 * ResultResolver 설정 (불변 record).
 *
 * @author JobQueue Team
 * @since 1.0.0
 * @param batchSize resolution 1회에 확인할 최대 요청 수 (1 이상, 기본 100)
 */
public record ResolverConfig(int batchSize) {

    public ResolverConfig() {
        this(100);
    }

    public ResolverConfig {
        if (batchSize <= 0) {
            throw new IllegalArgumentException(
                "batchSize must be positive (current: " + batchSize + ")"
            );
        }
    }

    public ResolverConfig withBatchSize(int batchSize) {
        return new ResolverConfig(batchSize);
    }
}

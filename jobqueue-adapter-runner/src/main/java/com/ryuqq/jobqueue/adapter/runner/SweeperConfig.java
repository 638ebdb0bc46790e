package com.ryuqq.jobqueue.adapter.runner;

/**
 * ClaimSweeper 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>batchSize: sweep 1회에 claim할 최대 Job 수 (기본 100)</li>
 *   <li>defaultSchema: schema가 없는 FUNC 대상의 기본 schema (기본 public)</li>
 * </ul>
 *
 * @author JobQueue Team
 * @since 1.0.0
 * @param batchSize 배치 크기 (1 이상)
 * @param defaultSchema 기본 schema (비어있으면 안 됨)
 */
public record SweeperConfig(
    int batchSize,
    String defaultSchema
) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: batchSize=100, defaultSchema=public</p>
     */
    public SweeperConfig() {
        this(100, "public");
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public SweeperConfig {
        if (batchSize <= 0) {
            throw new IllegalArgumentException(
                "batchSize must be positive (current: " + batchSize + ")"
            );
        }
        if (defaultSchema == null || defaultSchema.isBlank()) {
            throw new IllegalArgumentException("defaultSchema cannot be null or blank");
        }
    }

    /**
     * batchSize만 변경한 새 인스턴스 생성.
     */
    public SweeperConfig withBatchSize(int batchSize) {
        return new SweeperConfig(batchSize, defaultSchema);
    }

    /**
     * defaultSchema만 변경한 새 인스턴스 생성.
     */
    public SweeperConfig withDefaultSchema(String defaultSchema) {
        return new SweeperConfig(batchSize, defaultSchema);
    }
}

package com.ryuqq.jobqueue.adapter.runner;

/**
 * TickScheduler 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>tickIntervalMs: claim sweep 주기 (기본 60000ms)</li>
 *   <li>resolutionsPerTick: tick 1회당 결과 분류 횟수 (기본 6)</li>
 *   <li>resolutionIntervalMs: 결과 분류 간격 (기본 10000ms)</li>
 *   <li>reapEnabled: tick마다 장시간 PROCESSING 정리 실행 여부 (기본 true)</li>
 * </ul>
 *
 * <p>resolutionsPerTick * resolutionIntervalMs는 tickIntervalMs를 넘을 수 없습니다.</p>
 *
 * @author JobQueue Team
 * @since 1.0.0
 * @param tickIntervalMs tick 주기 (밀리초, 양수)
 * @param resolutionsPerTick tick당 결과 분류 횟수 (1 이상)
 * @param resolutionIntervalMs 결과 분류 간격 (밀리초, 양수)
 * @param reapEnabled 정리 실행 여부
 */
public record TickConfig(
    long tickIntervalMs,
    int resolutionsPerTick,
    long resolutionIntervalMs,
    boolean reapEnabled
) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: tickIntervalMs=60000ms, resolutionsPerTick=6, resolutionIntervalMs=10000ms, reapEnabled=true</p>
     */
    public TickConfig() {
        this(60000, 6, 10000, true);
    }

    public TickConfig {
        if (tickIntervalMs <= 0) {
            throw new IllegalArgumentException(
                "tickIntervalMs must be positive (current: " + tickIntervalMs + ")"
            );
        }
        if (resolutionsPerTick <= 0) {
            throw new IllegalArgumentException(
                "resolutionsPerTick must be positive (current: " + resolutionsPerTick + ")"
            );
        }
        if (resolutionIntervalMs <= 0) {
            throw new IllegalArgumentException(
                "resolutionIntervalMs must be positive (current: " + resolutionIntervalMs + ")"
            );
        }
        if (resolutionsPerTick * resolutionIntervalMs > tickIntervalMs) {
            throw new IllegalArgumentException(
                "resolutionsPerTick * resolutionIntervalMs must be <= tickIntervalMs (resolutions: "
                    + resolutionsPerTick + ", interval: " + resolutionIntervalMs + ", tick: " + tickIntervalMs + ")"
            );
        }
    }

    public TickConfig withTickIntervalMs(long tickIntervalMs) {
        return new TickConfig(tickIntervalMs, resolutionsPerTick, resolutionIntervalMs, reapEnabled);
    }

    public TickConfig withResolutionsPerTick(int resolutionsPerTick) {
        return new TickConfig(tickIntervalMs, resolutionsPerTick, resolutionIntervalMs, reapEnabled);
    }

    public TickConfig withResolutionIntervalMs(long resolutionIntervalMs) {
        return new TickConfig(tickIntervalMs, resolutionsPerTick, resolutionIntervalMs, reapEnabled);
    }

    public TickConfig withReapEnabled(boolean reapEnabled) {
        return new TickConfig(tickIntervalMs, resolutionsPerTick, resolutionIntervalMs, reapEnabled);
    }
}

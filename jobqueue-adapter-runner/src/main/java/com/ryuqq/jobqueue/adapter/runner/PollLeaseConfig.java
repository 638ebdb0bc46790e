package com.ryuqq.jobqueue.adapter.runner;

import java.time.Duration;

/**
 * PollLeaseManager 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>leaseDuration: poll 후 ack까지 허용되는 시간 (기본 60초)</li>
 *   <li>maxTimestampSkew: poll 요청 timestamp가 현재보다 과거일 수 있는 최대 시간 (기본 2초)</li>
 * </ul>
 *
 * @author JobQueue Team
 * @since 1.0.0
 * @param leaseDuration lease 시간 (양수)
 * @param maxTimestampSkew timestamp 허용 오차 (음수 불가)
 */
public record PollLeaseConfig(
    Duration leaseDuration,
    Duration maxTimestampSkew
) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: leaseDuration=60s, maxTimestampSkew=2s</p>
     */
    public PollLeaseConfig() {
        this(Duration.ofSeconds(60), Duration.ofSeconds(2));
    }

    public PollLeaseConfig {
        if (leaseDuration == null || leaseDuration.isZero() || leaseDuration.isNegative()) {
            throw new IllegalArgumentException(
                "leaseDuration must be positive (current: " + leaseDuration + ")"
            );
        }
        if (maxTimestampSkew == null || maxTimestampSkew.isNegative()) {
            throw new IllegalArgumentException(
                "maxTimestampSkew must be non-negative (current: " + maxTimestampSkew + ")"
            );
        }
    }

    public PollLeaseConfig withLeaseDuration(Duration leaseDuration) {
        return new PollLeaseConfig(leaseDuration, maxTimestampSkew);
    }

    public PollLeaseConfig withMaxTimestampSkew(Duration maxTimestampSkew) {
        return new PollLeaseConfig(leaseDuration, maxTimestampSkew);
    }
}

package com.ryuqq.jobqueue.core.outcome;

import java.time.Duration;

/**
 * ResponseClassifier 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>redirectStatus: redirect 트리거 상태 코드 (기본 210)</li>
 *   <li>defaultRateLimitDelay: Retry-After가 없거나 해석 불가할 때의 429 대기 시간 (기본 600초)</li>
 *   <li>finishedHeader: 4xx 응답을 완료로 취급하게 하는 헤더 이름 (기본 x-job-finished)</li>
 * </ul>
 *
 * @author JobQueue Team
 * @since 1.0.0
 * @param redirectStatus redirect 트리거 상태 코드 (100~599)
 * @param defaultRateLimitDelay 429 기본 대기 시간 (음수 불가)
 * @param finishedHeader 완료 헤더 이름
 */
public record ClassifierConfig(
    int redirectStatus,
    Duration defaultRateLimitDelay,
    String finishedHeader
) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: redirectStatus=210, defaultRateLimitDelay=600s, finishedHeader=x-job-finished</p>
     */
    public ClassifierConfig() {
        this(210, Duration.ofSeconds(600), "x-job-finished");
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public ClassifierConfig {
        if (redirectStatus < 100 || redirectStatus > 599) {
            throw new IllegalArgumentException(
                "redirectStatus must be between 100 and 599 (current: " + redirectStatus + ")"
            );
        }
        if (defaultRateLimitDelay == null || defaultRateLimitDelay.isNegative()) {
            throw new IllegalArgumentException(
                "defaultRateLimitDelay must be non-negative (current: " + defaultRateLimitDelay + ")"
            );
        }
        if (finishedHeader == null || finishedHeader.isBlank()) {
            throw new IllegalArgumentException("finishedHeader cannot be null or blank");
        }
    }

    public ClassifierConfig withRedirectStatus(int redirectStatus) {
        return new ClassifierConfig(redirectStatus, defaultRateLimitDelay, finishedHeader);
    }

    public ClassifierConfig withDefaultRateLimitDelay(Duration defaultRateLimitDelay) {
        return new ClassifierConfig(redirectStatus, defaultRateLimitDelay, finishedHeader);
    }

    public ClassifierConfig withFinishedHeader(String finishedHeader) {
        return new ClassifierConfig(redirectStatus, defaultRateLimitDelay, finishedHeader);
    }
}

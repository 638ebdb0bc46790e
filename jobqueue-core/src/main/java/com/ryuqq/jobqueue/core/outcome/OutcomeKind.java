package com.ryuqq.jobqueue.core.outcome;

/**
 * 실행 결과 분류.
 *
 * @author JobQueue Team
 * @since 1.0.0
 */
public enum OutcomeKind {

    /** 2xx 응답 또는 FUNC 실행 성공. */
    SUCCESS,

    /** redirect 트리거 응답, 파생 Job 1건 생성. */
    REDIRECTED,

    /** 4xx 응답, backoff 후 재시도. */
    TRANSIENT_FAILURE,

    /** 429 응답, Retry-After 후 재시도. */
    RATE_LIMITED,

    /** 5xx 응답, 재시도하지 않음. */
    PERMANENT_SERVER_FAILURE,

    /** 완료 헤더가 있는 4xx 응답, 성공으로 취급. */
    PERMANENT_CLIENT_SUCCESS,

    /** 재시도 한도 초과. */
    RETRIES_EXHAUSTED,

    /** 어느 규칙에도 해당하지 않는 응답. */
    UNCLASSIFIED,

    /** 전송 실패 또는 내부 실행 오류 (상태 코드 0). */
    INTERNAL_EXECUTION_ERROR,

    /** POLL lease 만료 (408). */
    POLL_LEASE_EXPIRED;

    /**
     * 실패한 시도로 집계되는지 확인.
     *
     * <p>실패한 시도는 retry_count를 증가시키고 Failure Log에 기록됩니다.</p>
     *
     * @return 실패 시도인 경우 true
     */
    public boolean isFailedAttempt() {
        return this == TRANSIENT_FAILURE || this == RATE_LIMITED || this == RETRIES_EXHAUSTED
            || this == INTERNAL_EXECUTION_ERROR || this == POLL_LEASE_EXPIRED;
    }
}

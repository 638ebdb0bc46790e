package com.ryuqq.jobqueue.core.outcome;

import com.ryuqq.jobqueue.core.model.ResponseSnapshot;
import com.ryuqq.jobqueue.core.statemachine.JobStatus;

import java.time.Instant;
import java.util.Optional;

/**
 * 한 번의 실행 시도에 대한 분류 결과.
 *
 * <p>Job에 적용할 다음 상태, 기록할 응답, 다음 실행 시각을 담고 있습니다.
 * {@link OutcomeKind#isFailedAttempt()}가 true면 retry_count 증가와 Failure Log 기록이 함께 적용됩니다.</p>
 *
 * @param kind 결과 분류
 * @param status 다음 상태
 * @param response 기록할 응답
 * @param runAt 다음 실행 시각 (null이면 변경하지 않음)
 *
 * @author JobQueue Team
 * @since 1.0.0
 */
public record Outcome(
    OutcomeKind kind,
    JobStatus status,
    ResponseSnapshot response,
    Instant runAt
) {

    public static final int POLL_TIMEOUT_STATUS = 408;
    public static final String POLL_TIMEOUT_MESSAGE = "Poll job not acknowledged in time";

    public Outcome {
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        if (status == null) {
            throw new IllegalArgumentException("status cannot be null");
        }
        if (response == null) {
            throw new IllegalArgumentException("response cannot be null");
        }
    }

    /**
     * FUNC 실행 성공.
     *
     * @param result 함수 반환값
     * @return SUCCESS (COMPLETED, 200)
     */
    public static Outcome functionSuccess(String result) {
        return new Outcome(OutcomeKind.SUCCESS, JobStatus.COMPLETED, ResponseSnapshot.of(200, result), null);
    }

    /**
     * POLL lease 만료.
     *
     * <p>Job은 NEW로 돌아가며 즉시 다시 poll 가능합니다.</p>
     *
     * @param now 현재 시각
     * @return POLL_LEASE_EXPIRED (NEW, 408)
     */
    public static Outcome pollLeaseExpired(Instant now) {
        return new Outcome(OutcomeKind.POLL_LEASE_EXPIRED, JobStatus.NEW,
            ResponseSnapshot.of(POLL_TIMEOUT_STATUS, POLL_TIMEOUT_MESSAGE), now);
    }

    public boolean isFailedAttempt() {
        return kind.isFailedAttempt();
    }

    public Optional<Instant> runAtOptional() {
        return Optional.ofNullable(runAt);
    }
}

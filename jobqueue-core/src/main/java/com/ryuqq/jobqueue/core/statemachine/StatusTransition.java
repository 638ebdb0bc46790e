package com.ryuqq.jobqueue.core.statemachine;

/**
 * 상태 전이 검증 및 실행.
 *
 * <p><strong>허용되는 전이:</strong></p>
 * <ul>
 *   <li>NEW → PROCESSING (claim), POLLED (poll), COMPLETED (auto-ack poll)</li>
 *   <li>FAILED → PROCESSING (재시도 claim)</li>
 *   <li>POLLED → PROCESSING (lease 만료 감지 claim), COMPLETED (ack)</li>
 *   <li>PROCESSING → COMPLETED, REDIRECTED, FAILED, SERVER_ERROR, TOO_MANY, OTHER (결과 분류)</li>
 *   <li>PROCESSING → NEW (poll lease 만료)</li>
 * </ul>
 *
 * <p><strong>불변식:</strong> 종료 상태에서는 어떤 상태로도 전이 불가</p>
 *
 * @author JobQueue Team
 * @since 1.0.0
 */
public final class StatusTransition {

    private StatusTransition() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 상태 전이가 유효한지 확인.
     *
     * @param from 현재 상태
     * @param to 전이할 상태
     * @return 허용된 전이인 경우 true
     */
    public static boolean isAllowed(JobStatus from, JobStatus to) {
        if (from == null || to == null) {
            return false;
        }
        return switch (from) {
            case NEW -> to == JobStatus.PROCESSING || to == JobStatus.POLLED || to == JobStatus.COMPLETED;
            case FAILED -> to == JobStatus.PROCESSING;
            case POLLED -> to == JobStatus.PROCESSING || to == JobStatus.COMPLETED;
            case PROCESSING -> to == JobStatus.COMPLETED || to == JobStatus.REDIRECTED
                || to == JobStatus.FAILED || to == JobStatus.SERVER_ERROR
                || to == JobStatus.TOO_MANY || to == JobStatus.OTHER || to == JobStatus.NEW;
            case COMPLETED, REDIRECTED, SERVER_ERROR, TOO_MANY, OTHER -> false;
        };
    }

    /**
     * 상태 전이가 유효한지 검증.
     *
     * @param from 현재 상태
     * @param to 전이할 상태
     * @throws IllegalArgumentException from 또는 to가 null인 경우
     * @throws IllegalStateException 유효하지 않은 전이인 경우
     */
    public static void validate(JobStatus from, JobStatus to) {
        if (from == null || to == null) {
            throw new IllegalArgumentException("States cannot be null (from: " + from + ", to: " + to + ")");
        }

        if (from.isTerminal()) {
            throw new IllegalStateException(
                String.format("Cannot transition from terminal state: %s → %s", from, to)
            );
        }

        if (!isAllowed(from, to)) {
            throw new IllegalStateException(
                String.format("Invalid state transition: %s → %s", from, to)
            );
        }
    }

    /**
     * 상태 전이 실행 (검증 후).
     *
     * @param current 현재 상태
     * @param next 다음 상태
     * @return 전이된 상태 (next)
     * @throws IllegalArgumentException current 또는 next가 null인 경우
     * @throws IllegalStateException 유효하지 않은 전이인 경우
     */
    public static JobStatus transition(JobStatus current, JobStatus next) {
        validate(current, next);
        return next;
    }
}

package com.ryuqq.jobqueue.core.model;

/**
 * Job 제출 시점의 유효성 검증 실패.
 *
 * <p>제출자에게 동기적으로 전달되는 유일한 실패 유형이며, 이 예외가 발생하면 Job은 저장되지 않습니다.</p>
 *
 * @author JobQueue Team
 * @since 1.0.0
 */
public class JobValidationException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    public JobValidationException(String message) {
        super(message);
    }

    public JobValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}

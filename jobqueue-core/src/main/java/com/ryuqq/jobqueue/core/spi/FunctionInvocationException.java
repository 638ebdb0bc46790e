package com.ryuqq.jobqueue.core.spi;

/**
 * Failure of a FUNC job's internal function call.
 *
 * @author JobQueue Team
 * @since 1.0.0
 */
public class FunctionInvocationException extends Exception {

    private static final long serialVersionUID = 1L;

    public FunctionInvocationException(String message) {
        super(message);
    }

    public FunctionInvocationException(String message, Throwable cause) {
        super(message, cause);
    }
}

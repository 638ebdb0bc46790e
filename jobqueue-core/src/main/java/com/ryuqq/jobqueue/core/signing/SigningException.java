package com.ryuqq.jobqueue.core.signing;

/**
 * HMAC 계산 실패 (JCA 알고리즘 또는 키 오류).
 *
 * @author JobQueue Team
 * @since 1.0.0
 */
public class SigningException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public SigningException(String message) {
        super(message);
    }

    public SigningException(String message, Throwable cause) {
        super(message, cause);
    }
}

package com.ryuqq.jobqueue.application.queue;

/**
 * poll 요청의 호출자 인증 실패.
 *
 * <p>asUser 모드에서 호출자 ID가 없는 경우 발생합니다.</p>
 *
 * @author JobQueue Team
 * @since 1.0.0
 */
public class AuthenticationException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public AuthenticationException(String message) {
        super(message);
    }
}

package com.ryuqq.jobqueue.adapter.runner;

import com.ryuqq.jobqueue.core.model.AuthConfig;
import com.ryuqq.jobqueue.core.spi.SessionTokenProvider;

import java.util.Optional;

/**
 * Job의 인증 설정을 Bearer 토큰으로 변환.
 *
 * <ul>
 *   <li>JWT: 지정된 토큰</li>
 *   <li>FROM_SESSION: 현재 세션 토큰 (없으면 empty)</li>
 *   <li>NONE: empty</li>
 * </ul>
 *
 * @author JobQueue Team
 * @since 1.0.0
 */
public final class AuthorizationResolver {

    private final SessionTokenProvider sessionTokenProvider;

    public AuthorizationResolver(SessionTokenProvider sessionTokenProvider) {
        if (sessionTokenProvider == null) {
            throw new IllegalArgumentException("sessionTokenProvider cannot be null");
        }
        this.sessionTokenProvider = sessionTokenProvider;
    }

    public Optional<String> bearerToken(AuthConfig auth) {
        if (auth == null) {
            return Optional.empty();
        }
        return switch (auth.mode()) {
            case JWT -> Optional.of(auth.jwt());
            case FROM_SESSION -> sessionTokenProvider.currentToken();
            case NONE -> Optional.empty();
        };
    }
}

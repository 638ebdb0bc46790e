package com.ryuqq.jobqueue.core.model;

/**
 * Job의 인증 설정.
 *
 * @param mode 인증 방식
 * @param jwt JWT 값 (mode가 JWT일 때만 non-null)
 *
 * @author JobQueue Team
 * @since 1.0.0
 */
public record AuthConfig(
    AuthMode mode,
    String jwt
) {

    private static final AuthConfig NONE = new AuthConfig(AuthMode.NONE, null);
    private static final AuthConfig FROM_SESSION = new AuthConfig(AuthMode.FROM_SESSION, null);

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException mode가 null이거나 JWT 모드에서 jwt가 비어있는 경우
     */
    public AuthConfig {
        if (mode == null) {
            throw new IllegalArgumentException("mode cannot be null");
        }
        if (mode == AuthMode.JWT && (jwt == null || jwt.isBlank())) {
            throw new IllegalArgumentException("jwt cannot be null or blank for JWT mode");
        }
        if (mode != AuthMode.JWT && jwt != null) {
            throw new IllegalArgumentException("jwt is only allowed for JWT mode (mode: " + mode + ")");
        }
    }

    public static AuthConfig none() {
        return NONE;
    }

    public static AuthConfig jwt(String token) {
        return new AuthConfig(AuthMode.JWT, token);
    }

    public static AuthConfig fromSession() {
        return FROM_SESSION;
    }

    @Override
    public String toString() {
        // 토큰 값은 로그에 남기지 않음
        return "AuthConfig{" + mode + '}';
    }
}

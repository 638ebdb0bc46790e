package com.ryuqq.jobqueue.core.model;

/**
 * outbound 요청의 Authorization 해석 방식.
 *
 * @author JobQueue Team
 * @since 1.0.0
 */
public enum AuthMode {

    /** Authorization 헤더 없음. */
    NONE,

    /** Job에 저장된 JWT를 그대로 사용. */
    JWT,

    /** 디스패치 시점에 현재 세션 토큰을 조회. */
    FROM_SESSION
}

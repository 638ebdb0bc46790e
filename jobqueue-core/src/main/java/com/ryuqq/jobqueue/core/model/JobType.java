package com.ryuqq.jobqueue.core.model;

/**
 * Job 실행 방식.
 *
 * <ul>
 *   <li>GET, POST, DELETE: 비동기 outbound HTTP 요청</li>
 *   <li>FUNC: 내부 함수 동기 호출 (schema.function)</li>
 *   <li>POLL: 외부 consumer가 poll/ack 프로토콜로 가져가는 작업 (스케줄러는 실행하지 않음)</li>
 * </ul>
 *
 * @author JobQueue Team
 * @since 1.0.0
 */
public enum JobType {

    GET,

    POST,

    DELETE,

    FUNC,

    POLL;

    /**
     * outbound HTTP 요청으로 실행되는 타입인지 확인.
     *
     * @return GET, POST, DELETE인 경우 true
     */
    public boolean isHttp() {
        return this == GET || this == POST || this == DELETE;
    }
}

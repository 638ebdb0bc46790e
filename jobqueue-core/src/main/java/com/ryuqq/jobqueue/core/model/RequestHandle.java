package com.ryuqq.jobqueue.core.model;

/**
 * 비동기 HTTP 요청의 상관관계 핸들.
 *
 * @param value 핸들 값 (HTTP facility가 발급)
 *
 * @author JobQueue Team
 * @since 1.0.0
 */
public record RequestHandle(String value) {

    public RequestHandle {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("value cannot be null or blank");
        }
    }

    public static RequestHandle of(String value) {
        return new RequestHandle(value);
    }
}

package com.ryuqq.jobqueue.core.model;

import java.net.URI;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 디스패치할 outbound HTTP 요청.
 *
 * @param method HTTP 메서드 (GET, POST, DELETE)
 * @param uri 대상 URL
 * @param headers 병합된 헤더 (서명, Authorization 포함)
 * @param body 요청 본문 (없으면 null)
 *
 * @author JobQueue Team
 * @since 1.0.0
 */
public record OutboundRequest(
    String method,
    URI uri,
    Map<String, String> headers,
    String body
) {

    public OutboundRequest {
        if (method == null || method.isBlank()) {
            throw new IllegalArgumentException("method cannot be null or blank");
        }
        if (uri == null) {
            throw new IllegalArgumentException("uri cannot be null");
        }
        headers = headers == null ? Collections.emptyMap() : Collections.unmodifiableMap(new LinkedHashMap<>(headers));
    }
}

package com.ryuqq.jobqueue.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * 비동기 HTTP 요청의 해석 결과.
 *
 * <p>응답을 받은 경우 status/headers/body를, 요청 자체가 실패한 경우(연결 실패 등)
 * status 0과 error 메시지를 가집니다.</p>
 *
 * @param status 응답 상태 코드 (전송 실패 시 0)
 * @param headers 응답 헤더
 * @param body 응답 본문
 * @param error 전송 실패 메시지 (응답을 받은 경우 null)
 *
 * @author JobQueue Team
 * @since 1.0.0
 */
public record HttpResult(
    int status,
    Map<String, String> headers,
    String body,
    String error
) {

    public HttpResult {
        headers = headers == null ? Collections.emptyMap() : Collections.unmodifiableMap(new LinkedHashMap<>(headers));
    }

    public static HttpResult response(int status, Map<String, String> headers, String body) {
        return new HttpResult(status, headers, body, null);
    }

    public static HttpResult failure(String error) {
        return new HttpResult(0, Collections.emptyMap(), null, error == null ? "request failed" : error);
    }

    public boolean isTransportFailure() {
        return error != null;
    }

    /**
     * 헤더 조회 (이름 대소문자 무시).
     *
     * @param name 헤더 이름
     * @return 헤더 값
     */
    public Optional<String> header(String name) {
        for (Map.Entry<String, String> entry : headers.entrySet()) {
            if (entry.getKey().equalsIgnoreCase(name)) {
                return Optional.ofNullable(entry.getValue());
            }
        }
        return Optional.empty();
    }

    public boolean hasHeader(String name) {
        return headers.keySet().stream().anyMatch(key -> key.equalsIgnoreCase(name));
    }
}

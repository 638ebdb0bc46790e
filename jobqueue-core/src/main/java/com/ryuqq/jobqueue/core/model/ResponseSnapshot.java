package com.ryuqq.jobqueue.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 마지막 실행 시도의 응답.
 *
 * <p>Job에는 가장 최근 시도의 응답만 남습니다. 실패 이력은 Failure Log에 별도로 쌓입니다.</p>
 *
 * @param status 응답 상태 코드 (내부 실행 오류는 0)
 * @param content 응답 본문 또는 오류 메시지
 * @param headers 응답 헤더
 *
 * @author JobQueue Team
 * @since 1.0.0
 */
public record ResponseSnapshot(
    int status,
    String content,
    Map<String, String> headers
) {

    public ResponseSnapshot {
        headers = headers == null ? Collections.emptyMap() : Collections.unmodifiableMap(new LinkedHashMap<>(headers));
    }

    public static ResponseSnapshot of(int status, String content) {
        return new ResponseSnapshot(status, content, Collections.emptyMap());
    }

    /**
     * 해석된 HTTP 결과로부터 생성.
     *
     * @param result HTTP 결과
     * @return ResponseSnapshot
     */
    public static ResponseSnapshot from(HttpResult result) {
        if (result.isTransportFailure()) {
            return of(0, result.error());
        }
        return new ResponseSnapshot(result.status(), result.body(), result.headers());
    }
}

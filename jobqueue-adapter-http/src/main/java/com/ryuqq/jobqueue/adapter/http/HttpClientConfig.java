package com.ryuqq.jobqueue.adapter.http;

import java.time.Duration;

/**
 * JdkAsyncHttpClient 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>connectTimeout: 연결 제한 시간 (기본 10초)</li>
 *   <li>requestTimeout: 요청 전체 제한 시간 (기본 30초, 초과 시 전송 오류)</li>
 * </ul>
 *
 * <p>3xx 응답은 따라가지 않고 그대로 분류 대상으로 전달됩니다.</p>
 *
 * @author JobQueue Team
 * @since 1.0.0
 * @param connectTimeout 연결 제한 시간 (양수)
 * @param requestTimeout 요청 제한 시간 (양수)
 */
public record HttpClientConfig(
    Duration connectTimeout,
    Duration requestTimeout
) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: connectTimeout=10s, requestTimeout=30s</p>
     */
    public HttpClientConfig() {
        this(Duration.ofSeconds(10), Duration.ofSeconds(30));
    }

    public HttpClientConfig {
        if (connectTimeout == null || connectTimeout.isZero() || connectTimeout.isNegative()) {
            throw new IllegalArgumentException(
                "connectTimeout must be positive (current: " + connectTimeout + ")"
            );
        }
        if (requestTimeout == null || requestTimeout.isZero() || requestTimeout.isNegative()) {
            throw new IllegalArgumentException(
                "requestTimeout must be positive (current: " + requestTimeout + ")"
            );
        }
    }

    public HttpClientConfig withConnectTimeout(Duration connectTimeout) {
        return new HttpClientConfig(connectTimeout, requestTimeout);
    }

    public HttpClientConfig withRequestTimeout(Duration requestTimeout) {
        return new HttpClientConfig(connectTimeout, requestTimeout);
    }
}

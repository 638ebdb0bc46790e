package com.ryuqq.jobqueue.core.model;

import java.net.URI;
import java.net.URISyntaxException;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Job 제출 요청.
 *
 * <p>제출 시점의 입력값만 담고 있으며, 서명 헤더와 run_at 기본값은
 * 제출 처리 과정에서 채워집니다.</p>
 *
 * <p><strong>유효성 검증:</strong></p>
 * <ul>
 *   <li>jobType 필수</li>
 *   <li>GET/POST/DELETE: target은 절대 http(s) URL</li>
 *   <li>FUNC: target(함수 이름) 필수</li>
 *   <li>POLL: owner 필수</li>
 *   <li>retryLimit 0 이상</li>
 * </ul>
 *
 * @param jobType 실행 방식
 * @param owner 소유자 (POLL 필수, 그 외 선택)
 * @param target URL 또는 schema.function 이름
 * @param payload 업무 데이터
 * @param headers outbound 헤더
 * @param auth 인증 설정
 * @param signing 서명 설정
 * @param retryLimit 최대 재시도 횟수
 * @param runAt 최초 실행 가능 시각 (null이면 즉시)
 *
 * @author JobQueue Team
 * @since 1.0.0
 */
public record JobSpec(
    JobType jobType,
    String owner,
    String target,
    Payload payload,
    Map<String, String> headers,
    AuthConfig auth,
    SigningConfig signing,
    int retryLimit,
    Instant runAt
) {

    public static final int DEFAULT_RETRY_LIMIT = 10;

    /**
     * Compact Constructor.
     *
     * @throws JobValidationException 유효하지 않은 제출 요청인 경우
     */
    public JobSpec {
        if (jobType == null) {
            throw new JobValidationException("jobType cannot be null");
        }
        if (retryLimit < 0) {
            throw new JobValidationException("retryLimit must be non-negative (current: " + retryLimit + ")");
        }
        if (jobType == JobType.POLL && (owner == null || owner.isBlank())) {
            throw new JobValidationException("owner is required for POLL jobs");
        }
        if (jobType != JobType.POLL && (target == null || target.isBlank())) {
            throw new JobValidationException("target is required for " + jobType + " jobs");
        }
        if (jobType.isHttp()) {
            validateUrl(target);
        }
        payload = payload == null ? Payload.empty() : payload;
        headers = headers == null ? Collections.emptyMap() : Collections.unmodifiableMap(new LinkedHashMap<>(headers));
        auth = auth == null ? AuthConfig.none() : auth;
        signing = signing == null ? SigningConfig.none() : signing;
    }

    private static void validateUrl(String target) {
        try {
            URI uri = new URI(target);
            String scheme = uri.getScheme();
            if (scheme == null || !(scheme.equalsIgnoreCase("http") || scheme.equalsIgnoreCase("https"))
                || uri.getHost() == null) {
                throw new JobValidationException("target must be an absolute http(s) URL (current: " + target + ")");
            }
        } catch (URISyntaxException e) {
            throw new JobValidationException("target is not a valid URL: " + target, e);
        }
    }

    /**
     * Builder 생성.
     *
     * @param jobType 실행 방식
     * @return Builder
     */
    public static Builder builder(JobType jobType) {
        return new Builder(jobType);
    }

    /**
     * JobSpec Builder.
     */
    public static final class Builder {

        private final JobType jobType;
        private String owner;
        private String target;
        private Payload payload;
        private final Map<String, String> headers = new LinkedHashMap<>();
        private AuthConfig auth;
        private SigningConfig signing;
        private int retryLimit = DEFAULT_RETRY_LIMIT;
        private Instant runAt;

        private Builder(JobType jobType) {
            this.jobType = jobType;
        }

        public Builder owner(String owner) {
            this.owner = owner;
            return this;
        }

        public Builder target(String target) {
            this.target = target;
            return this;
        }

        public Builder payload(Payload payload) {
            this.payload = payload;
            return this;
        }

        public Builder header(String name, String value) {
            this.headers.put(name, value);
            return this;
        }

        public Builder headers(Map<String, String> headers) {
            if (headers != null) {
                this.headers.putAll(headers);
            }
            return this;
        }

        public Builder auth(AuthConfig auth) {
            this.auth = auth;
            return this;
        }

        public Builder signing(SigningConfig signing) {
            this.signing = signing;
            return this;
        }

        public Builder retryLimit(int retryLimit) {
            this.retryLimit = retryLimit;
            return this;
        }

        public Builder runAt(Instant runAt) {
            this.runAt = runAt;
            return this;
        }

        public JobSpec build() {
            return new JobSpec(jobType, owner, target, payload, headers, auth, signing, retryLimit, runAt);
        }
    }
}

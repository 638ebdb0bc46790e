package com.ryuqq.jobqueue.adapter.runner;

import com.ryuqq.jobqueue.core.model.Job;
import com.ryuqq.jobqueue.core.model.JobType;
import com.ryuqq.jobqueue.core.model.OutboundRequest;
import com.ryuqq.jobqueue.core.model.RequestHandle;
import com.ryuqq.jobqueue.core.outcome.Outcome;
import com.ryuqq.jobqueue.core.spi.AsyncHttpClient;
import com.ryuqq.jobqueue.core.spi.FunctionInvocationException;
import com.ryuqq.jobqueue.core.spi.FunctionInvoker;
import com.ryuqq.jobqueue.core.spi.RequestLedger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * claim된 Job을 타입별로 실행.
 *
 * <p><strong>타입별 동작:</strong></p>
 * <ul>
 *   <li>FUNC: {@code schema.name} 함수를 payload의 key/value를 이름 있는 인자로 하여 동기 호출 → 즉시 결과</li>
 *   <li>GET/POST/DELETE: 요청을 비동기로 제출하고 (handle, jobId)를 ledger에 기록 → 결과는 나중에 분류</li>
 *   <li>POLL: sweep 대상이 된 POLL Job은 lease가 만료된 것 → 408 결과</li>
 * </ul>
 *
 * <p><strong>HTTP 요청 구성:</strong></p>
 * <ul>
 *   <li>헤더: Job 헤더 (서명 포함) + Authorization: Bearer (헤더에 없을 때만)</li>
 *   <li>POST: body = 정규화된 payload 텍스트, Content-Type 기본값 application/json</li>
 * </ul>
 *
 * @author JobQueue Team
 * @since 1.0.0
 */
public final class JobDispatcher {

    private static final Logger log = LoggerFactory.getLogger(JobDispatcher.class);

    private final AsyncHttpClient httpClient;
    private final FunctionInvoker functionInvoker;
    private final RequestLedger requestLedger;
    private final AuthorizationResolver authorizationResolver;
    private final SweeperConfig config;

    /**
     * 생성자.
     *
     * @param httpClient 비동기 HTTP
     * @param functionInvoker FUNC 실행기
     * @param requestLedger 발행 요청 기록
     * @param authorizationResolver 인증 토큰 해석
     * @param config 설정 (기본 schema)
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public JobDispatcher(AsyncHttpClient httpClient, FunctionInvoker functionInvoker, RequestLedger requestLedger,
                         AuthorizationResolver authorizationResolver, SweeperConfig config) {
        if (httpClient == null) {
            throw new IllegalArgumentException("httpClient cannot be null");
        }
        if (functionInvoker == null) {
            throw new IllegalArgumentException("functionInvoker cannot be null");
        }
        if (requestLedger == null) {
            throw new IllegalArgumentException("requestLedger cannot be null");
        }
        if (authorizationResolver == null) {
            throw new IllegalArgumentException("authorizationResolver cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.httpClient = httpClient;
        this.functionInvoker = functionInvoker;
        this.requestLedger = requestLedger;
        this.authorizationResolver = authorizationResolver;
        this.config = config;
    }

    /**
     * Job 실행.
     *
     * @param job PROCESSING으로 claim된 Job
     * @param now 현재 시각
     * @return 즉시 결정된 결과 (FUNC, POLL), HTTP 요청은 empty
     * @throws FunctionInvocationException FUNC 실행 실패
     */
    public Optional<Outcome> dispatch(Job job, Instant now) throws FunctionInvocationException {
        return switch (job.jobType()) {
            case FUNC -> Optional.of(invokeFunction(job));
            case POLL -> {
                log.info("Poll job {} was not acknowledged in time", job.id());
                yield Optional.of(Outcome.pollLeaseExpired(now));
            }
            case GET, POST, DELETE -> {
                submitRequest(job, now);
                yield Optional.empty();
            }
        };
    }

    /**
     * outbound HTTP 요청 구성.
     *
     * @param job HTTP Job
     * @return 요청
     */
    OutboundRequest buildRequest(Job job) {
        Map<String, String> headers = new LinkedHashMap<>(job.headers());

        authorizationResolver.bearerToken(job.auth())
            .filter(token -> !containsHeader(headers, "Authorization"))
            .ifPresent(token -> headers.put("Authorization", "Bearer " + token));

        String body = null;
        if (job.jobType() == JobType.POST) {
            if (!containsHeader(headers, "Content-Type")) {
                headers.put("Content-Type", "application/json");
            }
            body = job.payload().isEmpty() ? null : job.payload().toCanonicalText();
        }

        return new OutboundRequest(job.jobType().name(), URI.create(job.target()), headers, body);
    }

    private void submitRequest(Job job, Instant now) {
        RequestHandle handle = httpClient.submit(buildRequest(job));
        requestLedger.record(handle, job.id(), now);
        log.debug("Job {} dispatched: {} {} (handle {})", job.id(), job.jobType(), job.target(), handle.value());
    }

    private Outcome invokeFunction(Job job) throws FunctionInvocationException {
        String target = job.target();
        int dot = target.indexOf('.');
        String schema = dot < 0 ? config.defaultSchema() : target.substring(0, dot);
        String name = dot < 0 ? target : target.substring(dot + 1);

        String result = functionInvoker.invoke(schema, name, job.payload().namedArguments());
        log.debug("Job {} invoked {}.{}", job.id(), schema, name);
        return Outcome.functionSuccess(result);
    }

    private static boolean containsHeader(Map<String, String> headers, String name) {
        return headers.keySet().stream().anyMatch(key -> key.equalsIgnoreCase(name));
    }
}

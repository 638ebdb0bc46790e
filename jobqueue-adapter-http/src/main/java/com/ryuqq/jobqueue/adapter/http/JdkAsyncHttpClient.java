package com.ryuqq.jobqueue.adapter.http;

import com.ryuqq.jobqueue.core.model.HttpResult;
import com.ryuqq.jobqueue.core.model.OutboundRequest;
import com.ryuqq.jobqueue.core.model.RequestHandle;
import com.ryuqq.jobqueue.core.spi.AsyncHttpClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.http.HttpClient;
import java.net.http.HttpHeaders;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;

/**
 * {@link java.net.http.HttpClient} 기반 {@link AsyncHttpClient} 구현체.
 *
 * <p>요청은 {@code sendAsync}로 발행되고, 완료된 결과는 handle별로 보관되어
 * {@link #poll(RequestHandle)}로 조회됩니다. 보관된 결과는 {@link #discard(RequestHandle)}
 * 전까지 유지됩니다.</p>
 *
 * <p><strong>결과 변환:</strong></p>
 * <ul>
 *   <li>응답 수신: 상태 코드, 헤더 (이름별 첫 값), 본문 (UTF-8)</li>
 *   <li>연결 실패, 타임아웃, 잘못된 요청: {@link HttpResult#failure(String)}</li>
 * </ul>
 *
 * <p>JDK가 직접 관리하는 헤더 (Host, Content-Length, Connection 등)는 전송하지 않습니다.</p>
 *
 * @author JobQueue Team
 * @since 1.0.0
 */
public class JdkAsyncHttpClient implements AsyncHttpClient {

    private static final Logger log = LoggerFactory.getLogger(JdkAsyncHttpClient.class);

    private static final Set<String> RESTRICTED_HEADERS = Set.of(
        "connection", "content-length", "expect", "host", "upgrade"
    );

    private final HttpClient httpClient;
    private final HttpClientConfig config;
    private final ConcurrentHashMap<RequestHandle, CompletableFuture<HttpResult>> requests = new ConcurrentHashMap<>();

    public JdkAsyncHttpClient() {
        this(new HttpClientConfig());
    }

    public JdkAsyncHttpClient(HttpClientConfig config) {
        this(HttpClient.newBuilder()
            .followRedirects(HttpClient.Redirect.NEVER)
            .connectTimeout(config.connectTimeout())
            .build(), config);
    }

    /**
     * 생성자 (HttpClient 주입).
     *
     * @param httpClient JDK HTTP 클라이언트
     * @param config 설정
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public JdkAsyncHttpClient(HttpClient httpClient, HttpClientConfig config) {
        if (httpClient == null) {
            throw new IllegalArgumentException("httpClient cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.httpClient = httpClient;
        this.config = config;
    }

    @Override
    public RequestHandle submit(OutboundRequest request) {
        if (request == null) {
            throw new IllegalArgumentException("request cannot be null");
        }
        RequestHandle handle = RequestHandle.of(UUID.randomUUID().toString());
        requests.put(handle, send(request));
        return handle;
    }

    @Override
    public Optional<HttpResult> poll(RequestHandle handle) {
        CompletableFuture<HttpResult> future = requests.get(handle);
        if (future == null || !future.isDone()) {
            return Optional.empty();
        }
        return Optional.of(future.join());
    }

    @Override
    public void discard(RequestHandle handle) {
        CompletableFuture<HttpResult> future = requests.remove(handle);
        if (future != null && !future.isDone()) {
            future.cancel(true);
        }
    }

    /**
     * 결과를 기다리는 요청 수.
     *
     * @return 보관 중인 handle 수
     */
    public int inFlight() {
        return requests.size();
    }

    private CompletableFuture<HttpResult> send(OutboundRequest request) {
        HttpRequest httpRequest;
        try {
            httpRequest = toHttpRequest(request);
        } catch (IllegalArgumentException e) {
            log.warn("Invalid outbound request {} {}: {}", request.method(), request.uri(), e.getMessage());
            return CompletableFuture.completedFuture(HttpResult.failure(e.getMessage()));
        }

        return httpClient.sendAsync(httpRequest, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8))
            .handle((response, error) -> {
                if (error != null) {
                    Throwable cause = error instanceof CompletionException && error.getCause() != null
                        ? error.getCause()
                        : error;
                    log.warn("Request {} {} failed: {}", request.method(), request.uri(), describe(cause));
                    return HttpResult.failure(describe(cause));
                }
                log.debug("Request {} {} completed: {}", request.method(), request.uri(), response.statusCode());
                return HttpResult.response(response.statusCode(), firstValues(response.headers()), response.body());
            });
    }

    private HttpRequest toHttpRequest(OutboundRequest request) {
        HttpRequest.BodyPublisher body = request.body() == null
            ? HttpRequest.BodyPublishers.noBody()
            : HttpRequest.BodyPublishers.ofString(request.body(), StandardCharsets.UTF_8);

        HttpRequest.Builder builder = HttpRequest.newBuilder(request.uri())
            .timeout(config.requestTimeout())
            .method(request.method(), body);

        for (Map.Entry<String, String> header : request.headers().entrySet()) {
            if (RESTRICTED_HEADERS.contains(header.getKey().toLowerCase(Locale.ROOT))) {
                log.debug("Skipping restricted header {} for {}", header.getKey(), request.uri());
                continue;
            }
            builder.header(header.getKey(), header.getValue());
        }
        return builder.build();
    }

    private static Map<String, String> firstValues(HttpHeaders headers) {
        Map<String, String> values = new LinkedHashMap<>();
        for (Map.Entry<String, List<String>> header : headers.map().entrySet()) {
            if (!header.getValue().isEmpty() && !header.getKey().startsWith(":")) {
                values.put(header.getKey(), header.getValue().get(0));
            }
        }
        return values;
    }

    private static String describe(Throwable error) {
        String message = error.getMessage();
        return message == null || message.isBlank() ? error.getClass().getSimpleName() : message;
    }
}

package com.ryuqq.jobqueue.testkit.support;

import com.ryuqq.jobqueue.core.model.HttpResult;
import com.ryuqq.jobqueue.core.model.OutboundRequest;
import com.ryuqq.jobqueue.core.model.RequestHandle;
import com.ryuqq.jobqueue.core.spi.AsyncHttpClient;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Function;

/**
 * 응답을 미리 지정하는 {@link AsyncHttpClient}.
 *
 * <p>제출된 요청은 기록되며, 지정한 응답은 즉시 해석된 상태가 됩니다.
 * {@link #holdResponses()} 이후 제출된 요청은 {@link #releaseAll()} 전까지 in-flight 상태로 남습니다.</p>
 *
 * <pre>
 * StubAsyncHttpClient http = new StubAsyncHttpClient();
 * http.respondWith(HttpResult.response(503, Map.of(), "down"));
 * http.respondWith(request -&gt; HttpResult.response(200, Map.of(), "ok"));
 * </pre>
 *
 * @author JobQueue Team
 * @since 1.0.0
 */
public class StubAsyncHttpClient implements AsyncHttpClient {

    private final AtomicLong sequence = new AtomicLong();
    private final List<OutboundRequest> submitted = Collections.synchronizedList(new ArrayList<>());
    private final Map<RequestHandle, HttpResult> resolved = new ConcurrentHashMap<>();
    private final Map<RequestHandle, OutboundRequest> inFlight = new ConcurrentHashMap<>();
    private final Deque<Function<OutboundRequest, HttpResult>> queued = new ArrayDeque<>();
    private volatile Function<OutboundRequest, HttpResult> fallback = request -> HttpResult.response(200, Map.of(), "");
    private volatile boolean holding;

    /**
     * 다음 요청 1건의 응답 지정 (지정 순서대로 사용).
     */
    public synchronized StubAsyncHttpClient respondOnce(HttpResult result) {
        queued.addLast(request -> result);
        return this;
    }

    /**
     * 이후 모든 요청의 기본 응답 지정.
     */
    public StubAsyncHttpClient respondWith(HttpResult result) {
        return respondWith(request -> result);
    }

    public StubAsyncHttpClient respondWith(Function<OutboundRequest, HttpResult> responder) {
        if (responder == null) {
            throw new IllegalArgumentException("responder cannot be null");
        }
        this.fallback = responder;
        return this;
    }

    public void holdResponses() {
        this.holding = true;
    }

    /**
     * in-flight 요청을 모두 해석된 상태로 전환.
     */
    public synchronized void releaseAll() {
        holding = false;
        inFlight.forEach((handle, request) -> resolved.put(handle, nextResult(request)));
        inFlight.clear();
    }

    @Override
    public synchronized RequestHandle submit(OutboundRequest request) {
        if (request == null) {
            throw new IllegalArgumentException("request cannot be null");
        }
        RequestHandle handle = RequestHandle.of("stub-" + sequence.incrementAndGet());
        submitted.add(request);
        if (holding) {
            inFlight.put(handle, request);
        } else {
            resolved.put(handle, nextResult(request));
        }
        return handle;
    }

    @Override
    public Optional<HttpResult> poll(RequestHandle handle) {
        return Optional.ofNullable(resolved.get(handle));
    }

    @Override
    public void discard(RequestHandle handle) {
        resolved.remove(handle);
    }

    public List<OutboundRequest> submittedRequests() {
        synchronized (submitted) {
            return List.copyOf(submitted);
        }
    }

    public OutboundRequest lastRequest() {
        synchronized (submitted) {
            if (submitted.isEmpty()) {
                throw new IllegalStateException("No request submitted");
            }
            return submitted.get(submitted.size() - 1);
        }
    }

    private HttpResult nextResult(OutboundRequest request) {
        Function<OutboundRequest, HttpResult> responder = queued.pollFirst();
        return (responder != null ? responder : fallback).apply(request);
    }
}

package com.ryuqq.jobqueue.core.spi;

import com.ryuqq.jobqueue.core.model.HttpResult;
import com.ryuqq.jobqueue.core.model.OutboundRequest;
import com.ryuqq.jobqueue.core.model.RequestHandle;

import java.util.Optional;

/**
 * Asynchronous HTTP facility.
 *
 * <p>{@link #submit} returns immediately with a correlation handle; the result is collected
 * later with {@link #poll}. Transport errors are reported as a resolved
 * {@link HttpResult#failure(String) failure result}, not thrown from {@link #poll}.</p>
 *
 * @author JobQueue Team
 * @since 1.0.0
 */
public interface AsyncHttpClient {

    /**
     * Issues a request without waiting for the response.
     *
     * @param request outbound request
     * @return correlation handle
     */
    RequestHandle submit(OutboundRequest request);

    /**
     * Reads the result of a request. Non-destructive: the result stays available until
     * {@link #discard} is called.
     *
     * @param handle correlation handle
     * @return the result, or empty while the request is still in flight
     */
    Optional<HttpResult> poll(RequestHandle handle);

    /**
     * Forgets a resolved request.
     *
     * @param handle correlation handle
     */
    void discard(RequestHandle handle);
}

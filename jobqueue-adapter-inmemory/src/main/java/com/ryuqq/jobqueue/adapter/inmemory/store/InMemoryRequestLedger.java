package com.ryuqq.jobqueue.adapter.inmemory.store;

import com.ryuqq.jobqueue.core.model.JobId;
import com.ryuqq.jobqueue.core.model.RequestHandle;
import com.ryuqq.jobqueue.core.spi.RequestLedger;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * In-memory implementation of {@link RequestLedger} SPI.
 *
 * @author JobQueue Team
 * @since 1.0.0
 */
public class InMemoryRequestLedger implements RequestLedger {

    private final ConcurrentHashMap<RequestHandle, PendingRequest> requests = new ConcurrentHashMap<>();

    @Override
    public void record(RequestHandle handle, JobId jobId, Instant issuedAt) {
        requests.put(handle, new PendingRequest(handle, jobId, issuedAt));
    }

    @Override
    public List<PendingRequest> pending(int batchSize) {
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be positive (current: " + batchSize + ")");
        }
        return requests.values().stream()
            .sorted(Comparator.comparing(PendingRequest::issuedAt).thenComparing(PendingRequest::jobId))
            .limit(batchSize)
            .collect(Collectors.toList());
    }

    @Override
    public void remove(RequestHandle handle) {
        if (handle != null) {
            requests.remove(handle);
        }
    }

    @Override
    public boolean contains(JobId jobId) {
        return requests.values().stream().anyMatch(request -> request.jobId().equals(jobId));
    }

    @Override
    public boolean contains(RequestHandle handle) {
        return handle != null && requests.containsKey(handle);
    }

    public int size() {
        return requests.size();
    }

    public void clear() {
        requests.clear();
    }
}

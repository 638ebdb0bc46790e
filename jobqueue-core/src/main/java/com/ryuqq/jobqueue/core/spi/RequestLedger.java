package com.ryuqq.jobqueue.core.spi;

import com.ryuqq.jobqueue.core.model.JobId;
import com.ryuqq.jobqueue.core.model.RequestHandle;

import java.time.Instant;
import java.util.List;

/**
 * Join between issued asynchronous HTTP requests and the jobs that issued them.
 *
 * <p>The claim sweep records an entry per dispatched request; the resolution sweep reads the
 * pending entries, classifies the resolved ones and removes them.</p>
 *
 * @author JobQueue Team
 * @since 1.0.0
 */
public interface RequestLedger {

    /**
     * Pending (handle, job) pair.
     *
     * @param handle request handle
     * @param jobId job that issued the request
     * @param issuedAt dispatch time
     */
    record PendingRequest(RequestHandle handle, JobId jobId, Instant issuedAt) {

        public PendingRequest {
            if (handle == null) {
                throw new IllegalArgumentException("handle cannot be null");
            }
            if (jobId == null) {
                throw new IllegalArgumentException("jobId cannot be null");
            }
            if (issuedAt == null) {
                throw new IllegalArgumentException("issuedAt cannot be null");
            }
        }
    }

    void record(RequestHandle handle, JobId jobId, Instant issuedAt);

    /**
     * Pending entries, oldest first.
     *
     * @param batchSize maximum number of entries
     * @return entries
     */
    List<PendingRequest> pending(int batchSize);

    /**
     * Removes the entry of a handle. No-op if absent.
     *
     * @param handle request handle
     */
    void remove(RequestHandle handle);

    /**
     * Whether any pending entry refers to the job.
     *
     * @param jobId job id
     * @return true if a request of this job is still pending
     */
    boolean contains(JobId jobId);

    /**
     * Whether the handle is still pending. A removed handle belongs to an attempt whose result
     * was already applied, and must not be applied again.
     *
     * @param handle request handle
     * @return true if the entry of this handle has not been removed
     */
    boolean contains(RequestHandle handle);
}

package com.ryuqq.jobqueue.core.spi;

import com.ryuqq.jobqueue.core.model.Job;

/**
 * Exclusive claim on one job row.
 *
 * <p>While a claim is open no other claimer can obtain the same row; attempts to do so
 * skip it instead of waiting. Closing the claim releases the row.</p>
 *
 * <pre>
 * try (JobClaim claim = store.claim(jobId).orElseThrow()) {
 *     claim.apply(JobUpdate.to(JobStatus.PROCESSING).lastAt(now));
 * }
 * </pre>
 *
 * @author JobQueue Team
 * @since 1.0.0
 */
public interface JobClaim extends AutoCloseable {

    /**
     * Current snapshot of the claimed job, reflecting updates applied through this claim.
     *
     * @return the job
     */
    Job job();

    /**
     * Applies an update to the claimed job.
     *
     * @param update changes to apply
     * @return the updated snapshot
     * @throws IllegalStateException if the status change is not allowed or the claim is closed
     */
    Job apply(JobUpdate update);

    /**
     * Releases the row. Idempotent.
     */
    @Override
    void close();
}

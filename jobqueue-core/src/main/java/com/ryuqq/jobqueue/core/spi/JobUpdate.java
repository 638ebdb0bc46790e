package com.ryuqq.jobqueue.core.spi;

import com.ryuqq.jobqueue.core.model.Job;
import com.ryuqq.jobqueue.core.model.Payload;
import com.ryuqq.jobqueue.core.model.ResponseSnapshot;
import com.ryuqq.jobqueue.core.statemachine.JobStatus;
import com.ryuqq.jobqueue.core.statemachine.StatusTransition;

import java.time.Instant;

/**
 * Changes applied to a claimed job.
 *
 * <p>Unset fields are left unchanged. A status change is validated against
 * {@link StatusTransition}; {@link #incrementRetry()} adds exactly one to retry_count.</p>
 *
 * <pre>
 * JobUpdate.to(JobStatus.FAILED)
 *     .incrementRetry()
 *     .runAt(now.plusSeconds(5))
 *     .lastAt(now)
 *     .response(ResponseSnapshot.of(404, "not found"));
 * </pre>
 *
 * @author JobQueue Team
 * @since 1.0.0
 */
public final class JobUpdate {

    private final JobStatus status;
    private boolean incrementRetry;
    private Instant runAt;
    private Instant lastAt;
    private ResponseSnapshot response;
    private Payload payload;

    private JobUpdate(JobStatus status) {
        this.status = status;
    }

    /**
     * Update that moves the job to the given status.
     *
     * @param status target status
     * @return update
     * @throws IllegalArgumentException if status is null
     */
    public static JobUpdate to(JobStatus status) {
        if (status == null) {
            throw new IllegalArgumentException("status cannot be null");
        }
        return new JobUpdate(status);
    }

    /**
     * Update that leaves the status unchanged.
     *
     * @return update
     */
    public static JobUpdate keepStatus() {
        return new JobUpdate(null);
    }

    public JobUpdate incrementRetry() {
        this.incrementRetry = true;
        return this;
    }

    public JobUpdate runAt(Instant runAt) {
        this.runAt = runAt;
        return this;
    }

    public JobUpdate lastAt(Instant lastAt) {
        this.lastAt = lastAt;
        return this;
    }

    public JobUpdate response(ResponseSnapshot response) {
        this.response = response;
        return this;
    }

    /**
     * Replaces the payload. Headers, including a previously computed signature, are not touched.
     *
     * @param payload new payload
     * @return this update
     */
    public JobUpdate payload(Payload payload) {
        this.payload = payload;
        return this;
    }

    /**
     * Computes the job snapshot after this update.
     *
     * @param current current snapshot
     * @return updated snapshot
     * @throws IllegalStateException if the status change is not allowed
     */
    public Job applyTo(Job current) {
        JobStatus nextStatus = current.status();
        if (status != null && status != current.status()) {
            nextStatus = StatusTransition.transition(current.status(), status);
        } else if (status != null && current.isTerminal()) {
            StatusTransition.validate(current.status(), status);
        }
        return new Job(
            current.id(),
            current.owner(),
            current.jobType(),
            nextStatus,
            current.target(),
            payload != null ? payload : current.payload(),
            current.headers(),
            current.auth(),
            current.signing(),
            incrementRetry ? current.retryCount() + 1 : current.retryCount(),
            current.retryLimit(),
            runAt != null ? runAt : current.runAt(),
            lastAt != null ? lastAt : current.lastAt(),
            current.createdAt(),
            response != null ? response : current.lastResponse()
        );
    }

    @Override
    public String toString() {
        return "JobUpdate{" +
            "status=" + status +
            ", incrementRetry=" + incrementRetry +
            ", runAt=" + runAt +
            ", lastAt=" + lastAt +
            '}';
    }
}

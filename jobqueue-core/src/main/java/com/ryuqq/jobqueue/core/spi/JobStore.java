package com.ryuqq.jobqueue.core.spi;

import com.ryuqq.jobqueue.core.model.Job;
import com.ryuqq.jobqueue.core.model.JobId;
import com.ryuqq.jobqueue.core.model.NewJob;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Job Store SPI: the source of truth for jobs and the claim discipline.
 *
 * <p><strong>Claim discipline:</strong> every mutation happens through a {@link JobClaim}. Claims
 * are non-blocking: a row already claimed by someone else is skipped, never waited on. In SQL
 * stores this maps to {@code SELECT ... FOR UPDATE SKIP LOCKED}.</p>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>Thread-safe: all methods callable from multiple threads</li>
 *   <li>At most one open claim per job</li>
 *   <li>Status changes validated with {@link com.ryuqq.jobqueue.core.statemachine.StatusTransition}</li>
 *   <li>Terminal jobs are never returned by {@link #claimEligible}</li>
 * </ul>
 *
 * @author JobQueue Team
 * @since 1.0.0
 */
public interface JobStore {

    /**
     * Inserts a job in status NEW with a store-assigned id.
     *
     * @param newJob job to insert
     * @return the stored job
     * @throws IllegalArgumentException if newJob is null
     */
    Job insert(NewJob newJob);

    /**
     * Reads the current snapshot of a job without claiming it.
     *
     * @param jobId job id
     * @return the job, or empty if unknown
     */
    Optional<Job> find(JobId jobId);

    /**
     * Claims up to {@code batchSize} jobs eligible for the claim sweep at {@code now}
     * (see {@link Job#isEligibleForSweep(Instant)}), skipping rows claimed by others.
     *
     * <p>Jobs are returned ordered by run_at, then id. The caller must close every claim.</p>
     *
     * @param now sweep time
     * @param batchSize maximum number of claims
     * @return open claims
     */
    List<JobClaim> claimEligible(Instant now, int batchSize);

    /**
     * Claims a single job without waiting.
     *
     * @param jobId job id
     * @return the claim, or empty if the job is unknown or already claimed
     */
    Optional<JobClaim> claim(JobId jobId);

    /**
     * Claims the oldest (by run_at) POLL job of the owner that is NEW, due at {@code now}
     * and accepted by {@code acceptor}. Rows claimed by others and rejected rows are skipped.
     *
     * @param owner poll owner
     * @param now poll time
     * @param acceptor extra filter (the poll HMAC check)
     * @return the claim, or empty if nothing matches
     */
    Optional<JobClaim> claimNextPollable(String owner, Instant now, Predicate<Job> acceptor);

    /**
     * Lists PROCESSING jobs whose last_at is before {@code startedBefore}, without claiming them.
     *
     * @param startedBefore cutoff
     * @param batchSize maximum number of jobs
     * @return jobs, oldest first
     */
    List<Job> scanProcessing(Instant startedBefore, int batchSize);
}

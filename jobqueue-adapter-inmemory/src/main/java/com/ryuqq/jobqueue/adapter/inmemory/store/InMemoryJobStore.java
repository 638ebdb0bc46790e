package com.ryuqq.jobqueue.adapter.inmemory.store;

import com.ryuqq.jobqueue.core.model.Job;
import com.ryuqq.jobqueue.core.model.JobId;
import com.ryuqq.jobqueue.core.model.NewJob;
import com.ryuqq.jobqueue.core.spi.JobClaim;
import com.ryuqq.jobqueue.core.spi.JobStore;
import com.ryuqq.jobqueue.core.spi.JobUpdate;
import com.ryuqq.jobqueue.core.statemachine.JobStatus;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * In-memory implementation of {@link JobStore} SPI for testing and reference purposes.
 *
 * <p>Each row carries a claim flag taken with compare-and-set, the in-memory counterpart of
 * {@code SELECT ... FOR UPDATE SKIP LOCKED}: a claimer that loses the race skips the row instead
 * of waiting. A claim is not bound to the thread that took it.</p>
 *
 * <p><strong>Data Structures:</strong></p>
 * <ul>
 *   <li><strong>rows:</strong> ConcurrentHashMap&lt;JobId, Row&gt; - current snapshot and claim flag per job</li>
 *   <li><strong>sequence:</strong> AtomicLong - id generator (1, 2, 3, ...)</li>
 * </ul>
 *
 * <p><strong>Claim Protocol:</strong></p>
 * <pre>
 * 1. Scan a snapshot of candidate rows (ordered by run_at, id)
 * 2. compareAndSet(false, true) on the row's claim flag; skip on failure
 * 3. Re-check the predicate on the row's current snapshot; release if it no longer holds
 * </pre>
 *
 * <p><strong>Limitations:</strong></p>
 * <ul>
 *   <li>Data lost on process restart</li>
 *   <li>Candidate scans are O(N)</li>
 * </ul>
 *
 * @author JobQueue Team
 * @since 1.0.0
 */
public class InMemoryJobStore implements JobStore {

    private static final Comparator<Job> BY_RUN_AT = Comparator
        .comparing(Job::runAt)
        .thenComparing(Job::id);

    private final ConcurrentHashMap<JobId, Row> rows;
    private final AtomicLong sequence;

    /**
     * Creates a new InMemoryJobStore with empty storage.
     */
    public InMemoryJobStore() {
        this.rows = new ConcurrentHashMap<>();
        this.sequence = new AtomicLong();
    }

    @Override
    public Job insert(NewJob newJob) {
        if (newJob == null) {
            throw new IllegalArgumentException("newJob cannot be null");
        }
        JobId id = JobId.of(sequence.incrementAndGet());
        Job job = Job.create(id, newJob);
        rows.put(id, new Row(job));
        return job;
    }

    @Override
    public Optional<Job> find(JobId jobId) {
        if (jobId == null) {
            throw new IllegalArgumentException("jobId cannot be null");
        }
        Row row = rows.get(jobId);
        return row == null ? Optional.empty() : Optional.of(row.job);
    }

    /**
     * {@inheritDoc}
     *
     * <p><strong>Implementation Notes:</strong> rows claimed by another caller, or that stopped
     * being eligible between the scan and the claim, are skipped.</p>
     */
    @Override
    public List<JobClaim> claimEligible(Instant now, int batchSize) {
        if (now == null) {
            throw new IllegalArgumentException("now cannot be null");
        }
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be positive (current: " + batchSize + ")");
        }

        List<JobClaim> claims = new ArrayList<>();
        for (Job candidate : candidates(job -> job.isEligibleForSweep(now))) {
            if (claims.size() >= batchSize) {
                break;
            }
            tryClaim(candidate.id(), job -> job.isEligibleForSweep(now)).ifPresent(claims::add);
        }
        return claims;
    }

    @Override
    public Optional<JobClaim> claim(JobId jobId) {
        if (jobId == null) {
            throw new IllegalArgumentException("jobId cannot be null");
        }
        return tryClaim(jobId, job -> true);
    }

    @Override
    public Optional<JobClaim> claimNextPollable(String owner, Instant now, Predicate<Job> acceptor) {
        if (owner == null) {
            throw new IllegalArgumentException("owner cannot be null");
        }
        if (now == null) {
            throw new IllegalArgumentException("now cannot be null");
        }
        if (acceptor == null) {
            throw new IllegalArgumentException("acceptor cannot be null");
        }

        Predicate<Job> pollable = job -> job.isPollableBy(owner, now);
        for (Job candidate : candidates(pollable)) {
            Optional<JobClaim> claim = tryClaim(candidate.id(), pollable.and(acceptor));
            if (claim.isPresent()) {
                return claim;
            }
        }
        return Optional.empty();
    }

    @Override
    public List<Job> scanProcessing(Instant startedBefore, int batchSize) {
        if (startedBefore == null) {
            throw new IllegalArgumentException("startedBefore cannot be null");
        }
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be positive (current: " + batchSize + ")");
        }
        return rows.values().stream()
            .map(row -> row.job)
            .filter(job -> job.status() == JobStatus.PROCESSING)
            .filter(job -> job.lastAt() != null && job.lastAt().isBefore(startedBefore))
            .sorted(Comparator.comparing(Job::lastAt).thenComparing(Job::id))
            .limit(batchSize)
            .collect(Collectors.toList());
    }

    /**
     * Number of stored jobs (for testing).
     *
     * @return job count
     */
    public int size() {
        return rows.size();
    }

    /**
     * Clears all jobs (for testing).
     */
    public void clear() {
        rows.clear();
    }

    private List<Job> candidates(Predicate<Job> filter) {
        return rows.values().stream()
            .map(row -> row.job)
            .filter(filter)
            .sorted(BY_RUN_AT)
            .collect(Collectors.toList());
    }

    private Optional<JobClaim> tryClaim(JobId jobId, Predicate<Job> stillMatches) {
        Row row = rows.get(jobId);
        if (row == null || !row.claimed.compareAndSet(false, true)) {
            return Optional.empty();
        }
        if (!stillMatches.test(row.job)) {
            row.claimed.set(false);
            return Optional.empty();
        }
        return Optional.of(new InMemoryJobClaim(row));
    }

    private static final class Row {

        private volatile Job job;
        private final AtomicBoolean claimed = new AtomicBoolean(false);

        private Row(Job job) {
            this.job = job;
        }
    }

    private static final class InMemoryJobClaim implements JobClaim {

        private final Row row;
        private final AtomicBoolean closed = new AtomicBoolean(false);

        private InMemoryJobClaim(Row row) {
            this.row = row;
        }

        @Override
        public Job job() {
            return row.job;
        }

        @Override
        public Job apply(JobUpdate update) {
            if (update == null) {
                throw new IllegalArgumentException("update cannot be null");
            }
            if (closed.get()) {
                throw new IllegalStateException("Claim already released: " + row.job.id());
            }
            Job updated = update.applyTo(row.job);
            row.job = updated;
            return updated;
        }

        @Override
        public void close() {
            if (closed.compareAndSet(false, true)) {
                row.claimed.set(false);
            }
        }
    }
}

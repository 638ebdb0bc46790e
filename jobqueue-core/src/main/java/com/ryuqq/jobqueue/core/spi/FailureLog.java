package com.ryuqq.jobqueue.core.spi;

import com.ryuqq.jobqueue.core.model.FailureLogEntry;
import com.ryuqq.jobqueue.core.model.JobId;

import java.util.List;

/**
 * Append-only audit trail of failed attempts.
 *
 * <p>Entries are never updated or removed.</p>
 *
 * @author JobQueue Team
 * @since 1.0.0
 */
public interface FailureLog {

    /**
     * Appends an entry.
     *
     * @param entry failed attempt
     * @throws IllegalArgumentException if entry is null
     */
    void append(FailureLogEntry entry);

    /**
     * Entries of one job in append order.
     *
     * @param jobId job id
     * @return entries, empty if none
     */
    List<FailureLogEntry> findByJob(JobId jobId);
}

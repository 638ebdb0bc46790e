package com.ryuqq.jobqueue.adapter.inmemory.store;

import com.ryuqq.jobqueue.core.model.FailureLogEntry;
import com.ryuqq.jobqueue.core.model.JobId;
import com.ryuqq.jobqueue.core.spi.FailureLog;

import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * In-memory implementation of {@link FailureLog} SPI.
 *
 * <p>Entries are kept per job in append order. Nothing is ever removed except by {@link #clear()}.</p>
 *
 * @author JobQueue Team
 * @since 1.0.0
 */
public class InMemoryFailureLog implements FailureLog {

    private final ConcurrentHashMap<JobId, CopyOnWriteArrayList<FailureLogEntry>> entries = new ConcurrentHashMap<>();

    @Override
    public void append(FailureLogEntry entry) {
        if (entry == null) {
            throw new IllegalArgumentException("entry cannot be null");
        }
        entries.computeIfAbsent(entry.jobId(), id -> new CopyOnWriteArrayList<>()).add(entry);
    }

    @Override
    public List<FailureLogEntry> findByJob(JobId jobId) {
        if (jobId == null) {
            throw new IllegalArgumentException("jobId cannot be null");
        }
        List<FailureLogEntry> found = entries.get(jobId);
        return found == null ? List.of() : List.copyOf(found);
    }

    /**
     * Total number of entries (for testing).
     *
     * @return entry count
     */
    public int size() {
        return entries.values().stream().mapToInt(List::size).sum();
    }

    /**
     * Clears all entries (for testing).
     */
    public void clear() {
        entries.clear();
    }
}

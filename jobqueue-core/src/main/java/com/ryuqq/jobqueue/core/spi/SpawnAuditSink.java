package com.ryuqq.jobqueue.core.spi;

import com.ryuqq.jobqueue.core.model.Job;

/**
 * Receives jobs created by triggers or redirects, with their source.
 *
 * @author JobQueue Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface SpawnAuditSink {

    /**
     * @param job created job
     * @param source origin (e.g. a trigger name, or {@code redirect:<parentId>})
     */
    void record(Job job, String source);

    /**
     * Sink that discards everything.
     *
     * @return no-op sink
     */
    static SpawnAuditSink noop() {
        return (job, source) -> { };
    }
}

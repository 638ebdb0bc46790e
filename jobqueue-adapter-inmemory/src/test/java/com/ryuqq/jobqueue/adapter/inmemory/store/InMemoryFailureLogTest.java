package com.ryuqq.jobqueue.adapter.inmemory.store;

import com.ryuqq.jobqueue.core.model.FailureLogEntry;
import com.ryuqq.jobqueue.core.model.JobId;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * InMemoryFailureLog 테스트.
 *
 * @author JobQueue Team
 * @since 1.0.0
 */
class InMemoryFailureLogTest {

    private static final Instant NOW = Instant.parse("2024-01-01T00:00:00Z");

    private final InMemoryFailureLog failureLog = new InMemoryFailureLog();

    @Test
    void findByJob_기록_순서_유지() {
        // given
        JobId jobId = JobId.of(1);
        failureLog.append(new FailureLogEntry(jobId, 1, 404, "a", NOW));
        failureLog.append(new FailureLogEntry(JobId.of(2), 1, 500, "other", NOW));
        failureLog.append(new FailureLogEntry(jobId, 2, 0, "b", NOW.plusSeconds(5)));

        // when
        List<FailureLogEntry> entries = failureLog.findByJob(jobId);

        // then
        assertThat(entries).extracting(FailureLogEntry::attemptNumber).containsExactly(1, 2);
        assertThat(failureLog.size()).isEqualTo(3);
    }

    @Test
    void findByJob_반환_목록은_수정_불가() {
        JobId jobId = JobId.of(1);
        failureLog.append(new FailureLogEntry(jobId, 1, 404, "a", NOW));

        List<FailureLogEntry> entries = failureLog.findByJob(jobId);

        assertThatThrownBy(entries::clear).isInstanceOf(UnsupportedOperationException.class);
        assertThat(failureLog.findByJob(JobId.of(99))).isEmpty();
    }
}

package com.ryuqq.jobqueue.adapter.runner;

import com.ryuqq.jobqueue.core.model.FailureLogEntry;
import com.ryuqq.jobqueue.core.model.Job;
import com.ryuqq.jobqueue.core.model.JobId;
import com.ryuqq.jobqueue.core.model.JobSpec;
import com.ryuqq.jobqueue.core.model.JobType;
import com.ryuqq.jobqueue.core.model.NewJob;
import com.ryuqq.jobqueue.core.model.ResponseSnapshot;
import com.ryuqq.jobqueue.core.outcome.Outcome;
import com.ryuqq.jobqueue.core.outcome.OutcomeKind;
import com.ryuqq.jobqueue.core.spi.FailureLog;
import com.ryuqq.jobqueue.core.spi.JobClaim;
import com.ryuqq.jobqueue.core.spi.JobUpdate;
import com.ryuqq.jobqueue.core.statemachine.JobStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * OutcomeApplier 유닛 테스트.
 *
 * <p>분류 결과가 JobUpdate와 Failure Log 항목으로 변환되는지 검증합니다.</p>
 */
@ExtendWith(MockitoExtension.class)
class OutcomeApplierTest {

    private static final Instant NOW = Instant.parse("2024-03-01T00:00:00Z");

    @Mock
    private FailureLog failureLog;

    @Mock
    private RedirectSpawner redirectSpawner;

    @Mock
    private JobClaim claim;

    private OutcomeApplier applier;

    @BeforeEach
    void setUp() {
        applier = new OutcomeApplier(failureLog, redirectSpawner);
    }

    @Test
    void apply_실패_시도는_retry_count를_올리고_직전_시도_번호로_기록함() {
        // given
        Job job = processing(3);
        when(claim.job()).thenReturn(job);
        when(claim.apply(any())).thenAnswer(invocation -> invocation.<JobUpdate>getArgument(0).applyTo(job));
        Outcome outcome = new Outcome(OutcomeKind.TRANSIENT_FAILURE, JobStatus.FAILED,
            ResponseSnapshot.of(404, "not found"), NOW.plusSeconds(32));

        // when
        Job updated = applier.apply(claim, outcome, NOW);

        // then
        assertThat(updated.status()).isEqualTo(JobStatus.FAILED);
        assertThat(updated.retryCount()).isEqualTo(4);
        assertThat(updated.runAt()).isEqualTo(NOW.plusSeconds(32));
        assertThat(updated.lastAt()).isEqualTo(NOW);

        ArgumentCaptor<FailureLogEntry> captor = ArgumentCaptor.forClass(FailureLogEntry.class);
        verify(failureLog).append(captor.capture());
        assertThat(captor.getValue().jobId()).isEqualTo(job.id());
        assertThat(captor.getValue().attemptNumber()).isEqualTo(4);
        assertThat(captor.getValue().responseStatus()).isEqualTo(404);
        assertThat(captor.getValue().responseContent()).isEqualTo("not found");
        assertThat(captor.getValue().loggedAt()).isEqualTo(NOW);
    }

    @Test
    void apply_성공은_retry_count를_유지하고_Failure_Log에_기록하지_않음() {
        // given
        Job job = processing(2);
        when(claim.job()).thenReturn(job);
        when(claim.apply(any())).thenAnswer(invocation -> invocation.<JobUpdate>getArgument(0).applyTo(job));
        Outcome outcome = new Outcome(OutcomeKind.SUCCESS, JobStatus.COMPLETED, ResponseSnapshot.of(200, "ok"), null);

        // when
        Job updated = applier.apply(claim, outcome, NOW);

        // then
        assertThat(updated.status()).isEqualTo(JobStatus.COMPLETED);
        assertThat(updated.retryCount()).isEqualTo(2);
        assertThat(updated.runAt()).isEqualTo(job.runAt());
        verify(failureLog, never()).append(any());
        verify(redirectSpawner, never()).spawn(any(), any());
    }

    @Test
    void apply_REDIRECTED는_파생_Job_생성을_요청함() {
        // given
        Job job = processing(0);
        when(claim.job()).thenReturn(job);
        when(claim.apply(any())).thenAnswer(invocation -> invocation.<JobUpdate>getArgument(0).applyTo(job));
        ResponseSnapshot response = ResponseSnapshot.of(210, "{\"url\":\"https://next.example.com\"}");
        Outcome outcome = new Outcome(OutcomeKind.REDIRECTED, JobStatus.REDIRECTED, response, null);

        // when
        Job updated = applier.apply(claim, outcome, NOW);

        // then
        assertThat(updated.status()).isEqualTo(JobStatus.REDIRECTED);
        verify(redirectSpawner).spawn(updated, response);
        verify(failureLog, never()).append(any());
    }

    private static Job processing(int retryCount) {
        JobSpec spec = JobSpec.builder(JobType.GET).target("https://hooks.example.com/x").build();
        Job created = Job.create(JobId.of(7L), new NewJob(spec, spec.headers(), NOW, NOW));
        return new Job(created.id(), created.owner(), created.jobType(), JobStatus.PROCESSING, created.target(),
            created.payload(), created.headers(), created.auth(), created.signing(), retryCount,
            created.retryLimit(), created.runAt(), NOW, created.createdAt(), null);
    }
}

package com.ryuqq.jobqueue.adapter.runner;

import com.ryuqq.jobqueue.core.model.Job;
import com.ryuqq.jobqueue.core.model.JobSpec;
import com.ryuqq.jobqueue.core.model.JobType;
import com.ryuqq.jobqueue.core.spi.JobClaim;
import com.ryuqq.jobqueue.core.statemachine.JobStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * StaleProcessingReaper 테스트.
 *
 * <p>진행 중인 요청 없이 PROCESSING에 남은 Job의 정리를 검증합니다.</p>
 */
class StaleProcessingReaperTest {

    private EngineFixture fixture;
    private StaleProcessingReaper reaper;

    @BeforeEach
    void setUp() {
        fixture = new EngineFixture();
        reaper = fixture.reaper(new StaleReaperConfig().withTimeoutThresholdMs(60_000));
    }

    @Test
    void reap_요청_기록이_유실된_장기_PROCESSING_Job은_실행_오류로_정리됨() {
        // given
        Job job = processingJobWithoutPendingRequest();
        fixture.clock.advanceSeconds(61);

        // when
        int reaped = reaper.reap();

        // then
        Job reloaded = fixture.reload(job.id());
        assertThat(reaped).isEqualTo(1);
        assertThat(reloaded.status()).isEqualTo(JobStatus.FAILED);
        assertThat(reloaded.retryCount()).isEqualTo(1);
        assertThat(reloaded.lastResponse().status()).isZero();
        assertThat(reloaded.lastResponse().content()).isEqualTo("Job processing timed out");
        assertThat(fixture.failureLog.findByJob(job.id())).hasSize(1);
    }

    @Test
    void reap_임계값이_지나지_않은_Job은_그대로_둠() {
        // given
        Job job = processingJobWithoutPendingRequest();
        fixture.clock.advanceSeconds(30);

        // when
        int reaped = reaper.reap();

        // then
        assertThat(reaped).isZero();
        assertThat(fixture.reload(job.id()).status()).isEqualTo(JobStatus.PROCESSING);
    }

    @Test
    void reap_진행_중인_요청이_있는_Job은_건드리지_않음() {
        // given
        fixture.http.holdResponses();
        Job job = fixture.submitter.submit(JobSpec.builder(JobType.GET)
            .target("https://slow.example.com/report")
            .build());
        fixture.sweeper().sweep();
        fixture.clock.advanceSeconds(120);

        // when
        int reaped = reaper.reap();

        // then
        assertThat(reaped).isZero();
        assertThat(fixture.reload(job.id()).status()).isEqualTo(JobStatus.PROCESSING);
    }

    @Test
    void reap_다른_워커가_claim한_Job은_건너뜀() {
        // given
        Job job = processingJobWithoutPendingRequest();
        fixture.clock.advanceSeconds(61);

        try (JobClaim held = fixture.store.claim(job.id()).orElseThrow()) {
            // when
            int reaped = reaper.reap();

            // then
            assertThat(reaped).isZero();
            assertThat(held.job().status()).isEqualTo(JobStatus.PROCESSING);
        }
    }

    private Job processingJobWithoutPendingRequest() {
        fixture.http.holdResponses();
        Job job = fixture.submitter.submit(JobSpec.builder(JobType.GET)
            .target("https://hooks.example.com/lost")
            .build());
        fixture.sweeper().sweep();
        fixture.ledger.clear();
        return job;
    }
}

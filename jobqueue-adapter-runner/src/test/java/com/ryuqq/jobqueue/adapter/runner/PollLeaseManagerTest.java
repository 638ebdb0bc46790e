package com.ryuqq.jobqueue.adapter.runner;

import com.ryuqq.jobqueue.application.queue.AuthenticationException;
import com.ryuqq.jobqueue.application.queue.PollRequest;
import com.ryuqq.jobqueue.application.queue.PolledJob;
import com.ryuqq.jobqueue.application.queue.StaleRequestException;
import com.ryuqq.jobqueue.core.model.Job;
import com.ryuqq.jobqueue.core.model.JobSpec;
import com.ryuqq.jobqueue.core.model.JobType;
import com.ryuqq.jobqueue.core.model.Payload;
import com.ryuqq.jobqueue.core.model.SigningConfig;
import com.ryuqq.jobqueue.core.signing.HmacCodec;
import com.ryuqq.jobqueue.core.spi.JobClaim;
import com.ryuqq.jobqueue.core.statemachine.JobStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * PollLeaseManager 테스트.
 *
 * <p>poll 인증(timestamp, HMAC, 호출자), lease 부여, ack 처리를 검증합니다.</p>
 */
class PollLeaseManagerTest {

    private static final String OWNER = "worker-a";
    private static final byte[] SECRET = "poll-secret".getBytes(StandardCharsets.UTF_8);

    private EngineFixture fixture;
    private PollLeaseManager manager;

    @BeforeEach
    void setUp() {
        fixture = new EngineFixture();
        fixture.vault.put("worker-a-key", SECRET);
        manager = fixture.pollLeaseManager();
    }

    // ============================================================
    // 1. poll
    // ============================================================

    @Test
    void poll_서명이_맞으면_POLLED로_전환하고_60초_lease를_부여함() {
        // given
        Job job = submitPollJob(Map.of("task", "resize"));
        Instant now = fixture.clock.instant();

        // when
        Optional<PolledJob> polled = manager.poll(signedRequest(nowTimestamp()));

        // then
        assertThat(polled).isPresent();
        assertThat(polled.get().id()).isEqualTo(job.id());
        assertThat(polled.get().payload()).isEqualTo(Payload.of(Map.of("task", "resize")));

        Job reloaded = fixture.reload(job.id());
        assertThat(reloaded.status()).isEqualTo(JobStatus.POLLED);
        assertThat(reloaded.runAt()).isEqualTo(now.plusSeconds(60));
        assertThat(reloaded.lastAt()).isEqualTo(now);
    }

    @Test
    void poll_autoAck이면_바로_COMPLETED가_됨() {
        // given
        Job job = submitPollJob(Map.of());

        // when
        Optional<PolledJob> polled = manager.poll(signedRequest(nowTimestamp()).withAutoAck(true));

        // then
        assertThat(polled).isPresent();
        assertThat(fixture.reload(job.id()).status()).isEqualTo(JobStatus.COMPLETED);
    }

    @Test
    void poll_run_at이_가장_이른_Job부터_가져감() {
        // given
        Instant now = fixture.clock.instant();
        Job later = submitPollJob(Map.of("n", 2), now.minusSeconds(10));
        Job earlier = submitPollJob(Map.of("n", 1), now.minusSeconds(20));

        // when
        PolledJob first = manager.poll(signedRequest(nowTimestamp())).orElseThrow();
        PolledJob second = manager.poll(signedRequest(nowTimestamp())).orElseThrow();

        // then
        assertThat(first.id()).isEqualTo(earlier.id());
        assertThat(second.id()).isEqualTo(later.id());
        assertThat(manager.poll(signedRequest(nowTimestamp()))).isEmpty();
    }

    @Test
    void poll_허용_오차보다_오래된_timestamp는_거부되고_상태가_바뀌지_않음() {
        // given
        Job job = submitPollJob(Map.of());
        BigDecimal stale = nowTimestamp().subtract(BigDecimal.valueOf(3));

        // when & then
        assertThatThrownBy(() -> manager.poll(signedRequest(stale)))
            .isInstanceOf(StaleRequestException.class)
            .hasMessageContaining("Timestamp is too old");
        assertThat(fixture.reload(job.id()).status()).isEqualTo(JobStatus.NEW);
    }

    @Test
    void poll_허용_오차_안의_소수점_timestamp는_허용됨() {
        // given
        submitPollJob(Map.of());
        BigDecimal recent = nowTimestamp().subtract(new BigDecimal("1.5"));

        // when
        Optional<PolledJob> polled = manager.poll(signedRequest(recent));

        // then
        assertThat(polled).isPresent();
    }

    @Test
    void poll_서명이_틀리면_아무_Job도_가져가지_않음() {
        // given
        Job job = submitPollJob(Map.of());

        // when
        Optional<PolledJob> polled = manager.poll(PollRequest.of(OWNER, nowTimestamp(), "deadbeef"));

        // then
        assertThat(polled).isEmpty();
        assertThat(fixture.reload(job.id()).status()).isEqualTo(JobStatus.NEW);
    }

    @Test
    void poll_다른_owner의_Job은_가져가지_않음() {
        // given
        fixture.submitter.submit(JobSpec.builder(JobType.POLL)
            .owner("worker-b")
            .signing(SigningConfig.fromVault("worker-a-key"))
            .build());
        BigDecimal timestamp = nowTimestamp();

        // when
        Optional<PolledJob> polled = manager.poll(signedRequest(timestamp));

        // then
        assertThat(polled).isEmpty();
    }

    @Test
    void poll_asUser이면_호출자_ID가_서명에_포함됨() {
        // given
        Job job = submitPollJob(Map.of());
        BigDecimal timestamp = nowTimestamp();
        String hmac = HmacCodec.hexSha256(SECRET, OWNER + timestamp.toPlainString() + "user-42" + "POLL");

        // when
        Optional<PolledJob> polled = manager.poll(PollRequest.of(OWNER, timestamp, hmac).asCaller("user-42"));

        // then
        assertThat(polled).map(PolledJob::id).contains(job.id());
    }

    @Test
    void poll_asUser인데_호출자_ID가_없으면_인증_예외() {
        // given
        submitPollJob(Map.of());
        PollRequest request = signedRequest(nowTimestamp()).asCaller(null);

        // when & then
        assertThatThrownBy(() -> manager.poll(request))
            .isInstanceOf(AuthenticationException.class);
    }

    @Test
    void poll_다른_워커가_claim한_Job은_건너뛰고_다음_Job을_가져감() {
        // given
        Instant now = fixture.clock.instant();
        Job locked = submitPollJob(Map.of("n", 1), now.minusSeconds(20));
        Job free = submitPollJob(Map.of("n", 2), now.minusSeconds(10));

        try (JobClaim held = fixture.store.claim(locked.id()).orElseThrow()) {
            // when
            Optional<PolledJob> polled = manager.poll(signedRequest(nowTimestamp()));

            // then
            assertThat(polled).map(PolledJob::id).contains(free.id());
            assertThat(held.job().status()).isEqualTo(JobStatus.NEW);
        }
    }

    // ============================================================
    // 2. ack
    // ============================================================

    @Test
    void ack_서명이_맞으면_POLLED_Job을_COMPLETED로_전환함() {
        // given
        Job job = submitPollJob(Map.of());
        manager.poll(signedRequest(nowTimestamp()));

        // when
        boolean acked = manager.ack(job.id(), HmacCodec.hexSha256(SECRET, job.id().asText() + "ACK"));

        // then
        assertThat(acked).isTrue();
        assertThat(fixture.reload(job.id()).status()).isEqualTo(JobStatus.COMPLETED);
    }

    @Test
    void ack_서명이_틀리면_false이고_상태가_바뀌지_않음() {
        // given
        Job job = submitPollJob(Map.of());
        manager.poll(signedRequest(nowTimestamp()));

        // when
        boolean acked = manager.ack(job.id(), HmacCodec.hexSha256(SECRET, job.id().asText() + "NACK"));

        // then
        assertThat(acked).isFalse();
        assertThat(fixture.reload(job.id()).status()).isEqualTo(JobStatus.POLLED);
    }

    @Test
    void ack_POLLED가_아닌_Job은_false() {
        // given
        Job job = submitPollJob(Map.of());

        // when
        boolean acked = manager.ack(job.id(), HmacCodec.hexSha256(SECRET, job.id().asText() + "ACK"));

        // then
        assertThat(acked).isFalse();
        assertThat(fixture.reload(job.id()).status()).isEqualTo(JobStatus.NEW);
    }

    private Job submitPollJob(Map<String, ?> payload) {
        return submitPollJob(payload, null);
    }

    private Job submitPollJob(Map<String, ?> payload, Instant runAt) {
        return fixture.submitter.submit(JobSpec.builder(JobType.POLL)
            .owner(OWNER)
            .payload(Payload.of(payload))
            .signing(SigningConfig.fromVault("worker-a-key"))
            .runAt(runAt)
            .build());
    }

    private PollRequest signedRequest(BigDecimal timestamp) {
        String hmac = HmacCodec.hexSha256(SECRET, OWNER + timestamp.toPlainString() + "POLL");
        return PollRequest.of(OWNER, timestamp, hmac);
    }

    private BigDecimal nowTimestamp() {
        return PollLeaseManager.epochSeconds(fixture.clock.instant());
    }
}

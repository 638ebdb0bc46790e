package com.ryuqq.jobqueue.adapter.runner;

import com.ryuqq.jobqueue.application.queue.AuthenticationException;
import com.ryuqq.jobqueue.application.queue.PollRequest;
import com.ryuqq.jobqueue.application.queue.PolledJob;
import com.ryuqq.jobqueue.application.queue.StaleRequestException;
import com.ryuqq.jobqueue.core.model.Job;
import com.ryuqq.jobqueue.core.model.JobId;
import com.ryuqq.jobqueue.core.signing.HmacCodec;
import com.ryuqq.jobqueue.core.signing.SecretLookup;
import com.ryuqq.jobqueue.core.spi.JobClaim;
import com.ryuqq.jobqueue.core.spi.JobStore;
import com.ryuqq.jobqueue.core.spi.JobUpdate;
import com.ryuqq.jobqueue.core.statemachine.JobStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.Optional;

/**
 * POLL Job의 lease 기반 poll/ack 프로토콜.
 *
 * <p><strong>poll:</strong></p>
 * <pre>
 * 1. asUser인데 호출자 ID 없음 → AuthenticationException
 * 2. timestamp &lt; now - maxTimestampSkew → StaleRequestException (상태 변경 없음)
 * 3. owner의 NEW POLL Job 중 run_at이 가장 이른 것부터, 요청 HMAC이 Job secret과 일치하는 첫 Job claim
 * 4. autoAck → COMPLETED, 아니면 POLLED (run_at = now + leaseDuration)
 * </pre>
 *
 * <p><strong>ack:</strong> HMAC-SHA256(secret, jobId + "ACK")이 일치하고 POLLED인 경우에만 COMPLETED.</p>
 *
 * <p>lease 만료는 여기서 감지하지 않습니다. run_at이 지난 POLLED Job은 claim sweep이 NEW로 되돌립니다.</p>
 *
 * @author JobQueue Team
 * @since 1.0.0
 */
public final class PollLeaseManager {

    private static final Logger log = LoggerFactory.getLogger(PollLeaseManager.class);
    private static final String ACK_SUFFIX = "ACK";

    private final JobStore store;
    private final SecretLookup secretLookup;
    private final PollLeaseConfig config;
    private final Clock clock;

    /**
     * 생성자.
     *
     * @param store 저장소
     * @param secretLookup Job secret 조회
     * @param config 설정
     * @param clock 시계
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public PollLeaseManager(JobStore store, SecretLookup secretLookup, PollLeaseConfig config, Clock clock) {
        if (store == null) {
            throw new IllegalArgumentException("store cannot be null");
        }
        if (secretLookup == null) {
            throw new IllegalArgumentException("secretLookup cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.store = store;
        this.secretLookup = secretLookup;
        this.config = config;
        this.clock = clock;
    }

    /**
     * POLL Job 하나를 가져옴.
     *
     * @param request poll 요청
     * @return 가져온 Job, 조건에 맞는 Job이 없으면 empty
     * @throws AuthenticationException asUser인데 호출자 ID가 없는 경우
     * @throws StaleRequestException timestamp가 허용 오차보다 오래된 경우
     */
    public Optional<PolledJob> poll(PollRequest request) {
        if (request == null) {
            throw new IllegalArgumentException("request cannot be null");
        }
        if (request.asUser() && (request.callerId() == null || request.callerId().isBlank())) {
            throw new AuthenticationException("Caller id is required for user-scoped poll");
        }

        Instant now = clock.instant();
        if (request.timestamp().compareTo(epochSeconds(now.minus(config.maxTimestampSkew()))) < 0) {
            log.warn("Rejected poll for owner {} with stale timestamp {}", request.owner(),
                request.timestamp().toPlainString());
            throw new StaleRequestException(request.timestamp());
        }

        String message = request.stringToSign();
        Optional<JobClaim> claimed = store.claimNextPollable(
            request.owner(), now, job -> signatureMatches(job, message, request.hmac()));
        if (claimed.isEmpty()) {
            return Optional.empty();
        }

        try (JobClaim claim = claimed.get()) {
            JobUpdate update = request.autoAck()
                ? JobUpdate.to(JobStatus.COMPLETED).lastAt(now)
                : JobUpdate.to(JobStatus.POLLED).runAt(now.plus(config.leaseDuration())).lastAt(now);
            Job job = claim.apply(update);
            log.info("Job {} polled by {} → {}", job.id(), request.owner(), job.status().label());
            return Optional.of(new PolledJob(job.id(), job.payload(), job.headers()));
        }
    }

    /**
     * poll로 가져온 Job 완료 확인.
     *
     * @param jobId Job ID
     * @param hmac HMAC-SHA256(secret, jobId + "ACK") hex
     * @return 완료 처리되었으면 true
     */
    public boolean ack(JobId jobId, String hmac) {
        if (jobId == null) {
            throw new IllegalArgumentException("jobId cannot be null");
        }

        Optional<JobClaim> claimed = store.claim(jobId);
        if (claimed.isEmpty()) {
            log.debug("Ack for job {} ignored: not found or locked", jobId);
            return false;
        }

        try (JobClaim claim = claimed.get()) {
            Job job = claim.job();
            if (job.status() != JobStatus.POLLED) {
                log.debug("Ack for job {} ignored: status {}", jobId, job.status().label());
                return false;
            }
            if (!signatureMatches(job, jobId.asText() + ACK_SUFFIX, hmac)) {
                log.warn("Ack for job {} rejected: signature mismatch", jobId);
                return false;
            }
            claim.apply(JobUpdate.to(JobStatus.COMPLETED).lastAt(clock.instant()));
            log.info("Job {} acknowledged", jobId);
            return true;
        }
    }

    private boolean signatureMatches(Job job, String message, String hmac) {
        return secretLookup.secretFor(job.signing())
            .map(secret -> HmacCodec.matches(HmacCodec.hexSha256(secret, message), hmac))
            .orElse(false);
    }

    static BigDecimal epochSeconds(Instant instant) {
        return BigDecimal.valueOf(instant.getEpochSecond())
            .add(BigDecimal.valueOf(instant.getNano(), 9));
    }
}

package com.ryuqq.jobqueue.adapter.runner;

import com.ryuqq.jobqueue.core.model.Job;
import com.ryuqq.jobqueue.core.outcome.ResponseClassifier;
import com.ryuqq.jobqueue.core.spi.JobClaim;
import com.ryuqq.jobqueue.core.spi.JobStore;
import com.ryuqq.jobqueue.core.spi.RequestLedger;
import com.ryuqq.jobqueue.core.statemachine.JobStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Stale Processing Reaper 컴포넌트.
 *
 * <p>진행 중인 요청 없이 PROCESSING에 오래 머문 Job을 실행 오류로 정리합니다.</p>
 *
 * <p><strong>정리 시나리오:</strong></p>
 * <pre>
 * 1. Job claim → PROCESSING → HTTP 요청 발행
 * 2. 프로세스 재시작 → 메모리상의 요청 기록 유실
 * 3. Job은 PROCESSING으로 남음 (응답을 적용할 주체가 없음)
 * 4. Reaper가 last_at이 임계값보다 오래된 PROCESSING Job 발견
 * 5. "Job processing timed out" 실행 오류로 분류 → FAILED (재시도) 또는 TOO_MANY
 * </pre>
 *
 * <p>ledger에 진행 중인 요청이 남아 있는 Job은 건드리지 않습니다.</p>
 *
 * @author JobQueue Team
 * @since 1.0.0
 */
public final class StaleProcessingReaper {

    static final String TIMEOUT_MESSAGE = "Job processing timed out";

    private static final Logger log = LoggerFactory.getLogger(StaleProcessingReaper.class);

    private final JobStore store;
    private final RequestLedger ledger;
    private final ResponseClassifier classifier;
    private final OutcomeApplier applier;
    private final StaleReaperConfig config;
    private final Clock clock;

    /**
     * 생성자.
     *
     * @param store 저장소
     * @param ledger 발행 요청 기록
     * @param classifier 오류 분류
     * @param applier 결과 적용
     * @param config 설정
     * @param clock 시계
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public StaleProcessingReaper(JobStore store, RequestLedger ledger, ResponseClassifier classifier,
                                 OutcomeApplier applier, StaleReaperConfig config, Clock clock) {
        if (store == null) {
            throw new IllegalArgumentException("store cannot be null");
        }
        if (ledger == null) {
            throw new IllegalArgumentException("ledger cannot be null");
        }
        if (classifier == null) {
            throw new IllegalArgumentException("classifier cannot be null");
        }
        if (applier == null) {
            throw new IllegalArgumentException("applier cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.store = store;
        this.ledger = ledger;
        this.classifier = classifier;
        this.applier = applier;
        this.config = config;
        this.clock = clock;
    }

    /**
     * 장기 PROCESSING Job 스캔 및 정리.
     *
     * @return 정리한 Job 수
     */
    public int reap() {
        Instant now = clock.instant();
        Instant cutoff = now.minusMillis(config.timeoutThresholdMs());
        log.info("Stale processing scan started");

        // 1. 임계값보다 오래된 PROCESSING Job 스캔
        List<Job> stuck = store.scanProcessing(cutoff, config.batchSize());

        // 2. 진행 중인 요청이 없는 Job만 정리
        int reaped = 0;
        for (Job job : stuck) {
            if (ledger.contains(job.id())) {
                continue;
            }
            if (tryReap(job, cutoff, now)) {
                reaped++;
            }
        }

        // 3. 결과 로깅
        log.info("Stale processing scan completed: {} reaped out of {} stuck", reaped, stuck.size());
        return reaped;
    }

    private boolean tryReap(Job job, Instant cutoff, Instant now) {
        try {
            Optional<JobClaim> claimed = store.claim(job.id());
            if (claimed.isEmpty()) {
                return false;
            }
            try (JobClaim claim = claimed.get()) {
                // claim 이후 다시 확인 (다른 워커가 이미 처리했을 수 있음)
                Job current = claim.job();
                if (current.status() != JobStatus.PROCESSING || !isStale(current, cutoff)) {
                    return false;
                }
                applier.apply(claim, classifier.classifyError(current, TIMEOUT_MESSAGE, now), now);
                log.info("Reaped stale processing job {}", current.id());
                return true;
            }

        } catch (Exception e) {
            log.error("Failed to reap job {} in stale processing scan", job.id(), e);
            return false;
        }
    }

    private static boolean isStale(Job job, Instant cutoff) {
        return job.lastAt() == null || job.lastAt().isBefore(cutoff);
    }
}

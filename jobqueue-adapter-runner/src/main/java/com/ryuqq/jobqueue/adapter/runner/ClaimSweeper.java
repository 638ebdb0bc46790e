package com.ryuqq.jobqueue.adapter.runner;

import com.ryuqq.jobqueue.core.model.Job;
import com.ryuqq.jobqueue.core.outcome.Outcome;
import com.ryuqq.jobqueue.core.outcome.ResponseClassifier;
import com.ryuqq.jobqueue.core.spi.JobClaim;
import com.ryuqq.jobqueue.core.spi.JobStore;
import com.ryuqq.jobqueue.core.spi.JobUpdate;
import com.ryuqq.jobqueue.core.statemachine.JobStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Claim Sweeper 컴포넌트.
 *
 * <p>실행 가능한 Job을 비차단 방식으로 claim하여 PROCESSING으로 전환하고 실행합니다.</p>
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * sweep() 호출
 *   ↓
 * claimEligible(now, batchSize) → [claim1, claim2, ...]  (다른 워커가 잡고 있는 Job은 건너뜀)
 *   ↓
 * For each claim:
 *   1. PROCESSING, last_at = now
 *   2. dispatcher.dispatch(job):
 *      - FUNC → 즉시 결과 적용
 *      - POLL (lease 만료) → 408 결과 적용
 *      - HTTP → 요청 발행만, 결과는 ResultResolver가 적용
 *   3. claim 해제
 * </pre>
 *
 * <p><strong>오류 처리:</strong></p>
 * <ul>
 *   <li>Job 단위 실행 오류는 INTERNAL_EXECUTION_ERROR로 분류하여 재시도 예산을 소모합니다</li>
 *   <li>한 Job의 실패가 같은 sweep의 다른 Job 처리를 방해하지 않습니다</li>
 * </ul>
 *
 * @author JobQueue Team
 * @since 1.0.0
 */
public final class ClaimSweeper {

    private static final Logger log = LoggerFactory.getLogger(ClaimSweeper.class);

    private final JobStore store;
    private final JobDispatcher dispatcher;
    private final OutcomeApplier applier;
    private final ResponseClassifier classifier;
    private final SweeperConfig config;
    private final Clock clock;

    /**
     * 생성자.
     *
     * @param store 저장소
     * @param dispatcher 타입별 실행
     * @param applier 결과 적용
     * @param classifier 오류 분류
     * @param config 설정
     * @param clock 시계
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public ClaimSweeper(JobStore store, JobDispatcher dispatcher, OutcomeApplier applier,
                        ResponseClassifier classifier, SweeperConfig config, Clock clock) {
        if (store == null) {
            throw new IllegalArgumentException("store cannot be null");
        }
        if (dispatcher == null) {
            throw new IllegalArgumentException("dispatcher cannot be null");
        }
        if (applier == null) {
            throw new IllegalArgumentException("applier cannot be null");
        }
        if (classifier == null) {
            throw new IllegalArgumentException("classifier cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.store = store;
        this.dispatcher = dispatcher;
        this.applier = applier;
        this.classifier = classifier;
        this.config = config;
        this.clock = clock;
    }

    /**
     * sweep 1회 실행.
     *
     * @return claim한 Job 수
     */
    public int sweep() {
        Instant now = clock.instant();
        log.info("Claim sweep started");

        // 1. 실행 가능한 Job claim (잠긴 Job은 건너뜀)
        List<JobClaim> claims = store.claimEligible(now, config.batchSize());

        // 2. 각 Job 실행 시도
        int dispatched = 0;
        for (JobClaim claim : claims) {
            if (tryDispatch(claim, now)) {
                dispatched++;
            }
        }

        // 3. 결과 로깅
        log.info("Claim sweep completed: {} dispatched out of {} claimed", dispatched, claims.size());
        return claims.size();
    }

    /**
     * 개별 Job 실행 시도.
     *
     * <p>claim은 결과와 무관하게 항상 해제됩니다.</p>
     *
     * @param claim Job claim
     * @param now sweep 시각
     * @return 오류 없이 실행되었으면 true
     */
    private boolean tryDispatch(JobClaim claim, Instant now) {
        try (claim) {
            Job job = claim.job();
            try {
                Job processing = claim.apply(JobUpdate.to(JobStatus.PROCESSING).lastAt(now));
                Optional<Outcome> outcome = dispatcher.dispatch(processing, now);
                outcome.ifPresent(o -> applier.apply(claim, o, now));
                return true;

            } catch (Exception e) {
                log.error("Failed to dispatch job {} in claim sweep", job.id(), e);
                recordError(claim, e, now);
                return false;
            }
        }
    }

    private void recordError(JobClaim claim, Exception cause, Instant now) {
        Job job = claim.job();
        try {
            String message = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getName();
            applier.apply(claim, classifier.classifyError(job, message, now), now);
        } catch (Exception e) {
            log.error("Failed to record execution error for job {}", job.id(), e);
        }
    }
}

package com.ryuqq.jobqueue.adapter.runner;

import com.ryuqq.jobqueue.core.model.HttpResult;
import com.ryuqq.jobqueue.core.model.Job;
import com.ryuqq.jobqueue.core.outcome.ResponseClassifier;
import com.ryuqq.jobqueue.core.spi.AsyncHttpClient;
import com.ryuqq.jobqueue.core.spi.JobClaim;
import com.ryuqq.jobqueue.core.spi.JobStore;
import com.ryuqq.jobqueue.core.spi.RequestLedger;
import com.ryuqq.jobqueue.core.spi.RequestLedger.PendingRequest;
import com.ryuqq.jobqueue.core.statemachine.JobStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Result Resolver 컴포넌트.
 *
 * <p>발행된 HTTP 요청 중 응답(또는 전송 오류)이 도착한 것을 분류하여 Job에 적용합니다.</p>
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * resolve() 호출
 *   ↓
 * ledger.pending(batchSize) → [(handle, jobId), ...]
 *   ↓
 * For each pending:
 *   1. httpClient.poll(handle) → 아직 미해석이면 건너뜀 (다음 resolve에서 재확인)
 *   2. store.claim(jobId) → 잠겨 있으면 건너뜀
 *   3. handle이 ledger에 남아 있는지 확인 (이미 적용된 응답이면 버림)
 *   4. PROCESSING인 경우에만 classifier.classify → applier.apply
 *      (분류/적용 중 예외 → 상태 0 실행 오류로 기록)
 *   5. claim을 쥔 채로 ledger.remove(handle), httpClient.discard(handle)
 * </pre>
 *
 * <p><strong>멱등성:</strong> 이미 PROCESSING이 아닌 Job의 응답은 적용하지 않고 버립니다.</p>
 *
 * @author JobQueue Team
 * @since 1.0.0
 */
public final class ResultResolver {

    private static final Logger log = LoggerFactory.getLogger(ResultResolver.class);

    private final JobStore store;
    private final RequestLedger ledger;
    private final AsyncHttpClient httpClient;
    private final ResponseClassifier classifier;
    private final OutcomeApplier applier;
    private final ResolverConfig config;
    private final Clock clock;

    /**
     * 생성자.
     *
     * @param store 저장소
     * @param ledger 발행 요청 기록
     * @param httpClient 비동기 HTTP
     * @param classifier 응답 분류
     * @param applier 결과 적용
     * @param config 설정
     * @param clock 시계
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public ResultResolver(JobStore store, RequestLedger ledger, AsyncHttpClient httpClient,
                          ResponseClassifier classifier, OutcomeApplier applier,
                          ResolverConfig config, Clock clock) {
        if (store == null) {
            throw new IllegalArgumentException("store cannot be null");
        }
        if (ledger == null) {
            throw new IllegalArgumentException("ledger cannot be null");
        }
        if (httpClient == null) {
            throw new IllegalArgumentException("httpClient cannot be null");
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
        this.httpClient = httpClient;
        this.classifier = classifier;
        this.applier = applier;
        this.config = config;
        this.clock = clock;
    }

    /**
     * 해석된 요청 결과 적용 1회 실행.
     *
     * @return 결과를 적용한 Job 수
     */
    public int resolve() {
        log.debug("Result resolution started");

        List<PendingRequest> pending = ledger.pending(config.batchSize());

        int resolved = 0;
        for (PendingRequest request : pending) {
            if (tryResolve(request)) {
                resolved++;
            }
        }

        log.debug("Result resolution completed: {} resolved out of {} pending", resolved, pending.size());
        return resolved;
    }

    /**
     * 개별 요청 결과 적용 시도.
     *
     * @param request 발행 요청
     * @return Job에 결과를 적용했으면 true
     */
    private boolean tryResolve(PendingRequest request) {
        try {
            // 1. 응답 도착 여부 확인
            Optional<HttpResult> result = httpClient.poll(request.handle());
            if (result.isEmpty()) {
                return false;
            }

            // 2. Job 존재 확인
            if (store.find(request.jobId()).isEmpty()) {
                log.warn("Dropping response for unknown job {}", request.jobId());
                forget(request);
                return false;
            }

            // 3. claim 후 분류/적용 (잠겨 있으면 다음 resolve에서 재시도)
            Optional<JobClaim> claimed = store.claim(request.jobId());
            if (claimed.isEmpty()) {
                log.debug("Job {} is locked, deferring resolution", request.jobId());
                return false;
            }

            try (JobClaim claim = claimed.get()) {
                // 4. 이미 적용된 요청이면 버림
                if (!ledger.contains(request.handle())) {
                    log.debug("Response for job {} was already applied, discarding", request.jobId());
                    httpClient.discard(request.handle());
                    return false;
                }

                boolean applied = applyResult(claim, result.get());

                // 5. claim을 쥔 채로 기록 정리
                forget(request);
                return applied;
            }

        } catch (Exception e) {
            log.error("Failed to resolve response for job {}", request.jobId(), e);
            return false;
        }
    }

    private boolean applyResult(JobClaim claim, HttpResult result) {
        Job job = claim.job();
        if (job.status() != JobStatus.PROCESSING) {
            log.warn("Discarding response for job {} in status {}", job.id(), job.status().label());
            return false;
        }

        Instant now = clock.instant();
        try {
            applier.apply(claim, classifier.classify(job, result, now), now);
            return true;
        } catch (Exception e) {
            log.error("Failed to apply response for job {}", job.id(), e);
            return recordError(claim, e, now);
        }
    }

    private boolean recordError(JobClaim claim, Exception cause, Instant now) {
        Job job = claim.job();
        if (job.status() != JobStatus.PROCESSING) {
            return false;
        }
        try {
            String message = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getName();
            applier.apply(claim, classifier.classifyError(job, message, now), now);
            return true;
        } catch (Exception e) {
            log.error("Failed to record execution error for job {}", job.id(), e);
            return false;
        }
    }

    private void forget(PendingRequest request) {
        ledger.remove(request.handle());
        httpClient.discard(request.handle());
    }
}

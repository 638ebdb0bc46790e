package com.ryuqq.jobqueue.core.outcome;

import com.ryuqq.jobqueue.core.model.HttpResult;
import com.ryuqq.jobqueue.core.model.Job;
import com.ryuqq.jobqueue.core.model.ResponseSnapshot;
import com.ryuqq.jobqueue.core.retry.BackoffPolicy;
import com.ryuqq.jobqueue.core.retry.RetryAfterParser;
import com.ryuqq.jobqueue.core.statemachine.JobStatus;

import java.time.Duration;
import java.time.Instant;

/**
 * 실행 결과를 다음 상태로 분류.
 *
 * <p><strong>분류 규칙 (순서대로 적용):</strong></p>
 * <ol>
 *   <li>전송 실패 → 실패 경로 (status 0, 오류 메시지, backoff)</li>
 *   <li>redirect 트리거 코드 (기본 210) → REDIRECTED</li>
 *   <li>200~299 → COMPLETED</li>
 *   <li>429 → FAILED, run_at = now + Retry-After (없으면 600초)</li>
 *   <li>400~499 + 완료 헤더 → COMPLETED</li>
 *   <li>400~499 → FAILED, run_at = now + backoff</li>
 *   <li>500~599 → SERVER_ERROR</li>
 *   <li>그 외 → OTHER</li>
 * </ol>
 *
 * <p>FAILED로 분류되기 전에 retry_count + 1 &gt; retry_limit 이면 TOO_MANY가 됩니다.</p>
 *
 * <p>Thread-safe: 상태를 갖지 않습니다.</p>
 *
 * @author JobQueue Team
 * @since 1.0.0
 */
public class ResponseClassifier {

    private final ClassifierConfig config;
    private final BackoffPolicy backoffPolicy;

    public ResponseClassifier() {
        this(new ClassifierConfig(), new BackoffPolicy());
    }

    /**
     * 생성자.
     *
     * @param config 분류 설정
     * @param backoffPolicy 재시도 지연 계산기
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public ResponseClassifier(ClassifierConfig config, BackoffPolicy backoffPolicy) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (backoffPolicy == null) {
            throw new IllegalArgumentException("backoffPolicy cannot be null");
        }
        this.config = config;
        this.backoffPolicy = backoffPolicy;
    }

    /**
     * HTTP 결과 분류.
     *
     * @param job 실행한 Job (분류 시점의 retry_count 기준)
     * @param result HTTP 결과
     * @param now 현재 시각
     * @return 분류 결과
     */
    public Outcome classify(Job job, HttpResult result, Instant now) {
        if (result.isTransportFailure()) {
            return classifyError(job, result.error(), now);
        }

        int status = result.status();
        ResponseSnapshot response = ResponseSnapshot.from(result);

        if (status == config.redirectStatus()) {
            return new Outcome(OutcomeKind.REDIRECTED, JobStatus.REDIRECTED, response, null);
        }
        if (status >= 200 && status <= 299) {
            return new Outcome(OutcomeKind.SUCCESS, JobStatus.COMPLETED, response, null);
        }
        if (status == 429) {
            Duration delay = result.header("Retry-After")
                .flatMap(value -> RetryAfterParser.parse(value, now))
                .orElse(config.defaultRateLimitDelay());
            return failure(job, OutcomeKind.RATE_LIMITED, response, now.plus(delay));
        }
        if (status >= 400 && status <= 499) {
            if (result.hasHeader(config.finishedHeader())) {
                return new Outcome(OutcomeKind.PERMANENT_CLIENT_SUCCESS, JobStatus.COMPLETED, response, null);
            }
            return failure(job, OutcomeKind.TRANSIENT_FAILURE, response,
                backoffPolicy.nextRunAt(now, job.retryCount()));
        }
        if (status >= 500 && status <= 599) {
            return new Outcome(OutcomeKind.PERMANENT_SERVER_FAILURE, JobStatus.SERVER_ERROR, response, null);
        }
        return new Outcome(OutcomeKind.UNCLASSIFIED, JobStatus.OTHER, response, null);
    }

    /**
     * 내부 실행 오류 분류.
     *
     * <p>응답 상태 0, 오류 메시지를 기록하며 4xx 실패와 같은 재시도/한도 규칙을 따릅니다.</p>
     *
     * @param job 실행한 Job
     * @param message 오류 메시지
     * @param now 현재 시각
     * @return 분류 결과 (FAILED 또는 TOO_MANY)
     */
    public Outcome classifyError(Job job, String message, Instant now) {
        return failure(job, OutcomeKind.INTERNAL_EXECUTION_ERROR, ResponseSnapshot.of(0, message),
            backoffPolicy.nextRunAt(now, job.retryCount()));
    }

    private Outcome failure(Job job, OutcomeKind kind, ResponseSnapshot response, Instant retryAt) {
        if (job.isLastAttempt()) {
            return new Outcome(OutcomeKind.RETRIES_EXHAUSTED, JobStatus.TOO_MANY, response, null);
        }
        return new Outcome(kind, JobStatus.FAILED, response, retryAt);
    }
}

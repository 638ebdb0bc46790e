package com.ryuqq.jobqueue.adapter.runner;

import com.ryuqq.jobqueue.core.model.FailureLogEntry;
import com.ryuqq.jobqueue.core.model.Job;
import com.ryuqq.jobqueue.core.outcome.Outcome;
import com.ryuqq.jobqueue.core.outcome.OutcomeKind;
import com.ryuqq.jobqueue.core.spi.FailureLog;
import com.ryuqq.jobqueue.core.spi.JobClaim;
import com.ryuqq.jobqueue.core.spi.JobUpdate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;

/**
 * 분류 결과를 claim된 Job에 적용.
 *
 * <p><strong>적용 내용:</strong></p>
 * <ul>
 *   <li>상태, 마지막 응답, last_at 갱신 (run_at은 결과에 있을 때만)</li>
 *   <li>실패 시도: retry_count + 1, Failure Log 기록 (attempt = 적용 전 retry_count + 1)</li>
 *   <li>REDIRECTED: 파생 Job 1건 생성</li>
 * </ul>
 *
 * @author JobQueue Team
 * @since 1.0.0
 */
public final class OutcomeApplier {

    private static final Logger log = LoggerFactory.getLogger(OutcomeApplier.class);

    private final FailureLog failureLog;
    private final RedirectSpawner redirectSpawner;

    public OutcomeApplier(FailureLog failureLog, RedirectSpawner redirectSpawner) {
        if (failureLog == null) {
            throw new IllegalArgumentException("failureLog cannot be null");
        }
        if (redirectSpawner == null) {
            throw new IllegalArgumentException("redirectSpawner cannot be null");
        }
        this.failureLog = failureLog;
        this.redirectSpawner = redirectSpawner;
    }

    /**
     * 결과 적용.
     *
     * @param claim 대상 Job의 claim
     * @param outcome 분류 결과
     * @param now 현재 시각
     * @return 적용 후 Job
     * @throws IllegalStateException 허용되지 않은 상태 전이인 경우
     */
    public Job apply(JobClaim claim, Outcome outcome, Instant now) {
        Job before = claim.job();

        JobUpdate update = JobUpdate.to(outcome.status())
            .lastAt(now)
            .response(outcome.response());
        outcome.runAtOptional().ifPresent(update::runAt);
        if (outcome.isFailedAttempt()) {
            update.incrementRetry();
        }

        Job after = claim.apply(update);

        if (outcome.isFailedAttempt()) {
            failureLog.append(new FailureLogEntry(
                before.id(),
                before.retryCount() + 1,
                outcome.response().status(),
                outcome.response().content(),
                now
            ));
            log.warn("Job {} attempt {} failed: {} (status {}) → {}",
                before.id(), before.retryCount() + 1, outcome.kind(), outcome.response().status(),
                after.status().label());
        } else {
            log.info("Job {} {} → {}", before.id(), outcome.kind(), after.status().label());
        }

        if (outcome.kind() == OutcomeKind.REDIRECTED) {
            redirectSpawner.spawn(after, outcome.response());
        }
        return after;
    }
}

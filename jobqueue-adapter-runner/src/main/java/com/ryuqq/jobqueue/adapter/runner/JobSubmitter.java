package com.ryuqq.jobqueue.adapter.runner;

import com.ryuqq.jobqueue.core.model.Job;
import com.ryuqq.jobqueue.core.model.JobSpec;
import com.ryuqq.jobqueue.core.model.JobValidationException;
import com.ryuqq.jobqueue.core.model.NewJob;
import com.ryuqq.jobqueue.core.signing.PayloadSigner;
import com.ryuqq.jobqueue.core.spi.JobStore;
import com.ryuqq.jobqueue.core.spi.SpawnAuditSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.Map;

/**
 * Job 생성 (서명 → 삽입 → 감사 기록).
 *
 * <p>직접 제출, 트리거 제출, redirect 파생 Job 생성이 모두 이 경로를 사용합니다.</p>
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * 1. signer.sign(spec) → 서명 헤더 병합 (서명 설정이 있는 경우)
 * 2. run_at 결정 (지정값 또는 현재 시각)
 * 3. store.insert(newJob) → NEW
 * 4. source가 있으면 auditSink.record(job, source)
 * </pre>
 *
 * @author JobQueue Team
 * @since 1.0.0
 */
public final class JobSubmitter {

    private static final Logger log = LoggerFactory.getLogger(JobSubmitter.class);

    private final JobStore store;
    private final PayloadSigner signer;
    private final SpawnAuditSink auditSink;
    private final Clock clock;

    /**
     * 생성자.
     *
     * @param store 저장소
     * @param signer payload 서명
     * @param auditSink 파생 Job 감사 기록
     * @param clock 시계
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public JobSubmitter(JobStore store, PayloadSigner signer, SpawnAuditSink auditSink, Clock clock) {
        if (store == null) {
            throw new IllegalArgumentException("store cannot be null");
        }
        if (signer == null) {
            throw new IllegalArgumentException("signer cannot be null");
        }
        if (auditSink == null) {
            throw new IllegalArgumentException("auditSink cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.store = store;
        this.signer = signer;
        this.auditSink = auditSink;
        this.clock = clock;
    }

    /**
     * Job 생성.
     *
     * @param spec 제출 요청
     * @return 저장된 Job
     * @throws JobValidationException 유효하지 않은 요청인 경우
     */
    public Job submit(JobSpec spec) {
        return submit(spec, null);
    }

    /**
     * 출처를 기록하며 Job 생성.
     *
     * @param spec 제출 요청
     * @param source 출처 (null이면 감사 기록 생략)
     * @return 저장된 Job
     * @throws JobValidationException 유효하지 않은 요청인 경우
     */
    public Job submit(JobSpec spec, String source) {
        if (spec == null) {
            throw new JobValidationException("spec cannot be null");
        }

        Instant now = clock.instant();
        Map<String, String> headers = signer.sign(spec);
        Instant runAt = spec.runAt() != null ? spec.runAt() : now;

        Job job = store.insert(new NewJob(spec, headers, runAt, now));
        log.debug("Job {} submitted: type={}, runAt={}", job.id(), job.jobType(), job.runAt());

        if (source != null) {
            auditSink.record(job, source);
        }
        return job;
    }
}

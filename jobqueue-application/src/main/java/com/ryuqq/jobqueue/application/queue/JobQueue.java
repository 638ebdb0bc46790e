package com.ryuqq.jobqueue.application.queue;

import com.ryuqq.jobqueue.core.model.FailureLogEntry;
import com.ryuqq.jobqueue.core.model.Job;
import com.ryuqq.jobqueue.core.model.JobId;
import com.ryuqq.jobqueue.core.model.JobSpec;
import com.ryuqq.jobqueue.core.model.JobValidationException;

import java.util.List;
import java.util.Optional;

/**
 * Job 큐 진입점.
 *
 * <p>Job 제출, 조회, 그리고 외부 consumer의 poll/ack를 담당합니다.
 * 실행은 비동기이며 주기적인 sweep에 의해 진행됩니다 ({@link com.ryuqq.jobqueue.application.runtime.EngineRuntime}).</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * Job job = jobQueue.submit(JobSpec.builder(JobType.POST)
 *     .target("https://partner.example.com/webhook")
 *     .payload(Payload.of(Map.of("orderId", 42)))
 *     .signing(SigningConfig.fromVault("partner-webhook"))
 *     .build());
 *
 * // 이후 상태 조회
 * jobQueue.find(job.id()).map(Job::status);
 * </pre>
 *
 * <p>제출 검증 오류와 poll 인증 오류를 제외한 모든 실행 실패는 예외로 전파되지 않고
 * Job의 상태와 Failure Log에 기록됩니다.</p>
 *
 * @author JobQueue Team
 * @since 1.0.0
 */
public interface JobQueue {

    /**
     * Job 제출.
     *
     * <p>서명 설정이 있으면 이 시점에 payload 서명을 계산하여 헤더에 추가합니다.
     * run_at이 없으면 현재 시각으로 설정됩니다.</p>
     *
     * @param spec 제출 요청
     * @return 저장된 Job (NEW)
     * @throws JobValidationException 유효하지 않은 요청이거나 vault secret을 찾을 수 없는 경우
     */
    Job submit(JobSpec spec);

    /**
     * 트리거에 의한 Job 제출.
     *
     * <p>{@link #submit(JobSpec)}과 같으며, 생성된 Job을 출처와 함께 감사 sink에 기록합니다.</p>
     *
     * @param spec 제출 요청
     * @param source 출처 (예: 트리거 이름)
     * @return 저장된 Job
     * @throws JobValidationException 유효하지 않은 요청인 경우
     */
    Job submitFromTrigger(JobSpec spec, String source);

    Optional<Job> find(JobId jobId);

    /**
     * Job의 실패 이력.
     *
     * @param jobId Job ID
     * @return 기록 순서대로의 실패 항목
     */
    List<FailureLogEntry> failures(JobId jobId);

    /**
     * 소유자의 POLL Job 하나를 lease와 함께 가져옴.
     *
     * @param request poll 요청
     * @return 가져온 Job, 없으면 empty
     * @throws StaleRequestException timestamp가 허용 오차보다 오래된 경우
     * @throws AuthenticationException asUser인데 호출자 ID가 없는 경우
     */
    Optional<PolledJob> poll(PollRequest request);

    /**
     * poll로 가져온 Job의 완료 확인.
     *
     * @param jobId Job ID
     * @param hmac HMAC-SHA256(secret, jobId + "ACK") hex
     * @return 완료 처리되었으면 true, 서명 불일치/상태 불일치/claim 실패 시 false
     */
    boolean ack(JobId jobId, String hmac);
}

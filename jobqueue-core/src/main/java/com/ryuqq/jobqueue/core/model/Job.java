package com.ryuqq.jobqueue.core.model;

import com.ryuqq.jobqueue.core.statemachine.JobStatus;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * 저장된 Job (불변 스냅샷).
 *
 * <p>저장소에서 조회한 시점의 상태를 나타냅니다. 변경은 항상 저장소의 claim을 통해
 * 새로운 스냅샷으로 이루어집니다.</p>
 *
 * <p><strong>불변식:</strong></p>
 * <ul>
 *   <li>retryCount는 0 이상이며 감소하지 않음</li>
 *   <li>종료 상태의 Job은 다시 claim 되지 않음</li>
 * </ul>
 *
 * @param id Job ID
 * @param owner 소유자 (null 가능)
 * @param jobType 실행 방식
 * @param status 현재 상태
 * @param target URL 또는 함수 이름 (POLL은 null 가능)
 * @param payload 업무 데이터
 * @param headers outbound 헤더 (서명 헤더 포함)
 * @param auth 인증 설정
 * @param signing 서명 설정
 * @param retryCount 실패한 시도 횟수
 * @param retryLimit 최대 재시도 횟수
 * @param runAt 다음 실행 가능 시각
 * @param lastAt 마지막 상태 변경 시각
 * @param createdAt 생성 시각
 * @param lastResponse 마지막 시도의 응답 (없으면 null)
 *
 * @author JobQueue Team
 * @since 1.0.0
 */
public record Job(
    JobId id,
    String owner,
    JobType jobType,
    JobStatus status,
    String target,
    Payload payload,
    Map<String, String> headers,
    AuthConfig auth,
    SigningConfig signing,
    int retryCount,
    int retryLimit,
    Instant runAt,
    Instant lastAt,
    Instant createdAt,
    ResponseSnapshot lastResponse
) {

    public Job {
        if (id == null) {
            throw new IllegalArgumentException("id cannot be null");
        }
        if (jobType == null) {
            throw new IllegalArgumentException("jobType cannot be null");
        }
        if (status == null) {
            throw new IllegalArgumentException("status cannot be null");
        }
        if (retryCount < 0) {
            throw new IllegalArgumentException("retryCount must be non-negative (current: " + retryCount + ")");
        }
        if (runAt == null) {
            throw new IllegalArgumentException("runAt cannot be null");
        }
        payload = payload == null ? Payload.empty() : payload;
        headers = headers == null ? Collections.emptyMap() : Collections.unmodifiableMap(new LinkedHashMap<>(headers));
        auth = auth == null ? AuthConfig.none() : auth;
        signing = signing == null ? SigningConfig.none() : signing;
    }

    /**
     * 삽입 요청으로부터 NEW 상태의 Job 생성.
     *
     * @param id 저장소가 발급한 ID
     * @param newJob 삽입 요청
     * @return NEW 상태, retryCount 0인 Job
     */
    public static Job create(JobId id, NewJob newJob) {
        JobSpec spec = newJob.spec();
        return new Job(
            id,
            spec.owner(),
            spec.jobType(),
            JobStatus.NEW,
            spec.target(),
            spec.payload(),
            newJob.headers(),
            spec.auth(),
            spec.signing(),
            0,
            spec.retryLimit(),
            newJob.runAt(),
            newJob.createdAt(),
            newJob.createdAt(),
            null
        );
    }

    public boolean isTerminal() {
        return status.isTerminal();
    }

    /**
     * 한 번 더 실패하면 재시도 한도를 넘는지 확인.
     *
     * @return retryCount + 1 &gt; retryLimit인 경우 true
     */
    public boolean isLastAttempt() {
        return retryCount + 1 > retryLimit;
    }

    /**
     * claim sweep 대상인지 확인.
     *
     * <p>runAt이 도래한 Job 중:</p>
     * <ul>
     *   <li>NEW (POLL Job 제외, POLL Job은 consumer가 poll로 가져감)</li>
     *   <li>FAILED 이면서 retryCount ≤ retryLimit</li>
     *   <li>POLLED (lease 만료)</li>
     * </ul>
     *
     * @param now 기준 시각
     * @return 대상이면 true
     */
    public boolean isEligibleForSweep(Instant now) {
        if (runAt.isAfter(now)) {
            return false;
        }
        return switch (status) {
            case NEW -> jobType != JobType.POLL;
            case FAILED -> retryCount <= retryLimit;
            case POLLED -> true;
            default -> false;
        };
    }

    /**
     * 주어진 owner가 poll 할 수 있는 Job인지 확인.
     *
     * @param pollOwner poll 요청 owner
     * @param now 기준 시각
     * @return POLL 타입, NEW 상태, owner 일치, runAt 도래인 경우 true
     */
    public boolean isPollableBy(String pollOwner, Instant now) {
        return jobType == JobType.POLL
            && status == JobStatus.NEW
            && owner != null && owner.equals(pollOwner)
            && !runAt.isAfter(now);
    }

    public Optional<ResponseSnapshot> lastResponseOptional() {
        return Optional.ofNullable(lastResponse);
    }
}

package com.ryuqq.jobqueue.core.model;

import java.time.Instant;

/**
 * 실패한 실행 시도 1건의 감사 기록.
 *
 * <p>append-only: 기록 후 수정, 삭제되지 않습니다.</p>
 *
 * @param jobId Job ID
 * @param attemptNumber 시도 번호 (해당 시도 직전 retry_count + 1)
 * @param responseStatus 응답 상태 코드 (내부 오류 0, lease 만료 408)
 * @param responseContent 응답 본문 또는 오류 메시지
 * @param loggedAt 기록 시각
 *
 * @author JobQueue Team
 * @since 1.0.0
 */
public record FailureLogEntry(
    JobId jobId,
    int attemptNumber,
    int responseStatus,
    String responseContent,
    Instant loggedAt
) {

    public FailureLogEntry {
        if (jobId == null) {
            throw new IllegalArgumentException("jobId cannot be null");
        }
        if (attemptNumber < 1) {
            throw new IllegalArgumentException("attemptNumber must be positive (current: " + attemptNumber + ")");
        }
        if (loggedAt == null) {
            throw new IllegalArgumentException("loggedAt cannot be null");
        }
    }
}

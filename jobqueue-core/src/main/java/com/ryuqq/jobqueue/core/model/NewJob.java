package com.ryuqq.jobqueue.core.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 저장소에 삽입할 Job.
 *
 * <p>서명 헤더가 병합된 헤더와 확정된 run_at을 가집니다. ID는 저장소가 발급합니다.</p>
 *
 * @param spec 제출 요청
 * @param headers 서명 헤더까지 병합된 최종 헤더
 * @param runAt 최초 실행 가능 시각
 * @param createdAt 생성 시각
 *
 * @author JobQueue Team
 * @since 1.0.0
 */
public record NewJob(
    JobSpec spec,
    Map<String, String> headers,
    Instant runAt,
    Instant createdAt
) {

    public NewJob {
        if (spec == null) {
            throw new IllegalArgumentException("spec cannot be null");
        }
        if (runAt == null) {
            throw new IllegalArgumentException("runAt cannot be null");
        }
        if (createdAt == null) {
            throw new IllegalArgumentException("createdAt cannot be null");
        }
        headers = headers == null ? Collections.emptyMap() : Collections.unmodifiableMap(new LinkedHashMap<>(headers));
    }
}

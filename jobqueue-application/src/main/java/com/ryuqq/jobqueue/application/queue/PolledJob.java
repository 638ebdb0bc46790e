package com.ryuqq.jobqueue.application.queue;

import com.ryuqq.jobqueue.core.model.JobId;
import com.ryuqq.jobqueue.core.model.Payload;

import java.util.Map;

/**
 * poll 결과로 consumer에게 전달되는 Job.
 *
 * @param id Job ID (ack에 사용)
 * @param payload 업무 데이터
 * @param headers 헤더
 *
 * @author JobQueue Team
 * @since 1.0.0
 */
public record PolledJob(
    JobId id,
    Payload payload,
    Map<String, String> headers
) {

    public PolledJob {
        if (id == null) {
            throw new IllegalArgumentException("id cannot be null");
        }
        headers = headers == null ? Map.of() : Map.copyOf(headers);
    }
}

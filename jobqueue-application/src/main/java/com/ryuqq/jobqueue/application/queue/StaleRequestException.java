package com.ryuqq.jobqueue.application.queue;

import java.math.BigDecimal;

/**
 * 허용 오차보다 오래된 timestamp를 가진 poll 요청.
 *
 * <p>재전송 공격 방지를 위해 거부되며, 어떤 Job의 상태도 변경하지 않습니다.</p>
 *
 * @author JobQueue Team
 * @since 1.0.0
 */
public class StaleRequestException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final BigDecimal timestamp;

    public StaleRequestException(BigDecimal timestamp) {
        super("Timestamp is too old: " + (timestamp == null ? null : timestamp.toPlainString()));
        this.timestamp = timestamp;
    }

    public BigDecimal getTimestamp() {
        return timestamp;
    }
}

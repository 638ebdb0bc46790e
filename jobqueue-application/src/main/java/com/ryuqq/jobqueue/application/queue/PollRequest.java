package com.ryuqq.jobqueue.application.queue;

import java.math.BigDecimal;

/**
 * 외부 consumer의 poll 요청.
 *
 * <p>hmac은 Job secret으로 계산한 HMAC-SHA256(hex)이며, 서명 대상 문자열은 다음과 같습니다:</p>
 * <pre>
 * owner + timestamp + [callerId (asUser인 경우)] + "POLL"
 * </pre>
 *
 * <p>timestamp는 epoch 초 (소수 허용)이며, 서명 문자열에는 전달받은 표기 그대로
 * ({@link BigDecimal#toPlainString()}) 사용됩니다.</p>
 *
 * @param owner 소유자
 * @param timestamp 요청 시각 (epoch 초)
 * @param hmac 요청 서명
 * @param asUser 호출자 ID를 서명에 포함할지 여부
 * @param callerId 인증된 호출자 ID (asUser인 경우 필수)
 * @param autoAck 가져오면서 바로 완료 처리할지 여부
 *
 * @author JobQueue Team
 * @since 1.0.0
 */
public record PollRequest(
    String owner,
    BigDecimal timestamp,
    String hmac,
    boolean asUser,
    String callerId,
    boolean autoAck
) {

    public PollRequest {
        if (owner == null || owner.isBlank()) {
            throw new IllegalArgumentException("owner cannot be null or blank");
        }
        if (timestamp == null) {
            throw new IllegalArgumentException("timestamp cannot be null");
        }
        if (hmac == null) {
            throw new IllegalArgumentException("hmac cannot be null");
        }
    }

    /**
     * 기본 poll 요청 (asUser=false, autoAck=false).
     */
    public static PollRequest of(String owner, BigDecimal timestamp, String hmac) {
        return new PollRequest(owner, timestamp, hmac, false, null, false);
    }

    public PollRequest withAutoAck(boolean autoAck) {
        return new PollRequest(owner, timestamp, hmac, asUser, callerId, autoAck);
    }

    public PollRequest asCaller(String callerId) {
        return new PollRequest(owner, timestamp, hmac, true, callerId, autoAck);
    }

    /**
     * 서명 대상 문자열.
     *
     * @return owner + timestamp + [callerId] + "POLL"
     */
    public String stringToSign() {
        StringBuilder builder = new StringBuilder(owner).append(timestamp.toPlainString());
        if (asUser && callerId != null) {
            builder.append(callerId);
        }
        return builder.append("POLL").toString();
    }
}

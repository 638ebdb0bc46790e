package com.ryuqq.jobqueue.core.model;

/**
 * Job의 고유 식별자.
 *
 * <p>Job Store가 insert 시점에 발급하며, 이후 변경되지 않습니다.
 * 텍스트 형태({@link #asText()})는 poll/ack HMAC 서명 문자열에 그대로 사용됩니다.</p>
 *
 * <p><strong>유효성 검증:</strong></p>
 * <ul>
 *   <li>양수만 허용</li>
 * </ul>
 *
 * @author JobQueue Team
 * @since 1.0.0
 */
public final class JobId implements Comparable<JobId> {

    private final long value;

    private JobId(long value) {
        if (value <= 0) {
            throw new IllegalArgumentException("JobId must be positive (current: " + value + ")");
        }
        this.value = value;
    }

    /**
     * JobId 생성.
     *
     * @param value JobId 값
     * @return JobId 인스턴스
     * @throws IllegalArgumentException 양수가 아닌 경우
     */
    public static JobId of(long value) {
        return new JobId(value);
    }

    /**
     * JobId 값 조회.
     *
     * @return JobId 값
     */
    public long getValue() {
        return value;
    }

    /**
     * 서명 문자열에 사용되는 10진수 표현.
     *
     * @return 10진수 문자열
     */
    public String asText() {
        return Long.toString(value);
    }

    @Override
    public int compareTo(JobId other) {
        return Long.compare(value, other.value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        JobId jobId = (JobId) o;
        return value == jobId.value;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(value);
    }

    @Override
    public String toString() {
        return "JobId{" + value + '}';
    }
}

package com.ryuqq.jobqueue.core.retry;

import java.time.Duration;
import java.time.Instant;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Optional;

/**
 * {@code Retry-After} 헤더 파서.
 *
 * <p>delta-seconds ({@code 120}) 와 HTTP-date ({@code Wed, 21 Oct 2015 07:28:00 GMT}) 형식을 지원합니다.
 * 이미 지난 날짜는 0초로, {@link #MAX_DELAY}를 넘는 값은 {@link #MAX_DELAY}로 취급합니다.</p>
 *
 * @author JobQueue Team
 * @since 1.0.0
 */
public final class RetryAfterParser {

    /**
     * 허용하는 최대 대기 시간.
     */
    public static final Duration MAX_DELAY = Duration.ofDays(365);

    private RetryAfterParser() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 헤더 값을 대기 시간으로 변환.
     *
     * @param value 헤더 값 (null 가능)
     * @param now 기준 시각 (HTTP-date 형식에서 사용)
     * @return 대기 시간, 해석할 수 없으면 empty
     */
    public static Optional<Duration> parse(String value, Instant now) {
        if (value == null) {
            return Optional.empty();
        }
        String trimmed = value.trim();
        if (trimmed.isEmpty()) {
            return Optional.empty();
        }

        if (trimmed.chars().allMatch(Character::isDigit)) {
            try {
                return Optional.of(clamp(Duration.ofSeconds(Long.parseLong(trimmed))));
            } catch (NumberFormatException e) {
                // long 범위를 넘는 숫자
                return Optional.of(MAX_DELAY);
            }
        }

        try {
            Instant retryAt = ZonedDateTime.parse(trimmed, DateTimeFormatter.RFC_1123_DATE_TIME).toInstant();
            Duration delay = Duration.between(now, retryAt);
            return Optional.of(delay.isNegative() ? Duration.ZERO : clamp(delay));
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }

    private static Duration clamp(Duration delay) {
        return delay.compareTo(MAX_DELAY) > 0 ? MAX_DELAY : delay;
    }
}

package com.ryuqq.jobqueue.core.retry;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * BackoffPolicy 테스트.
 *
 * @author JobQueue Team
 * @since 1.0.0
 */
class BackoffPolicyTest {

    private final BackoffPolicy policy = new BackoffPolicy();

    @ParameterizedTest
    @CsvSource({
        "0, 5",
        "1, 9",
        "2, 17",
        "3, 32",
        "4, 59",
        "5, 107",
        "10, 1707",
        "14, 5461"
    })
    void delaySeconds_공식대로_계산(int retryCount, long expectedSeconds) {
        assertThat(policy.delaySeconds(retryCount)).isEqualTo(expectedSeconds);
    }

    @Test
    void delaySeconds_retryCount_15_이상이면_0() {
        assertThat(policy.delaySeconds(15)).isZero();
        assertThat(policy.delaySeconds(16)).isZero();
        assertThat(policy.delaySeconds(100)).isZero();
    }

    @Test
    void delaySeconds_음수면_예외() {
        assertThatThrownBy(() -> policy.delaySeconds(-1))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("retryCount");
    }

    @Test
    void delaySeconds_재시도가_늘수록_증가() {
        for (int n = 1; n < 10; n++) {
            assertThat(policy.delaySeconds(n)).isGreaterThan(policy.delaySeconds(n - 1));
        }
    }

    @Test
    void nextRunAt_현재_시각에_지연을_더함() {
        // given
        Instant now = Instant.parse("2024-01-01T00:00:00Z");

        // when
        Instant runAt = policy.nextRunAt(now, 3);

        // then
        assertThat(runAt).isEqualTo(now.plusSeconds(32));
        assertThat(policy.delay(0)).isEqualTo(Duration.ofSeconds(5));
    }
}

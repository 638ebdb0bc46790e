package com.ryuqq.jobqueue.application.queue;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * PollRequest 테스트.
 *
 * @author JobQueue Team
 * @since 1.0.0
 */
class PollRequestTest {

    @Test
    void stringToSign_owner_timestamp_POLL() {
        PollRequest request = PollRequest.of("worker-a", new BigDecimal("1700000000"), "x");

        assertThat(request.stringToSign()).isEqualTo("worker-a1700000000POLL");
    }

    @Test
    void stringToSign_소수_timestamp는_표기_그대로() {
        PollRequest request = PollRequest.of("worker-a", new BigDecimal("1700000000.250"), "x");

        assertThat(request.stringToSign()).isEqualTo("worker-a1700000000.250POLL");
    }

    @Test
    void stringToSign_asUser면_호출자_ID_포함() {
        PollRequest request = PollRequest.of("worker-a", new BigDecimal("1700000000"), "x")
            .asCaller("user-7");

        assertThat(request.asUser()).isTrue();
        assertThat(request.stringToSign()).isEqualTo("worker-a1700000000user-7POLL");
    }

    @Test
    void 생성_필수값_검증() {
        assertThatThrownBy(() -> PollRequest.of(" ", BigDecimal.ONE, "x"))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> PollRequest.of("o", null, "x"))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> PollRequest.of("o", BigDecimal.ONE, null))
            .isInstanceOf(IllegalArgumentException.class);
    }
}

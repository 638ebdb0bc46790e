package com.ryuqq.jobqueue.adapter.inmemory.function;

import com.ryuqq.jobqueue.core.spi.FunctionInvocationException;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * InMemoryFunctionRegistry 테스트.
 *
 * @author JobQueue Team
 * @since 1.0.0
 */
class InMemoryFunctionRegistryTest {

    @Test
    void invoke_등록된_함수_호출() throws Exception {
        InMemoryFunctionRegistry registry = new InMemoryFunctionRegistry()
            .register("billing", "close_month", args -> "closed " + args.get("month"));

        assertThat(registry.invoke("billing", "close_month", Map.of("month", "2024-01")))
            .isEqualTo("closed 2024-01");
    }

    @Test
    void invoke_없는_함수는_FunctionInvocationException() {
        InMemoryFunctionRegistry registry = new InMemoryFunctionRegistry();

        assertThatThrownBy(() -> registry.invoke("public", "nope", Map.of()))
            .isInstanceOf(FunctionInvocationException.class)
            .hasMessageContaining("public.nope");
    }

    @Test
    void invoke_함수_예외는_메시지와_함께_감쌈() {
        InMemoryFunctionRegistry registry = new InMemoryFunctionRegistry()
            .register("public", "fail", args -> {
                throw new IllegalStateException("division by zero");
            });

        assertThatThrownBy(() -> registry.invoke("public", "fail", Map.of()))
            .isInstanceOf(FunctionInvocationException.class)
            .hasMessage("division by zero")
            .hasCauseInstanceOf(IllegalStateException.class);
    }
}

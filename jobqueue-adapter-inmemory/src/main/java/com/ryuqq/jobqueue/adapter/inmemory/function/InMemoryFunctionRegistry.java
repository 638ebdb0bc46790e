package com.ryuqq.jobqueue.adapter.inmemory.function;

import com.ryuqq.jobqueue.core.spi.FunctionInvocationException;
import com.ryuqq.jobqueue.core.spi.FunctionInvoker;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * {@code schema.name}으로 등록된 Java 함수를 호출하는 {@link FunctionInvoker}.
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * InMemoryFunctionRegistry functions = new InMemoryFunctionRegistry()
 *     .register("public", "close_month", args -&gt; "closed " + args.get("month"));
 * </pre>
 *
 * @author JobQueue Team
 * @since 1.0.0
 */
public class InMemoryFunctionRegistry implements FunctionInvoker {

    /**
     * 등록 가능한 함수.
     */
    @FunctionalInterface
    public interface NamedFunction {

        String apply(Map<String, String> namedArgs) throws Exception;
    }

    private final ConcurrentHashMap<String, NamedFunction> functions = new ConcurrentHashMap<>();

    public InMemoryFunctionRegistry register(String schema, String name, NamedFunction function) {
        if (schema == null || name == null) {
            throw new IllegalArgumentException("schema and name cannot be null");
        }
        if (function == null) {
            throw new IllegalArgumentException("function cannot be null");
        }
        functions.put(key(schema, name), function);
        return this;
    }

    @Override
    public String invoke(String schema, String name, Map<String, String> namedArgs) throws FunctionInvocationException {
        NamedFunction function = functions.get(key(schema, name));
        if (function == null) {
            throw new FunctionInvocationException("function " + key(schema, name) + " does not exist");
        }
        try {
            return function.apply(namedArgs);
        } catch (FunctionInvocationException e) {
            throw e;
        } catch (Exception e) {
            throw new FunctionInvocationException(e.getMessage() == null ? e.toString() : e.getMessage(), e);
        }
    }

    private static String key(String schema, String name) {
        return schema + "." + name;
    }
}

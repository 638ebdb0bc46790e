package com.ryuqq.jobqueue.core.spi;

import java.util.Map;

/**
 * Synchronous invocation of internal named functions (FUNC jobs).
 *
 * @author JobQueue Team
 * @since 1.0.0
 */
public interface FunctionInvoker {

    /**
     * Invokes {@code schema.name} with named text arguments.
     *
     * @param schema function schema
     * @param name function name
     * @param namedArgs argument name to text value (null for JSON null)
     * @return the function result as text
     * @throws FunctionInvocationException if the function is unknown or fails
     */
    String invoke(String schema, String name, Map<String, String> namedArgs) throws FunctionInvocationException;
}

/**
 * Reusable contract tests for {@link com.ryuqq.jobqueue.core.spi.JobStore} implementations.
 *
 * <p>Adapters extend {@link com.ryuqq.jobqueue.testkit.contract.AbstractJobStoreContractTest}
 * and supply a fresh store per test.</p>
 *
 * @since 1.0.0
 * @author JobQueue Team
 */
package com.ryuqq.jobqueue.testkit.contract;

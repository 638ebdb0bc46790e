/**
 * Retry scheduling.
 *
 * <p>{@link com.ryuqq.jobqueue.core.retry.BackoffPolicy} computes the deterministic backoff for
 * failed attempts; {@link com.ryuqq.jobqueue.core.retry.RetryAfterParser} reads the delay a
 * rate-limited (429) response asks for.</p>
 *
 * @since 1.0.0
 * @author JobQueue Team
 */
package com.ryuqq.jobqueue.core.retry;

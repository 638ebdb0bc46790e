/**
 * Outcome classification.
 *
 * <p>Maps the result of one execution attempt (an HTTP response, a transport error, an internal
 * execution error or an expired poll lease) to the next job status, the response to record and
 * the next run time.</p>
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.ryuqq.jobqueue.core.outcome.ResponseClassifier} - ordered classification rules</li>
 *   <li>{@link com.ryuqq.jobqueue.core.outcome.Outcome} - classification result</li>
 *   <li>{@link com.ryuqq.jobqueue.core.outcome.OutcomeKind} - error taxonomy</li>
 *   <li>{@link com.ryuqq.jobqueue.core.outcome.ClassifierConfig} - redirect code, default rate-limit delay, finished header</li>
 * </ul>
 *
 * @since 1.0.0
 * @author JobQueue Team
 */
package com.ryuqq.jobqueue.core.outcome;

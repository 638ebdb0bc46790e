/**
 * Job status state machine package.
 *
 * <p>{@link com.ryuqq.jobqueue.core.statemachine.JobStatus} is a closed set of lifecycle states and
 * {@link com.ryuqq.jobqueue.core.statemachine.StatusTransition} holds the explicit transition table.
 * Every {@code JobStore} implementation validates status changes through it.</p>
 *
 * <h2>Transition Table</h2>
 * <pre>
 * NEW        → PROCESSING | POLLED | COMPLETED
 * FAILED     → PROCESSING
 * POLLED     → PROCESSING | COMPLETED
 * PROCESSING → COMPLETED | REDIRECTED | FAILED | SERVER_ERROR | TOO_MANY | OTHER | NEW
 *
 * Terminal: COMPLETED, REDIRECTED, SERVER_ERROR, TOO_MANY, OTHER
 * </pre>
 *
 * @since 1.0.0
 * @author JobQueue Team
 */
package com.ryuqq.jobqueue.core.statemachine;

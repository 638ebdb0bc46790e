/**
 * Job queue facade.
 *
 * <p>{@link com.ryuqq.jobqueue.application.queue.JobQueue} is the producer and consumer boundary:
 * submission, queries and the lease-based poll/ack protocol for pull-style consumers.</p>
 *
 * <h2>Poll / Ack</h2>
 * <pre>
 * poll: hmac = hex(HMAC-SHA256(secret, owner + timestamp + [callerId] + "POLL"))
 *       → NEW job becomes POLLED (lease 60s) or COMPLETED (autoAck)
 * ack:  hmac = hex(HMAC-SHA256(secret, jobId + "ACK"))
 *       → POLLED job becomes COMPLETED
 * </pre>
 *
 * @since 1.0.0
 * @author JobQueue Team
 */
package com.ryuqq.jobqueue.application.queue;

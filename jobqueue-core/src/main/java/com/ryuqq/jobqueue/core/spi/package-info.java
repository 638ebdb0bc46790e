/**
 * Service Provider Interface (SPI) package.
 *
 * <p>Interfaces implemented by adapters (in-memory reference implementations in
 * {@code jobqueue-adapter-inmemory}, the JDK HTTP client in {@code jobqueue-adapter-http})
 * or supplied by the embedding application.</p>
 *
 * <h2>Storage</h2>
 * <ul>
 *   <li>{@link com.ryuqq.jobqueue.core.spi.JobStore} - jobs and the non-blocking claim discipline</li>
 *   <li>{@link com.ryuqq.jobqueue.core.spi.FailureLog} - append-only failed attempts</li>
 *   <li>{@link com.ryuqq.jobqueue.core.spi.RequestLedger} - issued request handle to job</li>
 * </ul>
 *
 * <h2>Collaborators</h2>
 * <ul>
 *   <li>{@link com.ryuqq.jobqueue.core.spi.AsyncHttpClient} - submit / poll asynchronous requests</li>
 *   <li>{@link com.ryuqq.jobqueue.core.spi.FunctionInvoker} - FUNC job execution</li>
 *   <li>{@link com.ryuqq.jobqueue.core.spi.SecretResolver} - vault lookup by name</li>
 *   <li>{@link com.ryuqq.jobqueue.core.spi.SessionTokenProvider} - session JWT</li>
 *   <li>{@link com.ryuqq.jobqueue.core.spi.SpawnAuditSink} - audit of derived jobs</li>
 * </ul>
 *
 * @since 1.0.0
 * @author JobQueue Team
 */
package com.ryuqq.jobqueue.core.spi;

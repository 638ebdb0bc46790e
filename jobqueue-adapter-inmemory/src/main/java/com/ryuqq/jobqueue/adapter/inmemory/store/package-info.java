/**
 * In-memory storage adapters.
 *
 * <p>Reference implementations of the storage SPIs for tests and single-process use.</p>
 *
 * <p><strong>Main Components:</strong></p>
 * <ul>
 *   <li>{@link com.ryuqq.jobqueue.adapter.inmemory.store.InMemoryJobStore}:
 *       jobs with compare-and-set row claims ({@link com.ryuqq.jobqueue.core.spi.JobStore})</li>
 *   <li>{@link com.ryuqq.jobqueue.adapter.inmemory.store.InMemoryFailureLog}:
 *       append-only failed attempts ({@link com.ryuqq.jobqueue.core.spi.FailureLog})</li>
 *   <li>{@link com.ryuqq.jobqueue.adapter.inmemory.store.InMemoryRequestLedger}:
 *       issued request handles ({@link com.ryuqq.jobqueue.core.spi.RequestLedger})</li>
 * </ul>
 *
 * <p><strong>Limitations:</strong></p>
 * <ul>
 *   <li>Data lost on process restart</li>
 *   <li>Not suitable for multi-process deployment</li>
 * </ul>
 *
 * @author JobQueue Team
 * @since 1.0.0
 */
package com.ryuqq.jobqueue.adapter.inmemory.store;

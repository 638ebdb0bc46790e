/**
 * Runner Adapter Layer - JobQueue 엔진 구현체.
 *
 * <p>이 패키지는 {@link com.ryuqq.jobqueue.application.queue.JobQueue}와
 * {@link com.ryuqq.jobqueue.application.runtime.EngineRuntime}의 구체적인 구현을 포함합니다.</p>
 *
 * <h2>구성 요소</h2>
 * <ul>
 *   <li>{@link com.ryuqq.jobqueue.adapter.runner.EngineJobQueue} - 진입점 (빌더로 구성)</li>
 *   <li>{@link com.ryuqq.jobqueue.adapter.runner.ClaimSweeper} - claim/dispatch sweep</li>
 *   <li>{@link com.ryuqq.jobqueue.adapter.runner.ResultResolver} - HTTP 응답 분류 sweep</li>
 *   <li>{@link com.ryuqq.jobqueue.adapter.runner.StaleProcessingReaper} - 장기 PROCESSING 정리</li>
 *   <li>{@link com.ryuqq.jobqueue.adapter.runner.PollLeaseManager} - POLL Job poll/ack</li>
 *   <li>{@link com.ryuqq.jobqueue.adapter.runner.TickScheduler} - 선택적 주기 실행기</li>
 * </ul>
 *
 * <h2>아키텍처 위치</h2>
 * <pre>
 * adapter-runner (EngineJobQueue)
 *   ↓ implements
 * application (JobQueue, EngineRuntime)
 *   ↓ depends on
 * core (Job, JobStatus, ResponseClassifier, BackoffPolicy, PayloadSigner)
 *   ↓ depends on
 * core/spi (JobStore, FailureLog, RequestLedger, AsyncHttpClient, ...)
 * </pre>
 *
 * @author JobQueue Team
 * @since 1.0.0
 */
package com.ryuqq.jobqueue.adapter.runner;

/**
 * Core domain model.
 *
 * <h2>Jobs</h2>
 * <ul>
 *   <li>{@link com.ryuqq.jobqueue.core.model.JobSpec} - submission request, validated on construction</li>
 *   <li>{@link com.ryuqq.jobqueue.core.model.NewJob} - signed job ready for insertion</li>
 *   <li>{@link com.ryuqq.jobqueue.core.model.Job} - stored snapshot</li>
 *   <li>{@link com.ryuqq.jobqueue.core.model.FailureLogEntry} - one failed attempt</li>
 * </ul>
 *
 * <h2>Value Objects</h2>
 * <ul>
 *   <li>{@link com.ryuqq.jobqueue.core.model.JobId}, {@link com.ryuqq.jobqueue.core.model.Payload}</li>
 *   <li>{@link com.ryuqq.jobqueue.core.model.AuthConfig}, {@link com.ryuqq.jobqueue.core.model.SigningConfig}</li>
 *   <li>{@link com.ryuqq.jobqueue.core.model.OutboundRequest}, {@link com.ryuqq.jobqueue.core.model.HttpResult},
 *       {@link com.ryuqq.jobqueue.core.model.RequestHandle}, {@link com.ryuqq.jobqueue.core.model.ResponseSnapshot}</li>
 * </ul>
 *
 * @since 1.0.0
 * @author JobQueue Team
 */
package com.ryuqq.jobqueue.core.model;

/**
 * Registry of Java functions callable by FUNC jobs.
 *
 * @since 1.0.0
 * @author JobQueue Team
 */
package com.ryuqq.jobqueue.adapter.inmemory.function;

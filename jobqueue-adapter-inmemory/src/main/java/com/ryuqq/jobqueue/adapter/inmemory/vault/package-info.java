/**
 * In-memory secret vault.
 *
 * @since 1.0.0
 * @author JobQueue Team
 */
package com.ryuqq.jobqueue.adapter.inmemory.vault;

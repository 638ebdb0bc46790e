/**
 * HMAC signing.
 *
 * <p>{@link com.ryuqq.jobqueue.core.signing.PayloadSigner} signs the canonical payload text once,
 * when a job is created. {@link com.ryuqq.jobqueue.core.signing.SecretLookup} resolves a job's
 * secret (direct bytes first, then the vault) for both signing and the poll/ack authentication.</p>
 *
 * @since 1.0.0
 * @author JobQueue Team
 */
package com.ryuqq.jobqueue.core.signing;

package com.ryuqq.jobqueue.core.spi;

import java.util.Optional;

/**
 * Secret vault lookup by name.
 *
 * @author JobQueue Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface SecretResolver {

    /**
     * @param name vault secret name
     * @return the secret bytes, or empty if no secret has this name
     */
    Optional<byte[]> resolve(String name);
}

package com.ryuqq.jobqueue.core.spi;

import java.util.Optional;

/**
 * Session JWT for jobs whose auth mode is "from session".
 *
 * @author JobQueue Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface SessionTokenProvider {

    /**
     * @return the current session token, or empty if there is no session
     */
    Optional<String> currentToken();

    static SessionTokenProvider none() {
        return Optional::empty;
    }
}

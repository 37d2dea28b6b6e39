package org.contextql.engine.execution;

import java.time.Duration;

/**
 * Thrown when the store does not answer within the execution timeout. Nothing
 * is cached; the call may be retried.
 */
public class ExecutionTimeoutException extends RuntimeException {

    private final Duration timeout;

    public ExecutionTimeoutException(String contextId, Duration timeout) {
        super("Query on context '" + contextId + "' timed out after " + timeout.toMillis() + " ms");
        this.timeout = timeout;
    }

    public Duration getTimeout() {
        return timeout;
    }

    public boolean isRetryable() {
        return true;
    }
}

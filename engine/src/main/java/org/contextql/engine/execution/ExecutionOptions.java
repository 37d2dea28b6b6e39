package org.contextql.engine.execution;

import java.time.Duration;

/**
 * Per-call execution settings.
 *
 * @param useCache Whether to read and write the result cache
 * @param timeout  Bound on the store query, or null for the engine default
 */
public record ExecutionOptions(boolean useCache, Duration timeout) {

    public static final ExecutionOptions DEFAULTS = new ExecutionOptions(true, null);

    public ExecutionOptions {
        if (timeout != null && (timeout.isNegative() || timeout.isZero())) {
            throw new IllegalArgumentException("Timeout must be positive: " + timeout);
        }
    }

    public static ExecutionOptions withTimeout(Duration timeout) {
        return new ExecutionOptions(true, timeout);
    }

    public static ExecutionOptions noCache() {
        return new ExecutionOptions(false, null);
    }
}

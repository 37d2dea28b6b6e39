package org.contextql.engine.plan;

/**
 * Base class for requests that cannot be compiled against a context. These are
 * surfaced to the caller immediately and are not retryable.
 */
public abstract class CompileException extends RuntimeException {

    protected CompileException(String message) {
        super(message);
    }
}

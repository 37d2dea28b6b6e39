package org.contextql.engine.graph;

/**
 * Base class for failures to connect the datasets a query needs. These are
 * per-query errors: narrow the requested datasets or fix the context.
 */
public abstract class JoinResolutionException extends RuntimeException {

    protected JoinResolutionException(String message) {
        super(message);
    }
}

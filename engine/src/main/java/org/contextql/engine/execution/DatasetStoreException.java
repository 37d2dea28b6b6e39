package org.contextql.engine.execution;

/**
 * Thrown by a {@link DatasetStore} when a lookup or a query fails.
 */
public class DatasetStoreException extends RuntimeException {

    public DatasetStoreException(String message) {
        super(message);
    }

    public DatasetStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}

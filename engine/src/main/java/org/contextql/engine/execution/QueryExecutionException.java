package org.contextql.engine.execution;

/**
 * Thrown when the store fails to run a compiled query. The store's exception
 * is kept as the cause.
 */
public class QueryExecutionException extends RuntimeException {

    private final String sql;

    public QueryExecutionException(String message, String sql, Throwable cause) {
        super(message, cause);
        this.sql = sql;
    }

    public String getSql() {
        return sql;
    }

    public boolean isRetryable() {
        return false;
    }
}

package org.contextql.engine.plan;

/**
 * Thrown when a field names a dataset that is not part of the join, or a
 * column that dataset does not have.
 */
public class UndefinedColumnException extends CompileException {

    private final String field;

    public UndefinedColumnException(String field, String reason) {
        super("Field '" + field + "' " + reason);
        this.field = field;
    }

    public String getField() {
        return field;
    }
}

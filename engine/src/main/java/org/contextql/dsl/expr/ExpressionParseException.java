package org.contextql.dsl.expr;

/**
 * Exception thrown when a metric expression or a filter/rule condition cannot
 * be tokenized or parsed.
 */
public class ExpressionParseException extends RuntimeException {

    private final int position;

    public ExpressionParseException(String message, int position) {
        super(message + " at position " + position);
        this.position = position;
    }

    public int getPosition() {
        return position;
    }
}

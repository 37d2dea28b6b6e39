package org.contextql.engine.plan;

/**
 * Thrown for malformed requests: a non-positive limit, an unknown operator, a
 * sort key that is not in the output, or a parameter value of the wrong type.
 */
public class InvalidQueryException extends CompileException {

    public InvalidQueryException(String message) {
        super(message);
    }
}

package org.contextql.engine.validation;

import java.util.stream.Collectors;

/**
 * Thrown when an operation needs a context that failed validation. Carries the
 * full result so every issue can be surfaced.
 */
public class ContextValidationException extends RuntimeException {

    private final String contextId;
    private final ValidationResult result;

    public ContextValidationException(String contextId, ValidationResult result) {
        super("Context '" + contextId + "' failed validation with " + result.errors().size() + " error(s): "
                + result.errors().stream().map(i -> i.code().name()).distinct().collect(Collectors.joining(", ")));
        this.contextId = contextId;
        this.result = result;
    }

    public String getContextId() {
        return contextId;
    }

    public ValidationResult getResult() {
        return result;
    }
}

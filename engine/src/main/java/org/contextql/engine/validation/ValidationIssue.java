package org.contextql.engine.validation;

import java.util.Map;
import java.util.Objects;

/**
 * A single finding of the validator.
 *
 * @param code     Stable issue code
 * @param severity Whether the issue blocks activation
 * @param pass     The pass that reported it
 * @param field    Path of the offending field, e.g. {@code metrics[0].expression}
 * @param message  Human-readable explanation
 * @param details  Structured extras (cycle members, offending column, ...)
 */
public record ValidationIssue(
        IssueCode code,
        IssueSeverity severity,
        ValidationPass pass,
        String field,
        String message,
        Map<String, Object> details) {

    public ValidationIssue {
        Objects.requireNonNull(code, "Issue code cannot be null");
        Objects.requireNonNull(severity, "Severity cannot be null");
        Objects.requireNonNull(pass, "Pass cannot be null");
        details = details == null ? Map.of() : Map.copyOf(details);
    }

    public boolean isError() {
        return severity == IssueSeverity.ERROR;
    }

    @Override
    public String toString() {
        return severity + " " + code + " at " + field + ": " + message;
    }
}

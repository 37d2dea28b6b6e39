package org.contextql.engine.validation;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

/**
 * Outcome of validating a context document.
 *
 * Any error makes the result {@link ValidationStatus#FAILED}, which blocks
 * activation. Warnings alone give {@link ValidationStatus#WARNING}.
 *
 * @param status   Overall status
 * @param errors   Blocking issues, in the order they were found
 * @param warnings Non-blocking issues, in the order they were found
 */
public record ValidationResult(ValidationStatus status, List<ValidationIssue> errors, List<ValidationIssue> warnings) {

    public ValidationResult {
        errors = List.copyOf(errors);
        warnings = List.copyOf(warnings);
    }

    public static ValidationResult of(List<ValidationIssue> issues) {
        List<ValidationIssue> errors = new ArrayList<>();
        List<ValidationIssue> warnings = new ArrayList<>();
        for (ValidationIssue issue : issues) {
            (issue.isError() ? errors : warnings).add(issue);
        }
        ValidationStatus status = !errors.isEmpty() ? ValidationStatus.FAILED
                : !warnings.isEmpty() ? ValidationStatus.WARNING
                : ValidationStatus.PASSED;
        return new ValidationResult(status, errors, warnings);
    }

    public boolean blocksActivation() {
        return status == ValidationStatus.FAILED;
    }

    public Stream<ValidationIssue> issues() {
        return Stream.concat(errors.stream(), warnings.stream());
    }

    public boolean hasIssue(IssueCode code) {
        return issues().anyMatch(i -> i.code() == code);
    }

    public List<ValidationIssue> issues(IssueCode code) {
        return issues().filter(i -> i.code() == code).toList();
    }
}

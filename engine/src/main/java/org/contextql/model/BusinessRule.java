package org.contextql.model;

import java.util.Objects;
import java.util.Optional;

/**
 * A named boolean condition with a severity.
 *
 * Severity and rule type are kept as declared; the validator rejects values
 * outside {@link Severity} and {@link RuleType}.
 *
 * @param id          Rule identifier
 * @param name        Display name
 * @param severity    Declared severity ({@code error}, {@code warning}, {@code info})
 * @param ruleType    Declared rule type, or null
 * @param condition   Boolean SQL condition
 * @param description Free-text description (may be null)
 */
public record BusinessRule(
        String id,
        String name,
        String severity,
        String ruleType,
        String condition,
        String description) implements ContextElement {

    public BusinessRule {
        Objects.requireNonNull(id, "Rule id cannot be null");
        condition = condition == null ? "" : condition;
    }

    public static BusinessRule of(String id, Severity severity, String condition) {
        return new BusinessRule(id, id, severity.declaredName(), null, condition, null);
    }

    public Optional<Severity> severityLevel() {
        return Severity.fromDeclared(severity);
    }

    /**
     * @return true if this rule must be injected into every applicable query
     */
    public boolean isMandatory() {
        return severityLevel().orElse(null) == Severity.ERROR;
    }

    @Override
    public String elementId() {
        return id;
    }

    @Override
    public Kind kind() {
        return Kind.RULE;
    }
}

package org.contextql.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Optional classification of a business rule.
 */
public enum RuleType {
    VALIDATION,
    QUALITY,
    CONSTRAINT;

    public static Optional<RuleType> fromDeclared(String declared) {
        if (declared == null) {
            return Optional.empty();
        }
        for (RuleType type : values()) {
            if (type.name().equals(declared.trim().toUpperCase(Locale.ROOT))) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}

package org.contextql.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Severity of a business rule. Only {@link #ERROR} rules are enforced as filters.
 */
public enum Severity {
    ERROR,
    WARNING,
    INFO;

    public static Optional<Severity> fromDeclared(String declared) {
        if (declared == null) {
            return Optional.empty();
        }
        for (Severity severity : values()) {
            if (severity.name().equals(declared.trim().toUpperCase(Locale.ROOT))) {
                return Optional.of(severity);
            }
        }
        return Optional.empty();
    }

    public String declaredName() {
        return name().toLowerCase(Locale.ROOT);
    }
}

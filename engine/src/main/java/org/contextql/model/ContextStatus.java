package org.contextql.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Lifecycle state of a context version: {@code draft -> active -> deprecated}.
 */
public enum ContextStatus {
    DRAFT,
    ACTIVE,
    DEPRECATED;

    public static Optional<ContextStatus> fromDeclared(String declared) {
        if (declared == null) {
            return Optional.empty();
        }
        for (ContextStatus status : values()) {
            if (status.name().equals(declared.trim().toUpperCase(Locale.ROOT))) {
                return Optional.of(status);
            }
        }
        return Optional.empty();
    }

    public String declaredName() {
        return name().toLowerCase(Locale.ROOT);
    }
}

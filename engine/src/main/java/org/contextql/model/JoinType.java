package org.contextql.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Join types a relationship may declare.
 */
public enum JoinType {
    INNER("INNER JOIN"),
    LEFT("LEFT JOIN"),
    RIGHT("RIGHT JOIN"),
    OUTER("FULL OUTER JOIN");

    /** Applied when a relationship does not declare a join type. */
    public static final JoinType DEFAULT = LEFT;

    private final String sql;

    JoinType(String sql) {
        this.sql = sql;
    }

    /**
     * @return The SQL keyword sequence for this join
     */
    public String sql() {
        return sql;
    }

    /**
     * The join type to use when the relationship is traversed from its target to
     * its source.
     */
    public JoinType reversed() {
        return switch (this) {
            case LEFT -> RIGHT;
            case RIGHT -> LEFT;
            case INNER, OUTER -> this;
        };
    }

    /**
     * Looks up a declared join type name ({@code inner}, {@code left}, ...).
     */
    public static Optional<JoinType> fromDeclared(String declared) {
        if (declared == null) {
            return Optional.empty();
        }
        for (JoinType type : values()) {
            if (type.name().equals(declared.trim().toUpperCase(Locale.ROOT))) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }

    public String declaredName() {
        return name().toLowerCase(Locale.ROOT);
    }
}

package org.contextql.engine.plan;

import java.util.Locale;
import java.util.Optional;

/**
 * Operators a user filter may apply to a field.
 */
public enum FilterOperator {
    EQ("="),
    NE("<>"),
    LT("<"),
    LE("<="),
    GT(">"),
    GE(">="),
    IN("IN"),
    NOT_IN("NOT IN"),
    LIKE("LIKE"),
    ILIKE("ILIKE"),
    BETWEEN("BETWEEN"),
    IS_NULL("IS NULL"),
    IS_NOT_NULL("IS NOT NULL");

    private final String symbol;

    FilterOperator(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }

    /**
     * @return true if the operator takes no value
     */
    public boolean isUnary() {
        return this == IS_NULL || this == IS_NOT_NULL;
    }

    /**
     * Looks up an operator by symbol ({@code >=}, {@code !=}, {@code not in}) or
     * by name ({@code GE}, {@code not_in}).
     */
    public static Optional<FilterOperator> fromSymbol(String text) {
        if (text == null) {
            return Optional.empty();
        }
        String normalized = text.trim().replaceAll("\\s+", " ").toUpperCase(Locale.ROOT);
        if (normalized.equals("!=") || normalized.equals("==")) {
            return Optional.of(normalized.equals("!=") ? NE : EQ);
        }
        for (FilterOperator op : values()) {
            if (op.symbol.equals(normalized) || op.name().equals(normalized.replace(' ', '_'))) {
                return Optional.of(op);
            }
        }
        return Optional.empty();
    }
}

package org.contextql.engine.plan;

import java.util.Objects;

/**
 * A user filter: {@code field operator value}.
 *
 * @param field    {@code dataset.column}
 * @param operator Comparison to apply
 * @param value    Operand; a collection for IN / NOT IN, a two-element list for
 *                 BETWEEN, ignored for IS NULL / IS NOT NULL
 */
public record FilterCondition(String field, FilterOperator operator, Object value) {

    public FilterCondition {
        Objects.requireNonNull(field, "Filter field cannot be null");
        Objects.requireNonNull(operator, "Filter operator cannot be null");
    }

    public static FilterCondition of(String field, String operator, Object value) {
        FilterOperator op = FilterOperator.fromSymbol(operator)
                .orElseThrow(() -> new InvalidQueryException("Unknown filter operator '" + operator + "'"));
        return new FilterCondition(field, op, value);
    }

    public static FilterCondition eq(String field, Object value) {
        return new FilterCondition(field, FilterOperator.EQ, value);
    }
}

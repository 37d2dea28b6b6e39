package org.contextql.engine.transpiler;

import org.contextql.model.JoinType;

/**
 * Interface defining SQL dialect-specific behavior of compiled queries.
 */
public interface SQLDialect {

    /**
     * @return The dialect name (e.g., "DuckDB")
     */
    String name();

    /**
     * Quote an identifier (table name, column name, alias).
     *
     * @param identifier The identifier to quote
     * @return The quoted identifier
     */
    String quoteIdentifier(String identifier);

    /**
     * @return The keyword sequence introducing a join of the given type
     */
    default String joinKeyword(JoinType joinType) {
        return joinType.sql();
    }

    /**
     * @return The positional parameter marker
     */
    default String parameterMarker() {
        return "?";
    }

    /**
     * Renders the row limit clause.
     */
    default String limitClause(int limit) {
        return "LIMIT " + limit;
    }

    /**
     * @return Operator for a case-insensitive pattern match
     */
    String caseInsensitiveLike();
}

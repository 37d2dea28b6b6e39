package org.contextql.model;

import java.util.Objects;

/**
 * A column declared for a dataset in a context document.
 *
 * @param name         The physical column name
 * @param businessName Business-facing name (may be null)
 * @param dataType     Declared type as written in the document (may be null)
 * @param nullable     Whether the column may hold nulls
 * @param description  Free-text description (may be null)
 */
public record ColumnDef(
        String name,
        String businessName,
        String dataType,
        boolean nullable,
        String description) {

    public ColumnDef {
        Objects.requireNonNull(name, "Column name cannot be null");
    }

    public static ColumnDef of(String name, String dataType) {
        return new ColumnDef(name, null, dataType, true, null);
    }
}

package org.contextql.model;

import java.util.Objects;

/**
 * A column of a dataset, addressed by the dataset's local id.
 *
 * @param datasetId The local id of the dataset
 * @param column    The column name
 */
public record ColumnRef(String datasetId, String column) {

    public ColumnRef {
        Objects.requireNonNull(datasetId, "Dataset id cannot be null");
        Objects.requireNonNull(column, "Column cannot be null");
    }

    public static ColumnRef of(String datasetId, String column) {
        return new ColumnRef(datasetId, column);
    }

    /**
     * Parses a {@code dataset.column} reference.
     *
     * @throws IllegalArgumentException if the text is not qualified
     */
    public static ColumnRef parse(String qualified) {
        int dot = qualified.indexOf('.');
        if (dot <= 0 || dot == qualified.length() - 1 || qualified.indexOf('.', dot + 1) >= 0) {
            throw new IllegalArgumentException(
                    "Expected a reference of the form dataset.column but got '" + qualified + "'");
        }
        return new ColumnRef(qualified.substring(0, dot).trim(), qualified.substring(dot + 1).trim());
    }

    @Override
    public String toString() {
        return datasetId + "." + column;
    }
}

package org.contextql.engine.plan;

/**
 * Describes one column of a compiled query's result.
 *
 * @param name   Column label in the result
 * @param source The {@code dataset.column} field or metric id it comes from
 * @param metric true if the column is a metric
 * @param format Display format of the metric, or null
 */
public record OutputColumn(String name, String source, boolean metric, String format) {

    public static OutputColumn field(String qualifiedField, String column) {
        return new OutputColumn(column, qualifiedField, false, null);
    }

    public static OutputColumn metric(String metricId, String format) {
        return new OutputColumn(metricId, metricId, true, format);
    }
}

package org.contextql.model;

import java.util.List;
import java.util.Objects;

/**
 * A named, reusable aggregate expression.
 *
 * @param id          Metric identifier (also the output column alias)
 * @param name        Display name
 * @param expression  SQL expression over {@code dataset.column} references
 * @param dataType    Declared result type (may be null)
 * @param format      Display format applied to results (may be null)
 * @param datasets    Local ids the metric applies to; empty means all
 * @param description Free-text description (may be null)
 */
public record Metric(
        String id,
        String name,
        String expression,
        String dataType,
        String format,
        List<String> datasets,
        String description) implements ContextElement {

    public Metric {
        Objects.requireNonNull(id, "Metric id cannot be null");
        expression = expression == null ? "" : expression;
        datasets = datasets == null ? List.of() : List.copyOf(datasets);
    }

    public static Metric of(String id, String expression) {
        return new Metric(id, id, expression, null, null, List.of(), null);
    }

    public boolean appliesTo(String datasetLocalId) {
        return datasets.isEmpty() || datasets.contains(datasetLocalId);
    }

    @Override
    public String elementId() {
        return id;
    }

    @Override
    public Kind kind() {
        return Kind.METRIC;
    }
}

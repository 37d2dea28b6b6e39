package org.contextql.engine.plan;

import java.util.Objects;

/**
 * An ORDER BY key: a {@code dataset.column} field or the id of a requested metric.
 */
public record SortSpec(String key, Direction direction) {

    public enum Direction {
        ASC, DESC
    }

    public SortSpec {
        Objects.requireNonNull(key, "Sort key cannot be null");
        direction = direction == null ? Direction.ASC : direction;
    }

    public static SortSpec asc(String key) {
        return new SortSpec(key, Direction.ASC);
    }

    public static SortSpec desc(String key) {
        return new SortSpec(key, Direction.DESC);
    }
}

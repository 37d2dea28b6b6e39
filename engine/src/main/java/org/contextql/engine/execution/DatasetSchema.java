package org.contextql.engine.execution;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * What the Dataset Store knows about one dataset.
 *
 * @param datasetId External dataset id
 * @param ownerId   The user owning the dataset
 * @param columns   Physical columns
 * @param rowCount  Estimated row count, or null when unknown
 */
public record DatasetSchema(String datasetId, String ownerId, List<Column> columns, Long rowCount) {

    public DatasetSchema {
        Objects.requireNonNull(datasetId, "Dataset id cannot be null");
        columns = List.copyOf(columns);
    }

    /**
     * Column names are matched case-insensitively, as the store's SQL does.
     */
    public boolean hasColumn(String name) {
        return findColumn(name).isPresent();
    }

    public Optional<Column> findColumn(String name) {
        return columns.stream().filter(c -> c.name().equalsIgnoreCase(name)).findFirst();
    }

    public Optional<Long> estimatedRows() {
        return Optional.ofNullable(rowCount);
    }
}

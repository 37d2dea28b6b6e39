package org.contextql.model;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A dataset participating in a context document.
 *
 * @param localId           Identifier used inside the document (and as the SQL alias)
 * @param externalDatasetId Identifier of the dataset in the Dataset Store
 * @param name              Display name
 * @param description       Free-text description (may be null)
 * @param columns           Columns the document declares (may be empty)
 */
public record DatasetRef(
        String localId,
        String externalDatasetId,
        String name,
        String description,
        List<ColumnDef> columns) implements ContextElement {

    public DatasetRef {
        Objects.requireNonNull(localId, "Dataset local id cannot be null");
        Objects.requireNonNull(externalDatasetId, "External dataset id cannot be null");
        Objects.requireNonNull(name, "Dataset name cannot be null");
        columns = columns == null ? List.of() : List.copyOf(columns);
    }

    public static DatasetRef of(String localId, String externalDatasetId, String name) {
        return new DatasetRef(localId, externalDatasetId, name, null, List.of());
    }

    public Optional<ColumnDef> findColumn(String columnName) {
        return columns.stream()
                .filter(c -> c.name().equals(columnName))
                .findFirst();
    }

    @Override
    public String elementId() {
        return localId;
    }

    @Override
    public Kind kind() {
        return Kind.DATASET;
    }
}

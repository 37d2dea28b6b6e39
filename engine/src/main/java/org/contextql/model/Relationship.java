package org.contextql.model;

import java.util.Objects;

/**
 * A typed join condition between two datasets.
 *
 * The join type is kept as declared so the validator can report values outside
 * the supported set; {@link #effectiveJoinType()} gives the type to compile.
 *
 * @param id          Relationship identifier
 * @param from        Source column
 * @param to          Target column
 * @param joinType    Declared join type, or null when the document omits it
 * @param description Free-text description (may be null)
 */
public record Relationship(
        String id,
        ColumnRef from,
        ColumnRef to,
        String joinType,
        String description) implements ContextElement {

    public Relationship {
        Objects.requireNonNull(id, "Relationship id cannot be null");
        Objects.requireNonNull(from, "Relationship source cannot be null");
        Objects.requireNonNull(to, "Relationship target cannot be null");
    }

    public static Relationship of(String id, ColumnRef from, ColumnRef to, JoinType joinType) {
        return new Relationship(id, from, to, joinType == null ? null : joinType.declaredName(), null);
    }

    /**
     * @return The declared join type, or {@link JoinType#DEFAULT} when none (or an
     *         unsupported one) is declared
     */
    public JoinType effectiveJoinType() {
        return JoinType.fromDeclared(joinType).orElse(JoinType.DEFAULT);
    }

    public boolean isSelfReferencing() {
        return from.datasetId().equals(to.datasetId());
    }

    /**
     * Checks if this relationship involves the given dataset.
     */
    public boolean involves(String datasetId) {
        return from.datasetId().equals(datasetId) || to.datasetId().equals(datasetId);
    }

    /**
     * Gets the dataset that is NOT the given one.
     */
    public String otherDataset(String datasetId) {
        if (from.datasetId().equals(datasetId)) {
            return to.datasetId();
        }
        if (to.datasetId().equals(datasetId)) {
            return from.datasetId();
        }
        throw new IllegalArgumentException("Dataset " + datasetId + " is not part of relationship " + id);
    }

    @Override
    public String elementId() {
        return id;
    }

    @Override
    public Kind kind() {
        return Kind.RELATIONSHIP;
    }

    @Override
    public String toString() {
        return "Relationship " + id + "(" + from + " -> " + to + ")";
    }
}

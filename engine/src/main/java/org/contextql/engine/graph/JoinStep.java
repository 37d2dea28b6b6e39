package org.contextql.engine.graph;

import org.contextql.model.JoinType;
import org.contextql.model.Relationship;

/**
 * One join in a join path: attaches {@code target} to a dataset already in the
 * tree.
 *
 * @param relationship The relationship providing the join condition
 * @param source       The dataset already joined
 * @param target       The dataset this step joins in
 * @param joinType     Join type as seen from {@code source}
 */
public record JoinStep(Relationship relationship, String source, String target, JoinType joinType) {

    /**
     * Orients a relationship for traversal from {@code source}. A relationship
     * walked against its declared direction has LEFT and RIGHT swapped.
     */
    public static JoinStep traverse(Relationship relationship, String source) {
        JoinType declared = relationship.effectiveJoinType();
        if (relationship.from().datasetId().equals(source)) {
            return new JoinStep(relationship, source, relationship.to().datasetId(), declared);
        }
        return new JoinStep(relationship, source, relationship.from().datasetId(), declared.reversed());
    }

    public boolean reversed() {
        return !relationship.from().datasetId().equals(source);
    }
}

package org.contextql.engine.graph;

/**
 * Thrown when the relationships a query pins would make the join revisit a
 * dataset, or cannot be attached to the join tree at all.
 */
public class CircularPathException extends JoinResolutionException {

    private final String relationshipId;

    public CircularPathException(String message, String relationshipId) {
        super(message);
        this.relationshipId = relationshipId;
    }

    public String getRelationshipId() {
        return relationshipId;
    }
}

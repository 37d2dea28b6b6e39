package org.contextql.engine.validation;

/**
 * The four validation passes, in the order they run.
 */
public enum ValidationPass {
    SCHEMA,
    SEMANTIC,
    RELATIONSHIP_GRAPH,
    BUSINESS_RULES
}

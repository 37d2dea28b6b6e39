package org.contextql.engine.validation;

/**
 * Stable identifiers of everything the validator reports.
 */
public enum IssueCode {
    // Schema
    INVALID_NAME,
    INVALID_DESCRIPTION,
    INVALID_VERSION,
    NO_DATASETS,
    INVALID_LOCAL_ID,
    INVALID_METRIC_ID,
    DUPLICATE_DATASET_ID,
    MISSING_DATASET_ID,
    DUPLICATE_ID,
    INVALID_JOIN_TYPE,
    EMPTY_EXPRESSION,

    // Semantic
    MISSING_DATASET,
    MISSING_COLUMN,
    INVALID_EXPRESSION,
    UNDECLARED_PARAMETER,
    AMBIGUOUS_COLUMN,
    UNKNOWN_GLOSSARY_COLUMN,

    // Relationship graph
    CIRCULAR_DEPENDENCY,
    CIRCULAR_RELATIONSHIP,
    SELF_REFERENCING_RELATIONSHIP,
    DUPLICATE_RELATIONSHIP,
    NO_RELATIONSHIPS,
    DISCONNECTED_DATASET,

    // Business rules
    INVALID_SEVERITY,
    INVALID_RULE_TYPE,
    EMPTY_RULE_CONDITION,
    UNPARSABLE_RULE_CONDITION
}

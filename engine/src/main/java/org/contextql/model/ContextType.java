package org.contextql.model;

/**
 * Derived from the number of datasets a document declares.
 */
public enum ContextType {
    SINGLE_DATASET,
    MULTI_DATASET;

    public static ContextType forDatasetCount(int count) {
        return count > 1 ? MULTI_DATASET : SINGLE_DATASET;
    }
}

package org.contextql.engine.service;

/**
 * Counts over a user's contexts, one per context id (its latest version).
 */
public record ContextStatistics(int total, int singleDataset, int multiDataset, int active, int failedValidation) {
}

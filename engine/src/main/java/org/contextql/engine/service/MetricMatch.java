package org.contextql.engine.service;

import org.contextql.model.Metric;

/**
 * A metric usable with a given dataset.
 *
 * @param contextId      Context declaring the metric
 * @param version        Context version
 * @param datasetLocalId The dataset's local id inside that context
 * @param metric         The metric definition
 */
public record MetricMatch(String contextId, String version, String datasetLocalId, Metric metric) {
}

package org.contextql.engine.plan;

import org.contextql.engine.graph.JoinStep;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The executable query derived from a request and a validated context.
 *
 * Plans are value objects: compiling the same inputs twice gives equal plans
 * with the same cache key.
 *
 * @param contextId      Context the plan was compiled against
 * @param contextVersion Its version
 * @param fingerprint    Its content fingerprint
 * @param root           Dataset the query selects from
 * @param joins          Joins in emission order
 * @param sql            Query text with positional {@code ?} parameters
 * @param parameters     Bound parameter values, one per marker, in order
 * @param appliedMetrics Metrics projected
 * @param appliedFilters Named filters applied
 * @param appliedRules   Mandatory (error severity) rules injected into WHERE
 * @param advisories     Warning and info rules that apply to the query
 * @param outputColumns  Result column descriptors
 * @param cacheKey       SHA-256 over fingerprint, query text and parameters
 */
public record CompiledPlan(
        String contextId,
        String contextVersion,
        String fingerprint,
        String root,
        List<JoinStep> joins,
        String sql,
        List<Object> parameters,
        List<String> appliedMetrics,
        List<String> appliedFilters,
        List<String> appliedRules,
        List<Advisory> advisories,
        List<OutputColumn> outputColumns,
        String cacheKey) {

    public CompiledPlan {
        joins = List.copyOf(joins);
        // parameter values may be null
        parameters = Collections.unmodifiableList(new ArrayList<>(parameters));
        appliedMetrics = List.copyOf(appliedMetrics);
        appliedFilters = List.copyOf(appliedFilters);
        appliedRules = List.copyOf(appliedRules);
        advisories = List.copyOf(advisories);
        outputColumns = List.copyOf(outputColumns);
    }
}

package org.contextql.engine.graph;

import org.contextql.model.Relationship;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * A directed cycle among declared relationships.
 *
 * @param datasets      Local ids on the cycle, starting at the dataset the closing
 *                      relationship points back to
 * @param relationships The relationships forming the cycle, in traversal order
 * @param closing       The relationship classified as the DFS back edge
 */
public record Cycle(List<String> datasets, List<Relationship> relationships, Relationship closing) {

    public Cycle {
        datasets = List.copyOf(datasets);
        relationships = List.copyOf(relationships);
    }

    public Set<String> datasetSet() {
        return new LinkedHashSet<>(datasets);
    }

    /**
     * @return e.g. {@code a -> b -> c -> a}
     */
    public String describe() {
        return String.join(" -> ", datasets) + " -> " + datasets.get(0);
    }
}

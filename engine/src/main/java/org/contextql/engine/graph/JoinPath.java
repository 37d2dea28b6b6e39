package org.contextql.engine.graph;

import org.contextql.model.Relationship;

import java.util.ArrayList;
import java.util.List;

/**
 * An ordered set of joins forming a simple tree rooted at {@code root}: every
 * step joins a dataset not joined before.
 *
 * @param root  The dataset the query selects from
 * @param steps Joins in the order they must be emitted
 */
public record JoinPath(String root, List<JoinStep> steps) {

    public JoinPath {
        steps = List.copyOf(steps);
    }

    public static JoinPath single(String root) {
        return new JoinPath(root, List.of());
    }

    /**
     * @return The root followed by each joined dataset, in join order
     */
    public List<String> datasets() {
        List<String> datasets = new ArrayList<>(steps.size() + 1);
        datasets.add(root);
        for (JoinStep step : steps) {
            datasets.add(step.target());
        }
        return datasets;
    }

    public List<Relationship> relationships() {
        return steps.stream().map(JoinStep::relationship).toList();
    }

    public boolean contains(String localId) {
        return datasets().contains(localId);
    }

    public boolean isEmpty() {
        return steps.isEmpty();
    }
}

package org.contextql.engine.graph;

import org.contextql.model.Relationship;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.PriorityQueue;
import java.util.Set;
import java.util.TreeSet;

/**
 * Plans the joins connecting a set of datasets.
 *
 * Connecting a subset of nodes at minimum cost is the Steiner tree problem,
 * which is NP-hard; this resolver uses the greedy shortest-path heuristic and
 * does not guarantee an optimal tree for four or more datasets:
 * <ol>
 *   <li>start the tree at the requested dataset declared earliest;</li>
 *   <li>run a multi-source Dijkstra from every dataset in the tree;</li>
 *   <li>attach the nearest requested dataset not yet in the tree along its
 *       shortest path (ties go to the dataset declared earliest);</li>
 *   <li>repeat until every requested dataset is in the tree.</li>
 * </ol>
 * Between equal-cost edges the relationship declared earliest wins. Because the
 * search never re-enters the tree, the result is always a simple tree.
 */
public final class JoinPathResolver {

    private static final Logger LOGGER = LoggerFactory.getLogger(JoinPathResolver.class);

    private static final double EPSILON = 1e-9;

    private final RelationshipGraph graph;

    public JoinPathResolver(RelationshipGraph graph) {
        this.graph = graph;
    }

    public RelationshipGraph graph() {
        return graph;
    }

    public JoinPath findJoinPath(Collection<String> requested) {
        return findJoinPath(requested, List.of());
    }

    /**
     * @param requested Local ids of the datasets the query needs
     * @param pinned    Ids of relationships the join must use, attached before
     *                  any others
     * @throws NoPathException       if a requested dataset is unknown or unreachable
     * @throws CircularPathException if the pinned relationships revisit a dataset
     *                               or are not connected to the tree
     */
    public JoinPath findJoinPath(Collection<String> requested, List<String> pinned) {
        TreeSet<String> targets = new TreeSet<>(Comparator.comparingInt(graph::order));
        Set<String> unknown = new TreeSet<>();
        for (String ds : requested) {
            if (graph.contains(ds)) {
                targets.add(ds);
            } else {
                unknown.add(ds);
            }
        }
        if (!unknown.isEmpty()) {
            throw new NoPathException("Unknown dataset(s) " + unknown, unknown);
        }
        if (targets.isEmpty()) {
            if (graph.datasets().isEmpty()) {
                throw new NoPathException("The context declares no datasets", Set.of());
            }
            targets.add(graph.datasets().get(0));
        }

        String root = targets.first();
        Set<String> tree = new LinkedHashSet<>();
        tree.add(root);
        List<JoinStep> steps = new ArrayList<>();

        attachPinned(pinned, tree, steps);

        Set<String> remaining = new TreeSet<>(Comparator.comparingInt(graph::order));
        for (String ds : targets) {
            if (!tree.contains(ds)) {
                remaining.add(ds);
            }
        }

        while (!remaining.isEmpty()) {
            attachNearest(tree, remaining, steps);
        }

        JoinPath path = new JoinPath(root, steps);
        LOGGER.debug("Resolved join path for {}: {} via {}", targets, path.datasets(),
                path.relationships().stream().map(Relationship::id).toList());
        return path;
    }

    private void attachPinned(List<String> pinned, Set<String> tree, List<JoinStep> steps) {
        Deque<Relationship> pending = new ArrayDeque<>();
        Set<String> seen = new LinkedHashSet<>();
        for (String id : pinned) {
            if (!seen.add(id)) {
                continue;
            }
            int index = graph.indexOf(id);
            if (index < 0) {
                throw new NoPathException("Unknown relationship '" + id + "'", Set.of());
            }
            Relationship r = graph.relationship(index);
            if (r.isSelfReferencing()) {
                throw new CircularPathException(
                        "Relationship '" + id + "' joins " + r.from().datasetId() + " to itself", id);
            }
            pending.add(r);
        }

        boolean progressed = true;
        while (!pending.isEmpty() && progressed) {
            progressed = false;
            int size = pending.size();
            for (int i = 0; i < size; i++) {
                Relationship r = pending.poll();
                boolean hasFrom = tree.contains(r.from().datasetId());
                boolean hasTo = tree.contains(r.to().datasetId());
                if (hasFrom && hasTo) {
                    throw new CircularPathException("Relationship '" + r.id() + "' would join "
                            + r.from().datasetId() + " and " + r.to().datasetId() + " a second time", r.id());
                }
                if (hasFrom || hasTo) {
                    JoinStep step = JoinStep.traverse(r, hasFrom ? r.from().datasetId() : r.to().datasetId());
                    tree.add(step.target());
                    steps.add(step);
                    progressed = true;
                } else {
                    pending.add(r);
                }
            }
        }
        if (!pending.isEmpty()) {
            Relationship r = pending.peek();
            throw new CircularPathException(
                    "Relationship '" + r.id() + "' is not connected to the join tree", r.id());
        }
    }

    private record Entry(String node, double distance) {
    }

    private void attachNearest(Set<String> tree, Set<String> remaining, List<JoinStep> steps) {
        Map<String, Double> distance = new HashMap<>();
        Map<String, RelationshipGraph.Edge> via = new HashMap<>();
        Set<String> settled = new LinkedHashSet<>();
        PriorityQueue<Entry> queue = new PriorityQueue<>(Comparator
                .comparingDouble(Entry::distance)
                .thenComparingInt(e -> graph.order(e.node())));

        for (String node : tree) {
            distance.put(node, 0.0);
            queue.add(new Entry(node, 0.0));
        }

        while (!queue.isEmpty()) {
            Entry entry = queue.poll();
            if (!settled.add(entry.node())) {
                continue;
            }
            for (RelationshipGraph.Edge edge : graph.neighbors(entry.node())) {
                String next = edge.to();
                if (settled.contains(next) || tree.contains(next)) {
                    continue;
                }
                double candidate = entry.distance() + edge.weight();
                Double current = distance.get(next);
                boolean better = current == null || candidate < current - EPSILON
                        || (Math.abs(candidate - current) <= EPSILON && edge.index() < via.get(next).index());
                if (better) {
                    distance.put(next, candidate);
                    via.put(next, edge);
                    queue.add(new Entry(next, candidate));
                }
            }
        }

        String nearest = null;
        double best = Double.POSITIVE_INFINITY;
        for (String ds : remaining) {
            Double d = distance.get(ds);
            if (d != null && d < best - EPSILON) {
                best = d;
                nearest = ds;
            }
        }
        if (nearest == null) {
            throw new NoPathException("No relationship path connects " + remaining + " to " + tree, remaining);
        }

        Deque<JoinStep> branch = new ArrayDeque<>();
        String node = nearest;
        while (!tree.contains(node)) {
            RelationshipGraph.Edge edge = via.get(node);
            branch.addFirst(JoinStep.traverse(edge.relationship(), edge.from()));
            node = edge.from();
        }
        for (JoinStep step : branch) {
            tree.add(step.target());
            steps.add(step);
            remaining.remove(step.target());
        }
    }
}

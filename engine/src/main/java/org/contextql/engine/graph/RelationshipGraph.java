package org.contextql.engine.graph;

import org.contextql.engine.execution.DatasetSchema;
import org.contextql.engine.validation.ValidatedContext;
import org.contextql.model.ContextDocument;
import org.contextql.model.DatasetRef;
import org.contextql.model.Relationship;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Adjacency-list graph of a context document: nodes are dataset local ids,
 * edges are relationships.
 *
 * Relationships are directed as declared for cycle detection and undirected
 * for join planning. Relationships that close a cycle (DFS back edges) and self
 * relationships are kept out of the traversable adjacency, so every join tree
 * planned over this graph avoids them unless they are pinned explicitly.
 * Relationships naming undeclared datasets are ignored.
 *
 * Instances are immutable and safe to share between threads.
 */
public final class RelationshipGraph {

    /**
     * A traversable half-edge.
     *
     * @param index        Declaration index of the relationship
     * @param relationship The relationship
     * @param from         The dataset the edge is traversed from
     * @param to           The dataset the edge leads to
     * @param weight       Traversal cost
     */
    public record Edge(int index, Relationship relationship, String from, String to, double weight) {

        /**
         * @return true if this edge runs against the declared direction
         */
        public boolean reversed() {
            return !relationship.from().datasetId().equals(from);
        }
    }

    private final List<String> datasets;
    private final Map<String, Integer> order;
    private final List<Relationship> relationships;
    private final Map<String, List<Edge>> adjacency;
    private final Map<String, Integer> degree;
    private final List<Cycle> cycles;
    private final List<Relationship> selfLoops;
    private final Set<Integer> cycleClosing;

    private RelationshipGraph(List<String> datasets, List<Relationship> relationships, Map<String, Long> rowCounts) {
        this.order = new LinkedHashMap<>();
        for (String ds : datasets) {
            order.putIfAbsent(ds, order.size());
        }
        this.datasets = List.copyOf(order.keySet());

        this.relationships = relationships.stream()
                .filter(r -> order.containsKey(r.from().datasetId()) && order.containsKey(r.to().datasetId()))
                .toList();

        Map<String, List<Relationship>> outgoing = new LinkedHashMap<>();
        Map<String, Integer> degrees = new LinkedHashMap<>();
        for (String ds : order.keySet()) {
            outgoing.put(ds, new ArrayList<>());
            degrees.put(ds, 0);
        }
        for (Relationship r : this.relationships) {
            outgoing.get(r.from().datasetId()).add(r);
            degrees.merge(r.from().datasetId(), 1, Integer::sum);
            if (!r.isSelfReferencing()) {
                degrees.merge(r.to().datasetId(), 1, Integer::sum);
            }
        }
        this.degree = Collections.unmodifiableMap(degrees);

        CycleDetector.Result detected = CycleDetector.detect(List.copyOf(order.keySet()), outgoing);
        this.cycles = detected.cycles();
        this.selfLoops = detected.selfLoops();

        Set<Integer> closing = new HashSet<>();
        for (int i = 0; i < this.relationships.size(); i++) {
            Relationship r = this.relationships.get(i);
            if (r.isSelfReferencing() || isClosingEdge(r)) {
                closing.add(i);
            }
        }
        this.cycleClosing = Collections.unmodifiableSet(closing);

        Map<String, List<Edge>> adj = new LinkedHashMap<>();
        for (String ds : order.keySet()) {
            adj.put(ds, new ArrayList<>());
        }
        for (int i = 0; i < this.relationships.size(); i++) {
            if (closing.contains(i)) {
                continue;
            }
            Relationship r = this.relationships.get(i);
            String a = r.from().datasetId();
            String b = r.to().datasetId();
            double weight = weight(rowCounts.get(a), rowCounts.get(b));
            adj.get(a).add(new Edge(i, r, a, b, weight));
            adj.get(b).add(new Edge(i, r, b, a, weight));
        }
        adj.replaceAll((k, v) -> List.copyOf(v));
        this.adjacency = Collections.unmodifiableMap(adj);
    }

    /**
     * Builds the graph with unit edge weights.
     */
    public static RelationshipGraph build(ContextDocument document) {
        return build(document, Map.of());
    }

    /**
     * Builds the graph weighting each edge by the estimated size of the larger
     * of its two datasets.
     *
     * @param rowCounts Estimated row counts by local id; missing entries count as unknown
     */
    public static RelationshipGraph build(ContextDocument document, Map<String, Long> rowCounts) {
        List<String> ids = document.datasets().stream().map(DatasetRef::localId).toList();
        return new RelationshipGraph(ids, document.relationships(), rowCounts);
    }

    /**
     * Builds the graph of a validated context, using the row counts its store
     * schemas report.
     */
    public static RelationshipGraph build(ValidatedContext context) {
        Map<String, Long> rowCounts = new LinkedHashMap<>();
        for (Map.Entry<String, DatasetSchema> e : context.schemas().entrySet()) {
            e.getValue().estimatedRows().ifPresent(rows -> rowCounts.put(e.getKey(), rows));
        }
        return build(context.document(), rowCounts);
    }

    /**
     * Edge cost: 1 by default, {@code 1 + log10(1 + max(rowsA, rowsB))} when a
     * row count is known for either end.
     */
    static double weight(Long rowsA, Long rowsB) {
        if (rowsA == null && rowsB == null) {
            return 1.0;
        }
        long max = Math.max(rowsA == null ? 0L : rowsA, rowsB == null ? 0L : rowsB);
        return 1.0 + Math.log10(1.0 + Math.max(0L, max));
    }

    private boolean isClosingEdge(Relationship r) {
        for (Cycle cycle : cycles) {
            if (cycle.closing() == r) {
                return true;
            }
        }
        return false;
    }

    // ==================== Queries ====================

    public List<String> datasets() {
        return datasets;
    }

    public boolean contains(String localId) {
        return order.containsKey(localId);
    }

    /**
     * @return Declaration index of a dataset, or {@link Integer#MAX_VALUE} if unknown
     */
    public int order(String localId) {
        return order.getOrDefault(localId, Integer.MAX_VALUE);
    }

    /**
     * @return Relationships between declared datasets, in declaration order
     */
    public List<Relationship> relationships() {
        return relationships;
    }

    public Relationship relationship(int index) {
        return relationships.get(index);
    }

    /**
     * @return Declaration index of the relationship with the given id, or -1
     */
    public int indexOf(String relationshipId) {
        for (int i = 0; i < relationships.size(); i++) {
            if (relationships.get(i).id().equals(relationshipId)) {
                return i;
            }
        }
        return -1;
    }

    /**
     * @return Traversable edges leaving a dataset, in declaration order
     */
    public List<Edge> neighbors(String localId) {
        return adjacency.getOrDefault(localId, List.of());
    }

    /**
     * @return Number of relationships touching a dataset, traversable or not
     */
    public int degree(String localId) {
        return degree.getOrDefault(localId, 0);
    }

    public List<Cycle> cycles() {
        return cycles;
    }

    public List<Relationship> selfLoops() {
        return selfLoops;
    }

    public boolean isCycleClosing(int relationshipIndex) {
        return cycleClosing.contains(relationshipIndex);
    }

    public boolean hasCycles() {
        return !cycles.isEmpty();
    }
}

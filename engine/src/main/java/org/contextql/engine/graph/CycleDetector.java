package org.contextql.engine.graph;

import org.contextql.model.Relationship;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Depth-first search over the directed relationship graph with an explicit
 * recursion-stack set.
 *
 * Datasets are visited in declaration order and each dataset's outgoing
 * relationships in declaration order, so the classification is deterministic.
 * Every back edge yields one reported cycle. Self relationships are collected
 * separately and are not reported as cycles.
 */
final class CycleDetector {

    private final List<String> nodes;
    private final Map<String, List<Relationship>> outgoing;

    private final Set<String> visited = new HashSet<>();
    private final LinkedHashSet<String> recursionStack = new LinkedHashSet<>();
    private final List<Relationship> stackEdges = new ArrayList<>();
    private final List<Cycle> cycles = new ArrayList<>();
    private final List<Relationship> selfLoops = new ArrayList<>();

    private CycleDetector(List<String> nodes, Map<String, List<Relationship>> outgoing) {
        this.nodes = nodes;
        this.outgoing = outgoing;
    }

    record Result(List<Cycle> cycles, List<Relationship> selfLoops) {
    }

    static Result detect(List<String> nodes, Map<String, List<Relationship>> outgoing) {
        CycleDetector detector = new CycleDetector(nodes, outgoing);
        for (String node : nodes) {
            if (!detector.visited.contains(node)) {
                detector.visit(node);
            }
        }
        return new Result(List.copyOf(detector.cycles), List.copyOf(detector.selfLoops));
    }

    private void visit(String node) {
        visited.add(node);
        recursionStack.add(node);
        for (Relationship edge : outgoing.getOrDefault(node, List.of())) {
            String target = edge.to().datasetId();
            if (target.equals(node)) {
                selfLoops.add(edge);
            } else if (recursionStack.contains(target)) {
                cycles.add(cycleClosedBy(edge, target));
            } else if (!visited.contains(target)) {
                stackEdges.add(edge);
                visit(target);
                stackEdges.remove(stackEdges.size() - 1);
            }
        }
        recursionStack.remove(node);
    }

    private Cycle cycleClosedBy(Relationship closing, String target) {
        List<String> stack = new ArrayList<>(recursionStack);
        int start = stack.indexOf(target);
        List<String> datasets = stack.subList(start, stack.size());
        // stackEdges.get(i) leads from stack[i] to stack[i + 1]
        List<Relationship> edges = new ArrayList<>(stackEdges.subList(start, stackEdges.size()));
        edges.add(closing);
        return new Cycle(datasets, edges, closing);
    }
}

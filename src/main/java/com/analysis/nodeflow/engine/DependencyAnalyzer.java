package com.analysis.nodeflow.engine;

import com.analysis.nodeflow.error.CycleException;
import com.analysis.nodeflow.error.StructuralException;
import com.analysis.nodeflow.store.NodeRecord;

import java.util.*;

/**
 * Pure queries over a {@link DependencyGraph}.
 *
 * <p>
 * Dependency ids that do not name a node never take part in closures or
 * orders; {@link #validate(DependencyGraph)} is where they are reported.
 */
public final class DependencyAnalyzer {

    private DependencyAnalyzer() {
        // Utility class
    }

    /** Builds a graph from id to dependency ids, keeping the map's iteration order. */
    public static DependencyGraph buildGraph(Map<String, ? extends Collection<String>> edges) {
        DependencyGraph.Builder builder = DependencyGraph.builder();
        for (var e : edges.entrySet())
            builder.addNode(e.getKey(), e.getValue());
        return builder.build();
    }

    /** Builds a graph from the committed {@code dependsOn} of each record. */
    public static DependencyGraph buildGraph(List<NodeRecord> nodes) {
        DependencyGraph.Builder builder = DependencyGraph.builder();
        for (NodeRecord node : nodes)
            builder.addNode(node.id(), node.dependsOn());
        return builder.build();
    }

    /**
     * All nodes {@code id} depends on, directly or not. The node itself is
     * never part of the result, even when a cycle leads back to it.
     */
    public static Set<String> transitiveDependencies(DependencyGraph graph, String id) {
        requireNode(graph, id);
        Set<String> visited = new LinkedHashSet<>();
        Deque<String> queue = new ArrayDeque<>(graph.knownDependencies(id));
        while (!queue.isEmpty()) {
            String current = queue.poll();
            if (current.equals(id) || !visited.add(current))
                continue;
            queue.addAll(graph.knownDependencies(current));
        }
        return visited;
    }

    /** The given ids together with everything they depend on. */
    public static Set<String> closure(DependencyGraph graph, Collection<String> ids) {
        Set<String> result = new LinkedHashSet<>();
        for (String id : ids) {
            result.add(requireNode(graph, id));
            result.addAll(transitiveDependencies(graph, id));
        }
        return result;
    }

    /**
     * {@code id} and its closure, dependencies before dependents, ties broken
     * by insertion order.
     *
     * @throws CycleException      if a cycle is reachable from {@code id}
     * @throws StructuralException if {@code id} is not a node
     */
    public static List<String> executionOrder(DependencyGraph graph, String id) {
        Set<String> relevant = closure(graph, List.of(id));

        TopologicalOrder.Builder builder = TopologicalOrder.builder();
        List<String> byInsertion = new ArrayList<>(relevant);
        byInsertion.sort(Comparator.comparingInt(graph::insertionIndex));
        for (String node : byInsertion)
            builder.addNode(node);
        for (String node : byInsertion)
            for (String dep : graph.knownDependencies(node))
                if (relevant.contains(dep))
                    builder.addEdge(dep, node);
        return builder.build().ids();
    }

    public static ExecutionPlan executionPlan(DependencyGraph graph, String id, Set<String> alreadyDone) {
        List<String> order = executionOrder(graph, id);
        List<String> toRun = new ArrayList<>();
        List<String> skipped = new ArrayList<>();
        for (String node : order) {
            if (alreadyDone.contains(node))
                skipped.add(node);
            else
                toRun.add(node);
        }
        return new ExecutionPlan(id, order, toRun, skipped);
    }

    public static ValidationReport validate(DependencyGraph graph) {
        List<String> errors = new ArrayList<>();
        List<String> warnings = new ArrayList<>();
        Map<String, List<String>> missing = new LinkedHashMap<>();

        for (String id : graph.nodeIds())
            for (String dep : graph.dependenciesOf(id))
                if (!graph.contains(dep)) {
                    missing.computeIfAbsent(dep, k -> new ArrayList<>()).add(id);
                    errors.add("Node '" + id + "' depends on unknown node '" + dep + "'");
                }

        if (graph.hasCycle()) {
            List<String> path = CycleFinder.find(graph.nodeIds(), graph::knownDependencies);
            errors.add("Circular dependency detected: " + String.join(" -> ", path));
        }

        List<String> isolated = new ArrayList<>();
        for (String id : graph.nodeIds())
            if (graph.dependenciesOf(id).isEmpty() && graph.dependentsOf(id).isEmpty()) {
                isolated.add(id);
                warnings.add("Node '" + id + "' is isolated (no dependencies or dependents)");
            }
        return new ValidationReport(errors.isEmpty(), graph.hasCycle(), missing, isolated, errors, warnings);
    }

    /** Full report for one node. The execution order is empty when a cycle is reachable from it. */
    public static AnalysisReport analyze(DependencyGraph graph, String id) {
        List<String> transitive = new ArrayList<>(transitiveDependencies(graph, id));
        Collections.sort(transitive);
        List<String> dependents = new ArrayList<>(graph.dependentsOf(id));
        Collections.sort(dependents);

        List<String> order;
        try {
            order = executionOrder(graph, id);
        } catch (CycleException e) {
            order = List.of();
        }
        return new AnalysisReport(id, graph.dependenciesOf(id), transitive, order, dependents, graph.hasCycle());
    }

    public static Map<String, AnalysisReport> analyzeAll(DependencyGraph graph) {
        Map<String, AnalysisReport> reports = new LinkedHashMap<>();
        for (String id : graph.nodeIds())
            reports.put(id, analyze(graph, id));
        return reports;
    }

    public static ChainReport findChains(DependencyGraph graph) {
        List<String> sources = new ArrayList<>();
        List<String> leaves = new ArrayList<>();
        for (String id : graph.nodeIds()) {
            if (graph.knownDependencies(id).isEmpty())
                sources.add(id);
            if (graph.dependentsOf(id).isEmpty())
                leaves.add(id);
        }

        List<List<String>> chains = new ArrayList<>();
        for (String source : sources)
            walkChains(graph, source, new ArrayList<>(List.of(source)), chains);
        return new ChainReport(chains, sources, leaves);
    }

    private static void walkChains(DependencyGraph graph, String current, List<String> path,
            List<List<String>> out) {
        List<String> next = graph.dependentsOf(current);
        if (next.isEmpty()) {
            out.add(List.copyOf(path));
            return;
        }
        for (String dependent : next) {
            if (path.contains(dependent))
                continue;
            path.add(dependent);
            walkChains(graph, dependent, path, out);
            path.remove(path.size() - 1);
        }
    }

    private static String requireNode(DependencyGraph graph, String id) {
        if (!graph.contains(id))
            throw StructuralException.unknownNode(id);
        return id;
    }
}

package com.analysis.nodeflow.util;

import com.analysis.nodeflow.engine.DependencyGraph;
import com.analysis.nodeflow.engine.TopologicalOrder;
import com.analysis.nodeflow.store.NodeRecord;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Diagnostic utility for inspecting a project's graph and node states.
 *
 * <p>
 * Generates human-readable text and Mermaid diagrams. Nodes are listed in
 * topological order, or in insertion order when the graph has a cycle.
 */
public final class GraphExplain {
    private final DependencyGraph graph;
    private final Map<String, NodeRecord> records;
    private final TopologicalOrder topology;

    public GraphExplain(DependencyGraph graph) {
        this(graph, Collections.emptyMap());
    }

    public GraphExplain(DependencyGraph graph, Map<String, NodeRecord> records) {
        this.graph = graph;
        this.records = records;
        this.topology = graph.hasCycle() ? null : fullOrder(graph);
    }

    private static TopologicalOrder fullOrder(DependencyGraph graph) {
        TopologicalOrder.Builder builder = TopologicalOrder.builder();
        for (String id : graph.nodeIds())
            builder.addNode(id);
        for (String id : graph.nodeIds())
            for (String dep : graph.knownDependencies(id))
                builder.addEdge(dep, id);
        return builder.build();
    }

    /** Node ids in display order. */
    public List<String> displayOrder() {
        return topology != null ? topology.ids() : new ArrayList<>(graph.nodeIds());
    }

    /**
     * Dumps detailed state of a single node.
     */
    public String explainNode(String id) {
        NodeRecord record = records.get(id);
        StringBuilder sb = new StringBuilder(256);
        sb.append("Node: ").append(id).append('\n');
        if (topology != null)
            sb.append("  Topo index: ").append(topology.topoIndex(id)).append('\n');
        if (record != null) {
            sb.append("  Kind: ").append(record.kind().tag()).append('\n')
                    .append("  State: ").append(record.state().tag()).append('\n');
            if (record.hasResult())
                sb.append("  Result: ").append(record.result().path()).append('\n');
            if (record.errorMessage() != null)
                sb.append("  Error: ").append(record.errorMessage()).append('\n');
        }
        sb.append("  Depends on: ").append(String.join(", ", graph.dependenciesOf(id))).append('\n');
        sb.append("  Dependents: ").append(String.join(", ", graph.dependentsOf(id)));
        return sb.append('\n').toString();
    }

    /**
     * Dumps the entire topology in dot-like text format.
     */
    public String dumpTopology() {
        StringBuilder sb = new StringBuilder(1024);
        sb.append("Graph (").append(graph.nodeCount()).append(" nodes");
        if (graph.hasCycle())
            sb.append(", CYCLIC");
        sb.append("):\n");
        List<String> order = displayOrder();
        for (int i = 0; i < order.size(); i++) {
            String id = order.get(i);
            sb.append("  [").append(i).append("] ").append(id);
            if (graph.dependenciesOf(id).isEmpty())
                sb.append(" (SRC)");
            List<String> dependents = graph.dependentsOf(id);
            if (!dependents.isEmpty())
                sb.append(" → ").append(String.join(", ", dependents));
            sb.append('\n');
        }
        return sb.toString();
    }

    /**
     * Generates a Mermaid JS graph diagram.
     * <p>
     * Edges point from a dependency to its dependents. Node styles follow the
     * materialization state; unknown dependencies are drawn as missing nodes.
     * </p>
     */
    public String toMermaid() {
        StringBuilder sb = new StringBuilder(4096);
        sb.append("graph TD;\n");

        // 1. Nodes in display order
        for (String id : displayOrder()) {
            NodeRecord record = records.get(id);
            sb.append("  ").append(sanitize(id)).append("[\"").append(id);
            if (record != null)
                sb.append("<br/><small>").append(record.kind().tag()).append("</small>");
            sb.append("\"]");
            if (record != null)
                sb.append(":::").append(record.state().tag());
            sb.append(";\n");
        }

        // 2. Edges afterwards
        List<String> missing = new ArrayList<>();
        for (String id : displayOrder()) {
            for (String dep : graph.dependenciesOf(id)) {
                if (!graph.contains(dep) && !missing.contains(dep)) {
                    missing.add(dep);
                    sb.append("  ").append(sanitize(dep)).append("[\"").append(dep).append(" (missing)\"]:::missing;\n");
                }
                sb.append("  ").append(sanitize(dep)).append(" --> ").append(sanitize(id)).append(";\n");
            }
        }

        sb.append("  classDef validated fill:#d4edda,stroke:#28a745;\n");
        sb.append("  classDef pending_validation fill:#fff3cd,stroke:#ffc107;\n");
        sb.append("  classDef not_executed fill:#f8f9fa,stroke:#6c757d;\n");
        sb.append("  classDef missing fill:#f8d7da,stroke:#dc3545,stroke-dasharray: 5 5;\n");
        return sb.toString();
    }

    private static String sanitize(String name) {
        return name.replaceAll("[^a-zA-Z0-9_]", "_");
    }
}

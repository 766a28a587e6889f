package com.analysis.nodeflow.exec;

import com.analysis.nodeflow.api.NodeStore;
import com.analysis.nodeflow.infer.DependencyInferencer;
import com.analysis.nodeflow.infer.ExplicitDependencies;
import com.analysis.nodeflow.io.EdgeMode;
import com.analysis.nodeflow.store.NodeRecord;

import java.util.*;

/**
 * Produces dependency edges for graph queries, either from the committed
 * records or by inferring them from each node's current code.
 */
public final class EdgeDiscovery {
    private final NodeStore store;
    private final DependencyInferencer inferencer;

    public EdgeDiscovery(NodeStore store, DependencyInferencer inferencer) {
        this.store = store;
        this.inferencer = inferencer;
    }

    /** Dependencies of one piece of code. A {@code @depends_on} declaration is returned as written. */
    public List<String> discover(String nodeId, String code, Collection<String> allIds) {
        return inferencer.infer(nodeId, code, allIds, ExplicitDependencies.extract(code));
    }

    /**
     * Edges of every node, in store order. In {@link EdgeMode#INFERRED} mode a
     * node without code keeps its committed dependencies.
     */
    public Map<String, List<String>> edges(List<NodeRecord> nodes, EdgeMode mode) {
        Set<String> allIds = ids(nodes);
        Map<String, List<String>> edges = new LinkedHashMap<>();
        for (NodeRecord node : nodes) {
            if (mode == EdgeMode.COMMITTED) {
                edges.put(node.id(), node.dependsOn());
                continue;
            }
            Optional<String> code = store.getNodeCode(node.id());
            edges.put(node.id(), code.isPresent() ? discover(node.id(), code.get(), allIds) : node.dependsOn());
        }
        return edges;
    }

    /**
     * Inferred edges of {@code target} and every node reachable from it, keyed in
     * store order so insertion-order tie breaks match a full graph.
     */
    public Map<String, List<String>> reachableEdges(String target, List<NodeRecord> nodes) {
        Map<String, NodeRecord> byId = new LinkedHashMap<>();
        for (NodeRecord node : nodes)
            byId.put(node.id(), node);
        Set<String> allIds = byId.keySet();

        Map<String, List<String>> found = new HashMap<>();
        Deque<String> queue = new ArrayDeque<>(List.of(target));
        while (!queue.isEmpty()) {
            String id = queue.poll();
            NodeRecord node = byId.get(id);
            if (node == null || found.containsKey(id))
                continue;
            Optional<String> code = store.getNodeCode(id);
            List<String> deps = code.isPresent() ? discover(id, code.get(), allIds) : node.dependsOn();
            found.put(id, deps);
            queue.addAll(deps);
        }

        Map<String, List<String>> ordered = new LinkedHashMap<>();
        for (String id : allIds)
            if (found.containsKey(id))
                ordered.put(id, found.get(id));
        return ordered;
    }

    private static Set<String> ids(List<NodeRecord> nodes) {
        Set<String> ids = new LinkedHashSet<>();
        for (NodeRecord node : nodes)
            ids.add(node.id());
        return ids;
    }
}

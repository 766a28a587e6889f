package com.analysis.nodeflow.engine;

import com.analysis.nodeflow.error.CycleException;

import java.util.*;

import lombok.extern.log4j.Log4j2;

/**
 * Topological order of a set of node ids, dependencies first.
 *
 * <p>
 * Built with Kahn's algorithm. Whenever several nodes are ready at once the
 * one added to the builder first is emitted first, so the order is fully
 * deterministic for a given insertion sequence.
 */
@Log4j2
public final class TopologicalOrder {
    private final String[] order;
    private final Map<String, Integer> idToIndex;

    private TopologicalOrder(String[] order, Map<String, Integer> idToIndex) {
        this.order = order;
        this.idToIndex = idToIndex;
    }

    public int nodeCount() {
        return order.length;
    }

    /** Returns the node id at the given topological index. */
    public String node(int ti) {
        return order[ti];
    }

    /** Node ids in execution order. */
    public List<String> ids() {
        return List.of(order);
    }

    public int topoIndex(String id) {
        Integer idx = idToIndex.get(id);
        if (idx == null)
            throw new IllegalArgumentException("Unknown node: " + id);
        return idx;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for constructing the TopologicalOrder.
     * Handles cycle detection and topological sorting.
     */
    public static final class Builder {
        private final List<String> ids = new ArrayList<>();
        private final Map<String, Integer> idToIdx = new HashMap<>();
        private final Map<Integer, List<Integer>> forwardEdges = new HashMap<>();

        public Builder addNode(String id) {
            if (idToIdx.containsKey(id))
                throw new IllegalArgumentException("Duplicate node id: " + id);
            int idx = ids.size();
            ids.add(id);
            idToIdx.put(id, idx);
            forwardEdges.put(idx, new ArrayList<>());
            return this;
        }

        /** Declares that {@code dependent} needs {@code dependency} to run first. */
        public Builder addEdge(String dependency, String dependent) {
            List<Integer> children = forwardEdges.get(requireIndex(dependency));
            int child = requireIndex(dependent);
            if (!children.contains(child))
                children.add(child);
            return this;
        }

        private int requireIndex(String id) {
            Integer idx = idToIdx.get(id);
            if (idx == null)
                throw new IllegalArgumentException("Unknown node: " + id);
            return idx;
        }

        /**
         * Compiles the order.
         *
         * @throws CycleException if not every node could be ordered; the
         *                        exception carries one cycle among the leftovers
         */
        public TopologicalOrder build() {
            int n = ids.size();
            int[] inDegree = new int[n];

            for (var entry : forwardEdges.entrySet())
                for (int child : entry.getValue())
                    inDegree[child]++;

            // Lowest insertion index first among ready nodes
            PriorityQueue<Integer> ready = new PriorityQueue<>();
            for (int i = 0; i < n; i++)
                if (inDegree[i] == 0)
                    ready.add(i);

            String[] ordered = new String[n];
            Map<String, Integer> newIdToIndex = new HashMap<>(n * 2);
            int topoIdx = 0;
            int edges = 0;
            while (!ready.isEmpty()) {
                int curr = ready.poll();
                ordered[topoIdx] = ids.get(curr);
                newIdToIndex.put(ordered[topoIdx], topoIdx);
                topoIdx++;
                for (int child : forwardEdges.get(curr)) {
                    edges++;
                    if (--inDegree[child] == 0)
                        ready.add(child);
                }
            }
            if (topoIdx != n)
                throw leftoverCycle(inDegree, topoIdx);

            log.debug("Ordered {} nodes over {} edges", n, edges);
            return new TopologicalOrder(ordered, newIdToIndex);
        }

        private CycleException leftoverCycle(int[] inDegree, int processed) {
            // Nodes still holding in-degree are on, or downstream of, a cycle.
            List<String> leftover = new ArrayList<>();
            Map<String, List<String>> dependsOn = new HashMap<>();
            for (int i = 0; i < inDegree.length; i++)
                if (inDegree[i] > 0) {
                    leftover.add(ids.get(i));
                    dependsOn.put(ids.get(i), new ArrayList<>());
                }
            for (var entry : forwardEdges.entrySet()) {
                String dependency = ids.get(entry.getKey());
                for (int child : entry.getValue()) {
                    List<String> deps = dependsOn.get(ids.get(child));
                    if (deps != null)
                        deps.add(dependency);
                }
            }
            List<String> path = CycleFinder.find(leftover, id -> dependsOn.getOrDefault(id, List.of()));
            log.debug("Cycle detected, ordered {} of {} nodes: {}", processed, inDegree.length, path);
            return CycleException.staticCycle(path);
        }
    }
}

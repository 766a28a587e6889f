package com.analysis.nodeflow.engine;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Immutable dependency graph over node ids.
 *
 * <p>
 * Forward edges point from a node to the nodes it depends on; the reverse
 * mapping (dependency to dependents) is derived once. Nodes keep the order in
 * which they were added, and that insertion index is the tie-breaker for every
 * ordering computed from the graph. Edges may name ids that are not nodes;
 * those are kept as given and reported by
 * {@link DependencyAnalyzer#validate(DependencyGraph)}.
 */
public final class DependencyGraph {
    private final Map<String, List<String>> forward;
    private final Map<String, List<String>> reverse;
    private final Map<String, Integer> insertionIndex;
    private final boolean cyclic;

    private DependencyGraph(Map<String, List<String>> forward) {
        this.forward = forward;
        this.insertionIndex = new LinkedHashMap<>();
        Map<String, List<String>> rev = new LinkedHashMap<>();
        int i = 0;
        for (String id : forward.keySet()) {
            insertionIndex.put(id, i++);
            rev.put(id, new ArrayList<>());
        }
        for (var e : forward.entrySet())
            for (String dep : e.getValue()) {
                List<String> dependents = rev.get(dep);
                if (dependents != null)
                    dependents.add(e.getKey());
            }
        rev.replaceAll((k, v) -> Collections.unmodifiableList(v));
        this.reverse = rev;
        this.cyclic = !CycleFinder.find(forward.keySet(), this::knownDependencies).isEmpty();
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Node ids in insertion order. */
    public Set<String> nodeIds() {
        return Collections.unmodifiableSet(forward.keySet());
    }

    public int nodeCount() {
        return forward.size();
    }

    public boolean contains(String id) {
        return forward.containsKey(id);
    }

    /** Direct dependencies as declared, including ids that are not nodes. */
    public List<String> dependenciesOf(String id) {
        return Collections.unmodifiableList(require(id, forward));
    }

    /** Direct dependencies that are nodes of this graph. */
    public List<String> knownDependencies(String id) {
        List<String> known = new ArrayList<>();
        for (String dep : require(id, forward))
            if (forward.containsKey(dep))
                known.add(dep);
        return known;
    }

    /** Nodes that list {@code id} as a direct dependency, in insertion order. */
    public List<String> dependentsOf(String id) {
        return require(id, reverse);
    }

    public int insertionIndex(String id) {
        Integer idx = insertionIndex.get(id);
        if (idx == null)
            throw new IllegalArgumentException("Unknown node: " + id);
        return idx;
    }

    /** Whether any cycle exists. Computed once, at construction. */
    public boolean hasCycle() {
        return cyclic;
    }

    private static List<String> require(String id, Map<String, List<String>> edges) {
        List<String> list = edges.get(id);
        if (list == null)
            throw new IllegalArgumentException("Unknown node: " + id);
        return list;
    }

    public static final class Builder {
        private final Map<String, List<String>> forward = new LinkedHashMap<>();

        /**
         * Adds a node with its direct dependencies. Duplicate dependency ids are
         * collapsed, keeping first-seen order.
         */
        public Builder addNode(String id, Collection<String> dependencies) {
            if (id == null || id.isEmpty())
                throw new IllegalArgumentException("Node id must not be empty");
            if (forward.containsKey(id))
                throw new IllegalArgumentException("Duplicate node id: " + id);
            forward.put(id, Collections.unmodifiableList(new ArrayList<>(new LinkedHashSet<>(dependencies))));
            return this;
        }

        public DependencyGraph build() {
            return new DependencyGraph(new LinkedHashMap<>(forward));
        }
    }
}

package com.analysis.nodeflow.exec;

import com.analysis.nodeflow.api.NodeStore;
import com.analysis.nodeflow.store.NodeCommit;
import com.analysis.nodeflow.store.NodeRecord;
import com.analysis.nodeflow.store.ResultDescriptor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Dependencies discovered for one node, held back until the node has run.
 *
 * <p>
 * Discovery only records the provisional list. The store's edges change in
 * {@link #commit}, which is called once the node's own execution and
 * verification succeeded; a failed run leaves the previously committed edges
 * in place.
 */
public final class DependencyTransaction {
    private final String nodeId;
    private final List<String> previousDeps;
    private final List<String> provisionalDeps;
    private boolean committed;

    private DependencyTransaction(String nodeId, List<String> previousDeps, List<String> provisionalDeps) {
        this.nodeId = nodeId;
        this.previousDeps = List.copyOf(previousDeps);
        this.provisionalDeps = List.copyOf(provisionalDeps);
    }

    public static DependencyTransaction begin(NodeRecord node, List<String> discovered) {
        return new DependencyTransaction(node.id(), node.dependsOn(), discovered);
    }

    /**
     * Writes the provisional dependencies, {@code VALIDATED} state, descriptor
     * and timestamp, and clears the node's error.
     *
     * @return the commit that was written
     * @throws IllegalStateException if already committed
     */
    public NodeCommit commit(NodeStore store, ResultDescriptor result, Instant executedAt) {
        if (committed)
            throw new IllegalStateException("Dependencies of " + nodeId + " already committed");
        NodeCommit commit = NodeCommit.validated(provisionalDeps, result, executedAt);
        store.commitNode(nodeId, commit);
        committed = true;
        return commit;
    }

    public String nodeId() {
        return nodeId;
    }

    public List<String> previousDeps() {
        return previousDeps;
    }

    public List<String> provisionalDeps() {
        return provisionalDeps;
    }

    public boolean isCommitted() {
        return committed;
    }

    /** Provisional dependencies that were not committed before. */
    public List<String> addedEdges() {
        List<String> added = new ArrayList<>(provisionalDeps);
        added.removeAll(previousDeps);
        return added;
    }

    /** Committed dependencies the code no longer reads. */
    public List<String> removedEdges() {
        List<String> removed = new ArrayList<>(previousDeps);
        removed.removeAll(provisionalDeps);
        return removed;
    }
}

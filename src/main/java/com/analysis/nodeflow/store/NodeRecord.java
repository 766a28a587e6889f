package com.analysis.nodeflow.store;

import com.analysis.nodeflow.kind.NodeKind;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Persisted view of one node.
 *
 * @param id             also the name the node's code binds its value to
 * @param dependsOn      committed dependencies; only written after a
 *                       successful run of this node
 * @param result         null until the node has produced output
 * @param errorMessage   message of the last failed run, or null
 * @param lastExecutedAt null if the node never ran
 */
public record NodeRecord(String id, NodeKind kind, String name, List<String> dependsOn,
        MaterializationState state, ResultDescriptor result, String errorMessage, Instant lastExecutedAt) {
    public NodeRecord {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(kind, "kind");
        dependsOn = List.copyOf(dependsOn);
        Objects.requireNonNull(state, "state");
    }

    /** A node that has never run. */
    public static NodeRecord of(String id, NodeKind kind) {
        return new NodeRecord(id, kind, id, List.of(), MaterializationState.NOT_EXECUTED, null, null, null);
    }

    public boolean isValidated() {
        return state == MaterializationState.VALIDATED;
    }

    public boolean hasResult() {
        return result != null;
    }

    public NodeRecord apply(NodeCommit commit) {
        return new NodeRecord(id, kind, name, commit.dependsOn(), commit.state(), commit.result(),
                commit.errorMessage(), commit.executedAt());
    }
}

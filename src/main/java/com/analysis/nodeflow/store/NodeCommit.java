package com.analysis.nodeflow.store;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * A write to one node's persisted record.
 *
 * @param result       descriptor to store; null keeps none
 * @param errorMessage null clears the last error
 */
public record NodeCommit(List<String> dependsOn, MaterializationState state, ResultDescriptor result,
        String errorMessage, Instant executedAt) {
    public NodeCommit {
        dependsOn = List.copyOf(dependsOn);
        Objects.requireNonNull(state, "state");
        Objects.requireNonNull(executedAt, "executedAt");
    }

    /** Successful run: new edges, validated, error cleared. */
    public static NodeCommit validated(List<String> dependsOn, ResultDescriptor result, Instant executedAt) {
        return new NodeCommit(dependsOn, MaterializationState.VALIDATED, Objects.requireNonNull(result, "result"),
                null, executedAt);
    }

    /** Failed run: edges and descriptor stay as they were. */
    public static NodeCommit pending(NodeRecord current, String errorMessage, Instant executedAt) {
        return new NodeCommit(current.dependsOn(), MaterializationState.PENDING_VALIDATION, current.result(),
                errorMessage, executedAt);
    }
}

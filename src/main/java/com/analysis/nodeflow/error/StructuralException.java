package com.analysis.nodeflow.error;

import java.util.Set;

/** A node, or a dependency of one, references an id that is not a node. */
public class StructuralException extends NodeflowException {
    private final Set<String> missingIds;

    public StructuralException(String nodeId, Set<String> missingIds, String message) {
        super(nodeId, FailureKind.STRUCTURAL, message);
        this.missingIds = Set.copyOf(missingIds);
    }

    public static StructuralException unknownNode(String nodeId) {
        return new StructuralException(nodeId, Set.of(nodeId), "Node " + nodeId + " not found");
    }

    public static StructuralException missingDependencies(String nodeId, Set<String> missing) {
        return new StructuralException(nodeId, missing,
                "Node " + nodeId + " depends on unknown nodes " + missing);
    }

    public Set<String> missingIds() {
        return missingIds;
    }
}

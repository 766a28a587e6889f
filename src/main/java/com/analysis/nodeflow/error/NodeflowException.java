package com.analysis.nodeflow.error;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Base class of every failure raised while analysing or executing nodes.
 *
 * <p>
 * The failing node's id and the {@link FailureKind} are fixed when the
 * exception is created. As the failure travels up through the nodes that were
 * waiting on it, each of them is appended to the blocked chain, so the caller
 * can tell both <i>which</i> node failed and <i>whom</i> it blocked.
 */
public abstract class NodeflowException extends RuntimeException {
    private final String nodeId;
    private final FailureKind kind;
    private final List<String> blockedChain = new ArrayList<>();

    protected NodeflowException(String nodeId, FailureKind kind, String message) {
        super(message);
        this.nodeId = nodeId;
        this.kind = kind;
    }

    protected NodeflowException(String nodeId, FailureKind kind, String message, Throwable cause) {
        super(message, cause);
        this.nodeId = nodeId;
        this.kind = kind;
    }

    /** The deepest node at which the failure happened. */
    public String nodeId() {
        return nodeId;
    }

    public FailureKind kind() {
        return kind;
    }

    /** Records that {@code ancestorId} could not proceed because of this failure. */
    public void blocked(String ancestorId) {
        blockedChain.add(ancestorId);
    }

    /** Ancestors blocked by this failure, innermost first. */
    public List<String> blockedChain() {
        return Collections.unmodifiableList(blockedChain);
    }
}

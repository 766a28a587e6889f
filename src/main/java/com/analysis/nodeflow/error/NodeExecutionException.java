package com.analysis.nodeflow.error;

/** The session failed, or timed out, running a node's code. */
public class NodeExecutionException extends NodeflowException {
    private final String output;

    private NodeExecutionException(String nodeId, FailureKind kind, String message, String output) {
        super(nodeId, kind, message);
        this.output = output == null ? "" : output;
    }

    public static NodeExecutionException error(String nodeId, String message, String output) {
        return new NodeExecutionException(nodeId, FailureKind.EXECUTION, message, output);
    }

    public static NodeExecutionException timeout(String nodeId, String message, String output) {
        return new NodeExecutionException(nodeId, FailureKind.TIMEOUT, message, output);
    }

    /** Text the code printed before it failed. */
    public String output() {
        return output;
    }
}

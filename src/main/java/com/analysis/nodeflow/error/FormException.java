package com.analysis.nodeflow.error;

/** The node's code will not bind a value under the node's own id. Nothing was run. */
public class FormException extends NodeflowException {
    public FormException(String nodeId, String message) {
        super(nodeId, FailureKind.FORM, message);
    }
}

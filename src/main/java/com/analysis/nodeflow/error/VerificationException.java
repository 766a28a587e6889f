package com.analysis.nodeflow.error;

/** The code ran without error but did not leave the expected value or artifact behind. */
public class VerificationException extends NodeflowException {
    public VerificationException(String nodeId, String message) {
        super(nodeId, FailureKind.VERIFICATION, message);
    }
}

package com.analysis.nodeflow.error;

/** Classifies why a node (or a query touching it) could not be completed. */
public enum FailureKind {
    /** A dependency id does not name an existing node. */
    STRUCTURAL,
    /** A dependency cycle, found statically or while resolving. */
    CYCLE,
    /** The node's code does not bind a value under the node's own name. */
    FORM,
    /** The session reported an error while running the node's code. */
    EXECUTION,
    /** The session did not finish running the node's code in time. */
    TIMEOUT,
    /** The code ran but the expected value or artifact is missing. */
    VERIFICATION
}

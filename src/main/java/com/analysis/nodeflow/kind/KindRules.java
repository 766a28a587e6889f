package com.analysis.nodeflow.kind;

import com.analysis.nodeflow.error.VerificationException;
import com.analysis.nodeflow.session.SessionValue;
import com.analysis.nodeflow.store.ResultDescriptor;

/**
 * Per-kind capability used after a node's code has run: checks the value the
 * code bound and says where its output is persisted.
 */
public interface KindRules {
    NodeKind kind();

    /** Where the node's output will be written when it runs. */
    default ResultDescriptor describe(String nodeId) {
        ResultFormat format = kind().defaultFormat();
        return new ResultDescriptor(format, format.pathFor(nodeId));
    }

    /**
     * Checks the value found in the session after execution.
     *
     * @param value the session value bound under {@code nodeId}, or null if none
     * @return the descriptor to commit
     * @throws VerificationException if the value is missing or of the wrong shape
     */
    ResultDescriptor validate(String nodeId, SessionValue value) throws VerificationException;
}

package com.analysis.nodeflow.kind;

import com.analysis.nodeflow.error.VerificationException;
import com.analysis.nodeflow.session.SessionValue;
import com.analysis.nodeflow.store.ResultDescriptor;

import java.util.Set;

/**
 * Rules shared by every built-in kind: a value must be bound, callable kinds
 * need a callable, and when {@code acceptedTypes} is non-empty the value's
 * type name must be one of them.
 */
public final class StandardKindRules implements KindRules {
    private final NodeKind kind;
    private final Set<String> acceptedTypes;

    public StandardKindRules(NodeKind kind, Set<String> acceptedTypes) {
        this.kind = kind;
        this.acceptedTypes = Set.copyOf(acceptedTypes);
    }

    @Override
    public NodeKind kind() {
        return kind;
    }

    public Set<String> acceptedTypes() {
        return acceptedTypes;
    }

    @Override
    public ResultDescriptor validate(String nodeId, SessionValue value) {
        if (value == null)
            throw new VerificationException(nodeId,
                    "Execution of '" + nodeId + "' did not bind a value named '" + nodeId + "'");
        if (kind.producesCallable()) {
            if (!value.callable())
                throw new VerificationException(nodeId, "Node '" + nodeId + "' must produce a function or class, got "
                        + value.typeName());
        } else if (!acceptedTypes.isEmpty() && !acceptedTypes.contains(value.typeName())) {
            throw new VerificationException(nodeId, kind.tag() + " node '" + nodeId + "' must produce one of "
                    + acceptedTypes + ", got " + value.typeName());
        }
        return describe(nodeId);
    }
}

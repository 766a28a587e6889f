package com.analysis.nodeflow.api;

import com.analysis.nodeflow.store.NodeCommit;
import com.analysis.nodeflow.store.NodeRecord;
import com.analysis.nodeflow.store.ResultDescriptor;

import java.util.List;
import java.util.Optional;

/**
 * Durable node metadata and artifacts for one project.
 *
 * <p>
 * The store is the second cache tier: a node in state
 * {@code VALIDATED} whose artifact exists can be loaded instead of re-run.
 */
public interface NodeStore {

    /** All nodes, in the order they were defined. */
    List<NodeRecord> listNodes();

    default Optional<NodeRecord> findNode(String id) {
        for (NodeRecord node : listNodes())
            if (node.id().equals(id))
                return Optional.of(node);
        return Optional.empty();
    }

    Optional<String> getNodeCode(String id);

    /**
     * Writes dependencies, state, descriptor, error and timestamp for one node.
     *
     * @throws IllegalArgumentException if the node does not exist
     */
    void commitNode(String id, NodeCommit commit);

    boolean artifactExists(ResultDescriptor result);
}

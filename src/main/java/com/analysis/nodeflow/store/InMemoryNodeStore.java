package com.analysis.nodeflow.store;

import com.analysis.nodeflow.api.NodeStore;
import com.analysis.nodeflow.kind.NodeKind;

import java.util.*;

/**
 * Node store held entirely in memory. Artifacts are tracked by path only;
 * nothing is written to disk.
 */
public final class InMemoryNodeStore implements NodeStore {
    private final Map<String, NodeRecord> records = new LinkedHashMap<>();
    private final Map<String, String> code = new HashMap<>();
    private final Set<String> artifacts = new HashSet<>();

    /** Adds a node that has never run, or replaces the code of an existing one. */
    public synchronized InMemoryNodeStore define(String id, NodeKind kind, String nodeCode) {
        records.putIfAbsent(id, NodeRecord.of(id, kind));
        code.put(id, nodeCode);
        return this;
    }

    /** Adds or replaces a node record as-is. */
    public synchronized InMemoryNodeStore put(NodeRecord record, String nodeCode) {
        records.put(record.id(), record);
        code.put(record.id(), nodeCode);
        return this;
    }

    public synchronized void addArtifact(String path) {
        artifacts.add(path);
    }

    public synchronized void removeArtifact(String path) {
        artifacts.remove(path);
    }

    public synchronized NodeRecord node(String id) {
        NodeRecord record = records.get(id);
        if (record == null)
            throw new IllegalArgumentException("Unknown node: " + id);
        return record;
    }

    @Override
    public synchronized List<NodeRecord> listNodes() {
        return new ArrayList<>(records.values());
    }

    @Override
    public synchronized Optional<String> getNodeCode(String id) {
        return Optional.ofNullable(code.get(id));
    }

    @Override
    public synchronized void commitNode(String id, NodeCommit commit) {
        records.put(id, node(id).apply(commit));
    }

    @Override
    public synchronized boolean artifactExists(ResultDescriptor result) {
        return artifacts.contains(result.path());
    }
}

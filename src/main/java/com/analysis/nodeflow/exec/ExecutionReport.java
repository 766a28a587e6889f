package com.analysis.nodeflow.exec;

import com.analysis.nodeflow.error.FailureKind;
import com.analysis.nodeflow.error.NodeflowException;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of one execution request.
 *
 * @param failedNode   deepest node that failed, or null on success
 * @param blockedChain nodes that could not run because of the failure,
 *                     innermost first, ending with the target
 * @param newEdges     for each committed node, dependencies it did not have
 *                     before
 */
public record ExecutionReport(
        Status status,
        String target,
        String errorMessage,
        String failedNode,
        FailureKind failureKind,
        List<String> blockedChain,
        List<NodeRun> runs,
        Map<String, List<String>> newEdges) {

    public enum Status {
        SUCCESS, FAILED
    }

    public ExecutionReport {
        blockedChain = List.copyOf(blockedChain);
        runs = List.copyOf(runs);
        newEdges = Map.copyOf(newEdges);
    }

    static ExecutionReport success(String target, List<NodeRun> runs, List<DependencyTransaction> transactions) {
        return new ExecutionReport(Status.SUCCESS, target, null, null, null, List.of(), runs,
                newEdges(transactions));
    }

    static ExecutionReport failure(String target, List<NodeRun> runs, List<DependencyTransaction> transactions,
            NodeflowException error) {
        return new ExecutionReport(Status.FAILED, target, error.getMessage(), error.nodeId(), error.kind(),
                error.blockedChain(), runs, newEdges(transactions));
    }

    private static Map<String, List<String>> newEdges(List<DependencyTransaction> transactions) {
        Map<String, List<String>> edges = new LinkedHashMap<>();
        for (DependencyTransaction tx : transactions)
            if (tx.isCommitted() && !tx.addedEdges().isEmpty())
                edges.put(tx.nodeId(), tx.addedEdges());
        return edges;
    }

    public boolean isSuccess() {
        return status == Status.SUCCESS;
    }

    public List<String> executedNodes() {
        return idsWith(NodeRun.Action.EXECUTED);
    }

    public List<String> loadedNodes() {
        return idsWith(NodeRun.Action.LOADED);
    }

    public List<String> residentNodes() {
        return idsWith(NodeRun.Action.RESIDENT);
    }

    public long totalDurationMillis() {
        long total = 0;
        for (NodeRun run : runs)
            total += run.durationMillis();
        return total;
    }

    /** One-line summary for logs. */
    public String summary() {
        return String.format("%s %s: executed=%d loaded=%d resident=%d in %d ms", target, status,
                executedNodes().size(), loadedNodes().size(), residentNodes().size(), totalDurationMillis());
    }

    private List<String> idsWith(NodeRun.Action action) {
        List<String> ids = new ArrayList<>();
        for (NodeRun run : runs)
            if (run.action() == action)
                ids.add(run.nodeId());
        return ids;
    }
}

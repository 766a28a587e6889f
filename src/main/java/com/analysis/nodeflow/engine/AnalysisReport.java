package com.analysis.nodeflow.engine;

import java.util.List;

/** Everything the graph says about one node. */
public record AnalysisReport(
        String nodeId,
        List<String> directDependencies,
        List<String> transitiveDependencies,
        List<String> executionOrder,
        List<String> dependents,
        boolean hasCycle) {
    public AnalysisReport {
        directDependencies = List.copyOf(directDependencies);
        transitiveDependencies = List.copyOf(transitiveDependencies);
        executionOrder = List.copyOf(executionOrder);
        dependents = List.copyOf(dependents);
    }
}

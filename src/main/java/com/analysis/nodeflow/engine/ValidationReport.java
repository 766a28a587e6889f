package com.analysis.nodeflow.engine;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Result of {@link DependencyAnalyzer#validate(DependencyGraph)}.
 *
 * @param missingDependencies unknown dependency id to the nodes referencing it
 * @param isolatedNodes       nodes with neither dependencies nor dependents
 */
public record ValidationReport(
        boolean valid,
        boolean hasCycle,
        Map<String, List<String>> missingDependencies,
        List<String> isolatedNodes,
        List<String> errors,
        List<String> warnings) {
    public ValidationReport {
        missingDependencies = Collections.unmodifiableMap(new LinkedHashMap<>(missingDependencies));
        isolatedNodes = List.copyOf(isolatedNodes);
        errors = List.copyOf(errors);
        warnings = List.copyOf(warnings);
    }
}

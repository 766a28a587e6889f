package com.analysis.nodeflow.engine;

import java.util.List;

/**
 * What a request for {@code target} would do.
 *
 * @param order   the target and its closure, dependencies first
 * @param toRun   nodes of {@code order} without usable output, in order
 * @param skipped nodes of {@code order} that already have output, in order
 */
public record ExecutionPlan(String target, List<String> order, List<String> toRun, List<String> skipped) {
    public ExecutionPlan {
        order = List.copyOf(order);
        toRun = List.copyOf(toRun);
        skipped = List.copyOf(skipped);
    }

    public boolean isUpToDate() {
        return toRun.isEmpty();
    }
}

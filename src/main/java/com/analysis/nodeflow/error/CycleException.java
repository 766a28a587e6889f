package com.analysis.nodeflow.error;

import java.util.List;

/**
 * A dependency cycle.
 *
 * <p>
 * The path is written in "depends on" direction and closes on itself:
 * {@code [a, b, a]} reads "a depends on b, which depends on a".
 * <i>Static</i> cycles are found in a graph before anything runs;
 * <i>dynamic</i> ones are found on the execution stack while resolving, after
 * each node's code has been analysed in turn.
 */
public class CycleException extends NodeflowException {
    private final List<String> path;
    private final boolean dynamic;

    private CycleException(String nodeId, List<String> path, boolean dynamic) {
        super(nodeId, FailureKind.CYCLE,
                (dynamic ? "Circular dependency while executing: " : "Circular dependency detected: ")
                        + String.join(" -> ", path));
        this.path = List.copyOf(path);
        this.dynamic = dynamic;
    }

    public static CycleException staticCycle(List<String> path) {
        return new CycleException(path.get(0), path, false);
    }

    /**
     * @param detectedAt the node whose dependency closed the cycle
     */
    public static CycleException dynamicCycle(String detectedAt, List<String> path) {
        return new CycleException(detectedAt, path, true);
    }

    public List<String> path() {
        return path;
    }

    public boolean isDynamic() {
        return dynamic;
    }
}

package com.analysis.nodeflow.util;

import com.analysis.nodeflow.api.ExecutionListener;
import com.analysis.nodeflow.exec.ExecutionReport;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Aggregates execution and load timings per node to identify slow nodes. */
public class NodeProfileListener implements ExecutionListener {

    public static class NodeStats {
        public final String nodeId;
        public long executions;
        public long loads;
        public long failures;
        public long totalDurationNanos;
        public long minDurationNanos = Long.MAX_VALUE;
        public long maxDurationNanos = Long.MIN_VALUE;
        public long lastDurationNanos;

        public NodeStats(String nodeId) {
            this.nodeId = nodeId;
        }

        void update(long duration) {
            executions++;
            totalDurationNanos += duration;
            lastDurationNanos = duration;
            if (duration < minDurationNanos)
                minDurationNanos = duration;
            if (duration > maxDurationNanos)
                maxDurationNanos = duration;
        }

        public double avgMillis() {
            return executions == 0 ? 0 : totalDurationNanos / (double) executions / 1_000_000.0;
        }
    }

    private final Map<String, NodeStats> stats = new LinkedHashMap<>();
    private long requests;

    public synchronized NodeStats stats(String nodeId) {
        return stats.get(nodeId);
    }

    public synchronized long requests() {
        return requests;
    }

    @Override
    public synchronized void onRequestStart(String target) {
        requests++;
    }

    @Override
    public synchronized void onNodeLoaded(String nodeId, long durationNanos) {
        stats.computeIfAbsent(nodeId, NodeStats::new).loads++;
    }

    @Override
    public synchronized void onNodeExecuted(String nodeId, long durationNanos) {
        stats.computeIfAbsent(nodeId, NodeStats::new).update(durationNanos);
    }

    @Override
    public synchronized void onNodeFailed(String nodeId, Throwable error) {
        stats.computeIfAbsent(nodeId, NodeStats::new).failures++;
    }

    @Override
    public void onRequestEnd(ExecutionReport report) {
        // No-op
    }

    /** Resets all collected statistics. */
    public synchronized void reset() {
        stats.clear();
        requests = 0;
    }

    /**
     * Returns a formatted table of node statistics, slowest total first.
     */
    public synchronized String dump() {
        StringBuilder sb = new StringBuilder();
        sb.append(String.format("%-30s | %6s | %6s | %6s | %10s | %10s | %10s%n", "Node", "Runs", "Loads", "Fails",
                "Avg (ms)", "Min (ms)", "Max (ms)"));
        sb.append("------------------------------------------------------------------------------------------\n");

        List<NodeStats> rows = new ArrayList<>(stats.values());
        rows.sort((s1, s2) -> Long.compare(s2.totalDurationNanos, s1.totalDurationNanos));

        for (NodeStats s : rows) {
            boolean ran = s.executions > 0;
            sb.append(String.format("%-30s | %6d | %6d | %6d | %10.2f | %10.2f | %10.2f%n",
                    truncate(s.nodeId, 30),
                    s.executions,
                    s.loads,
                    s.failures,
                    s.avgMillis(),
                    ran ? s.minDurationNanos / 1_000_000.0 : 0.0,
                    ran ? s.maxDurationNanos / 1_000_000.0 : 0.0));
        }
        return sb.toString();
    }

    private String truncate(String s, int len) {
        if (s.length() <= len)
            return s;
        return s.substring(0, len - 3) + "...";
    }
}

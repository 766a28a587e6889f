package com.analysis.nodeflow.util;

import com.analysis.nodeflow.api.ExecutionListener;
import com.analysis.nodeflow.exec.ExecutionReport;

import java.util.Arrays;

/**
 * Aggregates multiple {@link ExecutionListener} instances. Adding a listener
 * replaces the backing array, so iteration never sees a partial update.
 */
public class CompositeExecutionListener implements ExecutionListener {
    private volatile ExecutionListener[] listeners = new ExecutionListener[0];

    public synchronized void addForComposite(ExecutionListener listener) {
        ExecutionListener[] old = listeners;
        ExecutionListener[] next = Arrays.copyOf(old, old.length + 1);
        next[old.length] = listener;
        listeners = next;
    }

    public int size() {
        return listeners.length;
    }

    @Override
    public void onRequestStart(String target) {
        for (ExecutionListener l : listeners)
            l.onRequestStart(target);
    }

    @Override
    public void onNodeLoaded(String nodeId, long durationNanos) {
        for (ExecutionListener l : listeners)
            l.onNodeLoaded(nodeId, durationNanos);
    }

    @Override
    public void onNodeExecuted(String nodeId, long durationNanos) {
        for (ExecutionListener l : listeners)
            l.onNodeExecuted(nodeId, durationNanos);
    }

    @Override
    public void onNodeFailed(String nodeId, Throwable error) {
        for (ExecutionListener l : listeners)
            l.onNodeFailed(nodeId, error);
    }

    @Override
    public void onRequestEnd(ExecutionReport report) {
        for (ExecutionListener l : listeners)
            l.onRequestEnd(report);
    }
}

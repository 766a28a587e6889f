package com.analysis.nodeflow.api;

import com.analysis.nodeflow.exec.ExecutionReport;

/**
 * Observability interface for monitoring execution requests.
 *
 * Callbacks run on the request thread, between session calls. They should
 * return quickly and must not call back into the engine.
 */
public interface ExecutionListener {

    /**
     * Called before anything is analysed for a request.
     *
     * @param target The node whose output was requested.
     */
    void onRequestStart(String target);

    /**
     * Called after a node's persisted output was loaded into the session.
     *
     * @param nodeId        The loaded node.
     * @param durationNanos Time spent in the load call.
     */
    void onNodeLoaded(String nodeId, long durationNanos);

    /**
     * Called after a node ran, was verified and had its dependencies committed.
     *
     * @param nodeId        The executed node.
     * @param durationNanos Time spent in the execute call.
     */
    void onNodeExecuted(String nodeId, long durationNanos);

    /**
     * Called once per request, for the deepest node that failed.
     *
     * @param nodeId The failing node.
     * @param error  The failure, with its kind.
     */
    void onNodeFailed(String nodeId, Throwable error);

    /** Called when the request is complete, whether it succeeded or not. */
    void onRequestEnd(ExecutionReport report);
}

package com.analysis.nodeflow.exec;

/**
 * What happened to one node during a request.
 *
 * @param durationMillis time spent in the session call; zero for resident nodes
 * @param output         text printed by the node's code, if it ran
 */
public record NodeRun(String nodeId, Action action, long durationMillis, String output) {

    public enum Action {
        /** Code ran, was verified and committed. */
        EXECUTED,
        /** Output was loaded from its artifact. */
        LOADED,
        /** Value was already bound in the session. */
        RESIDENT,
        /** The node failed; see the report's failure fields. */
        FAILED
    }
}

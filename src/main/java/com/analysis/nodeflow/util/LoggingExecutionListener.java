package com.analysis.nodeflow.util;

import com.analysis.nodeflow.api.ExecutionListener;
import com.analysis.nodeflow.exec.ExecutionReport;

import java.util.concurrent.TimeUnit;

import lombok.extern.log4j.Log4j2;

/** Writes one log line per node event at DEBUG, and failures at WARN. */
@Log4j2
public class LoggingExecutionListener implements ExecutionListener {

    @Override
    public void onRequestStart(String target) {
        log.debug("Request for {} started", target);
    }

    @Override
    public void onNodeLoaded(String nodeId, long durationNanos) {
        log.debug("Loaded {} in {} ms", nodeId, TimeUnit.NANOSECONDS.toMillis(durationNanos));
    }

    @Override
    public void onNodeExecuted(String nodeId, long durationNanos) {
        log.debug("Executed {} in {} ms", nodeId, TimeUnit.NANOSECONDS.toMillis(durationNanos));
    }

    @Override
    public void onNodeFailed(String nodeId, Throwable error) {
        log.warn("Node {} failed: {}", nodeId, error.getMessage());
    }

    @Override
    public void onRequestEnd(ExecutionReport report) {
        if (!report.isSuccess() && !report.blockedChain().isEmpty())
            log.warn("Blocked by {}: {}", report.failedNode(), report.blockedChain());
        log.debug("Request finished: {}", report.summary());
    }
}

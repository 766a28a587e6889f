package com.analysis.nodeflow.session;

import java.time.Instant;

/** Snapshot of one pooled session. */
public record SessionInfo(String projectId, Instant createdAt, Instant lastActivity, int inFlight) {
}

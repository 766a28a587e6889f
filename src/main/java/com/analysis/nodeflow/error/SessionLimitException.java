package com.analysis.nodeflow.error;

/** No session could be created because the pool is full and nothing could be reclaimed. */
public class SessionLimitException extends RuntimeException {
    public SessionLimitException(int maxSessions) {
        super("Maximum session limit (" + maxSessions + ") reached");
    }
}

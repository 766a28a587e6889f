package com.analysis.nodeflow.session;

public enum SessionStatus {
    SUCCESS,
    ERROR,
    TIMEOUT
}

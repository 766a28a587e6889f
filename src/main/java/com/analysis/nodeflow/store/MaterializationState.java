package com.analysis.nodeflow.store;

/**
 * Whether a node's output can be trusted.
 *
 * <pre>
 * NOT_EXECUTED ──run ok──▶ VALIDATED
 *      │                      │
 *   run failed          later run failed
 *      ▼                      ▼
 *        PENDING_VALIDATION ──run ok──▶ VALIDATED
 * </pre>
 */
public enum MaterializationState {
    NOT_EXECUTED("not_executed"),
    PENDING_VALIDATION("pending_validation"),
    VALIDATED("validated");

    private final String tag;

    MaterializationState(String tag) {
        this.tag = tag;
    }

    public String tag() {
        return tag;
    }

    /** Resolves a persisted tag; a missing tag means the node never ran. */
    public static MaterializationState fromTag(String tag) {
        if (tag == null || tag.isEmpty())
            return NOT_EXECUTED;
        for (MaterializationState s : values())
            if (s.tag.equals(tag))
                return s;
        throw new IllegalArgumentException("Unknown execution status: " + tag);
    }
}

package com.analysis.nodeflow.io;

/** Which edges the facade uses for analysis and planning. */
public enum EdgeMode {
    /** Re-infer dependencies from each node's current code. */
    INFERRED,
    /** Use the dependencies committed by the last successful run of each node. */
    COMMITTED
}

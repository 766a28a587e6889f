package com.analysis.nodeflow.kind;

/** On-disk formats a node's output can be persisted in. */
public enum ResultFormat {
    PARQUET("parquet", "parquets"),
    JSON("json", "parquets"),
    PICKLE("pkl", "functions"),
    IMAGE("png", "visualizations");

    private final String tag;
    private final String directory;

    ResultFormat(String tag, String directory) {
        this.tag = tag;
        this.directory = directory;
    }

    /** Name used in persisted project files, also the file extension. */
    public String tag() {
        return tag;
    }

    public String directory() {
        return directory;
    }

    /** Project-relative artifact path for a node, e.g. {@code parquets/orders.parquet}. */
    public String pathFor(String nodeId) {
        return directory + "/" + nodeId + "." + tag;
    }

    /** Accepts the tag or the constant name, e.g. {@code pkl} or {@code pickle}. */
    public static ResultFormat fromTag(String tag) {
        for (ResultFormat f : values())
            if (f.tag.equalsIgnoreCase(tag) || f.name().equalsIgnoreCase(tag))
                return f;
        throw new IllegalArgumentException("Unknown result format: " + tag);
    }
}

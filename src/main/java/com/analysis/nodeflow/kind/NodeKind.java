package com.analysis.nodeflow.kind;

import java.util.Arrays;
import java.util.stream.Collectors;

/**
 * The closed set of node kinds. A kind fixes how a node's output is persisted
 * and whether that output is a plain value or a callable.
 */
public enum NodeKind {
    DATA_SOURCE("data_source", ResultFormat.PARQUET, false),
    COMPUTE("compute", ResultFormat.PARQUET, false),
    DICT("dict", ResultFormat.JSON, false),
    CHART("chart", ResultFormat.JSON, false),
    IMAGE("image", ResultFormat.IMAGE, false),
    TOOL("tool", ResultFormat.PICKLE, true);

    private final String tag;
    private final ResultFormat defaultFormat;
    private final boolean callable;

    NodeKind(String tag, ResultFormat defaultFormat, boolean callable) {
        this.tag = tag;
        this.defaultFormat = defaultFormat;
        this.callable = callable;
    }

    public String tag() {
        return tag;
    }

    public ResultFormat defaultFormat() {
        return defaultFormat;
    }

    /** Whether the node's output is a function or class rather than a value. */
    public boolean producesCallable() {
        return callable;
    }

    /**
     * Resolves a persisted kind tag. {@code data} is accepted as an older
     * spelling of {@code data_source}.
     */
    public static NodeKind fromTag(String tag) {
        if ("data".equals(tag))
            return DATA_SOURCE;
        for (NodeKind k : values())
            if (k.tag.equals(tag))
                return k;
        throw new IllegalArgumentException("Unknown node kind '" + tag + "'. Available: "
                + Arrays.stream(values()).map(NodeKind::tag).collect(Collectors.joining(", ")));
    }
}

package com.analysis.nodeflow.store;

import com.analysis.nodeflow.kind.ResultFormat;

import java.util.Objects;

/**
 * Where a node's output lives on disk.
 *
 * @param path project-relative path of the artifact
 */
public record ResultDescriptor(ResultFormat format, String path) {
    public ResultDescriptor {
        Objects.requireNonNull(format, "format");
        Objects.requireNonNull(path, "path");
    }
}

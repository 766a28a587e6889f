package com.analysis.nodeflow.kind;

import com.analysis.nodeflow.store.ResultDescriptor;

import java.util.Optional;

/**
 * Generates the session-side code that writes a node's output to its
 * artifact, and the code that binds it again from that artifact.
 *
 * <p>
 * Helper names are prefixed with {@code _nf_} so they cannot shadow node ids.
 * Paths are relative to the session's working directory, which is the project
 * directory.
 */
public final class PersistenceCode {

    private PersistenceCode() {
        // Utility class
    }

    /**
     * Code that writes {@code nodeId} to its artifact. Images may be a figure
     * ({@code savefig}), a PIL image ({@code save}) or the path of a file
     * already on disk, which is copied.
     */
    public static String saveSnippet(String nodeId, ResultDescriptor result) {
        String path = result.path();
        String dir = result.format().directory();
        return switch (result.format()) {
            case PARQUET -> lines(
                    "import os as _nf_os",
                    "_nf_os.makedirs('" + dir + "', exist_ok=True)",
                    nodeId + ".to_parquet('" + path + "')");
            case JSON -> lines(
                    "import json as _nf_json, os as _nf_os",
                    "_nf_os.makedirs('" + dir + "', exist_ok=True)",
                    "with open('" + path + "', 'w', encoding='utf-8') as _nf_f:",
                    "    _nf_json.dump(" + jsonable(nodeId) + ", _nf_f, ensure_ascii=False, default=str)");
            case PICKLE -> lines(
                    "import pickle as _nf_pickle, os as _nf_os",
                    "_nf_os.makedirs('" + dir + "', exist_ok=True)",
                    "with open('" + path + "', 'wb') as _nf_f:",
                    "    _nf_pickle.dump(" + nodeId + ", _nf_f)");
            case IMAGE -> lines(
                    "import os as _nf_os, shutil as _nf_shutil",
                    "_nf_os.makedirs('" + dir + "', exist_ok=True)",
                    "if hasattr(" + nodeId + ", 'savefig'):",
                    "    " + nodeId + ".savefig('" + path + "')",
                    "elif hasattr(" + nodeId + ", 'save'):",
                    "    " + nodeId + ".save('" + path + "')",
                    "elif _nf_os.path.abspath(" + nodeId + ") != _nf_os.path.abspath('" + path + "'):",
                    "    _nf_shutil.copyfile(" + nodeId + ", '" + path + "')");
        };
    }

    /**
     * Code that binds {@code nodeId} from its artifact, or empty when the format
     * cannot be read back into a value (rendered images).
     */
    public static Optional<String> loadSnippet(String nodeId, ResultDescriptor result) {
        String path = result.path();
        return switch (result.format()) {
            case PARQUET -> Optional.of(lines(
                    "import pandas as _nf_pd",
                    nodeId + " = _nf_pd.read_parquet('" + path + "')"));
            case JSON -> Optional.of(lines(
                    "import json as _nf_json",
                    "with open('" + path + "', 'r', encoding='utf-8') as _nf_f:",
                    "    " + nodeId + " = _nf_json.load(_nf_f)"));
            case PICKLE -> Optional.of(lines(
                    "import pickle as _nf_pickle",
                    "with open('" + path + "', 'rb') as _nf_f:",
                    "    " + nodeId + " = _nf_pickle.load(_nf_f)"));
            case IMAGE -> Optional.empty();
        };
    }

    // Plotly figures serialize through to_plotly_json; plain dicts pass through.
    private static String jsonable(String nodeId) {
        return nodeId + ".to_plotly_json() if hasattr(" + nodeId + ", 'to_plotly_json') else " + nodeId;
    }

    private static String lines(String... lines) {
        return String.join("\n", lines);
    }
}

package com.analysis.nodeflow.infer;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads a dependency declaration written into the code as a comment:
 *
 * <pre>
 * # @depends_on: [orders, customers]
 * # @depends_on: orders, customers
 * </pre>
 */
public final class ExplicitDependencies {
    private static final Pattern ANNOTATION = Pattern.compile("@depends_on:[ \\t]*\\[(.*?)\\]|@depends_on:[ \\t]*(.*?)(?:\\n|$)",
            Pattern.MULTILINE);

    private ExplicitDependencies() {
        // Utility class
    }

    /** Declared ids in written order, or an empty list if the code has no declaration. */
    public static List<String> extract(String code) {
        Matcher m = ANNOTATION.matcher(code);
        if (!m.find())
            return List.of();
        String body = m.group(1) != null ? m.group(1) : m.group(2);
        List<String> ids = new ArrayList<>();
        for (String part : body.split(",")) {
            String id = part.strip().replace("'", "").replace("\"", "").strip();
            if (!id.isEmpty() && !ids.contains(id))
                ids.add(id);
        }
        return ids;
    }
}

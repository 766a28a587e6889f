package com.analysis.nodeflow.infer;

import java.util.regex.Pattern;

import lombok.extern.log4j.Log4j2;

/**
 * Checks, before anything runs, that a node's code will bind a value under
 * the node's own id.
 */
@Log4j2
public final class BindingChecker {
    private final CodeScanner scanner;

    public BindingChecker(CodeScanner scanner) {
        this.scanner = scanner;
    }

    /**
     * @param callable whether a {@code def} or {@code class} of that name also
     *                 counts
     */
    public boolean binds(String nodeId, String code, boolean callable) {
        try {
            ScanResult scan = scanner.scan(code);
            return scan.assigned().contains(nodeId) || (callable && scan.defined().contains(nodeId));
        } catch (CodeSyntaxException e) {
            log.debug("Form check for {} falls back to line patterns: {}", nodeId, e.getMessage());
            String id = Pattern.quote(nodeId);
            if (Pattern.compile("^\\s*" + id + "\\s*(:[^=]*)?=(?!=)", Pattern.MULTILINE).matcher(code).find())
                return true;
            return callable && Pattern.compile("^\\s*(def|class)\\s+" + id + "\\b", Pattern.MULTILINE)
                    .matcher(code).find();
        }
    }
}

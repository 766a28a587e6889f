package com.analysis.nodeflow.infer;

import java.util.Set;

/**
 * Names found by {@link CodeScanner}, split by the context they appear in.
 *
 * @param reads    names loaded somewhere in the code
 * @param assigned targets of plain, augmented and annotated assignments
 * @param defined  names of {@code def} and {@code class} statements
 * @param bound    other bindings: imports, loop and {@code as} targets,
 *                 walrus targets
 */
public record ScanResult(Set<String> reads, Set<String> assigned, Set<String> defined, Set<String> bound) {
    public ScanResult {
        reads = Set.copyOf(reads);
        assigned = Set.copyOf(assigned);
        defined = Set.copyOf(defined);
        bound = Set.copyOf(bound);
    }
}

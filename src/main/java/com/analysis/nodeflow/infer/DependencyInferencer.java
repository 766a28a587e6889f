package com.analysis.nodeflow.infer;

import java.util.*;

import lombok.extern.log4j.Log4j2;

/**
 * Works out which other nodes a piece of code reads.
 *
 * <p>
 * A node reference is any name read by the code that is the id of another
 * node and is not a reserved name. Explicit declarations replace inference
 * entirely.
 */
@Log4j2
public final class DependencyInferencer {

    /** How a dependency list was obtained. */
    public enum Method {
        EXPLICIT, STRUCTURED, LEXICAL
    }

    /** Dependencies of one node together with the method that found them. */
    public record Inference(List<String> dependencies, Method method) {
        public Inference {
            dependencies = List.copyOf(dependencies);
        }
    }

    private final CodeScanner scanner;
    private final ReservedNames reserved;

    public DependencyInferencer(CodeScanner scanner, ReservedNames reserved) {
        this.scanner = scanner;
        this.reserved = reserved;
    }

    /**
     * @param explicitDeps declared dependencies; returned unchanged when non-empty
     * @return dependency ids, sorted unless explicit
     */
    public List<String> infer(String nodeId, String code, Collection<String> allNodeIds, List<String> explicitDeps) {
        return inferWithMethod(nodeId, code, allNodeIds, explicitDeps).dependencies();
    }

    public Inference inferWithMethod(String nodeId, String code, Collection<String> allNodeIds,
            List<String> explicitDeps) {
        if (explicitDeps != null && !explicitDeps.isEmpty())
            return new Inference(explicitDeps, Method.EXPLICIT);

        Collection<String> candidates;
        Method method;
        try {
            candidates = scanner.scan(code).reads();
            method = Method.STRUCTURED;
        } catch (CodeSyntaxException e) {
            log.warn("Could not parse code of {} ({}); using lexical scan", nodeId, e.getMessage());
            candidates = CommentStripper.identifiers(code);
            method = Method.LEXICAL;
        }

        Set<String> known = new HashSet<>(allNodeIds);
        TreeSet<String> deps = new TreeSet<>();
        for (String name : candidates)
            if (known.contains(name) && !name.equals(nodeId) && !reserved.contains(name))
                deps.add(name);
        log.debug("Inferred {} dependencies for {}: {}", method, nodeId, deps);
        return new Inference(new ArrayList<>(deps), method);
    }
}

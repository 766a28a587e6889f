package com.analysis.nodeflow.engine;

import java.util.List;

/**
 * Source-to-leaf paths through the graph.
 *
 * @param chains      every path from a node without dependencies to a node
 *                    without dependents
 * @param sourceNodes nodes without dependencies
 * @param leafNodes   nodes without dependents
 */
public record ChainReport(List<List<String>> chains, List<String> sourceNodes, List<String> leafNodes) {
    public ChainReport {
        chains = List.copyOf(chains);
        sourceNodes = List.copyOf(sourceNodes);
        leafNodes = List.copyOf(leafNodes);
    }
}

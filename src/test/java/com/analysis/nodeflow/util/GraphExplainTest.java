package com.analysis.nodeflow.util;

import com.analysis.nodeflow.engine.DependencyAnalyzer;
import com.analysis.nodeflow.engine.DependencyGraph;
import com.analysis.nodeflow.kind.NodeKind;
import com.analysis.nodeflow.kind.ResultFormat;
import com.analysis.nodeflow.store.MaterializationState;
import com.analysis.nodeflow.store.NodeRecord;
import com.analysis.nodeflow.store.ResultDescriptor;
import org.junit.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.Assert.*;

public class GraphExplainTest {

    private static DependencyGraph graph(Map<String, List<String>> edges) {
        return DependencyAnalyzer.buildGraph(edges);
    }

    @Test
    public void testDisplayOrderIsTopological() {
        Map<String, List<String>> edges = new LinkedHashMap<>();
        edges.put("chart", List.of("sales"));
        edges.put("sales", List.of());

        GraphExplain explain = new GraphExplain(graph(edges));
        assertEquals(List.of("sales", "chart"), explain.displayOrder());

        String dump = explain.dumpTopology();
        assertTrue(dump.startsWith("Graph (2 nodes):\n"));
        assertTrue(dump.contains("[0] sales (SRC) → chart"));
        assertTrue(dump.contains("[1] chart\n"));
    }

    @Test
    public void testCyclicGraphFallsBackToInsertionOrder() {
        Map<String, List<String>> edges = new LinkedHashMap<>();
        edges.put("b", List.of("a"));
        edges.put("a", List.of("b"));

        GraphExplain explain = new GraphExplain(graph(edges));
        assertEquals(List.of("b", "a"), explain.displayOrder());
        assertTrue(explain.dumpTopology().contains("CYCLIC"));
    }

    @Test
    public void testMermaidShowsStatesAndMissingNodes() {
        Map<String, List<String>> edges = new LinkedHashMap<>();
        edges.put("raw-data", List.of());
        edges.put("report", List.of("raw-data", "ghost"));
        Map<String, NodeRecord> records = new LinkedHashMap<>();
        records.put("raw-data", new NodeRecord("raw-data", NodeKind.DATA_SOURCE, "raw", List.of(),
                MaterializationState.VALIDATED,
                new ResultDescriptor(ResultFormat.PARQUET, "parquets/raw-data.parquet"), null, null));
        records.put("report", NodeRecord.of("report", NodeKind.CHART));

        String mermaid = new GraphExplain(graph(edges), records).toMermaid();

        assertTrue(mermaid.startsWith("graph TD;\n"));
        assertTrue(mermaid.contains("  raw_data[\"raw-data<br/><small>data_source</small>\"]:::validated;\n"));
        assertTrue(mermaid.contains("  report[\"report<br/><small>chart</small>\"]:::not_executed;\n"));
        assertTrue(mermaid.contains("  ghost[\"ghost (missing)\"]:::missing;\n"));
        assertTrue(mermaid.contains("  raw_data --> report;\n"));
        assertTrue(mermaid.contains("  ghost --> report;\n"));
        assertTrue(mermaid.contains("classDef pending_validation"));
    }

    @Test
    public void testExplainNode() {
        Map<String, List<String>> edges = new LinkedHashMap<>();
        edges.put("a", List.of());
        edges.put("b", List.of("a"));
        NodeRecord failed = new NodeRecord("b", NodeKind.COMPUTE, "b", List.of("a"),
                MaterializationState.PENDING_VALIDATION, null, "boom", null);

        String text = new GraphExplain(graph(edges), Map.of("b", failed)).explainNode("b");

        assertTrue(text.startsWith("Node: b\n"));
        assertTrue(text.contains("Topo index: 1"));
        assertTrue(text.contains("State: pending_validation"));
        assertTrue(text.contains("Error: boom"));
        assertTrue(text.contains("Depends on: a"));
    }
}

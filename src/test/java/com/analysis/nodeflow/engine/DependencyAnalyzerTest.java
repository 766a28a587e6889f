package com.analysis.nodeflow.engine;

import com.analysis.nodeflow.error.CycleException;
import com.analysis.nodeflow.error.StructuralException;
import com.analysis.nodeflow.kind.NodeKind;
import com.analysis.nodeflow.store.NodeRecord;
import org.junit.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static com.analysis.nodeflow.engine.GraphFixtures.graph;
import static org.junit.Assert.*;

public class DependencyAnalyzerTest {

    @Test
    public void testLinearScenario() {
        DependencyGraph g = graph("a", "b:a", "c:b");

        assertEquals(List.of("a", "b", "c"), DependencyAnalyzer.executionOrder(g, "c"));

        ExecutionPlan plan = DependencyAnalyzer.executionPlan(g, "c", Set.of("a"));
        assertEquals("c", plan.target());
        assertEquals(List.of("a", "b", "c"), plan.order());
        assertEquals(List.of("b", "c"), plan.toRun());
        assertEquals(List.of("a"), plan.skipped());
        assertFalse(plan.isUpToDate());
    }

    @Test
    public void testOrderOnlyCoversClosure() {
        DependencyGraph g = graph("a", "b:a", "unrelated", "c:b");

        assertEquals(List.of("a", "b"), DependencyAnalyzer.executionOrder(g, "b"));
        assertEquals(List.of("unrelated"), DependencyAnalyzer.executionOrder(g, "unrelated"));
    }

    @Test
    public void testOrderBreaksTiesByInsertion() {
        DependencyGraph g = graph("z", "y", "x", "report:x,y,z");

        assertEquals(List.of("z", "y", "x", "report"), DependencyAnalyzer.executionOrder(g, "report"));
    }

    @Test
    public void testTransitiveDependencies() {
        DependencyGraph g = graph("a", "b:a", "c:a", "d:b,c", "e:d");

        assertEquals(Set.of("a", "b", "c", "d"), DependencyAnalyzer.transitiveDependencies(g, "e"));
        assertTrue(DependencyAnalyzer.transitiveDependencies(g, "a").isEmpty());
    }

    @Test
    public void testTransitiveExcludesSelfOnCycle() {
        DependencyGraph g = graph("a:b", "b:a");

        assertEquals(Set.of("b"), DependencyAnalyzer.transitiveDependencies(g, "a"));
    }

    @Test
    public void testClosureIsIdempotent() {
        DependencyGraph g = graph("a", "b:a", "c:a", "d:b,c", "e:d", "f");

        Set<String> once = DependencyAnalyzer.closure(g, List.of("e"));
        Set<String> twice = DependencyAnalyzer.closure(g, once);
        assertEquals(once, twice);
        assertEquals(Set.of("a", "b", "c", "d", "e"), once);
    }

    @Test(expected = StructuralException.class)
    public void testUnknownTarget() {
        DependencyAnalyzer.transitiveDependencies(graph("a"), "missing");
    }

    @Test
    public void testReachableCycleFailsOrder() {
        DependencyGraph g = graph("a:c", "b:a", "c:b", "d:c");
        try {
            DependencyAnalyzer.executionOrder(g, "d");
            fail("Expected CycleException");
        } catch (CycleException e) {
            List<String> path = e.path();
            assertEquals(path.get(0), path.get(path.size() - 1));
            assertTrue(path.containsAll(List.of("a", "b", "c")));
            assertFalse(path.contains("d"));
        }
    }

    @Test
    public void testUnreachableCycleDoesNotFailOrder() {
        DependencyGraph g = graph("a", "b:a", "x:y", "y:x");

        assertEquals(List.of("a", "b"), DependencyAnalyzer.executionOrder(g, "b"));
    }

    @Test
    public void testUnknownDependenciesAreIgnoredByOrder() {
        DependencyGraph g = graph("a", "b:a,ghost");

        assertEquals(List.of("a", "b"), DependencyAnalyzer.executionOrder(g, "b"));
        assertEquals(Set.of("a"), DependencyAnalyzer.transitiveDependencies(g, "b"));
    }

    @Test
    public void testValidateReportsMissingAndIsolated() {
        DependencyGraph g = graph("a", "b:a,ghost", "c:ghost", "lonely");

        ValidationReport report = DependencyAnalyzer.validate(g);
        assertFalse(report.valid());
        assertFalse(report.hasCycle());
        assertEquals(Map.of("ghost", List.of("b", "c")), report.missingDependencies());
        assertEquals(2, report.errors().size());
        assertEquals(List.of("lonely"), report.isolatedNodes());
        assertEquals(1, report.warnings().size());
    }

    @Test
    public void testValidateReportsCycle() {
        ValidationReport report = DependencyAnalyzer.validate(graph("a:b", "b:a"));

        assertFalse(report.valid());
        assertTrue(report.hasCycle());
        assertTrue(report.errors().get(0).startsWith("Circular dependency detected: "));
    }

    @Test
    public void testValidGraph() {
        ValidationReport report = DependencyAnalyzer.validate(graph("a", "b:a"));

        assertTrue(report.valid());
        assertTrue(report.errors().isEmpty());
        assertTrue(report.warnings().isEmpty());
    }

    @Test
    public void testSingleNodeIsIsolated() {
        ValidationReport report = DependencyAnalyzer.validate(graph("solo"));

        assertTrue(report.valid());
        assertEquals(List.of("solo"), report.isolatedNodes());
        assertEquals(1, report.warnings().size());
    }

    @Test
    public void testMissingDependenciesKeepFirstSeenOrder() {
        ValidationReport report = DependencyAnalyzer.validate(graph("b:zeta", "c:alpha", "d:zeta,mid"));

        assertEquals(List.of("zeta", "alpha", "mid"), new ArrayList<>(report.missingDependencies().keySet()));
        assertEquals(List.of("b", "d"), report.missingDependencies().get("zeta"));
    }

    @Test
    public void testAnalyze() {
        DependencyGraph g = graph("raw", "clean:raw", "features:clean", "model:features,clean", "chart:model");

        AnalysisReport report = DependencyAnalyzer.analyze(g, "model");
        assertEquals("model", report.nodeId());
        assertEquals(List.of("features", "clean"), report.directDependencies());
        assertEquals(List.of("clean", "features", "raw"), report.transitiveDependencies());
        assertEquals(List.of("raw", "clean", "features", "model"), report.executionOrder());
        assertEquals(List.of("chart"), report.dependents());
        assertFalse(report.hasCycle());
    }

    @Test
    public void testAnalyzeOnCycleHasEmptyOrder() {
        AnalysisReport report = DependencyAnalyzer.analyze(graph("a:b", "b:a"), "a");

        assertTrue(report.hasCycle());
        assertTrue(report.executionOrder().isEmpty());
        assertEquals(List.of("b"), report.transitiveDependencies());
    }

    @Test
    public void testAnalyzeAll() {
        Map<String, AnalysisReport> all = DependencyAnalyzer.analyzeAll(graph("a", "b:a"));

        assertEquals(List.of("a", "b"), List.copyOf(all.keySet()));
        assertEquals(List.of("b"), all.get("a").dependents());
    }

    @Test
    public void testFindChains() {
        ChainReport report = DependencyAnalyzer.findChains(graph("a", "b:a", "c:b", "d:a", "solo"));

        assertEquals(List.of("a", "solo"), report.sourceNodes());
        assertEquals(List.of("c", "d", "solo"), report.leafNodes());
        assertEquals(List.of(List.of("a", "b", "c"), List.of("a", "d"), List.of("solo")), report.chains());
    }

    @Test
    public void testBuildGraphFromRecords() {
        NodeRecord a = NodeRecord.of("a", NodeKind.DATA_SOURCE);
        NodeRecord b = new NodeRecord("b", NodeKind.COMPUTE, "b", List.of("a"), a.state(), null, null, null);

        DependencyGraph g = DependencyAnalyzer.buildGraph(List.of(a, b));
        assertEquals(List.of("a"), g.dependenciesOf("b"));
    }
}

package com.analysis.nodeflow.exec;

import com.analysis.nodeflow.kind.NodeKind;
import com.analysis.nodeflow.kind.ResultFormat;
import com.analysis.nodeflow.store.InMemoryNodeStore;
import com.analysis.nodeflow.store.MaterializationState;
import com.analysis.nodeflow.store.NodeRecord;
import com.analysis.nodeflow.store.ResultDescriptor;
import org.junit.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.Assert.*;

public class DependencyTransactionTest {
    private static final ResultDescriptor RESULT = new ResultDescriptor(ResultFormat.PARQUET, "parquets/c.parquet");

    @Test
    public void testNothingIsWrittenBeforeCommit() {
        InMemoryNodeStore store = new InMemoryNodeStore();
        store.put(new NodeRecord("c", NodeKind.COMPUTE, "c", List.of("a", "b"), MaterializationState.NOT_EXECUTED,
                null, "old error", null), "c = b + d");

        DependencyTransaction tx = DependencyTransaction.begin(store.node("c"), List.of("b", "d"));

        assertEquals(List.of("a", "b"), store.node("c").dependsOn());
        assertEquals(List.of("d"), tx.addedEdges());
        assertEquals(List.of("a"), tx.removedEdges());
        assertFalse(tx.isCommitted());

        tx.commit(store, RESULT, Instant.EPOCH);

        NodeRecord after = store.node("c");
        assertEquals(List.of("b", "d"), after.dependsOn());
        assertEquals(MaterializationState.VALIDATED, after.state());
        assertEquals(RESULT, after.result());
        assertNull(after.errorMessage());
        assertTrue(tx.isCommitted());
    }

    @Test(expected = IllegalStateException.class)
    public void testCommitOnce() {
        InMemoryNodeStore store = new InMemoryNodeStore().define("c", NodeKind.COMPUTE, "c = 1");
        DependencyTransaction tx = DependencyTransaction.begin(store.node("c"), List.of());
        tx.commit(store, RESULT, Instant.EPOCH);
        tx.commit(store, RESULT, Instant.EPOCH);
    }
}

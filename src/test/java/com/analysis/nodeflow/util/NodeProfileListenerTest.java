package com.analysis.nodeflow.util;

import org.junit.Test;

import static org.junit.Assert.*;

public class NodeProfileListenerTest {

    @Test
    public void testAggregatesPerNode() {
        NodeProfileListener profile = new NodeProfileListener();
        profile.onRequestStart("report");
        profile.onNodeExecuted("orders", 2_000_000);
        profile.onNodeExecuted("orders", 4_000_000);
        profile.onNodeLoaded("customers", 1_000);
        profile.onNodeFailed("report", new IllegalStateException("x"));

        NodeProfileListener.NodeStats orders = profile.stats("orders");
        assertEquals(2, orders.executions);
        assertEquals(3.0, orders.avgMillis(), 1e-9);
        assertEquals(2_000_000, orders.minDurationNanos);
        assertEquals(4_000_000, orders.maxDurationNanos);
        assertEquals(1, profile.stats("customers").loads);
        assertEquals(0, profile.stats("customers").executions);
        assertEquals(1, profile.stats("report").failures);
        assertEquals(1, profile.requests());

        String dump = profile.dump();
        assertTrue(dump.indexOf("orders") < dump.indexOf("customers"));

        profile.reset();
        assertNull(profile.stats("orders"));
        assertEquals(0, profile.requests());
    }

    @Test
    public void testCompositeForwardsToEveryListener() {
        NodeProfileListener first = new NodeProfileListener();
        NodeProfileListener second = new NodeProfileListener();
        CompositeExecutionListener composite = new CompositeExecutionListener();
        composite.addForComposite(first);
        composite.addForComposite(second);

        composite.onNodeExecuted("a", 10);

        assertEquals(2, composite.size());
        assertEquals(1, first.stats("a").executions);
        assertEquals(1, second.stats("a").executions);
    }
}

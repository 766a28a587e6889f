package com.analysis.nodeflow.exec;

import org.junit.Test;

import java.util.List;

import static org.junit.Assert.*;

public class ExecutionStackTest {

    @Test
    public void testPushDoesNotModify() {
        ExecutionStack root = ExecutionStack.empty().push("x");
        ExecutionStack deeper = root.push("a");

        assertEquals(1, root.depth());
        assertEquals(List.of("x", "a"), deeper.ids());
        assertFalse(root.contains("a"));
        assertTrue(deeper.contains("x"));
        assertEquals("x -> a", deeper.toString());
    }

    @Test
    public void testCycleTo() {
        ExecutionStack stack = ExecutionStack.empty().push("x").push("a").push("b");

        assertEquals(List.of("a", "b", "a"), stack.cycleTo("a"));
        assertEquals(List.of("b", "b"), stack.cycleTo("b"));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testCycleToUnknown() {
        ExecutionStack.empty().push("x").cycleTo("y");
    }
}

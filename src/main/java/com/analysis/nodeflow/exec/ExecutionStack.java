package com.analysis.nodeflow.exec;

import java.util.ArrayList;
import java.util.List;

/**
 * Ids of the nodes currently being resolved, outermost first.
 *
 * <p>
 * Immutable: {@link #push(String)} returns a new stack, so each level of the
 * recursion sees exactly the path that led to it.
 */
public final class ExecutionStack {
    private static final ExecutionStack EMPTY = new ExecutionStack(List.of());

    private final List<String> ids;

    private ExecutionStack(List<String> ids) {
        this.ids = ids;
    }

    public static ExecutionStack empty() {
        return EMPTY;
    }

    public ExecutionStack push(String id) {
        List<String> next = new ArrayList<>(ids.size() + 1);
        next.addAll(ids);
        next.add(id);
        return new ExecutionStack(List.copyOf(next));
    }

    public boolean contains(String id) {
        return ids.contains(id);
    }

    /**
     * The closed cycle formed by depending on {@code id} from the top of the
     * stack, e.g. {@code [a, b, a]} for stack {@code [x, a, b]}.
     */
    public List<String> cycleTo(String id) {
        int start = ids.indexOf(id);
        if (start < 0)
            throw new IllegalArgumentException(id + " is not on the stack " + ids);
        List<String> cycle = new ArrayList<>(ids.subList(start, ids.size()));
        cycle.add(id);
        return cycle;
    }

    public List<String> ids() {
        return ids;
    }

    public int depth() {
        return ids.size();
    }

    @Override
    public String toString() {
        return String.join(" -> ", ids);
    }
}

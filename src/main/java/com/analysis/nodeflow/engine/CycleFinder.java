package com.analysis.nodeflow.engine;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Depth-first search for one concrete cycle.
 *
 * <p>
 * Uses an explicit frame stack instead of recursion so deep chains of nodes
 * cannot overflow the thread stack. Successors outside {@code nodes} are
 * ignored.
 */
final class CycleFinder {
    private static final int ON_PATH = 1;
    private static final int DONE = 2;

    private CycleFinder() {
        // Utility class
    }

    /**
     * Returns a closed cycle path such as {@code [a, b, a]}, or an empty list if
     * the nodes are acyclic. Roots are tried in iteration order of {@code nodes}.
     */
    static List<String> find(Collection<String> nodes, Function<String, ? extends Collection<String>> successors) {
        Map<String, Integer> color = new HashMap<>();
        for (String n : nodes)
            color.put(n, 0);

        for (String root : nodes) {
            if (color.get(root) != 0)
                continue;
            Deque<Frame> stack = new ArrayDeque<>();
            List<String> path = new ArrayList<>();
            stack.push(new Frame(root, successors.apply(root).iterator()));
            color.put(root, ON_PATH);
            path.add(root);

            while (!stack.isEmpty()) {
                Frame top = stack.peek();
                if (!top.next.hasNext()) {
                    stack.pop();
                    color.put(top.id, DONE);
                    path.remove(path.size() - 1);
                    continue;
                }
                String next = top.next.next();
                Integer c = color.get(next);
                if (c == null || c == DONE)
                    continue;
                if (c == ON_PATH) {
                    List<String> cycle = new ArrayList<>(path.subList(path.indexOf(next), path.size()));
                    cycle.add(next);
                    return cycle;
                }
                color.put(next, ON_PATH);
                path.add(next);
                stack.push(new Frame(next, successors.apply(next).iterator()));
            }
        }
        return Collections.emptyList();
    }

    private static final class Frame {
        final String id;
        final Iterator<String> next;

        Frame(String id, Iterator<String> next) {
            this.id = id;
            this.next = next;
        }
    }
}

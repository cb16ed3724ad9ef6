package com.example.agentflow.validation;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Detects cycles in a step dependency map ({@code step name -> names it depends on}).
 * <p>
 * Depth-first search with three-color marking, iterative so deep chains cannot overflow the stack.
 * Names that are not keys of the map are treated as leaves without dependencies. Runs in O(steps + edges)
 * and keeps no state between calls.
 * </p>
 */
public final class DependencyCycleDetector {

    private enum Mark { IN_PROGRESS, DONE }

    private DependencyCycleDetector() {
    }

    public static boolean hasCycle(Map<String, ? extends Collection<String>> dependencies) {
        return findCycle(dependencies).isPresent();
    }

    /**
     * Returns the first cycle found as a closed path (first and last element equal), e.g. {@code [a, b, a]}.
     */
    public static Optional<List<String>> findCycle(Map<String, ? extends Collection<String>> dependencies) {
        if (dependencies == null || dependencies.isEmpty()) {
            return Optional.empty();
        }
        Map<String, Mark> marks = new HashMap<>();
        for (String start : dependencies.keySet()) {
            if (start == null || marks.containsKey(start)) {
                continue;
            }
            Deque<Frame> path = new ArrayDeque<>();
            marks.put(start, Mark.IN_PROGRESS);
            path.push(new Frame(start, edges(dependencies, start)));
            while (!path.isEmpty()) {
                Frame top = path.peek();
                if (!top.pending.hasNext()) {
                    marks.put(top.node, Mark.DONE);
                    path.pop();
                    continue;
                }
                String next = top.pending.next();
                if (next == null) {
                    continue;
                }
                Mark mark = marks.get(next);
                if (mark == Mark.IN_PROGRESS) {
                    return Optional.of(closedPath(path, next));
                }
                if (mark == null) {
                    marks.put(next, Mark.IN_PROGRESS);
                    path.push(new Frame(next, edges(dependencies, next)));
                }
            }
        }
        return Optional.empty();
    }

    private static Iterator<String> edges(Map<String, ? extends Collection<String>> dependencies, String node) {
        Collection<String> deps = dependencies.get(node);
        return deps != null ? deps.iterator() : Collections.emptyIterator();
    }

    private static List<String> closedPath(Deque<Frame> path, String repeated) {
        List<String> cycle = new ArrayList<>();
        Iterator<Frame> bottomUp = path.descendingIterator();
        boolean inCycle = false;
        while (bottomUp.hasNext()) {
            String node = bottomUp.next().node;
            if (node.equals(repeated)) {
                inCycle = true;
            }
            if (inCycle) {
                cycle.add(node);
            }
        }
        cycle.add(repeated);
        return cycle;
    }

    private static final class Frame {
        private final String node;
        private final Iterator<String> pending;

        private Frame(String node, Iterator<String> pending) {
            this.node = node;
            this.pending = pending;
        }
    }
}

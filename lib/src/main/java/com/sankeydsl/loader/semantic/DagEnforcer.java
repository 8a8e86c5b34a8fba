package com.sankeydsl.loader.semantic;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Admits edges one at a time while keeping the accepted set acyclic. An edge {@code s -> t} is
 * refused when it is a self-loop or when {@code t} already reaches {@code s}. Refused edges are
 * never reconsidered, so the result is the greedy input-order subset rather than an optimal one.
 */
public final class DagEnforcer {

    public enum Decision {
        ACCEPTED,
        SELF_LOOP,
        CLOSES_CYCLE
    }

    private final Map<String, Set<String>> adjacency = new HashMap<>();

    public Decision offer(String sourceId, String targetId) {
        if (sourceId.equals(targetId)) {
            return Decision.SELF_LOOP;
        }
        if (reaches(targetId, sourceId)) {
            return Decision.CLOSES_CYCLE;
        }
        adjacency.computeIfAbsent(sourceId, id -> new LinkedHashSet<>()).add(targetId);
        return Decision.ACCEPTED;
    }

    /** Depth-first search over accepted edges with an explicit stack. */
    public boolean reaches(String fromId, String toId) {
        if (fromId.equals(toId)) {
            return true;
        }
        Deque<String> stack = new ArrayDeque<>();
        Set<String> visited = new HashSet<>();
        stack.push(fromId);
        visited.add(fromId);
        while (!stack.isEmpty()) {
            String current = stack.pop();
            Set<String> next = adjacency.get(current);
            if (next == null) {
                continue;
            }
            for (String neighbor : next) {
                if (neighbor.equals(toId)) {
                    return true;
                }
                if (visited.add(neighbor)) {
                    stack.push(neighbor);
                }
            }
        }
        return false;
    }
}

package com.pillarpattern.core.registry;

import com.pillarpattern.core.exception.CircularDependencyException;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Directed graph with Kahn topological ordering. An edge {@code from -> to} means
 * {@code from} must be processed before {@code to}. Iteration follows insertion order,
 * so the ordering is deterministic.
 */
public class DependencyGraph {

    private final Map<String, Set<String>> adjacency = new LinkedHashMap<>();
    private final Map<String, Integer> inDegree = new LinkedHashMap<>();

    public void addNode(String node) {
        adjacency.computeIfAbsent(node, k -> new LinkedHashSet<>());
        inDegree.putIfAbsent(node, 0);
    }

    public void addEdge(String from, String to) {
        addNode(from);
        addNode(to);
        if (adjacency.get(from).add(to)) {
            inDegree.merge(to, 1, Integer::sum);
        }
    }

    public int nodeCount() {
        return adjacency.size();
    }

    /**
     * @return every node, each after all of its predecessors
     * @throws CircularDependencyException carrying the nodes that could not be ordered
     */
    public List<String> topologicalSort() {
        Map<String, Integer> remaining = new LinkedHashMap<>(inDegree);
        Deque<String> ready = new ArrayDeque<>();
        remaining.forEach((node, degree) -> {
            if (degree == 0) ready.add(node);
        });

        List<String> ordered = new ArrayList<>(adjacency.size());
        while (!ready.isEmpty()) {
            String node = ready.poll();
            ordered.add(node);
            for (String next : adjacency.get(node)) {
                int degree = remaining.merge(next, -1, Integer::sum);
                if (degree == 0) {
                    ready.add(next);
                }
            }
        }

        if (ordered.size() < adjacency.size()) {
            Set<String> placed = new HashSet<>(ordered);
            List<String> cycle = new ArrayList<>();
            for (String node : adjacency.keySet()) {
                if (!placed.contains(node)) {
                    cycle.add(node);
                }
            }
            throw new CircularDependencyException(cycle);
        }
        return ordered;
    }
}

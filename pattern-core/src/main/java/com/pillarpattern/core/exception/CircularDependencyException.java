package com.pillarpattern.core.exception;

import java.util.List;

/**
 * Raised by a topological sort that could not order every node. The cycle witness is the
 * set of nodes left unprocessed, not a minimal cycle.
 */
public class CircularDependencyException extends PatternEngineException {
    private final List<String> cycle;

    public CircularDependencyException(List<String> cycle) {
        super("Circular dependency among " + cycle);
        this.cycle = List.copyOf(cycle);
    }

    public List<String> getCycle() {
        return cycle;
    }
}

package com.pillarpattern.core.exception;

import java.util.List;

/**
 * Raised when a pattern both requires and is blocked by the same pattern.
 */
public class ContradictionException extends InvalidPatternException {
    private final List<String> conflictingIds;

    public ContradictionException(String patternId, List<String> conflictingIds) {
        super(patternId, "requires and is blocked by " + conflictingIds);
        this.conflictingIds = List.copyOf(conflictingIds);
    }

    public List<String> getConflictingIds() {
        return conflictingIds;
    }
}

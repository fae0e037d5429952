package com.pillarpattern.core.exception;

public class MissingDependencyException extends InvalidPatternException {
    private final String missingId;

    public MissingDependencyException(String patternId, String missingId) {
        super(patternId, "requires non-existent pattern '" + missingId + "'");
        this.missingId = missingId;
    }

    public String getMissingId() {
        return missingId;
    }
}

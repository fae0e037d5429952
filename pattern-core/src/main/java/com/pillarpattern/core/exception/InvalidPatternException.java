package com.pillarpattern.core.exception;

public class InvalidPatternException extends PatternEngineException {
    private final String patternId;

    public InvalidPatternException(String patternId, String message) {
        super("Pattern '" + patternId + "' " + message);
        this.patternId = patternId;
    }

    public String getPatternId() {
        return patternId;
    }
}

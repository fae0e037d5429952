package com.pillarpattern.core.exception;

/**
 * Root of every error raised by the pattern engine. Unchecked: all of them signal
 * catalog authoring defects, never bad chart data.
 */
public class PatternEngineException extends RuntimeException {

    public PatternEngineException(String message) {
        super(message);
    }

    public PatternEngineException(String message, Throwable cause) {
        super(message, cause);
    }
}

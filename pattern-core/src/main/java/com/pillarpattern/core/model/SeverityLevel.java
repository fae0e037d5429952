package com.pillarpattern.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Ordinal severity band. Declaration order is significant: MINOR &lt; MODERATE &lt; MAJOR &lt; CRITICAL.
 */
public enum SeverityLevel {
    MINOR("minor", "minor impact"),
    MODERATE("moderate", "moderate impact"),
    MAJOR("major", "significant impact"),
    CRITICAL("critical", "critical impact");

    static final double CRITICAL_THRESHOLD = 70.0;
    static final double MAJOR_THRESHOLD    = 50.0;
    static final double MODERATE_THRESHOLD = 30.0;

    private final String token;
    private final String phrase;

    SeverityLevel(String token, String phrase) {
        this.token = token;
        this.phrase = phrase;
    }

    @JsonValue
    public String token() {
        return token;
    }

    /** Impact phrase used in severity explanations. */
    public String phrase() {
        return phrase;
    }

    public static SeverityLevel fromNormalizedScore(double normalized) {
        if (normalized >= CRITICAL_THRESHOLD) return CRITICAL;
        if (normalized >= MAJOR_THRESHOLD)    return MAJOR;
        if (normalized >= MODERATE_THRESHOLD) return MODERATE;
        return MINOR;
    }

    @JsonCreator
    public static SeverityLevel fromToken(String token) {
        for (SeverityLevel level : values()) {
            if (level.token.equalsIgnoreCase(token)) {
                return level;
            }
        }
        return null;
    }

    @Override
    public String toString() {
        return token;
    }
}

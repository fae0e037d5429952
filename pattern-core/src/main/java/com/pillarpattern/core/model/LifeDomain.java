package com.pillarpattern.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Life-impact domains used to aggregate severity. Declaration order is the order
 * in which domain summaries are reported.
 */
public enum LifeDomain {
    HEALTH("health"),
    WEALTH("wealth"),
    CAREER("career"),
    RELATIONSHIP("relationship"),
    EDUCATION("education"),
    FAMILY("family"),
    LEGAL("legal"),
    TRAVEL("travel");

    private final String token;

    LifeDomain(String token) {
        this.token = token;
    }

    @JsonValue
    public String token() {
        return token;
    }

    /**
     * Returns null for unrecognized tokens.
     */
    @JsonCreator
    public static LifeDomain fromToken(String token) {
        for (LifeDomain domain : values()) {
            if (domain.token.equalsIgnoreCase(token)) {
                return domain;
            }
        }
        return null;
    }

    @Override
    public String toString() {
        return token;
    }
}

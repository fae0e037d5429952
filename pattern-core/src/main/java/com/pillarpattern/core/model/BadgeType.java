package com.pillarpattern.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Display classification of a pattern. Carries no scoring meaning.
 */
public enum BadgeType {
    TRANSFORMATION("transformation"),
    COMBINATION("combination"),
    CLASH("clash"),
    PUNISHMENT("punishment"),
    HARM("harm"),
    DESTRUCTION("destruction"),
    STEM_CONFLICT("stem_conflict");

    private final String token;

    BadgeType(String token) {
        this.token = token;
    }

    @JsonValue
    public String token() {
        return token;
    }

    @JsonCreator
    public static BadgeType fromToken(String token) {
        for (BadgeType type : values()) {
            if (type.token.equalsIgnoreCase(token)) {
                return type;
            }
        }
        return null;
    }
}

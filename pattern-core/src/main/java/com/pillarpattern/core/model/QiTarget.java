package com.pillarpattern.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum QiTarget {
    SOURCE("source"),
    TARGET("target"),
    ALL("all");

    private final String token;

    QiTarget(String token) {
        this.token = token;
    }

    @JsonValue
    public String token() {
        return token;
    }

    @JsonCreator
    public static QiTarget fromToken(String token) {
        for (QiTarget target : values()) {
            if (target.token.equalsIgnoreCase(token)) {
                return target;
            }
        }
        return null;
    }
}

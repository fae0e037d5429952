package com.pillarpattern.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Kind of chart node a filter applies to.
 */
public enum NodeType {
    HEAVENLY_STEM("heavenly_stem"),
    EARTHLY_BRANCH("earthly_branch");

    private final String token;

    NodeType(String token) {
        this.token = token;
    }

    @JsonValue
    public String token() {
        return token;
    }

    @JsonCreator
    public static NodeType fromToken(String token) {
        for (NodeType type : values()) {
            if (type.token.equalsIgnoreCase(token)) {
                return type;
            }
        }
        return null;
    }
}

package com.pillarpattern.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum Sentiment {
    POSITIVE("positive"),
    NEGATIVE("negative"),
    NEUTRAL("neutral"),
    CONDITIONAL("conditional");   // depends on chart context

    private final String token;

    Sentiment(String token) {
        this.token = token;
    }

    @JsonValue
    public String token() {
        return token;
    }

    @JsonCreator
    public static Sentiment fromToken(String token) {
        for (Sentiment sentiment : values()) {
            if (sentiment.token.equalsIgnoreCase(token)) {
                return sentiment;
            }
        }
        return null;
    }
}

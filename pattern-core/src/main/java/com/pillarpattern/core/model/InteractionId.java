package com.pillarpattern.core.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Parsed form of an identifier shaped {@code TYPE~p1-p2[-...]~tail}. The tail is an element,
 * a subtype token, a list of node ids or empty, depending on the producer.
 */
public record InteractionId(String type, List<String> participants, String tail) {

    public static final String SEGMENT_SEPARATOR = "~";
    public static final String PARTICIPANT_SEPARATOR = "-";

    public InteractionId {
        participants = List.copyOf(participants);
        if (tail == null) tail = "";
    }

    /**
     * Never fails: missing segments become an empty participant list or an empty tail.
     */
    public static InteractionId parse(String identifier) {
        if (identifier == null) {
            return new InteractionId("", List.of(), "");
        }
        String[] parts = identifier.split(SEGMENT_SEPARATOR, -1);
        List<String> participants = new ArrayList<>();
        if (parts.length >= 2) {
            for (String token : parts[1].split(PARTICIPANT_SEPARATOR)) {
                if (!token.isEmpty()) {
                    participants.add(token);
                }
            }
        }
        String tail = parts.length >= 3 ? parts[2] : "";
        return new InteractionId(parts[0], participants, tail);
    }

    /** Tail split on the participant separator; empty when there is no tail. */
    public List<String> tailTokens() {
        if (tail.isEmpty()) {
            return List.of();
        }
        return List.of(tail.split(PARTICIPANT_SEPARATOR));
    }

    public boolean isStructured() {
        return !participants.isEmpty();
    }
}

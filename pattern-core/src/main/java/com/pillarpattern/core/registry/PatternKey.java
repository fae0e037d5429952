package com.pillarpattern.core.registry;

import com.pillarpattern.core.model.InteractionId;
import com.pillarpattern.core.model.PatternCategory;
import com.pillarpattern.core.model.PatternSpec;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Canonical lookup key: category, participants and qualifier.
 *
 * <p>Participants are sorted when there are exactly two or three of them, so any ordering
 * of a pair or triad yields the same key. Other counts stay order-sensitive. A missing
 * qualifier and an empty one are the same key, which makes {@code HARM~Zi-Wei~} and
 * {@code HARM~Zi-Wei} equivalent.
 */
public record PatternKey(PatternCategory category, List<String> participants, String qualifier) {

    public PatternKey {
        participants = canonicalOrder(participants);
        qualifier = qualifier == null ? "" : qualifier;
    }

    public static PatternKey of(PatternCategory category, List<String> participants, String qualifier) {
        return new PatternKey(category, participants, qualifier);
    }

    /**
     * Key under which a spec is indexed, derived from its identifier and declared category.
     */
    public static PatternKey forSpec(PatternSpec spec) {
        InteractionId parsed = InteractionId.parse(spec.id());
        return new PatternKey(spec.category(), parsed.participants(), parsed.tail());
    }

    public PatternKey withQualifier(String newQualifier) {
        return new PatternKey(category, participants, newQualifier);
    }

    private static List<String> canonicalOrder(List<String> participants) {
        if (participants == null) {
            return List.of();
        }
        if (participants.size() == 2 || participants.size() == 3) {
            List<String> sorted = new ArrayList<>(participants);
            Collections.sort(sorted);
            return List.copyOf(sorted);
        }
        return List.copyOf(participants);
    }
}

package com.pillarpattern.core.analysis;

import com.pillarpattern.core.model.InteractionId;
import com.pillarpattern.core.model.PatternCategory;
import com.pillarpattern.core.model.PatternSpec;
import com.pillarpattern.core.model.PillarPosition;
import com.pillarpattern.core.registry.PatternKey;
import com.pillarpattern.core.registry.PatternRegistry;

import java.util.LinkedHashSet;
import java.util.Optional;
import java.util.Set;

/**
 * Reconciles runtime interaction identifiers with catalog entries.
 *
 * <p>Qualifiers are tried in order, first hit wins:
 * <ol>
 *   <li>the interaction's element when it has one;</li>
 *   <li>otherwise the identifier's third segment (unless it lists node ids), then no qualifier;</li>
 *   <li>for clashes, {@code opposite} then {@code same};</li>
 *   <li>for harms and stem conflicts, no qualifier.</li>
 * </ol>
 * Participant order never matters for pairs and triads; see {@link PatternKey}.
 */
public class PatternResolver {

    static final String CLASH_OPPOSITE = "opposite";
    static final String CLASH_SAME     = "same";

    private final PatternRegistry registry;

    public PatternResolver(PatternRegistry registry) {
        this.registry = registry;
    }

    public Optional<PatternSpec> resolve(PatternCategory category, InteractionId id, String element) {
        if (category == null || !id.isStructured()) {
            return Optional.empty();
        }
        PatternKey unqualified = PatternKey.of(category, id.participants(), "");
        for (String qualifier : qualifiers(category, id, element)) {
            Optional<PatternSpec> hit = registry.find(unqualified.withQualifier(qualifier));
            if (hit.isPresent()) {
                return hit;
            }
        }
        return Optional.empty();
    }

    private static Set<String> qualifiers(PatternCategory category, InteractionId id, String element) {
        Set<String> qualifiers = new LinkedHashSet<>();
        if (element != null && !element.isEmpty()) {
            qualifiers.add(element);
        } else {
            if (!id.tail().isEmpty() && !listsNodeIds(id)) {
                qualifiers.add(id.tail());
            }
            qualifiers.add("");
        }
        switch (category) {
            case CLASH -> {
                qualifiers.add(CLASH_OPPOSITE);
                qualifiers.add(CLASH_SAME);
            }
            case HARM, STEM_CONFLICT -> qualifiers.add("");
            default -> { }
        }
        return qualifiers;
    }

    private static boolean listsNodeIds(InteractionId id) {
        return id.tailTokens().stream().anyMatch(token -> PillarPosition.fromNodeId(token) != null);
    }
}

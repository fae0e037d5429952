package com.pillarpattern.core.analysis;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.pillarpattern.core.model.LifeDomain;
import com.pillarpattern.core.model.PatternCategory;

import java.util.List;

/**
 * Scored interaction. When no catalog pattern matched, names fall back to the raw type token
 * and {@code affectedDomains} is empty.
 */
public record EnhancedPatternMatch(
    @JsonProperty("pattern_id") String patternId,
    @JsonProperty("category") PatternCategory category,
    @JsonProperty("native_name") String nativeName,
    @JsonProperty("english_name") String englishName,
    @JsonProperty("participants") List<String> participants,
    @JsonProperty("distance") int distance,
    @JsonProperty("is_transformed") boolean transformed,
    @JsonProperty("severity") SeveritySummary severity,
    @JsonProperty("affected_domains") List<LifeDomain> affectedDomains,
    @JsonProperty("pillar_meaning") String pillarMeaning,
    @JsonProperty("event_predictions") List<EventPrediction> eventPredictions
) {
    public EnhancedPatternMatch {
        participants = List.copyOf(participants);
        affectedDomains = List.copyOf(affectedDomains);
        eventPredictions = List.copyOf(eventPredictions);
    }
}

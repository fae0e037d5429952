package com.pillarpattern.core.taxonomy;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.pillarpattern.core.model.LifeDomain;
import com.pillarpattern.core.model.Sentiment;
import com.pillarpattern.core.model.SeverityLevel;

import java.util.List;

/**
 * Canonical life event that patterns can be correlated with.
 */
public record EventType(
    @JsonProperty("id") String id,
    @JsonProperty("domain") LifeDomain domain,
    @JsonProperty("name") String name,
    @JsonProperty("native_name") String nativeName,
    @JsonProperty("default_sentiment") Sentiment defaultSentiment,
    @JsonProperty("severity_range") List<SeverityLevel> severityRange,
    @JsonProperty("primary_elements") List<String> primaryElements,
    @JsonProperty("secondary_elements") List<String> secondaryElements,
    @JsonProperty("common_patterns") List<String> commonPatterns,
    @JsonProperty("description") String description
) {
    public EventType {
        severityRange     = severityRange == null ? List.of() : List.copyOf(severityRange);
        primaryElements   = primaryElements == null ? List.of() : List.copyOf(primaryElements);
        secondaryElements = secondaryElements == null ? List.of() : List.copyOf(secondaryElements);
        commonPatterns    = commonPatterns == null ? List.of() : List.copyOf(commonPatterns);
    }

    public boolean involvesElement(String element) {
        return primaryElements.contains(element) || secondaryElements.contains(element);
    }
}

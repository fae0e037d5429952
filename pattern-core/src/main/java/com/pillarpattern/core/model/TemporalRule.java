package com.pillarpattern.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Seasonal-state constraints. An empty allow list admits every state not excluded.
 */
public record TemporalRule(
    @JsonProperty("allowed_states") List<String> allowedStates,
    @JsonProperty("excluded_states") List<String> excludedStates
) {
    public TemporalRule {
        allowedStates  = allowedStates  == null ? List.of() : List.copyOf(allowedStates);
        excludedStates = excludedStates == null ? List.of() : List.copyOf(excludedStates);
    }

    public boolean permits(String seasonalState) {
        if (excludedStates.contains(seasonalState)) {
            return false;
        }
        return allowedStates.isEmpty() || allowedStates.contains(seasonalState);
    }
}

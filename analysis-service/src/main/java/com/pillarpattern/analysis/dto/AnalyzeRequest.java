package com.pillarpattern.analysis.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * Body of {@code POST /api/v1/patterns/analyze}. Interaction values are decoded as plain maps
 * (or strings for placeholders) and adapted by the analyzer.
 */
public record AnalyzeRequest(
    @JsonProperty("interactions") Map<String, Object> interactions,
    @JsonProperty("seasonal_states") Map<String, String> seasonalStates,
    @JsonProperty("daymaster_stem") String daymasterStem,
    @JsonProperty("daymaster_element") String daymasterElement,
    @JsonProperty("post_element_score") Map<String, Double> postElementScore,
    @JsonProperty("year_branch") String yearBranch
) {
    public AnalyzeRequest {
        interactions = interactions == null ? Map.of() : interactions;
        seasonalStates = seasonalStates == null ? Map.of() : seasonalStates;
        postElementScore = postElementScore == null ? Map.of() : postElementScore;
    }
}

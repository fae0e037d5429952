package com.pillarpattern.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record TransformSpec(
    @JsonProperty("resulting_element") String resultingElement,
    @JsonProperty("requires_element_support") boolean requiresElementSupport,
    @JsonProperty("supporting_elements") List<String> supportingElements,
    @JsonProperty("use_branch_polarity") boolean useBranchPolarity,
    @JsonProperty("base_score_multiplier") Double baseScoreMultiplier
) {
    public TransformSpec {
        supportingElements = supportingElements == null ? List.of() : List.copyOf(supportingElements);
        if (baseScoreMultiplier == null) baseScoreMultiplier = 1.0;
    }
}

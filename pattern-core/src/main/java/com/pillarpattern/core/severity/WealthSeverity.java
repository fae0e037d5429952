package com.pillarpattern.core.severity;

import com.fasterxml.jackson.annotation.JsonProperty;

public record WealthSeverity(
    @JsonProperty("severity_result") SeverityResult severityResult,
    @JsonProperty("wealth_element") String wealthElement,
    @JsonProperty("wealth_seasonal_state") String wealthSeasonalState,
    @JsonProperty("adjusted_score") double adjustedScore,
    @JsonProperty("recommendation") String recommendation
) {}

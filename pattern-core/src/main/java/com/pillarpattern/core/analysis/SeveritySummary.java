package com.pillarpattern.core.analysis;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.pillarpattern.core.model.SeverityLevel;
import com.pillarpattern.core.severity.SeverityResult;

/**
 * Severity as reported per match, without the factor breakdown.
 */
public record SeveritySummary(
    @JsonProperty("raw_score") double rawScore,
    @JsonProperty("normalized_score") double normalizedScore,
    @JsonProperty("level") SeverityLevel level,
    @JsonProperty("explanation") String explanation
) {
    public static SeveritySummary of(SeverityResult result) {
        return new SeveritySummary(result.rawScore(), result.normalizedScore(), result.level(), result.explanation());
    }
}

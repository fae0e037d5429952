package com.pillarpattern.core.severity;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.pillarpattern.core.model.SeverityLevel;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Immutable outcome of a severity calculation.
 *
 * @param rawScore            unnormalized score, rounded to 2 decimals
 * @param normalizedScore     0-100, rounded to 1 decimal
 * @param contributingFactors named multiplicative factors, in application order
 */
public record SeverityResult(
    @JsonProperty("raw_score") double rawScore,
    @JsonProperty("normalized_score") double normalizedScore,
    @JsonProperty("severity_level") SeverityLevel level,
    @JsonProperty("contributing_factors") Map<String, Object> contributingFactors,
    @JsonProperty("explanation") String explanation
) {
    public SeverityResult {
        contributingFactors = contributingFactors == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(contributingFactors));
    }

    public static SeverityResult none() {
        return new SeverityResult(0.0, 0.0, SeverityLevel.MINOR, Map.of(), "No patterns detected");
    }
}

package com.pillarpattern.core.analysis;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.pillarpattern.core.model.SeverityLevel;

import java.util.List;

public record DomainSummary(
    @JsonProperty("pattern_count") int patternCount,
    @JsonProperty("compound_severity") double compoundSeverity,
    @JsonProperty("severity_level") SeverityLevel severityLevel,
    @JsonProperty("top_patterns") List<DomainContributor> topPatterns
) {
    public DomainSummary {
        topPatterns = List.copyOf(topPatterns);
    }
}

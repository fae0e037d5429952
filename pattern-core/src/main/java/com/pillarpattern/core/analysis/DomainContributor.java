package com.pillarpattern.core.analysis;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.pillarpattern.core.model.SeverityLevel;

public record DomainContributor(
    @JsonProperty("pattern_id") String patternId,
    @JsonProperty("severity") double severity,          // normalized score of the match
    @JsonProperty("level") SeverityLevel level
) {}

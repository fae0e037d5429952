package com.pillarpattern.core.analysis;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.pillarpattern.core.model.LifeDomain;

public record Recommendation(
    @JsonProperty("domain") LifeDomain domain,
    @JsonProperty("priority") String priority,   // high / medium
    @JsonProperty("title") String title,
    @JsonProperty("description") String description
) {}

package com.pillarpattern.core.analysis;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.pillarpattern.core.model.LifeDomain;
import com.pillarpattern.core.model.Sentiment;

public record EventPrediction(
    @JsonProperty("domain") LifeDomain domain,
    @JsonProperty("event_type") String eventType,
    @JsonProperty("event_name") String eventName,
    @JsonProperty("sentiment") Sentiment sentiment,
    @JsonProperty("probability") double probability
) {}

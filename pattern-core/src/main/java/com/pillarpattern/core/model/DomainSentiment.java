package com.pillarpattern.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record DomainSentiment(
    @JsonProperty("domain") LifeDomain domain,
    @JsonProperty("sentiment") Sentiment sentiment
) {}

package com.pillarpattern.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record QiEffect(
    @JsonProperty("target") QiTarget target,
    @JsonProperty("qi_change") double qiChange,
    @JsonProperty("is_percentage") boolean isPercentage
) {}

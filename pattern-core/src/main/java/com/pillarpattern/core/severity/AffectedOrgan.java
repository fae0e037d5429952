package com.pillarpattern.core.severity;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record AffectedOrgan(
    @JsonProperty("element") String element,
    @JsonProperty("zang") String zang,
    @JsonProperty("fu") String fu,
    @JsonProperty("native_zang") String nativeZang,
    @JsonProperty("native_fu") String nativeFu,
    @JsonProperty("body_parts") List<String> bodyParts,
    @JsonProperty("emotion") String emotion,
    @JsonProperty("seasonal_state") String seasonalState,
    @JsonProperty("vulnerability") double vulnerability   // seasonal multiplier of the element
) {}

package com.pillarpattern.core.registry;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

public record RegistryStatistics(
    @JsonProperty("total_patterns") int totalPatterns,
    @JsonProperty("by_category") Map<String, Integer> byCategory,
    @JsonProperty("by_domain") Map<String, Integer> byDomain,
    @JsonProperty("unique_participants") int uniqueParticipants,
    @JsonProperty("patterns_with_dependencies") int patternsWithDependencies,
    @JsonProperty("patterns_with_blockers") int patternsWithBlockers
) {}

package com.pillarpattern.core.taxonomy;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

public record TaxonomyStatistics(
    @JsonProperty("total_event_types") int totalEventTypes,
    @JsonProperty("by_domain") Map<String, Integer> byDomain,
    @JsonProperty("by_sentiment") Map<String, Integer> bySentiment,
    @JsonProperty("with_pattern_correlations") int withPatternCorrelations
) {}

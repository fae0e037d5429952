package com.pillarpattern.core.analysis;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Chart node through which a special star's branch appears.
 */
public record StarTrigger(
    @JsonProperty("node_id") String nodeId,
    @JsonProperty("pillar_type") String pillarType
) {}

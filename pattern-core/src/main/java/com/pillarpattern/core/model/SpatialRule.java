package com.pillarpattern.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Positional constraints between participating nodes. A null {@code maxDistance} means unbounded.
 */
public record SpatialRule(
    @JsonProperty("max_distance") Integer maxDistance,
    @JsonProperty("require_adjacent") boolean requireAdjacent,
    @JsonProperty("same_pillar") boolean samePillar
) {
    public boolean permitsDistance(int distance) {
        if (requireAdjacent && distance > 1) {
            return false;
        }
        return maxDistance == null || distance <= maxDistance;
    }
}

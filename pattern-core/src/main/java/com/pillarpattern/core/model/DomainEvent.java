package com.pillarpattern.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A (domain, event type) pair referenced by an event mapping.
 */
public record DomainEvent(
    @JsonProperty("domain") LifeDomain domain,
    @JsonProperty("event") String event
) {}

package com.pillarpattern.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Authored link between a pattern and the canonical life events it tends to produce.
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record EventMapping(
    @JsonProperty("primary_domains") List<LifeDomain> primaryDomains,
    @JsonProperty("positive_events") List<DomainEvent> positiveEvents,
    @JsonProperty("negative_events") List<DomainEvent> negativeEvents,
    @JsonProperty("domain_sentiment") List<DomainSentiment> domainSentiment
) {
    public EventMapping {
        primaryDomains  = primaryDomains  == null ? List.of() : List.copyOf(primaryDomains);
        positiveEvents  = positiveEvents  == null ? List.of() : List.copyOf(positiveEvents);
        negativeEvents  = negativeEvents  == null ? List.of() : List.copyOf(negativeEvents);
        domainSentiment = domainSentiment == null ? List.of() : List.copyOf(domainSentiment);
    }
}

package com.pillarpattern.core.severity;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Health deep-dive: compound severity plus the organ systems of the affected elements,
 * most vulnerable first.
 */
public record HealthSeverity(
    @JsonProperty("severity_result") SeverityResult severityResult,
    @JsonProperty("affected_organs") List<AffectedOrgan> affectedOrgans,
    @JsonProperty("most_vulnerable") AffectedOrgan mostVulnerable,
    @JsonProperty("recommendation") String recommendation
) {
    public HealthSeverity {
        affectedOrgans = List.copyOf(affectedOrgans);
    }
}

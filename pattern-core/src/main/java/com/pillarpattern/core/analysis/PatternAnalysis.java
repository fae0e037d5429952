package com.pillarpattern.core.analysis;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.pillarpattern.core.severity.HealthSeverity;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Result of one chart analysis. {@code domainAnalysis} is keyed by domain token and only
 * holds domains with at least one contributing match; {@code healthEnhanced} is null unless
 * the health domain has contributors and some element was affected.
 */
public record PatternAnalysis(
    @JsonProperty("enhanced_patterns") List<EnhancedPatternMatch> enhancedPatterns,
    @JsonProperty("pattern_count") int patternCount,
    @JsonProperty("domain_analysis") Map<String, DomainSummary> domainAnalysis,
    @JsonProperty("affected_elements") List<String> affectedElements,
    @JsonProperty("special_stars") List<SpecialStarHit> specialStars,
    @JsonProperty("health_enhanced") HealthSeverity healthEnhanced,
    @JsonProperty("recommendations") List<Recommendation> recommendations
) {
    public PatternAnalysis {
        enhancedPatterns = List.copyOf(enhancedPatterns);
        domainAnalysis = Collections.unmodifiableMap(new LinkedHashMap<>(domainAnalysis));
        affectedElements = List.copyOf(affectedElements);
        specialStars = List.copyOf(specialStars);
        recommendations = List.copyOf(recommendations);
    }
}

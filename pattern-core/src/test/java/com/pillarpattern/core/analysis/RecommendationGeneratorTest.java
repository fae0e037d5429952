package com.pillarpattern.core.analysis;

import com.pillarpattern.core.model.LifeDomain;
import com.pillarpattern.core.model.SeverityLevel;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class RecommendationGeneratorTest {

    private final RecommendationGenerator generator = new RecommendationGenerator();

    private static DomainSummary summary(double compound) {
        return new DomainSummary(1, compound, SeverityLevel.fromNormalizedScore(compound), List.of());
    }

    @Test
    @DisplayName("values on the thresholds → no advice")
    void thresholdsAreExclusive() {
        Map<String, DomainSummary> analysis = Map.of(
            "health", summary(50.0), "wealth", summary(40.0),
            "career", summary(50.0), "relationship", summary(40.0));
        assertTrue(generator.generate(analysis, Map.of("Water", "Dead")).isEmpty());
    }

    @Test
    @DisplayName("all four domains above threshold → health, wealth, career, relationship")
    void allDomains() {
        Map<String, DomainSummary> analysis = Map.of(
            "health", summary(60.0), "wealth", summary(41.0),
            "career", summary(51.0), "relationship", summary(41.0));

        List<Recommendation> recommendations = generator.generate(analysis, Map.of("Fire", "Trapped"));

        assertEquals(List.of(LifeDomain.HEALTH, LifeDomain.WEALTH, LifeDomain.CAREER, LifeDomain.RELATIONSHIP),
            recommendations.stream().map(Recommendation::domain).toList());
        Recommendation health = recommendations.get(0);
        assertEquals("medium", health.priority());
        assertEquals("Support Heart Function", health.title());
        assertEquals("Your Heart (心) may need attention. Associated body parts: tongue, blood_vessels, "
            + "complexion, sweat. Manage joy/anxiety for better balance.", health.description());
    }

    @Test
    @DisplayName("health above 70 → high priority")
    void highPriority() {
        List<Recommendation> recommendations = generator.generate(
            Map.of("health", summary(75.0)), Map.of("Metal", "Dead"));
        assertEquals("high", recommendations.get(0).priority());
        assertEquals("Support Lungs Function", recommendations.get(0).title());
    }

    @Test
    @DisplayName("no seasonal table → health advice skipped")
    void noSeasonalStates() {
        assertTrue(generator.generate(Map.of("health", summary(90.0)), Map.of()).isEmpty());
    }

    @Test
    @DisplayName("most vulnerable element → highest multiplier, first on ties")
    void mostVulnerable() {
        Map<String, String> states = new LinkedHashMap<>();
        states.put("Wood", "Prosperous");
        states.put("Earth", "Trapped");
        states.put("Water", "Trapped");
        assertEquals("Earth", RecommendationGenerator.mostVulnerableElement(states));
        assertNull(RecommendationGenerator.mostVulnerableElement(Map.of()));
    }
}

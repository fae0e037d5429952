package com.pillarpattern.core.severity;

import com.pillarpattern.core.model.LifeDomain;
import com.pillarpattern.core.model.PatternCategory;
import com.pillarpattern.core.model.SeverityLevel;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Deterministic verification of {@link SeverityCalculator}.
 */
class SeverityCalculatorTest {

    private static final double DELTA = 1e-9;

    private static SeverityResult clash(String seasonalState) {
        return SeverityCalculator.calculatePatternSeverity(
            "CLASH~Zi-Wu~opposite", "clash", 1, seasonalState, 1, "Water", "Water", false);
    }

    // ── calculatePatternSeverity() ─────────────────────────────────────────

    @Nested
    @DisplayName("calculatePatternSeverity()")
    class PatternSeverityTests {

        @Test
        @DisplayName("Zi-Wu clash, Trapped, day pillar, same element → raw 24.1, normalized 80.3, critical")
        void trappedClashOnDayMaster() {
            SeverityResult result = clash("Trapped");

            assertEquals(24.1, result.rawScore(), DELTA);
            assertEquals(80.3, result.normalizedScore(), DELTA);
            assertEquals(SeverityLevel.CRITICAL, result.level());
            assertEquals("CLASH pattern detected. critical impact. amplified by Trapped seasonal state. "
                + "directly affecting Day Master. in personal Day pillar.", result.explanation());
        }

        @Test
        @DisplayName("factors listed in application order")
        void factorOrder() {
            Map<String, Object> factors = clash("Trapped").contributingFactors();
            assertEquals(List.of("base_weight", "distance_mult", "seasonal_mult", "pillar_mult",
                "dm_relevance", "transform_bonus"), List.copyOf(factors.keySet()));
            assertEquals(0.9, (double) factors.get("base_weight"), DELTA);
            assertEquals(1.4, (double) factors.get("seasonal_mult"), DELTA);
        }

        @Test
        @DisplayName("seasonal monotonicity: Prosperous < Strengthening < Resting < Trapped < Dead")
        void seasonalMonotonicity() {
            List<String> states = List.of("Prosperous", "Strengthening", "Resting", "Trapped", "Dead");
            double previous = -1.0;
            for (String state : states) {
                double normalized = clash(state).normalizedScore();
                assertTrue(normalized > previous, state + " did not score above the previous state");
                previous = normalized;
            }
        }

        @Test
        @DisplayName("normalized score capped at 100")
        void cappedAt100() {
            SeverityResult result = SeverityCalculator.calculatePatternSeverity(
                "PUNISHMENT~Yin-Si-Shen~shi_xing", "punishment", 0, "Dead", 1, "Fire", "Fire", true);
            assertEquals(100.0, result.normalizedScore(), DELTA);
            assertEquals(SeverityLevel.CRITICAL, result.level());
        }

        @Test
        @DisplayName("unknown category, distance and state → defaults 0.5, 0.4, 1.0")
        void unknownInputsFallBack() {
            SeverityResult result = SeverityCalculator.calculatePatternSeverity(
                "MYSTERY~Zi-Wu~", "mystery", 9, "Unheard", 3, "Water", null, false);

            // 0.5 × 0.4 × 1.0 × 1.0 × 1.0 × 1.0 × 10
            assertEquals(2.0, result.rawScore(), DELTA);
            assertEquals(6.7, result.normalizedScore(), DELTA);
            assertEquals(SeverityLevel.MINOR, result.level());
            assertEquals("MYSTERY pattern detected. minor impact.", result.explanation());
        }

        @Test
        @DisplayName("null category weighs the default")
        void nullCategory() {
            SeverityResult result = SeverityCalculator.calculatePatternSeverity(
                "X", (PatternCategory) null, 0, "Resting", 0, null, null, false);
            assertEquals(5.0, result.rawScore(), DELTA);
        }

        @Test
        @DisplayName("category token is case-insensitive and enum overload agrees")
        void categoryCase() {
            SeverityResult upper = SeverityCalculator.calculatePatternSeverity(
                "HARM~Zi-Wei~", "HARM", 2, "Resting", 2, "Wood", "Earth", false);
            SeverityResult typed = SeverityCalculator.calculatePatternSeverity(
                "HARM~Zi-Wei~", PatternCategory.HARM, 2, "Resting", 2, "Wood", "Earth", false);
            assertEquals(upper, typed);
            assertTrue(upper.explanation().endsWith("in career Month pillar."));
        }

        @Test
        @DisplayName("luck pillar positions carry the year weight")
        void luckPillarWeight() {
            SeverityResult year = SeverityCalculator.calculatePatternSeverity(
                "CLASH~Zi-Wu~", "clash", 1, "Resting", 3, "Metal", "Water", false);
            SeverityResult luck = SeverityCalculator.calculatePatternSeverity(
                "CLASH~Zi-Wu~", "clash", 1, "Resting", 4, "Metal", "Water", false);
            SeverityResult unknown = SeverityCalculator.calculatePatternSeverity(
                "CLASH~Zi-Wu~", "clash", 1, "Resting", 42, "Metal", "Water", false);
            assertEquals(year.rawScore(), luck.rawScore(), DELTA);
            assertEquals(year.rawScore(), unknown.rawScore(), DELTA);
        }

        @Test
        @DisplayName("transformation multiplies by 1.3")
        void transformationBonus() {
            SeverityResult plain = SeverityCalculator.calculatePatternSeverity(
                "SIX_HARMONIES~Zi-Chou~Earth", "six_harmonies", 1, "Resting", 0, "Wood", "Earth", false);
            SeverityResult transformed = SeverityCalculator.calculatePatternSeverity(
                "SIX_HARMONIES~Zi-Chou~Earth", "six_harmonies", 1, "Resting", 0, "Wood", "Earth", true);
            assertEquals(plain.rawScore() * 1.3, transformed.rawScore(), 0.01);
        }
    }

    @Nested
    @DisplayName("dayMasterRelevance()")
    class RelevanceTests {

        @Test
        @DisplayName("same element → 1.5")
        void sameElement() {
            assertEquals(1.5, SeverityCalculator.dayMasterRelevance("Fire", "Fire"), DELTA);
        }

        @Test
        @DisplayName("Water relates to Wood, not the reverse")
        void directional() {
            assertEquals(1.2, SeverityCalculator.dayMasterRelevance("Water", "Wood"), DELTA);
            assertEquals(1.0, SeverityCalculator.dayMasterRelevance("Wood", "Water"), DELTA);
        }

        @Test
        @DisplayName("absent pattern element → 1.0")
        void absentElement() {
            assertEquals(1.0, SeverityCalculator.dayMasterRelevance(null, "Fire"), DELTA);
            assertEquals(1.0, SeverityCalculator.dayMasterRelevance("", "Fire"), DELTA);
        }
    }

    // ── calculateCompoundSeverity() ────────────────────────────────────────

    @Nested
    @DisplayName("calculateCompoundSeverity()")
    class CompoundTests {

        @Test
        @DisplayName("empty input → 0, minor, 'No patterns detected'")
        void emptyInput() {
            SeverityResult result = SeverityCalculator.calculateCompoundSeverity(List.of(), LifeDomain.HEALTH);
            assertEquals(0.0, result.rawScore(), DELTA);
            assertEquals(0.0, result.normalizedScore(), DELTA);
            assertEquals(SeverityLevel.MINOR, result.level());
            assertEquals("No patterns detected", result.explanation());
        }

        @Test
        @DisplayName("two results → summed raw × 1.25")
        void twoResults() {
            SeverityResult a = new SeverityResult(10.0, 33.3, SeverityLevel.MODERATE, Map.of(), "");
            SeverityResult b = new SeverityResult(6.0, 20.0, SeverityLevel.MINOR, Map.of(), "");

            SeverityResult result = SeverityCalculator.calculateCompoundSeverity(List.of(a, b), LifeDomain.CAREER);

            assertEquals(20.0, result.rawScore(), DELTA);
            assertEquals(40.0, result.normalizedScore(), DELTA);
            assertEquals(SeverityLevel.MODERATE, result.level());
            assertEquals(2, result.contributingFactors().get("pattern_count"));
            assertEquals(1.25, (double) result.contributingFactors().get("compound_multiplier"), DELTA);
            assertEquals(List.of(10.0, 6.0), result.contributingFactors().get("individual_scores"));
            assertEquals("2 patterns converge affecting career domain. Combined severity: moderate.",
                result.explanation());
        }

        @Test
        @DisplayName("two or more results → above any single contributor, growing with count")
        void compoundGrowth() {
            SeverityResult small = new SeverityResult(1.0, 3.3, SeverityLevel.MINOR, Map.of(), "");
            SeverityResult one = SeverityCalculator.calculateCompoundSeverity(List.of(small), LifeDomain.WEALTH);
            SeverityResult two = SeverityCalculator.calculateCompoundSeverity(List.of(small, small), LifeDomain.WEALTH);
            SeverityResult three = SeverityCalculator.calculateCompoundSeverity(List.of(small, small, small), LifeDomain.WEALTH);

            assertEquals(5.0, two.normalizedScore(), DELTA);
            assertTrue(two.normalizedScore() > small.normalizedScore());
            assertTrue(three.normalizedScore() > small.normalizedScore());
            assertTrue(two.normalizedScore() > one.normalizedScore());
            assertTrue(three.normalizedScore() > two.normalizedScore());
        }
    }

    // ── health / wealth ────────────────────────────────────────────────────

    @Nested
    @DisplayName("calculateHealthSeverity()")
    class HealthTests {

        @Test
        @DisplayName("organs ranked by seasonal vulnerability, non-elements ignored")
        void ranksOrgans() {
            SeverityResult r = new SeverityResult(30.0, 100.0, SeverityLevel.CRITICAL, Map.of(), "");
            HealthSeverity health = SeverityCalculator.calculateHealthSeverity(
                List.of(r), List.of("Wood", "Aether", "Water", "Fire"),
                Map.of("Wood", "Prosperous", "Water", "Dead"), "Water");

            assertEquals(List.of("Water", "Fire", "Wood"),
                health.affectedOrgans().stream().map(AffectedOrgan::element).toList());
            AffectedOrgan top = health.mostVulnerable();
            assertEquals("Kidneys", top.zang());
            assertEquals("膀胱", top.nativeFu());
            assertEquals(1.8, top.vulnerability(), DELTA);
            assertEquals("Resting", health.affectedOrgans().get(1).seasonalState());
            assertEquals("IMPORTANT: Nourish Kidneys through adequate hydration, manage fear, get sufficient rest. "
                + "Consider consulting a healthcare provider.", health.recommendation());
        }

        @Test
        @DisplayName("moderate level → plain care advice")
        void moderateAdvice() {
            SeverityResult r = new SeverityResult(9.0, 30.0, SeverityLevel.MODERATE, Map.of(), "");
            HealthSeverity health = SeverityCalculator.calculateHealthSeverity(
                List.of(r), List.of("Metal"), Map.of(), "Wood");

            assertEquals(SeverityLevel.MINOR, health.severityResult().level());
            assertEquals("Support Lungs through breathing exercises, process grief, protect from cold",
                health.recommendation());
        }

        @Test
        @DisplayName("no recognizable element → no organ, fixed message")
        void noOrgans() {
            HealthSeverity health = SeverityCalculator.calculateHealthSeverity(
                List.of(), List.of(), Map.of(), "Wood");
            assertNull(health.mostVulnerable());
            assertTrue(health.affectedOrgans().isEmpty());
            assertEquals("No specific organ vulnerability detected.", health.recommendation());
        }
    }

    @Nested
    @DisplayName("calculateWealthSeverity()")
    class WealthTests {

        @Test
        @DisplayName("adjusted score scales by the wealth element's seasonal multiplier")
        void adjustedScore() {
            SeverityResult r = new SeverityResult(20.0, 66.7, SeverityLevel.MAJOR, Map.of(), "");
            WealthSeverity wealth = SeverityCalculator.calculateWealthSeverity(List.of(r), "Metal", "Trapped");

            assertEquals(40.0, wealth.severityResult().normalizedScore(), DELTA);
            assertEquals(56.0, wealth.adjustedScore(), DELTA);
            assertEquals("Metal", wealth.wealthElement());
            assertEquals("Minor financial fluctuations possible. Maintain diversified portfolio.",
                wealth.recommendation());
        }

        @Test
        @DisplayName("critical compound → capital preservation advice")
        void criticalAdvice() {
            SeverityResult r = new SeverityResult(40.0, 100.0, SeverityLevel.CRITICAL, Map.of(), "");
            WealthSeverity wealth = SeverityCalculator.calculateWealthSeverity(List.of(r), "Earth", "Prosperous");

            assertEquals(SeverityLevel.CRITICAL, wealth.severityResult().level());
            assertEquals(48.0, wealth.adjustedScore(), DELTA);
            assertTrue(wealth.recommendation().startsWith("High financial volatility expected"));
        }
    }
}

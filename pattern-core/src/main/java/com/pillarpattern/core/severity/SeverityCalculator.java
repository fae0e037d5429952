package com.pillarpattern.core.severity;

import com.pillarpattern.core.model.LifeDomain;
import com.pillarpattern.core.model.PatternCategory;
import com.pillarpattern.core.model.PillarPosition;
import com.pillarpattern.core.model.SeasonalState;
import com.pillarpattern.core.model.SeverityLevel;
import com.pillarpattern.core.taxonomy.OrganSystem;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Stateless calculator converting a matched pattern and its chart context into a
 * {@link SeverityResult}, and compounding several results within one life domain.
 *
 * <p><b>Single pattern</b>:
 * <pre>
 *   raw        = categoryWeight × distanceMult × seasonalMult × pillarMult × dmRelevance × transformBonus × 10
 *   normalized = min(100, raw / 30 × 100)
 * </pre>
 *
 * <p><b>Compound</b> (same domain, n results):
 * <pre>
 *   raw        = Σ raw_i × (1 + 0.25 × (n − 1))
 *   normalized = min(100, raw / 50 × 100)
 * </pre>
 *
 * <p>Levels on the normalized score: ≥70 critical, ≥50 major, ≥30 moderate, else minor.
 * Unknown categories, distances, seasonal states and positions fall back to neutral or
 * weaker multipliers; nothing here throws on unexpected input.
 */
public final class SeverityCalculator {

    static final double DEFAULT_CATEGORY_WEIGHT = 0.5;
    static final double DEFAULT_DISTANCE_MULT   = 0.4;
    static final double SAME_ELEMENT_RELEVANCE  = 1.5;
    static final double RELATED_RELEVANCE       = 1.2;
    static final double TRANSFORM_BONUS         = 1.3;
    static final double SCORE_SCALE             = 10.0;
    static final double PATTERN_NORMALIZER      = 30.0;
    static final double COMPOUND_NORMALIZER     = 50.0;
    static final double COMPOUND_STEP           = 0.25;

    // Explanation notes only fire above these
    static final double SEASONAL_NOTE_THRESHOLD  = 1.2;
    static final double RELEVANCE_NOTE_THRESHOLD = 1.2;

    static final Map<String, Double> CATEGORY_WEIGHTS = Map.ofEntries(
        Map.entry("punishment",          1.0),
        Map.entry("clash",               0.9),
        Map.entry("harm",                0.7),
        Map.entry("destruction",         0.5),
        Map.entry("stem_conflict",       0.6),
        Map.entry("three_meetings",      1.0),
        Map.entry("three_combinations",  0.9),
        Map.entry("six_harmonies",       0.7),
        Map.entry("half_meetings",       0.5),
        Map.entry("half_combinations",   0.4),
        Map.entry("arched_combinations", 0.3),
        Map.entry("stem_combination",    0.8)
    );

    static final Map<Integer, Double> DISTANCE_MULTIPLIERS = Map.of(
        0, 1.0,
        1, 0.85,
        2, 0.70,
        3, 0.55,
        4, 0.45
    );

    // Directional: the key element feeds or relates to each listed element
    static final Map<String, Set<String>> ELEMENT_RELATIONS = Map.of(
        "Wood",  Set.of("Fire", "Earth"),
        "Fire",  Set.of("Earth", "Metal"),
        "Earth", Set.of("Metal", "Water"),
        "Metal", Set.of("Water", "Wood"),
        "Water", Set.of("Wood", "Fire")
    );

    private SeverityCalculator() {}

    /**
     * Convenience overload taking the typed category.
     */
    public static SeverityResult calculatePatternSeverity(
            String patternId,
            PatternCategory category,
            int distance,
            String seasonalState,
            int pillarPosition,
            String daymasterElement,
            String patternElement,
            boolean isTransformed) {
        return calculatePatternSeverity(patternId, category == null ? null : category.token(), distance,
            seasonalState, pillarPosition, daymasterElement, patternElement, isTransformed);
    }

    /**
     * Severity of one matched pattern.
     *
     * @param patternId        runtime identifier; its type segment heads the explanation
     * @param category         category token, case-insensitive; unknown or null weighs {@value DEFAULT_CATEGORY_WEIGHT}
     * @param distance         pillar distance; beyond 4 weighs {@value DEFAULT_DISTANCE_MULT}
     * @param seasonalState    seasonal state name of the pattern element
     * @param pillarPosition   primary pillar slot (0 hour, 1 day, 2 month, 3 year, 4-8 luck/transit)
     * @param daymasterElement element of the Day Master
     * @param patternElement   element of the pattern, may be null
     * @param isTransformed    whether the combination transformed
     */
    public static SeverityResult calculatePatternSeverity(
            String patternId,
            String category,
            int distance,
            String seasonalState,
            int pillarPosition,
            String daymasterElement,
            String patternElement,
            boolean isTransformed) {

        double baseWeight = category == null
            ? DEFAULT_CATEGORY_WEIGHT
            : CATEGORY_WEIGHTS.getOrDefault(category.toLowerCase(), DEFAULT_CATEGORY_WEIGHT);
        double distanceMult = DISTANCE_MULTIPLIERS.getOrDefault(distance, DEFAULT_DISTANCE_MULT);
        double seasonalMult = SeasonalState.multiplierOf(seasonalState);

        // Luck and transit slots, like unknown slots, carry the year weight
        PillarPosition pillar = PillarPosition.fromIndex(pillarPosition);
        double pillarMult = pillar == null ? PillarPosition.YEAR.weight() : pillar.weight();

        double dmRelevance = dayMasterRelevance(patternElement, daymasterElement);
        double transformBonus = isTransformed ? TRANSFORM_BONUS : 1.0;

        Map<String, Object> factors = new LinkedHashMap<>();
        factors.put("base_weight", baseWeight);
        factors.put("distance_mult", distanceMult);
        factors.put("seasonal_mult", seasonalMult);
        factors.put("pillar_mult", pillarMult);
        factors.put("dm_relevance", dmRelevance);
        factors.put("transform_bonus", transformBonus);

        double raw = baseWeight * distanceMult * seasonalMult * pillarMult
                   * dmRelevance * transformBonus * SCORE_SCALE;
        double normalized = Math.min(100.0, raw / PATTERN_NORMALIZER * 100.0);
        SeverityLevel level = SeverityLevel.fromNormalizedScore(normalized);

        String explanation = explain(patternId, level, seasonalMult, dmRelevance, seasonalState, pillar);
        return new SeverityResult(round2(raw), round1(normalized), level, factors, explanation);
    }

    /**
     * Combines results that affect the same domain. Each additional result adds 25% on top
     * of the summed raw scores.
     */
    public static SeverityResult calculateCompoundSeverity(List<SeverityResult> results, LifeDomain domain) {
        if (results == null || results.isEmpty()) {
            return SeverityResult.none();
        }

        int count = results.size();
        double totalRaw = 0.0;
        List<Double> individual = new ArrayList<>(count);
        for (SeverityResult result : results) {
            totalRaw += result.rawScore();
            individual.add(result.rawScore());
        }
        double compoundMult = 1.0 + (count - 1) * COMPOUND_STEP;
        double compounded = totalRaw * compoundMult;
        double normalized = Math.min(100.0, compounded / COMPOUND_NORMALIZER * 100.0);
        SeverityLevel level = SeverityLevel.fromNormalizedScore(normalized);

        Map<String, Object> factors = new LinkedHashMap<>();
        factors.put("pattern_count", count);
        factors.put("compound_multiplier", compoundMult);
        factors.put("individual_scores", List.copyOf(individual));

        String explanation = count + " patterns converge affecting " + domain.token() + " domain. "
                           + "Combined severity: " + level.token() + ".";
        return new SeverityResult(round2(compounded), round1(normalized), level, factors, explanation);
    }

    /**
     * Health compound severity plus organ-system ranking of the affected elements.
     * Elements that are not one of the five phases are ignored.
     */
    public static HealthSeverity calculateHealthSeverity(
            List<SeverityResult> results,
            Collection<String> affectedElements,
            Map<String, String> seasonalStates,
            String daymasterElement) {

        SeverityResult base = calculateCompoundSeverity(results, LifeDomain.HEALTH);

        List<AffectedOrgan> organs = new ArrayList<>();
        for (String element : affectedElements) {
            OrganSystem organ = OrganSystem.forElement(element);
            if (organ == null) {
                continue;
            }
            String state = seasonalStates.getOrDefault(element, SeasonalState.RESTING.displayName());
            organs.add(new AffectedOrgan(
                element, organ.zangOrgan(), organ.fuOrgan(), organ.nativeZang(), organ.nativeFu(),
                organ.bodyParts(), organ.emotion(), state, SeasonalState.multiplierOf(state)));
        }
        // List.sort is stable: equal vulnerability keeps element order
        organs.sort(Comparator.comparingDouble(AffectedOrgan::vulnerability).reversed());

        AffectedOrgan mostVulnerable = organs.isEmpty() ? null : organs.get(0);
        return new HealthSeverity(base, organs, mostVulnerable, healthRecommendation(mostVulnerable, base.level()));
    }

    /**
     * Wealth compound severity scaled by the wealth element's seasonal multiplier.
     */
    public static WealthSeverity calculateWealthSeverity(
            List<SeverityResult> results,
            String wealthElement,
            String seasonalState) {

        SeverityResult base = calculateCompoundSeverity(results, LifeDomain.WEALTH);
        double adjusted = base.normalizedScore() * SeasonalState.multiplierOf(seasonalState);
        return new WealthSeverity(base, wealthElement, seasonalState, round1(adjusted),
            wealthRecommendation(base.level()));
    }

    // ── helpers ──────────────────────────────────────────────────────────────

    static double dayMasterRelevance(String patternElement, String daymasterElement) {
        if (patternElement == null || patternElement.isEmpty()) {
            return 1.0;
        }
        if (patternElement.equals(daymasterElement)) {
            return SAME_ELEMENT_RELEVANCE;
        }
        Set<String> related = ELEMENT_RELATIONS.get(patternElement);
        return related != null && related.contains(daymasterElement) ? RELATED_RELEVANCE : 1.0;
    }

    private static String explain(String patternId, SeverityLevel level, double seasonalMult,
                                  double dmRelevance, String seasonalState, PillarPosition pillar) {
        List<String> parts = new ArrayList<>();
        String id = patternId == null ? "" : patternId;
        int separator = id.indexOf('~');
        parts.add((separator >= 0 ? id.substring(0, separator) : id) + " pattern detected");
        parts.add(level.phrase());
        if (seasonalMult > SEASONAL_NOTE_THRESHOLD) {
            parts.add("amplified by " + seasonalState + " seasonal state");
        }
        if (dmRelevance > RELEVANCE_NOTE_THRESHOLD) {
            parts.add("directly affecting Day Master");
        }
        if (pillar == PillarPosition.DAY) {
            parts.add("in personal Day pillar");
        } else if (pillar == PillarPosition.MONTH) {
            parts.add("in career Month pillar");
        }
        return String.join(". ", parts) + ".";
    }

    private static String healthRecommendation(AffectedOrgan primary, SeverityLevel level) {
        if (primary == null) {
            return "No specific organ vulnerability detected.";
        }
        String advice = OrganSystem.forElement(primary.element()).careAdvice();
        if (level == SeverityLevel.MAJOR || level == SeverityLevel.CRITICAL) {
            return "IMPORTANT: " + advice + ". Consider consulting a healthcare provider.";
        }
        return advice;
    }

    private static String wealthRecommendation(SeverityLevel level) {
        return switch (level) {
            case CRITICAL -> "High financial volatility expected. Avoid major investments. Preserve capital.";
            case MAJOR    -> "Financial caution advised. Review investments and reduce risk exposure.";
            case MODERATE -> "Minor financial fluctuations possible. Maintain diversified portfolio.";
            case MINOR    -> "Financial outlook stable. Normal business operations can continue.";
        };
    }

    static double round2(double value) {
        return Math.round(value * 100.0) / 100.0;
    }

    static double round1(double value) {
        return Math.round(value * 10.0) / 10.0;
    }
}

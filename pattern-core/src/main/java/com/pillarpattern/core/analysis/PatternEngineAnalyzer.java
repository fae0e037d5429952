package com.pillarpattern.core.analysis;

import com.pillarpattern.core.model.InteractionId;
import com.pillarpattern.core.model.LifeDomain;
import com.pillarpattern.core.model.PatternCategory;
import com.pillarpattern.core.model.PatternSpec;
import com.pillarpattern.core.model.PillarPosition;
import com.pillarpattern.core.model.SeasonalState;
import com.pillarpattern.core.registry.PatternRegistry;
import com.pillarpattern.core.severity.HealthSeverity;
import com.pillarpattern.core.severity.SeverityCalculator;
import com.pillarpattern.core.severity.SeverityResult;
import com.pillarpattern.core.taxonomy.EventTaxonomy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Scores a chart's interaction map against the pattern catalog.
 *
 * <p>Per interaction: parse the identifier, map its type to a category (unknown types are
 * skipped), resolve the catalog pattern, score severity, attach the primary pillar's meaning
 * and predict events. Unresolved patterns are still scored with their category weight.
 * The matches are then aggregated per life domain, special stars are detected from the
 * Day Master and Year Branch, and a health deep-dive and recommendations are derived.
 *
 * <p>Never throws on malformed interaction data, holds no mutable state and is deterministic
 * for identical inputs, so one instance can serve concurrent callers.
 */
public class PatternEngineAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(PatternEngineAnalyzer.class);

    // Domain contributors are rebuilt from their normalized score with this raw ratio
    static final double CONTRIBUTOR_RAW_RATIO = 0.3;
    static final int TOP_CONTRIBUTORS = 3;

    private final PatternRegistry registry;
    private final PatternResolver resolver;
    private final EventPredictor eventPredictor;
    private final SpecialStarDetector starDetector;
    private final RecommendationGenerator recommendationGenerator;

    public PatternEngineAnalyzer(PatternRegistry registry, EventTaxonomy taxonomy) {
        this.registry = registry;
        this.resolver = new PatternResolver(registry);
        this.eventPredictor = new EventPredictor(taxonomy);
        this.starDetector = new SpecialStarDetector();
        this.recommendationGenerator = new RecommendationGenerator();
    }

    public PatternRegistry registry() {
        return registry;
    }

    /**
     * @param interactions      identifier → interaction; values may be {@link Interaction}s, raw maps
     *                          as decoded from JSON, or bare strings (placeholders, skipped)
     * @param seasonalStates    element → seasonal state name
     * @param daymasterStem     Day Master stem, keys the Day-Master special stars
     * @param daymasterElement  Day Master element, drives relevance scoring
     * @param postElementScore  element → score after interactions; accepted for callers that
     *                          already compute it, not used in scoring
     * @param yearBranch        may be null or empty; enables the Year-Branch special stars
     */
    public PatternAnalysis analyzeInteractions(
            Map<String, ?> interactions,
            Map<String, String> seasonalStates,
            String daymasterStem,
            String daymasterElement,
            Map<String, Double> postElementScore,
            String yearBranch) {

        Map<String, ?> safeInteractions = interactions == null ? Map.of() : interactions;
        Map<String, String> safeStates = seasonalStates == null ? Map.of() : seasonalStates;

        List<EnhancedPatternMatch> matches = new ArrayList<>();
        Map<LifeDomain, List<DomainContributor>> domainRisks = new EnumMap<>(LifeDomain.class);
        Set<String> affectedElements = new LinkedHashSet<>();

        for (Map.Entry<String, ?> entry : safeInteractions.entrySet()) {
            String interactionKey = entry.getKey();
            Interaction interaction = Interaction.from(entry.getValue());
            if (interaction == null) {
                continue;
            }

            InteractionId id = InteractionId.parse(interactionKey);
            PatternCategory category = PatternCategory.fromInteractionType(id.type());
            if (category == null) {
                log.debug("Skipping interaction {}: unrecognized type {}", interactionKey, id.type());
                continue;
            }

            String element = interaction.element();
            Optional<PatternSpec> resolved = resolver.resolve(category, id, element);
            if (resolved.isEmpty()) {
                log.debug("No catalog pattern for {}, scoring generically", interactionKey);
            }
            PatternSpec pattern = resolved.orElse(null);

            if (element != null) {
                affectedElements.add(element);
            }
            String seasonalState = element == null
                ? SeasonalState.RESTING.displayName()
                : safeStates.getOrDefault(element, SeasonalState.RESTING.displayName());
            int distance = interaction.normalizedDistance();
            int primaryPosition = interaction.primaryPosition();

            SeverityResult severity = SeverityCalculator.calculatePatternSeverity(
                interactionKey, category, distance, seasonalState, primaryPosition,
                daymasterElement, element, interaction.transformed());

            List<LifeDomain> domains = pattern == null ? List.of() : List.copyOf(pattern.lifeDomains());
            String pillarMeaning = pattern == null || pattern.pillarMeanings() == null
                ? ""
                : pattern.pillarMeanings().forPosition(PillarPosition.fromIndex(primaryPosition));

            matches.add(new EnhancedPatternMatch(
                interactionKey,
                category,
                pattern == null ? id.type() : pattern.nativeName(),
                pattern == null ? id.type() : pattern.englishName(),
                id.participants(),
                distance,
                interaction.transformed(),
                SeveritySummary.of(severity),
                domains,
                pillarMeaning,
                eventPredictor.predict(pattern, category, severity.normalizedScore())));

            for (LifeDomain domain : domains) {
                domainRisks.computeIfAbsent(domain, d -> new ArrayList<>())
                    .add(new DomainContributor(interactionKey, severity.normalizedScore(), severity.level()));
            }
        }

        Map<String, DomainSummary> domainAnalysis = summarizeDomains(domainRisks);
        List<SpecialStarHit> specialStars = starDetector.detect(daymasterStem, safeInteractions.keySet(), yearBranch);

        HealthSeverity healthEnhanced = null;
        List<DomainContributor> healthRisks = domainRisks.get(LifeDomain.HEALTH);
        if (healthRisks != null && !affectedElements.isEmpty()) {
            healthEnhanced = SeverityCalculator.calculateHealthSeverity(
                asSeverityResults(healthRisks), affectedElements, safeStates, daymasterElement);
        }

        List<Recommendation> recommendations = recommendationGenerator.generate(domainAnalysis, safeStates);

        log.debug("Analyzed {} interactions: matches={} domains={} stars={}",
            safeInteractions.size(), matches.size(), domainAnalysis.keySet(), specialStars.size());

        return new PatternAnalysis(matches, matches.size(), domainAnalysis, new ArrayList<>(affectedElements),
            specialStars, healthEnhanced, recommendations);
    }

    private static Map<String, DomainSummary> summarizeDomains(Map<LifeDomain, List<DomainContributor>> domainRisks) {
        Map<String, DomainSummary> summaries = new LinkedHashMap<>();
        // EnumMap iterates in declaration order
        domainRisks.forEach((domain, risks) -> {
            SeverityResult compound = SeverityCalculator.calculateCompoundSeverity(asSeverityResults(risks), domain);
            List<DomainContributor> top = risks.stream()
                .sorted(Comparator.comparingDouble(DomainContributor::severity).reversed())
                .limit(TOP_CONTRIBUTORS)
                .toList();
            summaries.put(domain.token(),
                new DomainSummary(risks.size(), compound.normalizedScore(), compound.level(), top));
        });
        return summaries;
    }

    private static List<SeverityResult> asSeverityResults(List<DomainContributor> risks) {
        return risks.stream()
            .map(r -> new SeverityResult(r.severity() * CONTRIBUTOR_RAW_RATIO, r.severity(), r.level(), Map.of(), ""))
            .toList();
    }
}

package com.pillarpattern.core.analysis;

import com.pillarpattern.core.model.LifeDomain;
import com.pillarpattern.core.model.SeasonalState;
import com.pillarpattern.core.taxonomy.OrganSystem;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Fixed-template advice for domains whose compound severity crosses a threshold.
 *
 * <pre>
 *   health       &gt; 50  (high priority above 70; names the seasonally weakest element's organ)
 *   wealth       &gt; 40
 *   career       &gt; 50
 *   relationship &gt; 40
 * </pre>
 */
public class RecommendationGenerator {

    static final double HEALTH_THRESHOLD       = 50.0;
    static final double HEALTH_HIGH_THRESHOLD  = 70.0;
    static final double WEALTH_THRESHOLD       = 40.0;
    static final double CAREER_THRESHOLD       = 50.0;
    static final double RELATIONSHIP_THRESHOLD = 40.0;

    static final String HIGH   = "high";
    static final String MEDIUM = "medium";

    public List<Recommendation> generate(Map<String, DomainSummary> domainAnalysis, Map<String, String> seasonalStates) {
        List<Recommendation> recommendations = new ArrayList<>();

        DomainSummary health = domainAnalysis.get(LifeDomain.HEALTH.token());
        if (health != null && health.compoundSeverity() > HEALTH_THRESHOLD) {
            OrganSystem organ = OrganSystem.forElement(mostVulnerableElement(seasonalStates));
            if (organ != null) {
                recommendations.add(new Recommendation(
                    LifeDomain.HEALTH,
                    health.compoundSeverity() > HEALTH_HIGH_THRESHOLD ? HIGH : MEDIUM,
                    "Support " + organ.zangOrgan() + " Function",
                    "Your " + organ.zangOrgan() + " (" + organ.nativeZang() + ") may need attention. "
                        + "Associated body parts: " + String.join(", ", organ.bodyParts()) + ". "
                        + "Manage " + organ.emotion() + " for better balance."));
            }
        }

        DomainSummary wealth = domainAnalysis.get(LifeDomain.WEALTH.token());
        if (wealth != null && wealth.compoundSeverity() > WEALTH_THRESHOLD) {
            recommendations.add(new Recommendation(LifeDomain.WEALTH, MEDIUM,
                "Financial Caution Advised",
                "Multiple patterns indicate financial fluctuations. "
                    + "Consider conservative investments and avoid major financial commitments."));
        }

        DomainSummary career = domainAnalysis.get(LifeDomain.CAREER.token());
        if (career != null && career.compoundSeverity() > CAREER_THRESHOLD) {
            recommendations.add(new Recommendation(LifeDomain.CAREER, MEDIUM,
                "Career Dynamics Active",
                "Significant career energy detected. "
                    + "Be prepared for changes and opportunities in your professional life."));
        }

        DomainSummary relationship = domainAnalysis.get(LifeDomain.RELATIONSHIP.token());
        if (relationship != null && relationship.compoundSeverity() > RELATIONSHIP_THRESHOLD) {
            recommendations.add(new Recommendation(LifeDomain.RELATIONSHIP, MEDIUM,
                "Relationship Attention Needed",
                "Relationship patterns are active. "
                    + "Focus on communication and understanding in close relationships."));
        }

        return recommendations;
    }

    /**
     * Element with the highest seasonal multiplier over the whole table, first one on ties.
     * Null when the table is empty.
     */
    static String mostVulnerableElement(Map<String, String> seasonalStates) {
        String vulnerable = null;
        double maxMultiplier = 0.0;
        for (Map.Entry<String, String> entry : seasonalStates.entrySet()) {
            double multiplier = SeasonalState.multiplierOf(entry.getValue());
            if (multiplier > maxMultiplier) {
                maxMultiplier = multiplier;
                vulnerable = entry.getKey();
            }
        }
        return vulnerable;
    }
}

package com.pillarpattern.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable declarative rule describing one classical interaction, its scoring parameters
 * and its domain effects.
 *
 * <p>The identifier encodes {@code TYPE~participant-participant[-...]~qualifier}; the qualifier
 * is an element name, a subtype token, a day stem context or empty.
 *
 * <p>Convention: {@code baseScoreTransformed}, when present, is never below
 * {@code baseScoreCombined}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record PatternSpec(
    @JsonProperty("id") String id,
    @JsonProperty("category") PatternCategory category,
    @JsonProperty("priority") int priority,
    @JsonProperty("native_name") String nativeName,
    @JsonProperty("english_name") String englishName,
    @JsonProperty("node_filters") List<NodeFilter> nodeFilters,
    @JsonProperty("min_nodes") int minNodes,
    @JsonProperty("max_nodes") Integer maxNodes,
    @JsonProperty("spatial_rule") SpatialRule spatialRule,
    @JsonProperty("temporal_rule") TemporalRule temporalRule,
    @JsonProperty("transformation") TransformSpec transformation,
    @JsonProperty("base_score_combined") double baseScoreCombined,
    @JsonProperty("base_score_transformed") Double baseScoreTransformed,
    @JsonProperty("distance_multipliers") List<Double> distanceMultipliers,
    @JsonProperty("qi_effects") List<QiEffect> qiEffects,
    @JsonProperty("badge_type") BadgeType badgeType,
    @JsonProperty("life_domains") @JsonDeserialize(as = LinkedHashSet.class) Set<LifeDomain> lifeDomains,
    @JsonProperty("pillar_meanings") PillarMeanings pillarMeanings,
    @JsonProperty("event_mapping") EventMapping eventMapping,
    @JsonProperty("description") String description,
    @JsonProperty("classical_source") String classicalSource,
    @JsonProperty("notes") String notes,
    @JsonProperty("requires") @JsonDeserialize(as = LinkedHashSet.class) Set<String> requires,
    @JsonProperty("blocked_by") @JsonDeserialize(as = LinkedHashSet.class) Set<String> blockedBy
) {
    public PatternSpec {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(category, "category");
        nodeFilters         = nodeFilters == null ? List.of() : List.copyOf(nodeFilters);
        distanceMultipliers = distanceMultipliers == null ? List.of() : List.copyOf(distanceMultipliers);
        qiEffects           = qiEffects == null ? List.of() : List.copyOf(qiEffects);
        lifeDomains         = orderedCopy(lifeDomains);
        requires            = orderedCopy(requires);
        blockedBy           = orderedCopy(blockedBy);
        if (badgeType == null) badgeType = BadgeType.COMBINATION;
        if (description == null) description = "";
        if (classicalSource == null) classicalSource = "";
        if (notes == null) notes = "";
    }

    /**
     * Branch and stem values named by the node filters, in authored order, without duplicates.
     */
    public List<String> participants() {
        Set<String> values = new LinkedHashSet<>();
        for (NodeFilter filter : nodeFilters) {
            values.addAll(filter.branches());
            values.addAll(filter.stems());
        }
        return List.copyOf(values);
    }

    public boolean hasTransformation() {
        return transformation != null;
    }

    private static <T> Set<T> orderedCopy(Set<T> source) {
        if (source == null || source.isEmpty()) {
            return Set.of();
        }
        return Collections.unmodifiableSet(new LinkedHashSet<>(source));
    }
}

package com.pillarpattern.core.analysis;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.pillarpattern.core.model.PatternCategory;
import com.pillarpattern.core.model.PillarMeanings;

import java.util.List;

public record SpecialStarHit(
    @JsonProperty("pattern_id") String patternId,
    @JsonProperty("native_name") String nativeName,
    @JsonProperty("english_name") String englishName,
    @JsonProperty("category") PatternCategory category,
    @JsonProperty("target_branch") String targetBranch,
    @JsonProperty("description") String description,
    @JsonProperty("pillar_meanings") PillarMeanings pillarMeanings,
    @JsonProperty("triggers") List<StarTrigger> triggers
) {
    public SpecialStarHit {
        triggers = List.copyOf(triggers);
    }
}

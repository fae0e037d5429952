package com.pillarpattern.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Narrative meaning of a pattern when it lands on each natal pillar.
 */
public record PillarMeanings(
    @JsonProperty("year") String year,
    @JsonProperty("month") String month,
    @JsonProperty("day") String day,
    @JsonProperty("hour") String hour
) {
    /**
     * Meaning for a pillar slot; empty for luck/transit slots or when not authored.
     */
    public String forPosition(PillarPosition position) {
        if (position == null || !position.isNatal()) {
            return "";
        }
        String meaning = switch (position) {
            case YEAR  -> year;
            case MONTH -> month;
            case DAY   -> day;
            default    -> hour;
        };
        return meaning == null ? "" : meaning;
    }
}

package com.pillarpattern.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.HashMap;
import java.util.Map;

/**
 * Closed set of pattern categories. Each constant carries its wire token and whether
 * it belongs to the combination-like family used for fallback event predictions.
 */
public enum PatternCategory {
    // Branch and stem combinations
    THREE_MEETINGS("three_meetings", true),
    THREE_COMBINATIONS("three_combinations", true),
    SIX_HARMONIES("six_harmonies", true),
    HALF_MEETINGS("half_meetings", false),
    HALF_COMBINATIONS("half_combinations", false),
    ARCHED_COMBINATIONS("arched_combinations", false),
    STEM_COMBINATION("stem_combination", true),

    // Conflicts
    CLASH("clash", false),
    PUNISHMENT("punishment", false),
    HARM("harm", false),
    DESTRUCTION("destruction", false),
    STEM_CONFLICT("stem_conflict", false),

    // Context-dependent special stars
    KONG_WANG("kong_wang", false),
    GUI_REN("gui_ren", false),
    TAO_HUA("tao_hua", false),
    YI_MA("yi_ma", false),
    YANG_REN("yang_ren", false),
    LU_SHEN("lu_shen", false),
    HUA_GAI("hua_gai", false),
    GU_CHEN("gu_chen", false),
    GUA_SU("gua_su", false);

    private static final Map<String, PatternCategory> BY_TOKEN = new HashMap<>();

    // Runtime interaction type tokens emitted by the chart engine, singular and plural spellings
    private static final Map<String, PatternCategory> INTERACTION_TYPES = Map.ofEntries(
        Map.entry("THREE_MEETINGS",      THREE_MEETINGS),
        Map.entry("THREE_COMBINATIONS",  THREE_COMBINATIONS),
        Map.entry("SIX_HARMONIES",       SIX_HARMONIES),
        Map.entry("HALF_MEETINGS",       HALF_MEETINGS),
        Map.entry("HALF_MEETING",        HALF_MEETINGS),
        Map.entry("HALF_COMBINATIONS",   HALF_COMBINATIONS),
        Map.entry("ARCHED_COMBINATIONS", ARCHED_COMBINATIONS),
        Map.entry("ARCHED_COMBINATION",  ARCHED_COMBINATIONS),
        Map.entry("HS_COMBINATIONS",     STEM_COMBINATION),
        Map.entry("HS_COMBINATION",      STEM_COMBINATION),
        Map.entry("STEM_COMBINATION",    STEM_COMBINATION),
        Map.entry("CLASH",               CLASH),
        Map.entry("CLASHES",             CLASH),
        Map.entry("PUNISHMENT",          PUNISHMENT),
        Map.entry("PUNISHMENTS",         PUNISHMENT),
        Map.entry("HARM",                HARM),
        Map.entry("HARMS",               HARM),
        Map.entry("DESTRUCTION",         DESTRUCTION),
        Map.entry("STEM_CONFLICT",       STEM_CONFLICT),
        Map.entry("STEM_CONFLICTS",      STEM_CONFLICT)
    );

    static {
        for (PatternCategory category : values()) {
            BY_TOKEN.put(category.token, category);
        }
    }

    private final String token;
    private final boolean combinationLike;

    PatternCategory(String token, boolean combinationLike) {
        this.token = token;
        this.combinationLike = combinationLike;
    }

    @JsonValue
    public String token() {
        return token;
    }

    /**
     * Whether a match without authored event mapping is predicted as a career opportunity
     * rather than a health warning.
     */
    public boolean isCombinationLike() {
        return combinationLike;
    }

    /**
     * Resolves a wire token (case-insensitive). Returns null for unknown tokens.
     */
    @JsonCreator
    public static PatternCategory fromToken(String token) {
        return token == null ? null : BY_TOKEN.get(token.toLowerCase());
    }

    /**
     * Resolves the type segment of a runtime interaction identifier.
     * Returns null for types the engine does not score.
     */
    public static PatternCategory fromInteractionType(String interactionType) {
        return interactionType == null ? null : INTERACTION_TYPES.get(interactionType);
    }

    @Override
    public String toString() {
        return token;
    }
}

package com.pillarpattern.core.model;

import java.util.Map;

/**
 * Seasonal vigor of an element. A state further from vigor amplifies severity.
 */
public enum SeasonalState {
    PROSPEROUS("Prosperous", 0.6),
    STRENGTHENING("Strengthening", 0.8),
    RESTING("Resting", 1.0),
    TRAPPED("Trapped", 1.4),
    DEAD("Dead", 1.8);

    public static final double DEFAULT_MULTIPLIER = 1.0;

    private static final Map<String, SeasonalState> BY_NAME = Map.of(
        "Prosperous",    PROSPEROUS,
        "Strengthening", STRENGTHENING,
        "Resting",       RESTING,
        "Trapped",       TRAPPED,
        "Dead",          DEAD
    );

    private final String displayName;
    private final double multiplier;

    SeasonalState(String displayName, double multiplier) {
        this.displayName = displayName;
        this.multiplier = multiplier;
    }

    public String displayName() {
        return displayName;
    }

    public double multiplier() {
        return multiplier;
    }

    /**
     * Resolves a state name as emitted by the chart engine. Returns null for unknown names.
     */
    public static SeasonalState fromName(String name) {
        return name == null ? null : BY_NAME.get(name);
    }

    /**
     * Multiplier for a raw state name, {@value #DEFAULT_MULTIPLIER} when unrecognized.
     */
    public static double multiplierOf(String name) {
        SeasonalState state = fromName(name);
        return state == null ? DEFAULT_MULTIPLIER : state.multiplier;
    }
}

package com.pillarpattern.core.model;

import java.util.Map;

/**
 * Pillar slots addressed by interaction positions. Slots 0-3 are the natal pillars;
 * 4-8 are luck and transit pillars, which carry the year weight.
 */
public enum PillarPosition {
    HOUR(0, "hour", 1.0),
    DAY(1, "day", 1.5),
    MONTH(2, "month", 1.2),
    YEAR(3, "year", 1.0),
    TEN_YEAR_LUCK(4, "10yl", 1.0),
    ANNUAL(5, "annual", 1.0),
    MONTHLY(6, "monthly", 1.0),
    DAILY(7, "daily", 1.0),
    HOURLY(8, "hourly", 1.0);

    // Node id suffix (after hs_/eb_) -> pillar
    private static final Map<String, PillarPosition> NODE_SUFFIXES = Map.of(
        "h",    HOUR,
        "d",    DAY,
        "m",    MONTH,
        "y",    YEAR,
        "10yl", TEN_YEAR_LUCK,
        "yl",   ANNUAL,
        "ml",   MONTHLY,
        "dl",   DAILY,
        "hl",   HOURLY
    );

    private final int index;
    private final String label;
    private final double weight;

    PillarPosition(int index, String label, double weight) {
        this.index = index;
        this.label = label;
        this.weight = weight;
    }

    public int index() {
        return index;
    }

    public String label() {
        return label;
    }

    public double weight() {
        return weight;
    }

    public boolean isNatal() {
        return index <= YEAR.index;
    }

    /** Returns null for indexes outside 0-8. */
    public static PillarPosition fromIndex(int index) {
        for (PillarPosition position : values()) {
            if (position.index == index) {
                return position;
            }
        }
        return null;
    }

    /**
     * Resolves a chart node id such as {@code eb_d} or {@code hs_10yl}. Returns null for
     * anything that is not a stem or branch node id.
     */
    public static PillarPosition fromNodeId(String nodeId) {
        if (nodeId == null || nodeId.length() < 4) {
            return null;
        }
        String prefix = nodeId.substring(0, 3);
        if (!prefix.equals("hs_") && !prefix.equals("eb_")) {
            return null;
        }
        return NODE_SUFFIXES.get(nodeId.substring(3));
    }
}

package com.pillarpattern.core.analysis;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * One interaction record from the chart engine. Every field is optional; malformed values
 * degrade to defaults instead of failing.
 *
 * @param element     element the interaction is attributed to, null when absent
 * @param distance    an integer, a numeric string or {@code distance_<N>}; see {@link #normalizedDistance()}
 * @param transformed whether a combination transformed
 * @param positions   pillar slots taking part
 */
public record Interaction(String element, Object distance, boolean transformed, List<Integer> positions) {

    static final int DEFAULT_DISTANCE = 1;
    static final int DEFAULT_POSITION = 1;   // day pillar

    private static final String DISTANCE_PREFIX = "distance_";

    public Interaction {
        if (element != null && element.isEmpty()) element = null;
        positions = positions == null ? List.of() : List.copyOf(positions);
    }

    public static Interaction of(String element, Object distance, boolean transformed, List<Integer> positions) {
        return new Interaction(element, distance, transformed, positions);
    }

    /**
     * Adapts a raw map value as decoded from JSON. Returns null for bare strings (upstream
     * placeholders) and anything else that is not a record.
     */
    public static Interaction from(Object raw) {
        if (raw instanceof Interaction interaction) {
            return interaction;
        }
        if (!(raw instanceof Map<?, ?> map)) {
            return null;
        }
        Object element = map.get("element");
        List<Integer> positions = new ArrayList<>();
        if (map.get("positions") instanceof List<?> rawPositions) {
            for (Object position : rawPositions) {
                if (position instanceof Number number) {
                    positions.add(number.intValue());
                }
            }
        }
        return new Interaction(
            element instanceof String s ? s : null,
            map.get("distance"),
            Boolean.TRUE.equals(map.get("transformed")),
            positions);
    }

    /**
     * Integer distance. {@code distance_<N>} yields N; a numeric string or number yields its
     * integer value; zero, absent or unparsable values yield {@value #DEFAULT_DISTANCE}.
     */
    public int normalizedDistance() {
        if (distance instanceof Number number) {
            int value = number.intValue();
            return value == 0 ? DEFAULT_DISTANCE : value;
        }
        if (distance instanceof String text) {
            String trimmed = text.trim();
            if (trimmed.startsWith(DISTANCE_PREFIX)) {
                Integer value = parseLeadingInt(trimmed.substring(DISTANCE_PREFIX.length()));
                return value == null ? DEFAULT_DISTANCE : value;
            }
            Integer value = parseLeadingInt(trimmed);
            return value == null || value == 0 ? DEFAULT_DISTANCE : value;
        }
        return DEFAULT_DISTANCE;
    }

    /** Minimum listed position, {@value #DEFAULT_POSITION} when none. */
    public int primaryPosition() {
        return positions.stream().mapToInt(Integer::intValue).min().orElse(DEFAULT_POSITION);
    }

    // Leading optional sign and digits, e.g. "3", "-2", "4.5" -> 4; null when no digits lead
    private static Integer parseLeadingInt(String text) {
        int end = 0;
        if (end < text.length() && (text.charAt(end) == '-' || text.charAt(end) == '+')) {
            end++;
        }
        int digitsStart = end;
        while (end < text.length() && Character.isDigit(text.charAt(end))) {
            end++;
        }
        if (end == digitsStart) {
            return null;
        }
        try {
            return Integer.parseInt(text.substring(0, end));
        } catch (NumberFormatException e) {
            // overflow
            return null;
        }
    }
}

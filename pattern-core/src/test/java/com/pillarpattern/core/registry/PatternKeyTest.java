package com.pillarpattern.core.registry;

import com.pillarpattern.core.model.PatternCategory;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.pillarpattern.core.PatternFixtures.spec;
import static org.junit.jupiter.api.Assertions.*;

class PatternKeyTest {

    @Test
    @DisplayName("triad in any order → same key")
    void triadPermutations() {
        PatternKey canonical = PatternKey.of(PatternCategory.THREE_MEETINGS, List.of("Yin", "Mao", "Chen"), "Wood");
        PatternKey reordered = PatternKey.of(PatternCategory.THREE_MEETINGS, List.of("Chen", "Yin", "Mao"), "Wood");
        assertEquals(canonical, reordered);
    }

    @Test
    @DisplayName("four participants stay order-sensitive")
    void quadIsOrdered() {
        PatternKey a = PatternKey.of(PatternCategory.PUNISHMENT, List.of("Zi", "Mao", "Wu", "You"), "");
        PatternKey b = PatternKey.of(PatternCategory.PUNISHMENT, List.of("Mao", "Zi", "Wu", "You"), "");
        assertNotEquals(a, b);
    }

    @Test
    @DisplayName("null qualifier equals empty qualifier")
    void nullQualifier() {
        assertEquals(
            PatternKey.of(PatternCategory.HARM, List.of("Zi", "Wei"), null),
            PatternKey.of(PatternCategory.HARM, List.of("Wei", "Zi"), ""));
    }

    @Test
    @DisplayName("forSpec → trailing separator id keyed without qualifier")
    void forSpecTrailingSeparator() {
        PatternKey key = PatternKey.forSpec(spec("HARM~Zi-Wei~", PatternCategory.HARM, 240, "Zi", "Wei"));
        assertEquals(PatternKey.of(PatternCategory.HARM, List.of("Zi", "Wei"), ""), key);
    }

    @Test
    @DisplayName("withQualifier keeps category and participants")
    void withQualifier() {
        PatternKey key = PatternKey.of(PatternCategory.CLASH, List.of("Zi", "Wu"), "").withQualifier("opposite");
        assertEquals(PatternCategory.CLASH, key.category());
        assertEquals(List.of("Wu", "Zi"), key.participants());
        assertEquals("opposite", key.qualifier());
    }
}

package com.pillarpattern.core.analysis;

import com.pillarpattern.core.catalog.PatternCatalog;
import com.pillarpattern.core.model.LifeDomain;
import com.pillarpattern.core.model.PatternCategory;
import com.pillarpattern.core.model.PatternSpec;
import com.pillarpattern.core.model.Sentiment;
import com.pillarpattern.core.registry.PatternRegistry;
import com.pillarpattern.core.taxonomy.EventTaxonomy;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class EventPredictorTest {

    private static final double DELTA = 1e-9;

    private static PatternRegistry registry;
    private static EventPredictor predictor;

    @BeforeAll
    static void setUp() {
        registry = PatternCatalog.loadDefault();
        predictor = new EventPredictor(EventTaxonomy.loadDefault());
    }

    @Test
    @DisplayName("authored negatives → capped at 0.8, named from the taxonomy")
    void authoredNegatives() {
        PatternSpec clash = registry.get("CLASH~Zi-Wu~opposite").orElseThrow();
        List<EventPrediction> predictions = predictor.predict(clash, PatternCategory.CLASH, 80.3);

        assertEquals(5, predictions.size());
        EventPrediction first = predictions.get(0);
        assertEquals(LifeDomain.HEALTH, first.domain());
        assertEquals("illness_major", first.eventType());
        assertEquals("Major Illness", first.eventName());
        assertEquals(Sentiment.NEGATIVE, first.sentiment());
        assertEquals(0.8, first.probability(), DELTA);
    }

    @Test
    @DisplayName("authored positives → 0.5 + n/200, listed first, truncated to five")
    void authoredPositives() {
        PatternSpec noble = registry.get("GUI_REN~Jia~Chou").orElseThrow();
        List<EventPrediction> predictions = predictor.predict(noble, PatternCategory.GUI_REN, 40.0);

        assertEquals(4, predictions.size());
        assertTrue(predictions.stream().allMatch(p -> p.sentiment() == Sentiment.POSITIVE));
        assertEquals(0.7, predictions.get(0).probability(), DELTA);
        assertEquals("promotion", predictions.get(0).eventType());
    }

    @Test
    @DisplayName("no mapping, combination-like → career opportunity")
    void fallbackCombination() {
        List<EventPrediction> predictions = predictor.predict(null, PatternCategory.SIX_HARMONIES, 90.0);
        assertEquals(List.of(new EventPrediction(LifeDomain.CAREER, "opportunity", "opportunity",
            Sentiment.POSITIVE, 0.8)), predictions);
    }

    @Test
    @DisplayName("no mapping, conflict → health attention, capped at 0.7")
    void fallbackConflict() {
        PatternSpec harm = registry.get("HARM~Zi-Wei~").orElseThrow();
        List<EventPrediction> predictions = predictor.predict(harm, PatternCategory.HARM, 45.0);

        assertEquals(1, predictions.size());
        assertEquals("attention_needed", predictions.get(0).eventType());
        assertEquals(Sentiment.NEGATIVE, predictions.get(0).sentiment());
        assertEquals(0.45, predictions.get(0).probability(), DELTA);
        assertEquals(0.7, predictor.predict(null, PatternCategory.CLASH, 99.0).get(0).probability(), DELTA);
    }
}

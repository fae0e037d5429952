package com.pillarpattern.core.analysis;

import com.pillarpattern.core.model.DomainEvent;
import com.pillarpattern.core.model.EventMapping;
import com.pillarpattern.core.model.LifeDomain;
import com.pillarpattern.core.model.PatternCategory;
import com.pillarpattern.core.model.PatternSpec;
import com.pillarpattern.core.model.Sentiment;
import com.pillarpattern.core.taxonomy.EventTaxonomy;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns a scored match into up to {@value #MAX_PREDICTIONS} event predictions.
 *
 * <pre>
 *   authored positive  p = min(0.9, 0.5 + normalized / 200)
 *   authored negative  p = min(0.8, 0.4 + normalized / 200)
 *   fallback, combination-like category  career/opportunity/positive       p = min(0.8, normalized / 100)
 *   fallback, otherwise                  health/attention_needed/negative  p = min(0.7, normalized / 100)
 * </pre>
 * Positives are listed before negatives, each in authored order.
 */
public class EventPredictor {

    static final int MAX_PREDICTIONS = 5;

    static final double POSITIVE_BASE = 0.5;
    static final double POSITIVE_CAP  = 0.9;
    static final double NEGATIVE_BASE = 0.4;
    static final double NEGATIVE_CAP  = 0.8;
    static final double FALLBACK_OPPORTUNITY_CAP = 0.8;
    static final double FALLBACK_ATTENTION_CAP   = 0.7;

    static final String OPPORTUNITY      = "opportunity";
    static final String ATTENTION_NEEDED = "attention_needed";

    private final EventTaxonomy taxonomy;

    public EventPredictor(EventTaxonomy taxonomy) {
        this.taxonomy = taxonomy;
    }

    /**
     * @param pattern    matched spec, null when unresolved
     * @param category   resolved category of the interaction type
     * @param normalized normalized severity of the match
     */
    public List<EventPrediction> predict(PatternSpec pattern, PatternCategory category, double normalized) {
        EventMapping mapping = pattern == null ? null : pattern.eventMapping();
        if (mapping == null) {
            return List.of(fallback(category, normalized));
        }

        List<EventPrediction> predictions = new ArrayList<>();
        double positive = Math.min(POSITIVE_CAP, POSITIVE_BASE + normalized / 200.0);
        for (DomainEvent event : mapping.positiveEvents()) {
            predictions.add(prediction(event.domain(), event.event(), Sentiment.POSITIVE, positive));
        }
        double negative = Math.min(NEGATIVE_CAP, NEGATIVE_BASE + normalized / 200.0);
        for (DomainEvent event : mapping.negativeEvents()) {
            predictions.add(prediction(event.domain(), event.event(), Sentiment.NEGATIVE, negative));
        }
        return predictions.size() > MAX_PREDICTIONS ? predictions.subList(0, MAX_PREDICTIONS) : predictions;
    }

    private EventPrediction fallback(PatternCategory category, double normalized) {
        if (category != null && category.isCombinationLike()) {
            return prediction(LifeDomain.CAREER, OPPORTUNITY, Sentiment.POSITIVE,
                Math.min(FALLBACK_OPPORTUNITY_CAP, normalized / 100.0));
        }
        return prediction(LifeDomain.HEALTH, ATTENTION_NEEDED, Sentiment.NEGATIVE,
            Math.min(FALLBACK_ATTENTION_CAP, normalized / 100.0));
    }

    private EventPrediction prediction(LifeDomain domain, String eventType, Sentiment sentiment, double probability) {
        return new EventPrediction(domain, eventType, taxonomy.displayName(eventType), sentiment, probability);
    }
}

package com.pillarpattern.core.taxonomy;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.pillarpattern.core.exception.PatternCatalogException;
import com.pillarpattern.core.model.LifeDomain;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Static reference table of canonical life events, loaded from the classpath.
 */
public class EventTaxonomy {

    private static final Logger log = LoggerFactory.getLogger(EventTaxonomy.class);

    public static final String DEFAULT_RESOURCE = "taxonomy/event-types.json";

    private final Map<String, EventType> events;

    public EventTaxonomy(Collection<EventType> eventTypes) {
        Map<String, EventType> indexed = new LinkedHashMap<>();
        for (EventType event : eventTypes) {
            indexed.putIfAbsent(event.id(), event);
        }
        this.events = Collections.unmodifiableMap(indexed);
    }

    public static EventTaxonomy loadDefault() {
        return load(new ObjectMapper(), DEFAULT_RESOURCE);
    }

    /**
     * @throws PatternCatalogException when the resource is missing or not valid JSON
     */
    public static EventTaxonomy load(ObjectMapper mapper, String resource) {
        try (InputStream in = EventTaxonomy.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null) {
                throw new PatternCatalogException(resource, "resource not found on classpath");
            }
            List<EventType> eventTypes = mapper.readValue(in, new TypeReference<List<EventType>>() {});
            log.info("Loaded {} event types from {}", eventTypes.size(), resource);
            return new EventTaxonomy(eventTypes);
        } catch (IOException e) {
            throw new PatternCatalogException(resource, "unreadable event taxonomy", e);
        }
    }

    public Optional<EventType> get(String id) {
        return Optional.ofNullable(events.get(id));
    }

    /** Display name of an event id, or the id itself when unknown. */
    public String displayName(String id) {
        EventType event = events.get(id);
        return event == null ? id : event.name();
    }

    public List<EventType> byDomain(LifeDomain domain) {
        return events.values().stream()
            .filter(e -> e.domain() == domain)
            .toList();
    }

    /** Events listing the element as primary or secondary. */
    public List<EventType> byElement(String element) {
        return events.values().stream()
            .filter(e -> e.involvesElement(element))
            .toList();
    }

    public List<EventType> all() {
        return List.copyOf(events.values());
    }

    public int size() {
        return events.size();
    }

    public TaxonomyStatistics statistics() {
        Map<String, Integer> byDomain = new LinkedHashMap<>();
        Map<String, Integer> bySentiment = new LinkedHashMap<>();
        int correlated = 0;
        for (EventType event : events.values()) {
            byDomain.merge(event.domain().token(), 1, Integer::sum);
            bySentiment.merge(event.defaultSentiment().token(), 1, Integer::sum);
            if (!event.commonPatterns().isEmpty()) {
                correlated++;
            }
        }
        return new TaxonomyStatistics(events.size(), byDomain, bySentiment, correlated);
    }
}

package com.pillarpattern.core.catalog;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.pillarpattern.core.exception.PatternCatalogException;
import com.pillarpattern.core.model.PatternSpec;
import com.pillarpattern.core.registry.PatternRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;

/**
 * Loads the static pattern catalog: combination, conflict and stem patterns from classpath
 * JSON resources, plus the generated special stars.
 */
public final class PatternCatalog {

    private static final Logger log = LoggerFactory.getLogger(PatternCatalog.class);

    public static final List<String> DEFAULT_RESOURCES = List.of(
        "catalog/branch-combinations.json",
        "catalog/branch-conflicts.json",
        "catalog/stem-patterns.json"
    );

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private PatternCatalog() {}

    /**
     * Registry over the default resources and every special star.
     */
    public static PatternRegistry loadDefault() {
        return load(DEFAULT_RESOURCES, true);
    }

    /**
     * @param resources           classpath JSON resources, each an array of pattern specs
     * @param includeSpecialStars also register {@link SpecialStarCatalog#all()}
     * @throws PatternCatalogException when a resource is missing or malformed
     */
    public static PatternRegistry load(List<String> resources, boolean includeSpecialStars) {
        PatternRegistry registry = new PatternRegistry();
        for (String resource : resources) {
            List<PatternSpec> patterns = readResource(resource);
            int added = registry.registerAll(patterns, true);
            log.info("Loaded {} patterns from {} ({} new)", patterns.size(), resource, added);
        }
        if (includeSpecialStars) {
            int added = registry.registerAll(SpecialStarCatalog.all(), true);
            log.info("Registered {} special star patterns", added);
        }
        log.info("Pattern catalog ready. total={}", registry.size());
        return registry;
    }

    /**
     * Parses one catalog resource without registering it.
     */
    public static List<PatternSpec> readResource(String resource) {
        try (InputStream in = PatternCatalog.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null) {
                throw new PatternCatalogException(resource, "resource not found on classpath");
            }
            List<PatternSpec> patterns = MAPPER.readValue(in, new TypeReference<List<PatternSpec>>() {});
            return new ArrayList<>(patterns);
        } catch (IOException e) {
            throw new PatternCatalogException(resource, "malformed pattern catalog", e);
        }
    }
}

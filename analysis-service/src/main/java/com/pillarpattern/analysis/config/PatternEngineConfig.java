package com.pillarpattern.analysis.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.pillarpattern.core.analysis.PatternEngineAnalyzer;
import com.pillarpattern.core.catalog.PatternCatalog;
import com.pillarpattern.core.registry.PatternRegistry;
import com.pillarpattern.core.taxonomy.EventTaxonomy;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

@Configuration
public class PatternEngineConfig {

    @Value("${pattern-engine.catalog.resources:catalog/branch-combinations.json,catalog/branch-conflicts.json,catalog/stem-patterns.json}")
    private String[] catalogResources;

    @Value("${pattern-engine.catalog.include-special-stars:true}")
    private boolean includeSpecialStars;

    @Value("${pattern-engine.taxonomy.resource:" + EventTaxonomy.DEFAULT_RESOURCE + "}")
    private String taxonomyResource;

    @Bean
    public PatternRegistry patternRegistry() {
        return PatternCatalog.load(List.of(catalogResources), includeSpecialStars);
    }

    @Bean
    public EventTaxonomy eventTaxonomy(ObjectMapper objectMapper) {
        return EventTaxonomy.load(objectMapper, taxonomyResource);
    }

    @Bean
    public PatternEngineAnalyzer patternEngineAnalyzer(PatternRegistry registry, EventTaxonomy taxonomy) {
        return new PatternEngineAnalyzer(registry, taxonomy);
    }
}

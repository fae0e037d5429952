package com.pillarpattern.analysis.service;

import com.pillarpattern.analysis.dto.AnalyzeRequest;
import com.pillarpattern.core.analysis.PatternAnalysis;
import com.pillarpattern.core.analysis.PatternEngineAnalyzer;
import com.pillarpattern.core.model.PatternCategory;
import com.pillarpattern.core.model.PatternSpec;
import com.pillarpattern.core.registry.PatternRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.List;

@Service
public class PatternAnalysisService {

    private static final Logger log = LoggerFactory.getLogger(PatternAnalysisService.class);

    private final PatternEngineAnalyzer analyzer;
    private final PatternRegistry registry;

    public PatternAnalysisService(PatternEngineAnalyzer analyzer) {
        this.analyzer = analyzer;
        this.registry = analyzer.registry();
    }

    public Mono<PatternAnalysis> analyze(AnalyzeRequest request) {
        log.info("Analyzing {} interactions. daymaster={}/{} yearBranch={}",
            request.interactions().size(), request.daymasterStem(), request.daymasterElement(), request.yearBranch());
        return Mono.fromCallable(() -> analyzer.analyzeInteractions(
                request.interactions(),
                request.seasonalStates(),
                request.daymasterStem(),
                request.daymasterElement(),
                request.postElementScore(),
                request.yearBranch()))
            .subscribeOn(Schedulers.boundedElastic())
            .doOnSuccess(result -> log.info("Analysis complete. patterns={} domains={} stars={}",
                result.patternCount(), result.domainAnalysis().keySet(), result.specialStars().size()));
    }

    /** Empty when the identifier is not registered. */
    public Mono<PatternSpec> findPattern(String id) {
        return Mono.justOrEmpty(registry.get(id));
    }

    /**
     * @param category category token, or null for every pattern in processing order
     * @throws IllegalArgumentException for an unknown category token
     */
    public Mono<List<PatternSpec>> listPatterns(String category) {
        if (category == null || category.isBlank()) {
            return Mono.just(registry.getProcessingOrder());
        }
        PatternCategory parsed = PatternCategory.fromToken(category);
        if (parsed == null) {
            return Mono.error(new IllegalArgumentException("unknown pattern category: " + category));
        }
        return Mono.just(registry.getByCategory(parsed));
    }
}

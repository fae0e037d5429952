package com.pillarpattern.analysis.controller;

import com.pillarpattern.analysis.dto.AnalyzeRequest;
import com.pillarpattern.analysis.service.PatternAnalysisService;
import com.pillarpattern.core.analysis.PatternAnalysis;
import com.pillarpattern.core.model.PatternSpec;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

import java.util.List;

@RestController
@RequestMapping("/api/v1/patterns")
public class PatternController {

    private final PatternAnalysisService analysisService;

    public PatternController(PatternAnalysisService analysisService) {
        this.analysisService = analysisService;
    }

    @PostMapping("/analyze")
    public Mono<ResponseEntity<PatternAnalysis>> analyze(@RequestBody AnalyzeRequest request) {
        return analysisService.analyze(request)
            .map(ResponseEntity::ok);
    }

    @GetMapping
    public Mono<ResponseEntity<List<PatternSpec>>> list(
            @RequestParam(value = "category", required = false) String category) {
        return analysisService.listPatterns(category)
            .map(ResponseEntity::ok);
    }

    @GetMapping("/health")
    public ResponseEntity<String> health() {
        return ResponseEntity.ok("OK");
    }

    @GetMapping("/{id}")
    public Mono<ResponseEntity<PatternSpec>> get(@PathVariable("id") String id) {
        return analysisService.findPattern(id)
            .map(ResponseEntity::ok)
            .defaultIfEmpty(ResponseEntity.notFound().build());
    }
}

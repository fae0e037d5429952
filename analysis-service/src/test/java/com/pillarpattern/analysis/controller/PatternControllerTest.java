package com.pillarpattern.analysis.controller;

import com.pillarpattern.analysis.service.PatternAnalysisService;
import com.pillarpattern.core.analysis.PatternEngineAnalyzer;
import com.pillarpattern.core.catalog.PatternCatalog;
import com.pillarpattern.core.taxonomy.EventTaxonomy;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.reactive.server.WebTestClient;

/**
 * HTTP contract of {@link PatternController}, bound without a running server.
 */
class PatternControllerTest {

    private WebTestClient client;

    @BeforeEach
    void setUp() {
        PatternEngineAnalyzer analyzer = new PatternEngineAnalyzer(PatternCatalog.loadDefault(), EventTaxonomy.loadDefault());
        client = WebTestClient.bindToController(new PatternController(new PatternAnalysisService(analyzer)))
            .controllerAdvice(new ApiExceptionHandler())
            .build();
    }

    @Test
    @DisplayName("GET /health → OK")
    void health() {
        client.get().uri("/api/v1/patterns/health")
            .exchange()
            .expectStatus().isOk()
            .expectBody(String.class).isEqualTo("OK");
    }

    @Nested
    @DisplayName("GET /api/v1/patterns")
    class LookupTests {

        @Test
        @DisplayName("known id → snake_case spec")
        void knownId() {
            client.get().uri("/api/v1/patterns/{id}", "CLASH~Zi-Wu~opposite")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.id").isEqualTo("CLASH~Zi-Wu~opposite")
                .jsonPath("$.category").isEqualTo("clash")
                .jsonPath("$.english_name").isEqualTo("Rat-Horse Clash")
                .jsonPath("$.life_domains[0]").isEqualTo("health");
        }

        @Test
        @DisplayName("unknown id → 404")
        void unknownId() {
            client.get().uri("/api/v1/patterns/{id}", "CLASH~Zi-Mao~")
                .exchange()
                .expectStatus().isNotFound();
        }

        @Test
        @DisplayName("category filter → six clashes")
        void byCategory() {
            client.get().uri("/api/v1/patterns?category=clash")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.length()").isEqualTo(6);
        }

        @Test
        @DisplayName("no filter → whole catalog, lowest priority first")
        void all() {
            client.get().uri("/api/v1/patterns")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.length()").isEqualTo(187)
                .jsonPath("$[0].priority").isEqualTo(50);
        }

        @Test
        @DisplayName("unknown category → 400 INVALID_ARGUMENT")
        void unknownCategory() {
            client.get().uri("/api/v1/patterns?category=bogus")
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.error_code").isEqualTo("INVALID_ARGUMENT")
                .jsonPath("$.timestamp").exists();
        }
    }

    @Nested
    @DisplayName("POST /api/v1/patterns/analyze")
    class AnalyzeTests {

        @Test
        @DisplayName("trapped Zi-Wu clash → critical match, health compound 48.2")
        void analyze() {
            String body = """
                {
                  "interactions": {
                    "CLASH~Zi-Wu~opposite": {"element": "Water", "distance": 1, "transformed": false, "positions": [1, 2]},
                    "HARM~Zi-Wei~": "placeholder"
                  },
                  "seasonal_states": {"Water": "Trapped"},
                  "daymaster_stem": "Ren",
                  "daymaster_element": "Water",
                  "year_branch": "Zi"
                }
                """;

            client.post().uri("/api/v1/patterns/analyze")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(body)
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.pattern_count").isEqualTo(1)
                .jsonPath("$.enhanced_patterns[0].english_name").isEqualTo("Rat-Horse Clash")
                .jsonPath("$.enhanced_patterns[0].severity.level").isEqualTo("critical")
                .jsonPath("$.enhanced_patterns[0].severity.normalized_score").isEqualTo(80.3)
                .jsonPath("$.domain_analysis.health.compound_severity").isEqualTo(48.2)
                .jsonPath("$.affected_elements[0]").isEqualTo("Water")
                .jsonPath("$.special_stars[0].pattern_id").isEqualTo("YANG_REN~Ren~Zi")
                .jsonPath("$.health_enhanced.most_vulnerable.zang").isEqualTo("Kidneys")
                .jsonPath("$.recommendations[0].domain").isEqualTo("relationship");
        }

        @Test
        @DisplayName("empty body object → empty analysis")
        void emptyRequest() {
            client.post().uri("/api/v1/patterns/analyze")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{}")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.pattern_count").isEqualTo(0)
                .jsonPath("$.special_stars.length()").isEqualTo(0);
        }

        @Test
        @DisplayName("malformed JSON → 400 BAD_REQUEST")
        void malformedBody() {
            client.post().uri("/api/v1/patterns/analyze")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"interactions\": ")
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.error_code").isEqualTo("BAD_REQUEST");
        }
    }
}

package com.pillarpattern.analysis;

import com.pillarpattern.core.registry.PatternRegistry;
import com.pillarpattern.core.taxonomy.EventTaxonomy;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.reactive.AutoConfigureWebTestClient;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.web.reactive.server.WebTestClient;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
@AutoConfigureWebTestClient
class AnalysisServiceApplicationTest {

    @Autowired
    private PatternRegistry registry;

    @Autowired
    private EventTaxonomy taxonomy;

    @Autowired
    private WebTestClient client;

    @Test
    @DisplayName("context wires the configured catalog and taxonomy")
    void contextLoads() {
        assertEquals(187, registry.size());
        assertEquals(43, taxonomy.size());
    }

    @Test
    @DisplayName("health endpoint served")
    void health() {
        client.get().uri("/api/v1/patterns/health")
            .exchange()
            .expectStatus().isOk()
            .expectBody(String.class).isEqualTo("OK");
    }
}

package com.riskguardian.coordinator.controller;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.riskguardian.coordinator.model.AnalyzeRequest;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.reactive.AutoConfigureWebTestClient;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.reactive.server.WebTestClient;

import static com.riskguardian.coordinator.support.Fixtures.compoundingPortfolio;
import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
@AutoConfigureWebTestClient
class RiskAnalysisControllerTest {

    @Autowired
    private WebTestClient webTestClient;

    @Autowired
    private ObjectMapper objectMapper;

    @Test
    @DisplayName("POST /analyze → 200 with a compounding report from the bundled reference data")
    void analyze() {
        webTestClient.post().uri("/api/v1/risk/analyze")
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue(AnalyzeRequest.of("it-1", compoundingPortfolio()))
            .exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.outcome").isEqualTo("REPORT")
            .jsonPath("$.correlationId").isEqualTo("it-1")
            .jsonPath("$.correlation.bracket").isEqualTo("HIGH")
            .jsonPath("$.concentration.concentratedCategories[0]").isEqualTo("DeFi Governance")
            .jsonPath("$.synthesis.compoundingDetected").isEqualTo(true)
            .jsonPath("$.synthesis.overallRiskLevel").isEqualTo("CRITICAL")
            .jsonPath("$.callOutcomes[0].status").isEqualTo("SUCCEEDED")
            .jsonPath("$.callOutcomes[0].origin").isEqualTo("local://CorrelationAnalyzer");
    }

    @Test
    @DisplayName("POST /analyze/text → plain-text transparency report")
    void analyzeAsText() {
        String body = webTestClient.post().uri("/api/v1/risk/analyze/text")
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue(AnalyzeRequest.of("it-2", compoundingPortfolio()))
            .exchange()
            .expectStatus().isOk()
            .expectBody(String.class)
            .returnResult()
            .getResponseBody();

        assertNotNull(body);
        assertTrue(body.contains("RISK ANALYSIS REPORT  correlationId=it-2"));
        assertTrue(body.contains("TRANSPARENCY"));
    }

    @Test
    @DisplayName("partial settings override applies one threshold and keeps the other defaults")
    void partialSettingsOverride() throws Exception {
        String body = "{\"correlationId\":\"it-3\",\"snapshot\":"
                      + objectMapper.writeValueAsString(compoundingPortfolio())
                      + ",\"settings\":{\"dangerThreshold\":70}}";

        webTestClient.post().uri("/api/v1/risk/analyze")
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue(body)
            .exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.correlation.windowDays").isEqualTo(90)
            .jsonPath("$.concentration.concentratedCategories").isEmpty()
            .jsonPath("$.concentration.diversificationLabel").isEqualTo("MODERATE")
            .jsonPath("$.synthesis.compoundingDetected").isEqualTo(false)
            .jsonPath("$.synthesis.overallRiskLevel").isEqualTo("MODERATE");
    }

    @Test
    @DisplayName("settings override with a zero threshold → 400")
    void zeroThresholdRejected() throws Exception {
        String body = "{\"correlationId\":\"it-4\",\"snapshot\":"
                      + objectMapper.writeValueAsString(compoundingPortfolio())
                      + ",\"settings\":{\"compoundingCorrelationThreshold\":0}}";

        webTestClient.post().uri("/api/v1/risk/analyze")
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue(body)
            .exchange()
            .expectStatus().isBadRequest();
    }

    @Test
    @DisplayName("snapshot without holdings → 400")
    void invalidSnapshot() {
        webTestClient.post().uri("/api/v1/risk/analyze")
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue("{\"correlationId\":\"bad\",\"snapshot\":{\"ownerIdentifier\":\"x\",\"holdings\":[]}}")
            .exchange()
            .expectStatus().isBadRequest();
    }

    @Test
    @DisplayName("GET /health → OK")
    void health() {
        webTestClient.get().uri("/api/v1/risk/health")
            .exchange()
            .expectStatus().isOk()
            .expectBody(String.class).isEqualTo("OK");
    }
}

package com.riskguardian.knowledge;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.riskguardian.common.model.CoMovementBracket;
import com.riskguardian.common.model.ScenarioExcerpt;
import com.riskguardian.common.model.ScenarioRecord;
import com.riskguardian.knowledge.graph.ScenarioGraph;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.io.IOException;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Graph and table backends over the bundled catalog must be indistinguishable.
 */
class KnowledgeBackendParityTest {

    private static List<ScenarioRecord> catalog;
    private static GraphKnowledgeBackend graph;
    private static TableKnowledgeBackend table;

    @BeforeAll
    static void loadCatalog() throws IOException {
        catalog = ScenarioCatalog.loadDefault(new ObjectMapper());
        graph = new GraphKnowledgeBackend(ScenarioGraph.fromScenarios(catalog));
        table = new TableKnowledgeBackend(catalog);
    }

    // ── parity ──────────────────────────────────────────────────────────────

    @Nested
    @DisplayName("graph == table")
    class Parity {

        @ParameterizedTest
        @EnumSource(CoMovementBracket.class)
        @DisplayName("bracket performance")
        void bracketParity(CoMovementBracket bracket) {
            assertEquals(table.lookupBracketPerformance(bracket), graph.lookupBracketPerformance(bracket));
        }

        @ParameterizedTest
        @ValueSource(strings = {"DeFi Governance", "Layer-2", "Yield Protocols", "Stablecoins", "Unmapped"})
        @DisplayName("category performance and opportunity cost")
        void categoryParity(String category) {
            assertEquals(table.lookupCategoryPerformance(category), graph.lookupCategoryPerformance(category));
            assertEquals(table.lookupOpportunityCost(category), graph.lookupOpportunityCost(category));
        }

        @ParameterizedTest
        @EnumSource(CoMovementBracket.class)
        @DisplayName("joint performance")
        void jointParity(CoMovementBracket bracket) {
            for (String category : List.of("DeFi Governance", "Yield Protocols", "Layer-2", "Stablecoins")) {
                assertEquals(table.lookupJointPerformance(bracket, category),
                    graph.lookupJointPerformance(bracket, category));
            }
        }
    }

    // ── catalog content ─────────────────────────────────────────────────────

    @Nested
    @DisplayName("bundled catalog")
    class Content {

        @Test
        @DisplayName("HIGH bracket covers every scenario in load order")
        void highBracketInLoadOrder() {
            List<ScenarioExcerpt> high = graph.lookupBracketPerformance(CoMovementBracket.HIGH);
            assertEquals(List.of("crash_2022_bear", "crash_2021_correction", "crash_2020_covid"),
                high.stream().map(ScenarioExcerpt::scenarioId).toList());
            assertEquals(-73.0, high.get(0).expectedLossPct());
            assertEquals(-75.0, high.get(0).referenceLossPct());
            assertEquals(-55.0, high.get(0).marketAverageLossPct());
        }

        @Test
        @DisplayName("category missing from a scenario is skipped, not zero-filled")
        void yieldProtocolsAbsentIn2020() {
            List<ScenarioExcerpt> yield = table.lookupCategoryPerformance("Yield Protocols");
            assertEquals(2, yield.size());
            assertTrue(yield.stream().noneMatch(e -> e.scenarioId().equals("crash_2020_covid")));
        }

        @Test
        @DisplayName("opportunity cost names the best performer outside the category")
        void opportunityCostOutsideCategory() {
            String defi = table.lookupOpportunityCost("DeFi Governance");
            assertTrue(defi.contains("Layer-2 tokens like OP gained 540%"), defi);

            String layer2 = table.lookupOpportunityCost("Layer-2");
            assertFalse(layer2.contains("OP gained"), layer2);
            assertTrue(layer2.contains("Layer-1 Alts tokens like SOL gained 310%"), layer2);
        }

        @Test
        @DisplayName("scenario without opportunity records falls back to recovery leaders")
        void recoveryLeadersFallback() {
            String defi = graph.lookupOpportunityCost("DeFi Governance");
            assertTrue(defi.contains("the recovery (Mar 2020 - May 2021) was led by AAVE, SOL, LINK."), defi);
        }

        @Test
        @DisplayName("unknown category → empty lists and empty narrative")
        void unknownCategory() {
            assertTrue(graph.lookupCategoryPerformance("Memecoins").isEmpty());
            assertEquals("", graph.lookupOpportunityCost("Memecoins"));
            assertTrue(graph.lookupJointPerformance(CoMovementBracket.HIGH, "Memecoins").isEmpty());
        }
    }
}

package com.riskguardian.analysis.analyzer;

import com.riskguardian.analysis.reference.PriceHistory;
import com.riskguardian.analysis.support.PriceSeries;
import com.riskguardian.analysis.support.TestKnowledge;
import com.riskguardian.common.config.EngineSettings;
import com.riskguardian.common.model.CoMovementBracket;
import com.riskguardian.common.model.CorrelationResult;
import com.riskguardian.common.model.CorrelationStatus;
import com.riskguardian.common.model.Holding;
import com.riskguardian.common.model.PortfolioSnapshot;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class CorrelationAnalyzerTest {

    private static final EngineSettings SETTINGS = EngineSettings.defaults();
    private static final List<Double> ETH = PriceSeries.randomWalk(42, 120, 2_000.0);

    private static final PriceHistory HISTORY;
    static {
        Map<String, List<Double>> closes = new LinkedHashMap<>();
        closes.put("ETH", ETH);
        closes.put("LDO", PriceSeries.scaled(ETH, 0.001));
        closes.put("USDC", PriceSeries.mirrored(ETH, 1.0));
        closes.put("BTC", PriceSeries.randomWalk(4242, 120, 40_000.0));
        closes.put("NEWCOIN", PriceSeries.randomWalk(9, 30, 1.0));
        HISTORY = PriceHistory.of(closes);
    }

    private final CorrelationAnalyzer analyzer = new CorrelationAnalyzer(HISTORY, TestKnowledge.bundledCatalog());

    private static PortfolioSnapshot portfolio(Holding... holdings) {
        return PortfolioSnapshot.of("agent1qtest", List.of(holdings), Instant.parse("2024-06-01T00:00:00Z"));
    }

    // ── computed ────────────────────────────────────────────────────────────

    @Nested
    @DisplayName("COMPUTED results")
    class Computed {

        @Test
        @DisplayName("single holding tracking the reference → 100%, HIGH, full scenario context")
        void singleHoldingOwnCorrelation() {
            CorrelationResult result = analyzer.analyze(portfolio(new Holding("LDO", 1_000, 2.0)), SETTINGS);

            assertEquals(CorrelationStatus.COMPUTED, result.status());
            assertEquals(1.0, result.coefficient(), 1e-9);
            assertEquals(100, result.percentage());
            assertEquals(CoMovementBracket.HIGH, result.bracket());
            assertEquals(3, result.scenarioContexts().size());
            assertTrue(result.narrative().contains("lost 73% vs 55% benchmark"), result.narrative());
            assertEquals(90, result.windowDays());
        }

        @Test
        @DisplayName("inverse mover reports the magnitude of a negative coefficient")
        void negativeCoefficient() {
            CorrelationResult result = analyzer.analyze(portfolio(new Holding("USDC", 500, 1.0)), SETTINGS);

            assertEquals(-1.0, result.coefficient(), 1e-9);
            assertEquals(100, result.percentage());
            assertTrue(result.narrative().contains("moves against ETH"), result.narrative());
        }

        @Test
        @DisplayName("unrelated asset lands in the LOW bracket")
        void independentAssetLow() {
            CorrelationResult result = analyzer.analyze(portfolio(new Holding("BTC", 1, 40_000.0)), SETTINGS);

            assertEquals(CoMovementBracket.LOW, result.bracket());
            assertTrue(result.percentage() >= 0 && result.percentage() < 70);
        }

        @Test
        @DisplayName("holding with short history is excluded and named")
        void exclusionNote() {
            CorrelationResult result = analyzer.analyze(portfolio(
                new Holding("ETH", 1, 2_000.0),
                new Holding("NEWCOIN", 100, 1.0)), SETTINGS);

            assertEquals(CorrelationStatus.COMPUTED, result.status());
            assertEquals(Set.of("NEWCOIN"), result.excludedSymbols());
            assertEquals(Set.of("ETH"), result.includedSymbols());
            assertTrue(result.narrative().contains("Excluded for lack of 90-day price history: NEWCOIN"), result.narrative());
        }

        @Test
        @DisplayName("percentage stays in [0,100] and agrees with the bracket for blended portfolios")
        void percentageRange() {
            for (int btc = 1; btc <= 10; btc++) {
                CorrelationResult result = analyzer.analyze(portfolio(
                    new Holding("ETH", 10, 2_000.0),
                    new Holding("BTC", btc, 40_000.0),
                    new Holding("USDC", 1_000 * btc, 1.0)), SETTINGS);
                assertTrue(result.percentage() >= 0 && result.percentage() <= 100);
                assertEquals(CoMovementBracket.fromPercentage(result.percentage()), result.bracket());
            }
        }

        @Test
        @DisplayName("shorter window from settings is honoured")
        void windowFromSettings() {
            CorrelationResult result = analyzer.analyze(portfolio(new Holding("NEWCOIN", 10, 1.0)),
                SETTINGS.withWindowDays(20));
            assertEquals(CorrelationStatus.COMPUTED, result.status());
            assertEquals(20, result.windowDays());
        }
    }

    // ── insufficient data ───────────────────────────────────────────────────

    @Nested
    @DisplayName("INSUFFICIENT_DATA results")
    class Insufficient {

        @Test
        @DisplayName("every holding lacks history")
        void allExcluded() {
            CorrelationResult result = analyzer.analyze(portfolio(
                new Holding("NEWCOIN", 10, 1.0),
                new Holding("GHOST", 5, 3.0)), SETTINGS);

            assertEquals(CorrelationStatus.INSUFFICIENT_DATA, result.status());
            assertNull(result.coefficient());
            assertNull(result.percentage());
            assertNull(result.bracket());
            assertTrue(result.narrative().toLowerCase().contains("insufficient data"));
            assertEquals(Set.of("NEWCOIN", "GHOST"), result.excludedSymbols());
        }

        @Test
        @DisplayName("excluded value above the allowed share")
        void excludedShareTooLarge() {
            CorrelationResult result = analyzer.analyze(portfolio(
                new Holding("ETH", 1, 2_000.0),
                new Holding("NEWCOIN", 3_000, 1.0)), SETTINGS);

            assertTrue(result.isInsufficientData());
            assertTrue(result.narrative().contains("60% of portfolio value"), result.narrative());
        }

        @Test
        @DisplayName("reference asset without history")
        void referenceMissing() {
            EngineSettings settings = new EngineSettings(90, 60, 40, 85, null, null, null, null, 0.5, "SOL");
            CorrelationResult result = analyzer.analyze(portfolio(new Holding("ETH", 1, 2_000.0)), settings);

            assertTrue(result.isInsufficientData());
            assertTrue(result.narrative().contains("reference asset SOL"), result.narrative());
        }
    }
}

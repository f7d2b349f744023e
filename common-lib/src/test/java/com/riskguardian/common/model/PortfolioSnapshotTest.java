package com.riskguardian.common.model;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.riskguardian.common.exception.InvalidPortfolioException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PortfolioSnapshotTest {

    private static final Instant AT = Instant.parse("2024-03-01T00:00:00Z");

    // ── Holding ─────────────────────────────────────────────────────────────

    @Nested
    @DisplayName("Holding validation")
    class HoldingTests {

        @Test
        @DisplayName("value = quantity × unitPrice")
        void valueIsProduct() {
            assertEquals(2_500.0, new Holding("UNI", 250, 10.0).value(), 1e-9);
        }

        @Test
        @DisplayName("blank symbol rejected")
        void blankSymbol() {
            assertThrows(InvalidPortfolioException.class, () -> new Holding(" ", 1, 1));
        }

        @Test
        @DisplayName("zero or negative quantity and price rejected")
        void nonPositiveAmounts() {
            assertThrows(InvalidPortfolioException.class, () -> new Holding("UNI", 0, 1));
            assertThrows(InvalidPortfolioException.class, () -> new Holding("UNI", 1, -2));
        }
    }

    // ── snapshot totals ─────────────────────────────────────────────────────

    @Nested
    @DisplayName("totalValue invariant")
    class Totals {

        @Test
        @DisplayName("of() computes the total from the holdings")
        void factoryComputesTotal() {
            PortfolioSnapshot snapshot = PortfolioSnapshot.of("owner-1",
                List.of(new Holding("UNI", 100, 5.0), new Holding("ETH", 2, 1_500.0)), AT);
            assertEquals(3_500.0, snapshot.totalValue(), 1e-9);
            assertEquals(2, snapshot.holdings().size());
        }

        @Test
        @DisplayName("supplied total within relative tolerance is accepted")
        void totalWithinTolerance() {
            List<Holding> holdings = List.of(new Holding("UNI", 1_000_000, 1.0));
            assertDoesNotThrow(() -> new PortfolioSnapshot("o", holdings, 1_000_000.5, AT));
        }

        @Test
        @DisplayName("mismatched total rejected")
        void mismatchedTotal() {
            List<Holding> holdings = List.of(new Holding("UNI", 10, 1.0));
            assertThrows(InvalidPortfolioException.class, () -> new PortfolioSnapshot("o", holdings, 11.0, AT));
        }

        @Test
        @DisplayName("zero holdings rejected by both constructor and factory")
        void emptyHoldings() {
            assertThrows(InvalidPortfolioException.class, () -> PortfolioSnapshot.of("o", List.of(), AT));
            assertThrows(InvalidPortfolioException.class, () -> new PortfolioSnapshot("o", List.of(), 0.0, AT));
        }
    }

    // ── JSON ────────────────────────────────────────────────────────────────

    @Test
    @DisplayName("JSON payload without totalValue gets the computed total")
    void jsonWithoutTotal() throws Exception {
        String json = """
            {"ownerIdentifier":"agent1q","holdings":[
              {"symbol":"AAVE","quantity":10,"unitPrice":90.0},
              {"symbol":"USDC","quantity":100,"unitPrice":1.0}]}
            """;
        PortfolioSnapshot snapshot = new ObjectMapper().findAndRegisterModules().readValue(json, PortfolioSnapshot.class);
        assertEquals(1_000.0, snapshot.totalValue(), 1e-9);
        assertEquals("AAVE", snapshot.holdings().get(0).symbol());
    }
}

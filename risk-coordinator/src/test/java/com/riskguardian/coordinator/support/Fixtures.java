package com.riskguardian.coordinator.support;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.riskguardian.common.config.EngineSettings;
import com.riskguardian.common.knowledge.HistoricalKnowledgeStore;
import com.riskguardian.common.model.CategoryHolding;
import com.riskguardian.common.model.CategoryRisk;
import com.riskguardian.common.model.CoMovementBracket;
import com.riskguardian.common.model.ConcentrationResult;
import com.riskguardian.common.model.CorrelationResult;
import com.riskguardian.common.model.DiversificationLabel;
import com.riskguardian.common.model.Holding;
import com.riskguardian.common.model.PortfolioSnapshot;
import com.riskguardian.knowledge.ScenarioCatalog;
import com.riskguardian.knowledge.TableKnowledgeBackend;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/** Hand-built analyzer results backed by the bundled scenario catalog. */
public final class Fixtures {

    public static final HistoricalKnowledgeStore STORE = bundledStore();

    private Fixtures() {}

    private static HistoricalKnowledgeStore bundledStore() {
        try {
            return new TableKnowledgeBackend(ScenarioCatalog.loadDefault(new ObjectMapper()));
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public static CorrelationResult correlation(int percentage) {
        CoMovementBracket bracket = CoMovementBracket.fromPercentage(percentage);
        return CorrelationResult.computed(percentage / 100.0, percentage, bracket,
            STORE.lookupBracketPerformance(bracket), 90, Set.of("UNI", "ETH"), Set.of(),
            "Your portfolio moves " + percentage + "% in step with ETH.");
    }

    public static CorrelationResult insufficientCorrelation() {
        return CorrelationResult.insufficientData(90, Set.of(), Set.of("NEWCOIN"),
            "Correlation not computed: insufficient data for the reference asset ETH.");
    }

    public static ConcentrationResult insufficientConcentration() {
        return ConcentrationResult.insufficientData(Set.of("FOO", "BAR"), 5_000.0,
            "Concentration could not be assessed: no holding maps to a known category.",
            "None of the holdings maps to a known category (FOO, BAR).");
    }

    /**
     * @param categoryShares alternating category name and share, largest share first
     */
    public static ConcentrationResult concentration(EngineSettings settings, Object... categoryShares) {
        Map<String, CategoryHolding> breakdown = new LinkedHashMap<>();
        List<String> concentrated = new ArrayList<>();
        List<CategoryRisk> risks = new ArrayList<>();
        for (int i = 0; i < categoryShares.length; i += 2) {
            String category = (String) categoryShares[i];
            double share = ((Number) categoryShares[i + 1]).doubleValue();
            breakdown.put(category, new CategoryHolding(category, share * 100.0, share, Set.of(category + "-TOKEN")));
            if (share > settings.dangerThreshold()) {
                concentrated.add(category);
                risks.add(new CategoryRisk(category, STORE.lookupCategoryPerformance(category),
                    STORE.lookupOpportunityCost(category)));
            }
        }
        double largest = breakdown.values().stream().mapToDouble(CategoryHolding::percentage).max().orElse(0.0);
        DiversificationLabel label = !concentrated.isEmpty() ? DiversificationLabel.HIGH_CONCENTRATION
            : largest >= settings.moderateThreshold() ? DiversificationLabel.MODERATE
            : DiversificationLabel.WELL_DIVERSIFIED;
        return ConcentrationResult.computed(breakdown, concentrated, label, risks, Set.of(), 0.0, 0.0,
            concentrated.isEmpty() ? "No concentration warnings." : "Concentration above the danger threshold.",
            "Holdings span " + breakdown.size() + " categories.");
    }

    /** Nine DeFi holdings at 68% of a 10 000 portfolio. */
    public static PortfolioSnapshot compoundingPortfolio() {
        return PortfolioSnapshot.of("agent1qtest", List.of(
            new Holding("UNI", 75, 10.0), new Holding("AAVE", 10, 75.0), new Holding("COMP", 15, 50.0),
            new Holding("MKR", 1, 750.0), new Holding("SNX", 250, 3.0), new Holding("CRV", 1_500, 0.5),
            new Holding("BAL", 150, 5.0), new Holding("YFI", 0.125, 6_000.0), new Holding("CVX", 200, 4.0),
            new Holding("USDC", 1_200, 1.0), new Holding("SOL", 10, 100.0), new Holding("LINK", 50, 20.0)),
            Instant.parse("2024-06-01T00:00:00Z"));
    }
}

package com.riskguardian.analysis.analyzer;

import com.riskguardian.analysis.reference.CategoryMapping;
import com.riskguardian.common.config.EngineSettings;
import com.riskguardian.common.knowledge.HistoricalKnowledgeStore;
import com.riskguardian.common.model.CategoryHolding;
import com.riskguardian.common.model.CategoryRisk;
import com.riskguardian.common.model.ConcentrationResult;
import com.riskguardian.common.model.DiversificationLabel;
import com.riskguardian.common.model.Holding;
import com.riskguardian.common.model.PortfolioSnapshot;
import com.riskguardian.common.model.ScenarioExcerpt;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Groups holdings into categories and flags dangerous concentration.
 *
 * <p>Shares are computed against the sum of all holding values, unknown symbols included,
 * and are not rounded, so category shares plus the unknown share add up to 100.
 *
 * <pre>
 *   share  > dangerThreshold                    → concentrated
 *   any concentrated                            → HIGH_CONCENTRATION
 *   moderateThreshold ≤ largest ≤ danger        → MODERATE
 *   otherwise                                   → WELL_DIVERSIFIED
 * </pre>
 *
 * <p>A portfolio with no mapped holding at all has nothing to label and yields an
 * {@code INSUFFICIENT_DATA} result instead.
 */
public class ConcentrationAnalyzer implements PortfolioAnalyzer<ConcentrationResult> {

    private static final Logger log = LoggerFactory.getLogger(ConcentrationAnalyzer.class);

    private final CategoryMapping categoryMapping;
    private final HistoricalKnowledgeStore knowledgeStore;

    public ConcentrationAnalyzer(CategoryMapping categoryMapping, HistoricalKnowledgeStore knowledgeStore) {
        this.categoryMapping = categoryMapping;
        this.knowledgeStore = knowledgeStore;
    }

    @Override
    public String analyzerName() { return "ConcentrationAnalyzer"; }

    @Override
    public ConcentrationResult analyze(PortfolioSnapshot snapshot, EngineSettings settings) {
        log.info("[ConcentrationAnalyzer] Analyzing holdings={} dangerThreshold={} moderateThreshold={}",
                 snapshot.holdings().size(), settings.dangerThreshold(), settings.moderateThreshold());

        Map<String, Double> valueByCategory = new LinkedHashMap<>();
        Map<String, Set<String>> membersByCategory = new LinkedHashMap<>();
        Set<String> unknownSymbols = new LinkedHashSet<>();
        double unknownValue = 0.0;
        double total = 0.0;

        for (Holding holding : snapshot.holdings()) {
            total += holding.value();
            Optional<String> category = categoryMapping.categoryOf(holding.symbol());
            if (category.isEmpty()) {
                if (unknownSymbols.add(holding.symbol())) {
                    log.warn("[ConcentrationAnalyzer] UNKNOWN_CATEGORY symbol={} value={}",
                             holding.symbol(), holding.value());
                }
                unknownValue += holding.value();
                continue;
            }
            valueByCategory.merge(category.get(), holding.value(), Double::sum);
            membersByCategory.computeIfAbsent(category.get(), c -> new LinkedHashSet<>()).add(holding.symbol());
        }

        if (valueByCategory.isEmpty()) {
            log.warn("[ConcentrationAnalyzer] INSUFFICIENT_DATA no holding maps to a known category. unknownSymbols={}",
                     unknownSymbols);
            return ConcentrationResult.insufficientData(unknownSymbols, unknownValue,
                "Concentration could not be assessed: no holding maps to a known category.",
                String.format(Locale.ROOT, "None of the holdings maps to a known category (%s); "
                    + "category concentration was not computed.", String.join(", ", unknownSymbols)));
        }

        // ── breakdown, largest share first; ties keep holding order ─────────
        final double denominator = total;
        List<CategoryHolding> ranked = new ArrayList<>();
        valueByCategory.forEach((category, value) -> ranked.add(new CategoryHolding(
            category, value, value / denominator * 100.0, membersByCategory.get(category))));
        ranked.sort(Comparator.comparingDouble(CategoryHolding::percentage).reversed());

        Map<String, CategoryHolding> breakdown = new LinkedHashMap<>();
        List<String> concentrated = new ArrayList<>();
        for (CategoryHolding holding : ranked) {
            breakdown.put(holding.categoryName(), holding);
            if (holding.percentage() > settings.dangerThreshold()) {
                concentrated.add(holding.categoryName());
            }
        }

        double largest = ranked.get(0).percentage();
        DiversificationLabel label = label(concentrated, largest, settings);

        List<CategoryRisk> risks = new ArrayList<>();
        for (String category : concentrated) {
            risks.add(new CategoryRisk(category,
                knowledgeStore.lookupCategoryPerformance(category),
                knowledgeStore.lookupOpportunityCost(category)));
        }

        double unknownPercentage = unknownValue / total * 100.0;
        log.info("[ConcentrationAnalyzer] Complete. categories={} concentrated={} label={} unknownSymbols={}",
                 breakdown.size(), concentrated, label, unknownSymbols.size());

        return ConcentrationResult.computed(breakdown, concentrated, label, risks, unknownSymbols,
            unknownValue, unknownPercentage,
            warningNarrative(risks, breakdown, settings),
            narrative(ranked, label, unknownSymbols, unknownPercentage));
    }

    static DiversificationLabel label(List<String> concentrated, double largestShare, EngineSettings settings) {
        if (!concentrated.isEmpty()) return DiversificationLabel.HIGH_CONCENTRATION;
        if (largestShare >= settings.moderateThreshold() && largestShare <= settings.dangerThreshold()) {
            return DiversificationLabel.MODERATE;
        }
        return DiversificationLabel.WELL_DIVERSIFIED;
    }

    // ── narratives ──────────────────────────────────────────────────────────

    private static String warningNarrative(List<CategoryRisk> risks, Map<String, CategoryHolding> breakdown,
                                           EngineSettings settings) {
        if (risks.isEmpty()) {
            return String.format(Locale.ROOT,
                "No concentration warnings: no category exceeds %.0f%% of portfolio value.", settings.dangerThreshold());
        }
        List<String> parts = new ArrayList<>();
        for (CategoryRisk risk : risks) {
            double share = breakdown.get(risk.categoryName()).percentage();
            StringBuilder sb = new StringBuilder(String.format(Locale.ROOT,
                "Your %.0f%% %s concentration is above the %.0f%% danger threshold.",
                share, risk.categoryName(), settings.dangerThreshold()));
            for (ScenarioExcerpt scenario : risk.scenarioContexts()) {
                sb.append(String.format(Locale.ROOT,
                    " %s lost %.0f%% during the %s (%s), compared to %.0f%% market average.",
                    risk.categoryName(), Math.abs(scenario.expectedLossPct()), scenario.displayName(),
                    scenario.periodLabel(), Math.abs(scenario.marketAverageLossPct())));
            }
            if (!risk.opportunityCostNarrative().isEmpty()) {
                sb.append(" Meanwhile: ").append(risk.opportunityCostNarrative());
            }
            parts.add(sb.toString());
        }
        return String.join(" ", parts);
    }

    private static String narrative(List<CategoryHolding> ranked, DiversificationLabel label,
                                    Set<String> unknownSymbols, double unknownPercentage) {
        CategoryHolding top = ranked.get(0);
        StringBuilder sb = new StringBuilder(String.format(Locale.ROOT, "Holdings span %d %s; the largest is %s at %.1f%%.",
            ranked.size(), ranked.size() == 1 ? "category" : "categories", top.categoryName(), top.percentage()));
        sb.append(" Diversification: ").append(label).append('.');
        if (!unknownSymbols.isEmpty()) {
            sb.append(String.format(Locale.ROOT, " %d %s without a category mapping (%s) account for %.1f%% of value.",
                unknownSymbols.size(), unknownSymbols.size() == 1 ? "symbol" : "symbols",
                String.join(", ", unknownSymbols), unknownPercentage));
        }
        return sb.toString();
    }
}

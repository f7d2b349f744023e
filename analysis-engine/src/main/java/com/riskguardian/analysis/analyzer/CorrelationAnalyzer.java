package com.riskguardian.analysis.analyzer;

import com.riskguardian.analysis.reference.PriceHistory;
import com.riskguardian.analysis.statistics.ReturnStatistics;
import com.riskguardian.common.config.EngineSettings;
import com.riskguardian.common.knowledge.HistoricalKnowledgeStore;
import com.riskguardian.common.model.CoMovementBracket;
import com.riskguardian.common.model.CorrelationResult;
import com.riskguardian.common.model.Holding;
import com.riskguardian.common.model.PortfolioSnapshot;
import com.riskguardian.common.model.ScenarioExcerpt;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Measures how closely the portfolio moves with the reference asset over a trailing window.
 *
 * <p>The portfolio return series is a fixed-weight blend of the included holdings' simple
 * daily returns, weighted by today's value share renormalised over the included set. Weights
 * are not rebalanced through the window; this is an approximation of the historical
 * portfolio, not a reconstruction of it.
 *
 * <p>Outcome:
 * <ul>
 *   <li>{@code INSUFFICIENT_DATA}: the reference lacks history, every holding lacks history,
 *       or the holdings without history exceed {@code maxExcludedValueShare} of value</li>
 *   <li>{@code COMPUTED}         : coefficient, {@code round(|r| × 100)} percentage, bracket and
 *       historical context for that bracket</li>
 * </ul>
 */
public class CorrelationAnalyzer implements PortfolioAnalyzer<CorrelationResult> {

    private static final Logger log = LoggerFactory.getLogger(CorrelationAnalyzer.class);

    private final PriceHistory priceHistory;
    private final HistoricalKnowledgeStore knowledgeStore;

    public CorrelationAnalyzer(PriceHistory priceHistory, HistoricalKnowledgeStore knowledgeStore) {
        this.priceHistory = priceHistory;
        this.knowledgeStore = knowledgeStore;
    }

    @Override
    public String analyzerName() { return "CorrelationAnalyzer"; }

    @Override
    public CorrelationResult analyze(PortfolioSnapshot snapshot, EngineSettings settings) {
        int window = settings.windowDays();
        String reference = settings.referenceSymbol();
        log.info("[CorrelationAnalyzer] Analyzing holdings={} reference={} windowDays={}",
                 snapshot.holdings().size(), reference, window);

        // ── partition holdings by history coverage ──────────────────────────
        Map<String, Double> includedValue = new LinkedHashMap<>();
        Map<String, List<Double>> includedCloses = new LinkedHashMap<>();
        Set<String> excluded = new LinkedHashSet<>();
        double totalValue = 0.0;
        double excludedValue = 0.0;

        for (Holding holding : snapshot.holdings()) {
            totalValue += holding.value();
            Optional<List<Double>> closes = priceHistory.trailingCloses(holding.symbol(), window);
            if (closes.isPresent()) {
                includedValue.merge(holding.symbol(), holding.value(), Double::sum);
                includedCloses.putIfAbsent(holding.symbol(), closes.get());
            } else {
                excluded.add(holding.symbol());
                excludedValue += holding.value();
            }
        }

        Optional<List<Double>> referenceCloses = priceHistory.trailingCloses(reference, window);
        if (referenceCloses.isEmpty()) {
            log.warn("[CorrelationAnalyzer] Reference symbol={} has {} closes, need {}",
                     reference, priceHistory.daysAvailable(reference), window + 1);
            return CorrelationResult.insufficientData(window, includedValue.keySet(), excluded, String.format(Locale.ROOT,
                "Correlation not computed: insufficient data for the reference asset %s, which needs %d days of price history.",
                reference, window));
        }
        if (includedValue.isEmpty()) {
            return CorrelationResult.insufficientData(window, Set.of(), excluded, String.format(Locale.ROOT,
                "Correlation not computed: insufficient data, none of the holdings (%s) has %d days of price history.",
                String.join(", ", excluded), window));
        }
        double excludedShare = excludedValue / totalValue;
        if (excludedShare > settings.maxExcludedValueShare()) {
            return CorrelationResult.insufficientData(window, includedValue.keySet(), excluded, String.format(Locale.ROOT,
                "Correlation not computed: insufficient data, holdings without %d days of history (%s) make up "
                    + "%.0f%% of portfolio value, above the %.0f%% limit.",
                window, String.join(", ", excluded), excludedShare * 100, settings.maxExcludedValueShare() * 100));
        }

        // ── weighted portfolio returns vs reference ─────────────────────────
        double includedTotal = includedValue.values().stream().mapToDouble(Double::doubleValue).sum();
        List<double[]> series = new ArrayList<>(includedCloses.size());
        double[] weights = new double[includedCloses.size()];
        int k = 0;
        for (Map.Entry<String, List<Double>> entry : includedCloses.entrySet()) {
            series.add(ReturnStatistics.simpleReturns(entry.getValue()));
            weights[k++] = includedValue.get(entry.getKey()) / includedTotal;
        }
        double[] portfolioReturns = ReturnStatistics.weightedReturns(series, weights);
        double[] referenceReturns = ReturnStatistics.simpleReturns(referenceCloses.get());

        double coefficient = ReturnStatistics.pearson(portfolioReturns, referenceReturns);
        int percentage = ReturnStatistics.toPercentage(coefficient);
        CoMovementBracket bracket = CoMovementBracket.fromPercentage(percentage);

        List<ScenarioExcerpt> context = knowledgeStore.lookupBracketPerformance(bracket);

        log.info("[CorrelationAnalyzer] Complete. coefficient={} percentage={} bracket={} included={} excluded={}",
                 String.format(Locale.ROOT, "%.4f", coefficient), percentage, bracket, includedValue.size(), excluded.size());

        return CorrelationResult.computed(coefficient, percentage, bracket, context, window,
            includedValue.keySet(), excluded, narrative(coefficient, percentage, bracket, reference, window, context, excluded));
    }

    private static String narrative(double coefficient, int percentage, CoMovementBracket bracket, String reference,
                                    int window, List<ScenarioExcerpt> context, Set<String> excluded) {
        StringBuilder sb = new StringBuilder();
        if (coefficient < 0) {
            sb.append(String.format(Locale.ROOT,
                "Your portfolio moves against %s with %d%% strength over the last %d days (coefficient %.2f)",
                reference, percentage, window, coefficient));
        } else {
            sb.append(String.format(Locale.ROOT,
                "Your portfolio moves %d%% in step with %s over the last %d days (coefficient %.2f)",
                percentage, reference, window, coefficient));
        }
        sb.append(String.format(Locale.ROOT, ", placing it in the %s co-movement bracket (%s).",
            bracket, bracket.label()));

        if (context.isEmpty()) {
            sb.append(" No historical scenario context is available for this bracket.");
        }
        for (ScenarioExcerpt scenario : context) {
            sb.append(String.format(Locale.ROOT,
                " In the %s (%s), portfolios in this bracket lost %.0f%% vs %.0f%% benchmark while %s fell %.0f%%.",
                scenario.displayName(), scenario.periodLabel(), Math.abs(scenario.expectedLossPct()),
                Math.abs(scenario.marketAverageLossPct()), reference, Math.abs(scenario.referenceLossPct())));
        }
        if (!excluded.isEmpty()) {
            sb.append(String.format(Locale.ROOT, " Excluded for lack of %d-day price history: %s.",
                window, String.join(", ", excluded)));
        }
        return sb.toString();
    }
}

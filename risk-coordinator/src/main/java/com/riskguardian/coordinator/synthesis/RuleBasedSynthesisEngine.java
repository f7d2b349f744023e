package com.riskguardian.coordinator.synthesis;

import com.riskguardian.common.config.EngineSettings;
import com.riskguardian.common.knowledge.HistoricalKnowledgeStore;
import com.riskguardian.common.model.CategoryHolding;
import com.riskguardian.common.model.CategoryRisk;
import com.riskguardian.common.model.CoMovementBracket;
import com.riskguardian.common.model.ConcentrationResult;
import com.riskguardian.common.model.CorrelationResult;
import com.riskguardian.common.model.DiversificationLabel;
import com.riskguardian.common.model.Recommendation;
import com.riskguardian.common.model.RecommendationFocus;
import com.riskguardian.common.model.RiskLevel;
import com.riskguardian.common.model.ScenarioExcerpt;
import com.riskguardian.common.model.SynthesisResult;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Rule table implementation of {@link SynthesisEngine}.
 *
 * <p>Recommendations:
 * <ul>
 *   <li><b>Compounding</b>         : concentration, correlation, prioritization, in that order</li>
 *   <li><b>Balanced</b>            : WELL_DIVERSIFIED and LOW bracket: a single MAINTAIN entry</li>
 *   <li><b>Otherwise</b>           : whichever of concentrated category, correlation and moderate
 *                                     category apply, in that order; none applying gives a
 *                                     monitoring entry</li>
 * </ul>
 *
 * <p>The risk multiplier compares the mean joint (bracket × top concentrated category) loss with
 * the mean bracket loss over the scenarios both tables record. Without such overlap it is 1.0
 * and reported as unvalidated.
 */
public class RuleBasedSynthesisEngine implements SynthesisEngine {

    private static final int CRITICAL_CORRELATION_FLOOR_EXCLUSIVE = 90;

    private final HistoricalKnowledgeStore knowledgeStore;

    public RuleBasedSynthesisEngine(HistoricalKnowledgeStore knowledgeStore) {
        this.knowledgeStore = knowledgeStore;
    }

    @Override
    public SynthesisResult synthesize(CorrelationResult correlation, ConcentrationResult concentration,
                                      EngineSettings settings) {
        requireComputed(correlation);
        requireComputed(concentration);

        boolean compounding = correlation.percentage() > settings.compoundingCorrelationThreshold()
                              && concentration.hasConcentration();
        Multiplier multiplier = compounding ? multiplier(correlation, concentration) : Multiplier.ESTIMATE;
        RiskLevel level = overallLevel(compounding, correlation.percentage(), correlation.bracket(),
                                       concentration.diversificationLabel());

        List<Recommendation> recommendations = new ArrayList<>();
        if (compounding) {
            recommendations.add(reduceConcentrated(concentration, settings));
            recommendations.add(reduceCorrelation(correlation, settings));
            recommendations.add(prioritize(correlation, concentration, multiplier, settings));
        } else if (concentration.diversificationLabel() == DiversificationLabel.WELL_DIVERSIFIED
                   && correlation.bracket() == CoMovementBracket.LOW) {
            recommendations.add(maintainBalanced(correlation, settings));
        } else {
            recommendations.addAll(applicable(correlation, concentration, settings));
        }

        StringBuilder narrative = new StringBuilder();
        if (compounding) {
            String category = concentration.concentratedCategories().get(0);
            narrative.append(String.format(Locale.ROOT,
                "Compounding risk detected: the portfolio moves %d%% in step with %s while %s makes up %.0f%% of its value.",
                correlation.percentage(), settings.referenceSymbol(), category, shareOf(concentration, category)));
        } else {
            narrative.append(String.format(Locale.ROOT,
                "No compounding risk: co-movement with %s is %d%% (%s bracket) and diversification is %s.",
                settings.referenceSymbol(), correlation.percentage(), correlation.bracket(),
                concentration.diversificationLabel()));
        }
        narrative.append(' ').append(multiplier.describe());
        narrative.append(" Overall risk: ").append(level).append('.');

        return new SynthesisResult(correlation, concentration, compounding, multiplier.value(),
            multiplier.validated(), level, ranked(recommendations), false, narrative.toString());
    }

    @Override
    public SynthesisResult synthesizeCorrelationOnly(CorrelationResult correlation, EngineSettings settings) {
        requireComputed(correlation);
        boolean elevated = correlation.bracket() != CoMovementBracket.LOW;
        RiskLevel level = elevated ? RiskLevel.MODERATE : RiskLevel.LOW;
        String narrative = degradedNarrative("Concentration", "correlation", level);
        return new SynthesisResult(correlation, null, false, Multiplier.ESTIMATE.value(), false, level,
            ranked(applicable(correlation, null, settings)), true, narrative);
    }

    @Override
    public SynthesisResult synthesizeConcentrationOnly(ConcentrationResult concentration, EngineSettings settings) {
        requireComputed(concentration);
        boolean elevated = concentration.diversificationLabel() != DiversificationLabel.WELL_DIVERSIFIED;
        RiskLevel level = elevated ? RiskLevel.MODERATE : RiskLevel.LOW;
        String narrative = degradedNarrative("Correlation", "concentration", level);
        return new SynthesisResult(null, concentration, false, Multiplier.ESTIMATE.value(), false, level,
            ranked(applicable(null, concentration, settings)), true, narrative);
    }

    static RiskLevel overallLevel(boolean compounding, int percentage, CoMovementBracket bracket,
                                  DiversificationLabel label) {
        if (compounding && percentage > CRITICAL_CORRELATION_FLOOR_EXCLUSIVE) return RiskLevel.CRITICAL;
        if (compounding) return RiskLevel.HIGH;
        if (bracket == CoMovementBracket.MODERATE || label == DiversificationLabel.MODERATE) return RiskLevel.MODERATE;
        return RiskLevel.LOW;
    }

    // ── Risk multiplier ──────────────────────────────────────────────────────

    private Multiplier multiplier(CorrelationResult correlation, ConcentrationResult concentration) {
        String category = concentration.concentratedCategories().get(0);
        List<ScenarioExcerpt> joint = knowledgeStore.lookupJointPerformance(correlation.bracket(), category);

        Map<String, Double> bracketLossByScenario = new HashMap<>();
        for (ScenarioExcerpt excerpt : correlation.scenarioContexts()) {
            bracketLossByScenario.put(excerpt.scenarioId(), Math.abs(excerpt.expectedLossPct()));
        }

        double jointSum = 0.0;
        double bracketSum = 0.0;
        int matched = 0;
        for (ScenarioExcerpt excerpt : joint) {
            Double bracketLoss = bracketLossByScenario.get(excerpt.scenarioId());
            if (bracketLoss == null) continue;
            jointSum += Math.abs(excerpt.expectedLossPct());
            bracketSum += bracketLoss;
            matched++;
        }
        if (matched == 0 || bracketSum == 0.0) {
            return Multiplier.ESTIMATE;
        }
        double value = Math.round(jointSum / bracketSum * 100.0) / 100.0;
        return new Multiplier(value, true, jointSum / matched, bracketSum / matched, matched);
    }

    private record Multiplier(double value, boolean validated, double jointLossPct,
                              double correlationLossPct, int scenarios) {

        static final Multiplier ESTIMATE = new Multiplier(1.0, false, 0.0, 0.0, 0);

        String describe() {
            if (!validated) {
                return String.format(Locale.ROOT,
                    "The risk multiplier of %.1f is an estimate rather than a historically validated figure.", value);
            }
            return String.format(Locale.ROOT,
                "Historically, holding both risks lost %.2fx the correlation-only loss (%.0f%% vs %.0f%% across %d scenario%s).",
                value, jointLossPct, correlationLossPct, scenarios, scenarios == 1 ? "" : "s");
        }
    }

    // ── Recommendations ──────────────────────────────────────────────────────

    private List<Recommendation> applicable(CorrelationResult correlation, ConcentrationResult concentration,
                                            EngineSettings settings) {
        List<Recommendation> recommendations = new ArrayList<>();
        if (concentration != null && concentration.hasConcentration()) {
            recommendations.add(reduceConcentrated(concentration, settings));
        }
        if (correlation != null && correlation.bracket() != CoMovementBracket.LOW) {
            recommendations.add(reduceCorrelation(correlation, settings));
        }
        if (concentration != null && concentration.diversificationLabel() == DiversificationLabel.MODERATE) {
            concentration.largestCategory().ifPresent(largest -> recommendations.add(trimModerate(largest, settings)));
        }
        if (recommendations.isEmpty()) {
            recommendations.add(monitor(correlation, concentration, settings));
        }
        return recommendations;
    }

    private Recommendation reduceConcentrated(ConcentrationResult concentration, EngineSettings settings) {
        String category = concentration.concentratedCategories().get(0);
        double share = shareOf(concentration, category);

        String rationale = String.format(Locale.ROOT, "%.0f%% of portfolio value sits in %s, above the %.0f%% danger threshold.",
            share, category, settings.dangerThreshold());
        Optional<ScenarioExcerpt> worst = riskOf(concentration, category)
            .flatMap(risk -> risk.scenarioContexts().stream()
                .max(Comparator.comparingDouble(e -> Math.abs(e.expectedLossPct()))));
        rationale += worst
            .map(e -> String.format(Locale.ROOT, " %s lost %.0f%% during the %s (%s), compared to %.0f%% market average.",
                category, Math.abs(e.expectedLossPct()), e.displayName(), e.periodLabel(),
                Math.abs(e.marketAverageLossPct())))
            .orElse(" No historical drawdown is recorded for this category.");

        String impact = String.format(Locale.ROOT, "Cuts single-category exposure by at least %.0f percentage points of "
            + "portfolio value.", Math.max(0.0, share - settings.moderateThreshold()));
        String opportunity = riskOf(concentration, category).map(CategoryRisk::opportunityCostNarrative).orElse("");
        if (!opportunity.isBlank()) {
            impact += " " + opportunity;
        }

        return new Recommendation(0, RecommendationFocus.CATEGORY_CONCENTRATION,
            String.format(Locale.ROOT, "Reduce %s concentration from %.0f%% to below %.0f%%",
                category, share, settings.moderateThreshold()),
            rationale, impact);
    }

    private Recommendation reduceCorrelation(CorrelationResult correlation, EngineSettings settings) {
        String reference = settings.referenceSymbol();
        Optional<ScenarioExcerpt> current = correlation.scenarioContexts().stream().findFirst();

        String rationale = String.format(Locale.ROOT, "The portfolio moves %d%% in step with %s (%s bracket).",
            correlation.percentage(), reference, correlation.bracket());
        rationale += current
            .map(e -> String.format(Locale.ROOT, " In the %s (%s), portfolios in this bracket lost %.0f%%.",
                e.displayName(), e.periodLabel(), Math.abs(e.expectedLossPct())))
            .orElse("");

        String impact = current
            .flatMap(e -> knowledgeStore.lookupBracketPerformance(CoMovementBracket.LOW).stream()
                .filter(low -> low.scenarioId().equals(e.scenarioId()))
                .findFirst()
                .map(low -> String.format(Locale.ROOT, "In the %s, LOW-bracket portfolios lost %.0f%% instead of %.0f%%.",
                    low.displayName(), Math.abs(low.expectedLossPct()), Math.abs(e.expectedLossPct()))))
            .orElse(String.format(Locale.ROOT, "Reduces the share of losses driven by %s drawdowns.", reference));

        return new Recommendation(0, RecommendationFocus.CORRELATION,
            String.format(Locale.ROOT, "Lower co-movement with %s from %d%% to the LOW bracket (%s) by adding assets that "
                + "move independently of it", reference, correlation.percentage(), CoMovementBracket.LOW.label()),
            rationale, impact);
    }

    private Recommendation prioritize(CorrelationResult correlation, ConcentrationResult concentration,
                                      Multiplier multiplier, EngineSettings settings) {
        String category = concentration.concentratedCategories().get(0);
        String rationale = multiplier.validated()
            ? String.format(Locale.ROOT, "Both risks reinforce each other: %s holdings in %s-bracket portfolios lost %.0f%% on "
                + "average versus %.0f%% for the bracket alone (%.2fx).",
                category, correlation.bracket(), multiplier.jointLossPct(), multiplier.correlationLossPct(),
                multiplier.value())
            : String.format(Locale.ROOT, "Both risks reinforce each other: %.0f%% of value sits in %s while the portfolio "
                + "moves %d%% in step with %s.",
                shareOf(concentration, category), category, correlation.percentage(), settings.referenceSymbol());

        return new Recommendation(0, RecommendationFocus.PRIORITIZATION,
            String.format(Locale.ROOT, "Address the %s concentration first, then rebalance toward assets less correlated with %s",
                category, settings.referenceSymbol()),
            rationale,
            "Removing the concentration also removes the compounding condition, which caps the overall risk "
                + "level at MODERATE.");
    }

    private Recommendation trimModerate(CategoryHolding largest, EngineSettings settings) {
        return new Recommendation(0, RecommendationFocus.CATEGORY_CONCENTRATION,
            String.format(Locale.ROOT, "Trim %s from %.0f%% to below %.0f%%",
                largest.categoryName(), largest.percentage(), settings.moderateThreshold()),
            String.format(Locale.ROOT, "%s holds %.0f%% of portfolio value, between the %.0f%% moderate and %.0f%% danger "
                + "thresholds.", largest.categoryName(), largest.percentage(), settings.moderateThreshold(),
                settings.dangerThreshold()),
            "Moves the portfolio to WELL_DIVERSIFIED and keeps a single category from drifting past the "
                + "danger threshold after a rally.");
    }

    private Recommendation maintainBalanced(CorrelationResult correlation, EngineSettings settings) {
        String impact = correlation.scenarioContexts().stream().findFirst()
            .map(e -> String.format(Locale.ROOT, "Historically, LOW-bracket portfolios lost %.0f%% in the %s versus a %.0f%% "
                + "market average.", Math.abs(e.expectedLossPct()), e.displayName(),
                Math.abs(e.marketAverageLossPct())))
            .orElse("Keeps drawdown exposure spread across categories.");
        return new Recommendation(0, RecommendationFocus.MAINTAIN,
            "Maintain current balanced portfolio structure",
            String.format(Locale.ROOT, "No category reaches %.0f%% of portfolio value and co-movement with %s is %d%%, in the "
                + "LOW bracket.", settings.moderateThreshold(), settings.referenceSymbol(), correlation.percentage()),
            impact);
    }

    private Recommendation monitor(CorrelationResult correlation, ConcentrationResult concentration,
                                   EngineSettings settings) {
        String rationale;
        if (correlation == null) {
            rationale = "Only the concentration perspective was available and it shows no threshold breach.";
        } else if (concentration == null) {
            rationale = "Only the correlation perspective was available and it shows no threshold breach.";
        } else {
            rationale = "No risk threshold is currently exceeded.";
        }
        return new Recommendation(0, RecommendationFocus.MAINTAIN,
            "Monitor category shares and co-movement as prices change",
            rationale,
            String.format(Locale.ROOT, "Early warning if a category passes %.0f%% or co-movement with %s leaves the LOW bracket.",
                settings.moderateThreshold(), settings.referenceSymbol()));
    }

    private static List<Recommendation> ranked(List<Recommendation> recommendations) {
        List<Recommendation> ranked = new ArrayList<>();
        for (Recommendation recommendation : recommendations) {
            if (ranked.size() == SynthesisResult.MAX_RECOMMENDATIONS) break;
            ranked.add(recommendation.withRank(ranked.size() + 1));
        }
        return ranked;
    }

    // ── Helpers ──────────────────────────────────────────────────────────────

    private static String degradedNarrative(String missing, String present, RiskLevel level) {
        return String.format(Locale.ROOT,
            "%s analysis was unavailable, so this assessment rests on the %s perspective alone "
            + "and compounding risk could not be evaluated. %s Overall risk: %s.",
            missing, present, Multiplier.ESTIMATE.describe(), level);
    }

    private static double shareOf(ConcentrationResult concentration, String category) {
        CategoryHolding holding = concentration.breakdown().get(category);
        return holding == null ? 0.0 : holding.percentage();
    }

    private static Optional<CategoryRisk> riskOf(ConcentrationResult concentration, String category) {
        return concentration.categoryRisks().stream()
            .filter(risk -> risk.categoryName().equals(category))
            .findFirst();
    }

    private static void requireComputed(CorrelationResult correlation) {
        Objects.requireNonNull(correlation, "correlation");
        if (correlation.isInsufficientData()) {
            throw new IllegalArgumentException("Correlation result has insufficient data and cannot be synthesized");
        }
    }

    private static void requireComputed(ConcentrationResult concentration) {
        Objects.requireNonNull(concentration, "concentration");
        if (concentration.isInsufficientData()) {
            throw new IllegalArgumentException("Concentration result has insufficient data and cannot be synthesized");
        }
    }
}

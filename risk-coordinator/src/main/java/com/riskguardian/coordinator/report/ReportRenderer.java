package com.riskguardian.coordinator.report;

import com.riskguardian.common.model.CategoryHolding;
import com.riskguardian.common.model.ConcentrationResult;
import com.riskguardian.common.model.Recommendation;
import com.riskguardian.common.model.SynthesisResult;
import com.riskguardian.coordinator.model.AnalysisFailure;
import com.riskguardian.coordinator.model.AnalysisOutcome;
import com.riskguardian.coordinator.model.AnalysisReport;
import com.riskguardian.coordinator.model.CallOutcome;
import com.riskguardian.coordinator.model.FailureCause;

import java.util.Locale;

/**
 * Renders an {@link AnalysisOutcome} as a plain-text transparency report: the judgment, the
 * evidence from both perspectives, the recommendations, then how each analyzer call went.
 * Formatting only; every value shown comes from the structured outcome.
 */
public class ReportRenderer {

    private static final String RULE = "=".repeat(72);

    public String render(AnalysisOutcome outcome) {
        if (outcome instanceof AnalysisReport report) {
            return renderReport(report);
        }
        return renderFailure((AnalysisFailure) outcome);
    }

    private String renderReport(AnalysisReport report) {
        SynthesisResult synthesis = report.synthesis();
        StringBuilder out = new StringBuilder();
        out.append(RULE).append('\n');
        out.append("RISK ANALYSIS REPORT  correlationId=").append(report.correlationId()).append('\n');
        out.append(RULE).append('\n');
        out.append("Overall risk:      ").append(synthesis.overallRiskLevel())
           .append(synthesis.degraded() ? "  (degraded)" : "").append('\n');
        out.append("Compounding risk:  ").append(synthesis.compoundingDetected() ? "detected" : "not detected").append('\n');
        out.append("Risk multiplier:   ").append(String.format(Locale.ROOT, "%.2f", synthesis.riskMultiplier()))
           .append(synthesis.multiplierValidated() ? "  (historically validated)" : "  (estimate)").append('\n');

        section(out, "CORRELATION");
        out.append("  ").append(report.correlation() != null ? report.correlation().narrative() : "unavailable")
           .append('\n');

        section(out, "CONCENTRATION");
        ConcentrationResult concentration = report.concentration();
        if (concentration == null) {
            out.append("  unavailable\n");
        } else if (concentration.isInsufficientData()) {
            out.append("  ").append(concentration.narrative()).append('\n');
        } else {
            for (CategoryHolding holding : concentration.breakdown().values()) {
                out.append(String.format(Locale.ROOT, "  %-20s %6.1f%%  %s%n", holding.categoryName(), holding.percentage(),
                    String.join(", ", holding.memberSymbols())));
            }
            if (!concentration.unknownSymbols().isEmpty()) {
                out.append(String.format(Locale.ROOT, "  %-20s %6.1f%%  %s%n", "(unmapped)", concentration.unknownPercentage(),
                    String.join(", ", concentration.unknownSymbols())));
            }
            out.append("  ").append(concentration.warningNarrative()).append('\n');
        }

        section(out, "RECOMMENDATIONS");
        for (Recommendation recommendation : synthesis.recommendations()) {
            out.append("  ").append(recommendation.rank()).append(". [").append(recommendation.focus()).append("] ")
               .append(recommendation.action()).append('\n');
            out.append("     Why:    ").append(recommendation.rationale()).append('\n');
            out.append("     Impact: ").append(recommendation.expectedImpact()).append('\n');
        }

        section(out, "SYNTHESIS");
        out.append("  ").append(synthesis.narrative()).append('\n');

        section(out, "TRANSPARENCY");
        for (CallOutcome call : report.callOutcomes()) {
            out.append(String.format(Locale.ROOT, "  %-22s %-9s durationMs=%d", call.analyzerName(), call.status(), call.durationMs()));
            if (call.isSuccess()) {
                out.append(" origin=").append(call.origin()).append(" processingMs=").append(call.processingMs());
            } else {
                out.append(" reason=").append(call.failureMessage());
            }
            out.append('\n');
        }
        if (report.isDegraded()) {
            out.append("  Degradation: ").append(report.degradationNote()).append('\n');
        }
        out.append("  Total duration: ").append(report.totalDurationMs()).append(" ms\n");
        return out.toString();
    }

    private String renderFailure(AnalysisFailure failure) {
        StringBuilder out = new StringBuilder();
        out.append(RULE).append('\n');
        out.append("RISK ANALYSIS FAILED  correlationId=").append(failure.correlationId()).append('\n');
        out.append(RULE).append('\n');
        for (FailureCause cause : failure.causes()) {
            out.append("  ").append(cause.source()).append(' ').append(cause.status()).append(": ")
               .append(cause.message()).append('\n');
        }
        out.append("  Total duration: ").append(failure.totalDurationMs()).append(" ms\n");
        return out.toString();
    }

    private static void section(StringBuilder out, String title) {
        out.append('\n').append(title).append('\n').append("-".repeat(title.length())).append('\n');
    }
}

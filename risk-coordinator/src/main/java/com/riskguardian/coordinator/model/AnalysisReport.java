package com.riskguardian.coordinator.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.riskguardian.common.model.ConcentrationResult;
import com.riskguardian.common.model.CorrelationResult;
import com.riskguardian.common.model.SynthesisResult;

import java.util.List;

/**
 * Assembled answer to an {@link AnalyzeRequest}.
 *
 * <p>{@code correlation} and {@code concentration} are the analyzers' results verbatim, or
 * {@code null} when that call did not succeed. {@code degradationNote} is non-null exactly when
 * the synthesis had to work from one perspective.
 */
public record AnalysisReport(
    @JsonProperty("correlationId")   String correlationId,
    @JsonProperty("correlation")     CorrelationResult correlation,
    @JsonProperty("concentration")   ConcentrationResult concentration,
    @JsonProperty("synthesis")       SynthesisResult synthesis,
    @JsonProperty("callOutcomes")    List<CallOutcome> callOutcomes,
    @JsonProperty("degradationNote") String degradationNote,
    @JsonProperty("totalDurationMs") long totalDurationMs
) implements AnalysisOutcome {

    public AnalysisReport {
        callOutcomes = callOutcomes == null ? List.of() : List.copyOf(callOutcomes);
    }

    @JsonIgnore
    public boolean isDegraded() {
        return degradationNote != null;
    }
}

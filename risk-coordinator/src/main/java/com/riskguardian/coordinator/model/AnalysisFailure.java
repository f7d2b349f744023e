package com.riskguardian.coordinator.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/** Terminal outcome: no usable perspective, or the overall deadline passed. */
public record AnalysisFailure(
    @JsonProperty("correlationId")   String correlationId,
    @JsonProperty("causes")          List<FailureCause> causes,
    @JsonProperty("totalDurationMs") long totalDurationMs
) implements AnalysisOutcome {

    public AnalysisFailure {
        causes = causes == null ? List.of() : List.copyOf(causes);
    }
}

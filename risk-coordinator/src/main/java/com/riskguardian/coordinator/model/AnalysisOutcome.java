package com.riskguardian.coordinator.model;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Result of one coordinated analysis: either a report (possibly degraded) or a terminal
 * failure. Serialized with an {@code "outcome"} discriminator.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "outcome")
@JsonSubTypes({
    @JsonSubTypes.Type(value = AnalysisReport.class,  name = "REPORT"),
    @JsonSubTypes.Type(value = AnalysisFailure.class, name = "FAILURE")
})
public sealed interface AnalysisOutcome permits AnalysisReport, AnalysisFailure {
    String correlationId();
    long totalDurationMs();
}

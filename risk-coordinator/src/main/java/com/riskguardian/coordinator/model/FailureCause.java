package com.riskguardian.coordinator.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/** Why part of an analysis produced nothing usable. */
public record FailureCause(
    @JsonProperty("source")  String source,
    @JsonProperty("status")  CallStatus status,
    @JsonProperty("message") String message
) {
    public static FailureCause of(CallOutcome outcome) {
        return new FailureCause(outcome.analyzerName(), outcome.status(), outcome.failureMessage());
    }
}

package com.riskguardian.coordinator.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Transparency record for one analyzer call.
 *
 * <p>{@code durationMs} is wall-clock time as seen by the coordinator; {@code processingMs} is
 * what the analyzer endpoint reported for itself and is only present on success, as is
 * {@code origin}. {@code failureMessage} is only present for {@code TIMED_OUT} and {@code FAILED}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CallOutcome(
    @JsonProperty("analyzerName")   String analyzerName,
    @JsonProperty("status")         CallStatus status,
    @JsonProperty("durationMs")     long durationMs,
    @JsonProperty("origin")         String origin,
    @JsonProperty("processingMs")   Long processingMs,
    @JsonProperty("failureMessage") String failureMessage
) {
    /** Starting point of every call; the coordinator moves it to exactly one terminal status. */
    public static CallOutcome pending(String analyzerName) {
        return new CallOutcome(analyzerName, CallStatus.PENDING, 0L, null, null, null);
    }

    public CallOutcome succeed(long durationMs, String origin, long processingMs) {
        requirePending(CallStatus.SUCCEEDED);
        return new CallOutcome(analyzerName, CallStatus.SUCCEEDED, durationMs, origin, processingMs, null);
    }

    public CallOutcome timeOut(long durationMs, String message) {
        requirePending(CallStatus.TIMED_OUT);
        return new CallOutcome(analyzerName, CallStatus.TIMED_OUT, durationMs, null, null, message);
    }

    public CallOutcome fail(long durationMs, String message) {
        requirePending(CallStatus.FAILED);
        return new CallOutcome(analyzerName, CallStatus.FAILED, durationMs, null, null, message);
    }

    private void requirePending(CallStatus target) {
        if (status != CallStatus.PENDING) {
            throw new IllegalStateException(analyzerName + " call is already " + status + ", cannot move to " + target);
        }
    }

    @JsonIgnore
    public boolean isSuccess() {
        return status == CallStatus.SUCCEEDED;
    }
}

package com.riskguardian.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record Recommendation(
    @JsonProperty("rank")           int rank,
    @JsonProperty("focus")          RecommendationFocus focus,
    @JsonProperty("action")         String action,
    @JsonProperty("rationale")      String rationale,
    @JsonProperty("expectedImpact") String expectedImpact
) {
    public Recommendation {
        if (rationale == null || rationale.isBlank()) {
            throw new IllegalArgumentException("Recommendation rationale must not be blank");
        }
        if (expectedImpact == null || expectedImpact.isBlank()) {
            throw new IllegalArgumentException("Recommendation expectedImpact must not be blank");
        }
    }

    public Recommendation withRank(int newRank) {
        return new Recommendation(newRank, focus, action, rationale, expectedImpact);
    }
}

package com.riskguardian.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Combined risk judgment.
 *
 * <p>Fields:
 * <ul>
 *   <li>{@code riskMultiplier}     : dual-risk historical loss ÷ correlation-only loss; 1.0 when unknown</li>
 *   <li>{@code multiplierValidated}: {@code true} only when a joint historical record backs the multiplier</li>
 *   <li>{@code degraded}           : {@code true} when one perspective was unavailable; exactly one of
 *                                     {@code correlation}/{@code concentration} is then {@code null}</li>
 *   <li>{@code recommendations}    : 1 to 3 entries, ranked from 1</li>
 * </ul>
 */
public record SynthesisResult(
    @JsonProperty("correlation")         CorrelationResult correlation,
    @JsonProperty("concentration")       ConcentrationResult concentration,
    @JsonProperty("compoundingDetected") boolean compoundingDetected,
    @JsonProperty("riskMultiplier")      double riskMultiplier,
    @JsonProperty("multiplierValidated") boolean multiplierValidated,
    @JsonProperty("overallRiskLevel")    RiskLevel overallRiskLevel,
    @JsonProperty("recommendations")     List<Recommendation> recommendations,
    @JsonProperty("degraded")            boolean degraded,
    @JsonProperty("narrative")           String narrative
) {
    public static final int MAX_RECOMMENDATIONS = 3;

    public SynthesisResult {
        if (recommendations == null || recommendations.isEmpty() || recommendations.size() > MAX_RECOMMENDATIONS) {
            throw new IllegalArgumentException("Synthesis requires 1 to " + MAX_RECOMMENDATIONS
                + " recommendations, got " + (recommendations == null ? 0 : recommendations.size()));
        }
        recommendations = List.copyOf(recommendations);
    }
}

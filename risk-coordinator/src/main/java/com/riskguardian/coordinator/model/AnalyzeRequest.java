package com.riskguardian.coordinator.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.riskguardian.common.config.EngineSettings;
import com.riskguardian.common.exception.InvalidPortfolioException;
import com.riskguardian.common.model.PortfolioSnapshot;

import java.util.UUID;

/**
 * Inbound request. A blank {@code correlationId} is replaced by a random one;
 * {@code settings} overrides the coordinator's defaults for this request only.
 */
public record AnalyzeRequest(
    @JsonProperty("correlationId") String correlationId,
    @JsonProperty("snapshot")      PortfolioSnapshot snapshot,
    @JsonProperty("settings")      EngineSettings settings
) {
    public AnalyzeRequest {
        if (snapshot == null) {
            throw new InvalidPortfolioException("AnalyzeRequest requires a portfolio snapshot");
        }
        if (correlationId == null || correlationId.isBlank()) {
            correlationId = UUID.randomUUID().toString();
        }
    }

    public static AnalyzeRequest of(String correlationId, PortfolioSnapshot snapshot) {
        return new AnalyzeRequest(correlationId, snapshot, null);
    }
}

package com.riskguardian.analysis.channel;

import com.riskguardian.common.config.EngineSettings;
import com.riskguardian.common.model.PortfolioSnapshot;

/** Request half of an analyzer exchange; the correlation id ties the reply to its request. */
public record AnalyzerCall(
    String correlationId,
    PortfolioSnapshot snapshot,
    EngineSettings settings
) {}

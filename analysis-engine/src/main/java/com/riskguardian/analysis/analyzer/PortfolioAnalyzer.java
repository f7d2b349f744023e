package com.riskguardian.analysis.analyzer;

import com.riskguardian.common.config.EngineSettings;
import com.riskguardian.common.model.PortfolioSnapshot;

/**
 * One independent perspective on a portfolio. Implementations are stateless between
 * calls and safe to invoke concurrently.
 */
public interface PortfolioAnalyzer<T> {
    T analyze(PortfolioSnapshot snapshot, EngineSettings settings);
    String analyzerName();
}

package com.riskguardian.coordinator.synthesis;

import com.riskguardian.common.config.EngineSettings;
import com.riskguardian.common.model.ConcentrationResult;
import com.riskguardian.common.model.CorrelationResult;
import com.riskguardian.common.model.SynthesisResult;

/**
 * Strategy contract for combining the correlation and concentration perspectives into one
 * risk judgment.
 *
 * <p>Implementations must be:
 * <ul>
 *   <li><b>Deterministic</b>: same inputs and knowledge contents give an equal result</li>
 *   <li><b>Stateless</b>    : no mutable state; safe to call concurrently</li>
 *   <li><b>Non-null</b>     : must always return a valid {@link SynthesisResult}</li>
 * </ul>
 *
 * <p>Overall level, first match wins:
 * <pre>
 *   compounding AND correlation &gt; 90%             → CRITICAL
 *   compounding                                   → HIGH
 *   bracket MODERATE OR label MODERATE            → MODERATE
 *   otherwise                                     → LOW
 * </pre>
 *
 * <p>Callers that may hold only one perspective go through {@link SynthesisGuard}, which picks
 * the matching method.
 */
public interface SynthesisEngine {

    /**
     * @param correlation   a {@code COMPUTED} correlation result
     * @param concentration a concentration result
     */
    SynthesisResult synthesize(CorrelationResult correlation, ConcentrationResult concentration,
                               EngineSettings settings);

    /** Degraded synthesis when the concentration perspective is unavailable. */
    SynthesisResult synthesizeCorrelationOnly(CorrelationResult correlation, EngineSettings settings);

    /** Degraded synthesis when the correlation perspective is unavailable. */
    SynthesisResult synthesizeConcentrationOnly(ConcentrationResult concentration, EngineSettings settings);
}

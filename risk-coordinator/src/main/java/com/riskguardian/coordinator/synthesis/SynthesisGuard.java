package com.riskguardian.coordinator.synthesis;

import com.riskguardian.common.config.EngineSettings;
import com.riskguardian.common.model.ConcentrationResult;
import com.riskguardian.common.model.CorrelationResult;
import com.riskguardian.common.model.SynthesisResult;

import java.util.Optional;

/**
 * Routes whatever perspectives are usable to the matching {@link SynthesisEngine} method.
 *
 * <p>A result with {@code INSUFFICIENT_DATA} status counts as unavailable, whichever analyzer
 * produced it.
 *
 * <p>This class is a pure utility:
 * <ul>
 *   <li>No reactive types</li>
 *   <li>No logging</li>
 *   <li>No state</li>
 *   <li>No Spring dependency</li>
 * </ul>
 */
public final class SynthesisGuard {

    private SynthesisGuard() {}

    /**
     * @param correlation   the correlation result, or {@code null} when the call did not succeed
     * @param concentration the concentration result, or {@code null} when the call did not succeed
     * @return the synthesis, or empty when neither perspective is usable
     */
    public static Optional<SynthesisResult> resolve(CorrelationResult correlation,
                                                    ConcentrationResult concentration,
                                                    EngineSettings settings,
                                                    SynthesisEngine engine) {
        boolean correlationUsable = isUsable(correlation);
        boolean concentrationUsable = isUsable(concentration);
        if (correlationUsable && concentrationUsable) {
            return Optional.of(engine.synthesize(correlation, concentration, settings));
        }
        if (correlationUsable) {
            return Optional.of(engine.synthesizeCorrelationOnly(correlation, settings));
        }
        if (concentrationUsable) {
            return Optional.of(engine.synthesizeConcentrationOnly(concentration, settings));
        }
        return Optional.empty();
    }

    public static boolean isUsable(CorrelationResult correlation) {
        return correlation != null && !correlation.isInsufficientData();
    }

    public static boolean isUsable(ConcentrationResult concentration) {
        return concentration != null && !concentration.isInsufficientData();
    }
}

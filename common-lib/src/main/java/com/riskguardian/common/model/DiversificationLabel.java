package com.riskguardian.common.model;

/**
 * Portfolio-level concentration label.
 *
 * <pre>
 *   any category &gt; danger threshold                       → HIGH_CONCENTRATION
 *   moderate threshold ≤ largest share ≤ danger threshold  → MODERATE
 *   otherwise                                              → WELL_DIVERSIFIED
 * </pre>
 */
public enum DiversificationLabel {
    WELL_DIVERSIFIED,
    MODERATE,
    HIGH_CONCENTRATION
}

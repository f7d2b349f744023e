package com.riskguardian.common.model;

/**
 * Qualitative co-movement classification of a portfolio against the reference asset.
 *
 * <pre>
 *   percentage &gt; 85        → HIGH
 *   70 ≤ percentage ≤ 85   → MODERATE
 *   percentage &lt; 70        → LOW
 * </pre>
 */
public enum CoMovementBracket {
    HIGH(">85%"),
    MODERATE("70-85%"),
    LOW("<70%");

    private static final int HIGH_FLOOR_EXCLUSIVE = 85;
    private static final int MODERATE_FLOOR = 70;

    private final String label;

    CoMovementBracket(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public static CoMovementBracket fromPercentage(int percentage) {
        if (percentage > HIGH_FLOOR_EXCLUSIVE) return HIGH;
        if (percentage >= MODERATE_FLOOR) return MODERATE;
        return LOW;
    }
}

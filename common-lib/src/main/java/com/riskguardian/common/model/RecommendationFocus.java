package com.riskguardian.common.model;

/** What a recommendation acts on; lets consumers reason about recommendations without parsing text. */
public enum RecommendationFocus {
    CATEGORY_CONCENTRATION,
    CORRELATION,
    PRIORITIZATION,
    MAINTAIN
}

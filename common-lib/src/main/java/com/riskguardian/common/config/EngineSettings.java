package com.riskguardian.common.config;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Duration;

/**
 * Request-scoped engine configuration.
 *
 * <p>A coordinator is constructed with one instance as its default; an individual request
 * may carry its own instance, which then applies to that request only. Nothing in the
 * engine reads thresholds or timeouts from anywhere else.
 *
 * <p>Thresholds are percentages in (0, 100]; {@code maxExcludedValueShare} is a fraction (0–1).
 * A request payload only needs the fields it overrides: {@link #fromJson} fills the rest from
 * the defaults.
 */
public record EngineSettings(
    @JsonProperty("windowDays")                      int windowDays,
    @JsonProperty("dangerThreshold")                 double dangerThreshold,
    @JsonProperty("moderateThreshold")               double moderateThreshold,
    @JsonProperty("compoundingCorrelationThreshold") int compoundingCorrelationThreshold,
    @JsonProperty("perCallTimeout")                  Duration perCallTimeout,
    @JsonProperty("overallDeadline")                 Duration overallDeadline,
    @JsonProperty("knowledgeBackend")                KnowledgeBackend knowledgeBackend,
    @JsonProperty("knowledgeLookupTimeout")          Duration knowledgeLookupTimeout,
    @JsonProperty("maxExcludedValueShare")           double maxExcludedValueShare,
    @JsonProperty("referenceSymbol")                 String referenceSymbol
) {
    public static final int      DEFAULT_WINDOW_DAYS               = 90;
    public static final double   DEFAULT_DANGER_THRESHOLD          = 60.0;
    public static final double   DEFAULT_MODERATE_THRESHOLD        = 40.0;
    public static final int      DEFAULT_COMPOUNDING_THRESHOLD     = 85;
    public static final Duration DEFAULT_PER_CALL_TIMEOUT          = Duration.ofSeconds(10);
    public static final Duration DEFAULT_OVERALL_DEADLINE          = Duration.ofSeconds(60);
    public static final Duration DEFAULT_KNOWLEDGE_LOOKUP_TIMEOUT  = Duration.ofSeconds(2);
    public static final double   DEFAULT_MAX_EXCLUDED_VALUE_SHARE  = 0.5;
    public static final String   DEFAULT_REFERENCE_SYMBOL          = "ETH";

    public EngineSettings {
        if (windowDays < 2) {
            throw new IllegalArgumentException("windowDays must be at least 2, was " + windowDays);
        }
        requirePercentage("dangerThreshold", dangerThreshold);
        requirePercentage("moderateThreshold", moderateThreshold);
        requirePercentage("compoundingCorrelationThreshold", compoundingCorrelationThreshold);
        if (moderateThreshold > dangerThreshold) {
            throw new IllegalArgumentException("moderateThreshold (" + moderateThreshold
                + ") must not exceed dangerThreshold (" + dangerThreshold + ")");
        }
        if (maxExcludedValueShare < 0.0 || maxExcludedValueShare > 1.0) {
            throw new IllegalArgumentException("maxExcludedValueShare must be within [0, 1], was " + maxExcludedValueShare);
        }
        perCallTimeout         = perCallTimeout == null ? DEFAULT_PER_CALL_TIMEOUT : perCallTimeout;
        overallDeadline        = overallDeadline == null ? DEFAULT_OVERALL_DEADLINE : overallDeadline;
        knowledgeBackend       = knowledgeBackend == null ? KnowledgeBackend.GRAPH : knowledgeBackend;
        knowledgeLookupTimeout = knowledgeLookupTimeout == null ? DEFAULT_KNOWLEDGE_LOOKUP_TIMEOUT : knowledgeLookupTimeout;
        referenceSymbol        = referenceSymbol == null || referenceSymbol.isBlank()
                                     ? DEFAULT_REFERENCE_SYMBOL : referenceSymbol;
    }

    /** Absent numbers take the matching {@code DEFAULT_*} value rather than Java's zero. */
    @JsonCreator
    public static EngineSettings fromJson(
            @JsonProperty("windowDays")                      Integer windowDays,
            @JsonProperty("dangerThreshold")                 Double dangerThreshold,
            @JsonProperty("moderateThreshold")               Double moderateThreshold,
            @JsonProperty("compoundingCorrelationThreshold") Integer compoundingCorrelationThreshold,
            @JsonProperty("perCallTimeout")                  Duration perCallTimeout,
            @JsonProperty("overallDeadline")                 Duration overallDeadline,
            @JsonProperty("knowledgeBackend")                KnowledgeBackend knowledgeBackend,
            @JsonProperty("knowledgeLookupTimeout")          Duration knowledgeLookupTimeout,
            @JsonProperty("maxExcludedValueShare")           Double maxExcludedValueShare,
            @JsonProperty("referenceSymbol")                 String referenceSymbol) {
        return new EngineSettings(
            windowDays != null ? windowDays : DEFAULT_WINDOW_DAYS,
            dangerThreshold != null ? dangerThreshold : DEFAULT_DANGER_THRESHOLD,
            moderateThreshold != null ? moderateThreshold : DEFAULT_MODERATE_THRESHOLD,
            compoundingCorrelationThreshold != null ? compoundingCorrelationThreshold : DEFAULT_COMPOUNDING_THRESHOLD,
            perCallTimeout, overallDeadline, knowledgeBackend, knowledgeLookupTimeout,
            maxExcludedValueShare != null ? maxExcludedValueShare : DEFAULT_MAX_EXCLUDED_VALUE_SHARE,
            referenceSymbol);
    }

    public static EngineSettings defaults() {
        return new EngineSettings(DEFAULT_WINDOW_DAYS, DEFAULT_DANGER_THRESHOLD, DEFAULT_MODERATE_THRESHOLD,
            DEFAULT_COMPOUNDING_THRESHOLD, DEFAULT_PER_CALL_TIMEOUT, DEFAULT_OVERALL_DEADLINE,
            KnowledgeBackend.GRAPH, DEFAULT_KNOWLEDGE_LOOKUP_TIMEOUT, DEFAULT_MAX_EXCLUDED_VALUE_SHARE,
            DEFAULT_REFERENCE_SYMBOL);
    }

    public EngineSettings withWindowDays(int days) {
        return new EngineSettings(days, dangerThreshold, moderateThreshold, compoundingCorrelationThreshold,
            perCallTimeout, overallDeadline, knowledgeBackend, knowledgeLookupTimeout, maxExcludedValueShare,
            referenceSymbol);
    }

    public EngineSettings withThresholds(double danger, double moderate, int compounding) {
        return new EngineSettings(windowDays, danger, moderate, compounding,
            perCallTimeout, overallDeadline, knowledgeBackend, knowledgeLookupTimeout, maxExcludedValueShare,
            referenceSymbol);
    }

    public EngineSettings withTimeouts(Duration perCall, Duration overall) {
        return new EngineSettings(windowDays, dangerThreshold, moderateThreshold, compoundingCorrelationThreshold,
            perCall, overall, knowledgeBackend, knowledgeLookupTimeout, maxExcludedValueShare, referenceSymbol);
    }

    public EngineSettings withKnowledgeBackend(KnowledgeBackend backend) {
        return new EngineSettings(windowDays, dangerThreshold, moderateThreshold, compoundingCorrelationThreshold,
            perCallTimeout, overallDeadline, backend, knowledgeLookupTimeout, maxExcludedValueShare, referenceSymbol);
    }

    public EngineSettings withMaxExcludedValueShare(double share) {
        return new EngineSettings(windowDays, dangerThreshold, moderateThreshold, compoundingCorrelationThreshold,
            perCallTimeout, overallDeadline, knowledgeBackend, knowledgeLookupTimeout, share, referenceSymbol);
    }

    private static void requirePercentage(String name, double value) {
        if (!(value > 0.0 && value <= 100.0)) {
            throw new IllegalArgumentException(name + " must be within (0, 100], was " + value);
        }
    }
}

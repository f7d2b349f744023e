package com.riskguardian.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One scenario's answer to a knowledge lookup.
 *
 * <p>{@code expectedLossPct} is the loss of whatever was looked up (a bracket, a category
 * or a bracket × category pair); {@code referenceLossPct} is the reference asset's drawdown
 * in the same scenario.
 */
public record ScenarioExcerpt(
    @JsonProperty("scenarioId")           String scenarioId,
    @JsonProperty("displayName")          String displayName,
    @JsonProperty("periodLabel")          String periodLabel,
    @JsonProperty("expectedLossPct")      double expectedLossPct,
    @JsonProperty("referenceLossPct")     double referenceLossPct,
    @JsonProperty("marketAverageLossPct") double marketAverageLossPct
) {
    public static ScenarioExcerpt of(ScenarioRecord scenario, double expectedLossPct) {
        return new ScenarioExcerpt(scenario.scenarioId(), scenario.displayName(), scenario.periodLabel(),
            expectedLossPct, scenario.referenceAssetDrawdownPct(), scenario.marketAverageLossPct());
    }
}

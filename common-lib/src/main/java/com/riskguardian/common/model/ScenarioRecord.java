package com.riskguardian.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static java.util.Collections.unmodifiableMap;
import static java.util.Collections.unmodifiableSet;

/**
 * A historical stress event. Loaded once at startup and shared read-only by every
 * request; all collections are copied into unmodifiable, insertion-ordered views.
 *
 * <p>Loss figures are signed percentages (a 73% loss is {@code -73.0}).
 */
public record ScenarioRecord(
    @JsonProperty("scenarioId")                String scenarioId,
    @JsonProperty("displayName")               String displayName,
    @JsonProperty("periodLabel")               String periodLabel,
    @JsonProperty("referenceAssetDrawdownPct") double referenceAssetDrawdownPct,
    @JsonProperty("marketAverageLossPct")      double marketAverageLossPct,
    @JsonProperty("bracketLossTable")          Map<CoMovementBracket, Double> bracketLossTable,
    @JsonProperty("categoryLossTable")         Map<String, Double> categoryLossTable,
    @JsonProperty("jointLossTable")            Map<CoMovementBracket, Map<String, Double>> jointLossTable,
    @JsonProperty("recoveryWinners")           Set<String> recoveryWinners,
    @JsonProperty("recoveryPeriodLabel")       String recoveryPeriodLabel,
    @JsonProperty("opportunityCosts")          List<OpportunityCost> opportunityCosts
) {
    public ScenarioRecord {
        bracketLossTable  = bracketLossTable == null ? Map.of() : unmodifiableMap(new LinkedHashMap<>(bracketLossTable));
        categoryLossTable = categoryLossTable == null ? Map.of() : unmodifiableMap(new LinkedHashMap<>(categoryLossTable));
        if (jointLossTable == null) {
            jointLossTable = Map.of();
        } else {
            Map<CoMovementBracket, Map<String, Double>> copy = new LinkedHashMap<>();
            jointLossTable.forEach((bracket, byCategory) ->
                copy.put(bracket, unmodifiableMap(new LinkedHashMap<>(byCategory))));
            jointLossTable = unmodifiableMap(copy);
        }
        recoveryWinners  = recoveryWinners == null ? Set.of() : unmodifiableSet(new LinkedHashSet<>(recoveryWinners));
        opportunityCosts = opportunityCosts == null ? List.of() : List.copyOf(opportunityCosts);
    }
}

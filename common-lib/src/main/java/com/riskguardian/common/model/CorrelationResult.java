package com.riskguardian.common.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import static java.util.Collections.unmodifiableSet;

/**
 * Output of the correlation analyzer.
 *
 * <p>When {@code status} is {@link CorrelationStatus#INSUFFICIENT_DATA} the numeric fields
 * ({@code coefficient}, {@code percentage}, {@code bracket}) are {@code null} and
 * {@code scenarioContexts} is empty.
 */
public record CorrelationResult(
    @JsonProperty("status")           CorrelationStatus status,
    @JsonProperty("coefficient")      Double coefficient,
    @JsonProperty("percentage")       Integer percentage,
    @JsonProperty("bracket")          CoMovementBracket bracket,
    @JsonProperty("scenarioContexts") List<ScenarioExcerpt> scenarioContexts,
    @JsonProperty("windowDays")       int windowDays,
    @JsonProperty("includedSymbols")  Set<String> includedSymbols,
    @JsonProperty("excludedSymbols")  Set<String> excludedSymbols,
    @JsonProperty("narrative")        String narrative
) {
    public CorrelationResult {
        scenarioContexts = scenarioContexts == null ? List.of() : List.copyOf(scenarioContexts);
        includedSymbols  = includedSymbols == null ? Set.of() : unmodifiableSet(new LinkedHashSet<>(includedSymbols));
        excludedSymbols  = excludedSymbols == null ? Set.of() : unmodifiableSet(new LinkedHashSet<>(excludedSymbols));
    }

    public static CorrelationResult computed(double coefficient, int percentage, CoMovementBracket bracket,
                                             List<ScenarioExcerpt> scenarioContexts, int windowDays,
                                             Set<String> includedSymbols, Set<String> excludedSymbols,
                                             String narrative) {
        return new CorrelationResult(CorrelationStatus.COMPUTED, coefficient, percentage, bracket,
            scenarioContexts, windowDays, includedSymbols, excludedSymbols, narrative);
    }

    public static CorrelationResult insufficientData(int windowDays, Set<String> includedSymbols,
                                                     Set<String> excludedSymbols, String narrative) {
        return new CorrelationResult(CorrelationStatus.INSUFFICIENT_DATA, null, null, null,
            List.of(), windowDays, includedSymbols, excludedSymbols, narrative);
    }

    @JsonIgnore
    public boolean isInsufficientData() {
        return status == CorrelationStatus.INSUFFICIENT_DATA;
    }
}

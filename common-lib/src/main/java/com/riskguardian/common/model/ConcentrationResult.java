package com.riskguardian.common.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static java.util.Collections.unmodifiableMap;
import static java.util.Collections.unmodifiableSet;

/**
 * Output of the concentration analyzer.
 *
 * <p>{@code breakdown} is ordered by share, largest first. Unknown symbols are not part of
 * the breakdown; their value only appears in {@code unknownValue}/{@code unknownPercentage},
 * so breakdown percentages plus {@code unknownPercentage} add up to 100.
 *
 * <p>When no holding maps to a known category the status is
 * {@link ConcentrationStatus#INSUFFICIENT_DATA}: the breakdown is empty and
 * {@code diversificationLabel} is {@code null}.
 */
public record ConcentrationResult(
    @JsonProperty("status")                 ConcentrationStatus status,
    @JsonProperty("breakdown")              Map<String, CategoryHolding> breakdown,
    @JsonProperty("concentratedCategories") List<String> concentratedCategories,
    @JsonProperty("diversificationLabel")   DiversificationLabel diversificationLabel,
    @JsonProperty("categoryRisks")          List<CategoryRisk> categoryRisks,
    @JsonProperty("unknownSymbols")         Set<String> unknownSymbols,
    @JsonProperty("unknownValue")           double unknownValue,
    @JsonProperty("unknownPercentage")      double unknownPercentage,
    @JsonProperty("warningNarrative")       String warningNarrative,
    @JsonProperty("narrative")              String narrative
) {
    public ConcentrationResult {
        status = status == null ? ConcentrationStatus.COMPUTED : status;
        breakdown = breakdown == null ? Map.of() : unmodifiableMap(new LinkedHashMap<>(breakdown));
        concentratedCategories = concentratedCategories == null ? List.of() : List.copyOf(concentratedCategories);
        categoryRisks = categoryRisks == null ? List.of() : List.copyOf(categoryRisks);
        unknownSymbols = unknownSymbols == null ? Set.of() : unmodifiableSet(new LinkedHashSet<>(unknownSymbols));
    }

    public static ConcentrationResult computed(Map<String, CategoryHolding> breakdown,
                                               List<String> concentratedCategories,
                                               DiversificationLabel diversificationLabel,
                                               List<CategoryRisk> categoryRisks, Set<String> unknownSymbols,
                                               double unknownValue, double unknownPercentage,
                                               String warningNarrative, String narrative) {
        return new ConcentrationResult(ConcentrationStatus.COMPUTED, breakdown, concentratedCategories,
            diversificationLabel, categoryRisks, unknownSymbols, unknownValue, unknownPercentage,
            warningNarrative, narrative);
    }

    public static ConcentrationResult insufficientData(Set<String> unknownSymbols, double unknownValue,
                                                       String warningNarrative, String narrative) {
        return new ConcentrationResult(ConcentrationStatus.INSUFFICIENT_DATA, Map.of(), List.of(), null,
            List.of(), unknownSymbols, unknownValue, 100.0, warningNarrative, narrative);
    }

    @JsonIgnore
    public boolean isInsufficientData() {
        return status == ConcentrationStatus.INSUFFICIENT_DATA;
    }

    /** Category with the largest share, if any holding was mapped at all. */
    @JsonIgnore
    public Optional<CategoryHolding> largestCategory() {
        return breakdown.values().stream().findFirst();
    }

    @JsonIgnore
    public boolean hasConcentration() {
        return !concentratedCategories.isEmpty();
    }
}

package com.riskguardian.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.LinkedHashSet;
import java.util.Set;

import static java.util.Collections.unmodifiableSet;

/** Aggregated exposure of one category; {@code percentage} is of the full portfolio total. */
public record CategoryHolding(
    @JsonProperty("categoryName")  String categoryName,
    @JsonProperty("value")         double value,
    @JsonProperty("percentage")    double percentage,
    @JsonProperty("memberSymbols") Set<String> memberSymbols
) {
    public CategoryHolding {
        memberSymbols = memberSymbols == null ? Set.of() : unmodifiableSet(new LinkedHashSet<>(memberSymbols));
    }
}

package com.riskguardian.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/** Historical context attached to a concentrated category. */
public record CategoryRisk(
    @JsonProperty("categoryName")             String categoryName,
    @JsonProperty("scenarioContexts")         List<ScenarioExcerpt> scenarioContexts,
    @JsonProperty("opportunityCostNarrative") String opportunityCostNarrative
) {
    public CategoryRisk {
        scenarioContexts = scenarioContexts == null ? List.of() : List.copyOf(scenarioContexts);
        opportunityCostNarrative = opportunityCostNarrative == null ? "" : opportunityCostNarrative;
    }
}

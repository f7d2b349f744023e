package com.riskguardian.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/** Best recovery performer of a category after a stress scenario. */
public record OpportunityCost(
    @JsonProperty("category")        String category,
    @JsonProperty("bestPerformer")   String bestPerformer,
    @JsonProperty("recoveryGainPct") double recoveryGainPct,
    @JsonProperty("reason")          String reason
) {}

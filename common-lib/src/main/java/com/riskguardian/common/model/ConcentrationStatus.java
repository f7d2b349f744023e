package com.riskguardian.common.model;

public enum ConcentrationStatus {
    COMPUTED,
    INSUFFICIENT_DATA
}

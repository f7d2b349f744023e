package com.riskguardian.common.model;

public enum CorrelationStatus {
    COMPUTED,
    INSUFFICIENT_DATA
}

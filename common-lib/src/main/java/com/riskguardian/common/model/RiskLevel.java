package com.riskguardian.common.model;

public enum RiskLevel {
    LOW,
    MODERATE,
    HIGH,
    CRITICAL
}

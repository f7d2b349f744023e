package com.riskguardian.coordinator.model;

/** Lifecycle of one analyzer call: {@code PENDING → SUCCEEDED | TIMED_OUT | FAILED}. */
public enum CallStatus {
    PENDING,
    SUCCEEDED,
    TIMED_OUT,
    FAILED
}

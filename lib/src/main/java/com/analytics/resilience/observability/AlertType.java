package com.analytics.resilience.observability;

public enum AlertType {
    BUDGET_VIOLATION,
    CONSECUTIVE_FAILURES,
    HIGH_LATENCY,
    LOW_SUCCESS_RATE,
    CONNECTION_ISSUES
}

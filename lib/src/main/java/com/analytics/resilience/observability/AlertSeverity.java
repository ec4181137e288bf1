package com.analytics.resilience.observability;

public enum AlertSeverity {
    INFO,
    WARNING,
    ERROR,
    CRITICAL;

    /**
     * Severe enough to count as evidence that the service is degrading.
     */
    public boolean isSevere() {
        return this == ERROR || this == CRITICAL;
    }
}

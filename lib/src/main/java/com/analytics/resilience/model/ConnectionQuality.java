package com.analytics.resilience.model;

/**
 * Live channel quality derived from heartbeat round-trip latency.
 */
public enum ConnectionQuality {
    EXCELLENT,
    GOOD,
    POOR,
    CRITICAL;

    public static ConnectionQuality fromLatency(double latencyMs) {
        if (latencyMs < 100) {
            return EXCELLENT;
        }
        if (latencyMs < 300) {
            return GOOD;
        }
        if (latencyMs < 1000) {
            return POOR;
        }
        return CRITICAL;
    }
}

package com.analytics.resilience.model;

/**
 * Result of an upstream health check.
 */
public enum HealthStatus {
    HEALTHY,
    DEGRADED,
    UNHEALTHY
}

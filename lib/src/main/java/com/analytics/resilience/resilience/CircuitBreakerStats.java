package com.analytics.resilience.resilience;

import com.analytics.resilience.model.CircuitState;

/**
 * Point-in-time counters of a circuit breaker. Times are epoch milliseconds of the breaker's clock.
 */
public record CircuitBreakerStats(
    CircuitState state,
    int failureCount,
    int successCount,
    long lastFailureTime,
    long lastSuccessTime,
    long totalRequests,
    long totalFailures,
    long totalSuccesses,
    long uptimeMs,
    long lastStateChange) {
}

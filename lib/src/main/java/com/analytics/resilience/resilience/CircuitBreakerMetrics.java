package com.analytics.resilience.resilience;

/**
 * Derived rates and response-time percentiles over the breaker's response-time window.
 *
 * @param requestRate requests per second over the last minute
 * @param errorRate failed share of all requests since creation or last reset
 */
public record CircuitBreakerMetrics(
    double requestRate,
    double errorRate,
    double averageResponseTime,
    long p95ResponseTime,
    long p99ResponseTime) {
}

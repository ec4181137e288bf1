package com.analytics.resilience.observability;

/**
 * Aggregates over the requests completed within the retention window. Latencies are in milliseconds.
 */
public record PerformanceSnapshot(
    double requestLatency,
    int requestCount,
    double successRate,
    double errorRate,
    int retryCount,
    long connectionCount,
    long reconnectionCount,
    long messageCount,
    double cacheHitRate,
    double cacheMissRate,
    int budgetViolations,
    int performanceScore
) {
}

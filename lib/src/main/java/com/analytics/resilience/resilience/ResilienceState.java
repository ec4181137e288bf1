package com.analytics.resilience.resilience;

import com.analytics.resilience.error.AnalyticsException;
import com.analytics.resilience.model.CircuitState;
import com.analytics.resilience.model.DegradationLevel;

import java.util.List;

/**
 * Aggregated health of the resilience layer.
 *
 * @param healthScore 0 to 100; the layer counts as healthy at 70 and above
 * @param circuitState worst state across all operation breakers
 * @param recentErrors most recent first, at most ten
 */
public record ResilienceState(
    boolean healthy,
    int healthScore,
    DegradationLevel degradationLevel,
    CircuitState circuitState,
    int performanceScore,
    List<AnalyticsException> recentErrors,
    double errorRate,
    int consecutiveFailures,
    String statusMessage,
    List<String> recommendations
) {
}

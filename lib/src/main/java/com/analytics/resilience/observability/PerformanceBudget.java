package com.analytics.resilience.observability;

import java.time.Instant;

/**
 * State of one performance budget. {@code lastViolation} is {@code null} until the budget is first violated.
 */
public record PerformanceBudget(
    String name,
    Metric metric,
    double threshold,
    double current,
    boolean violated,
    int violationCount,
    Instant lastViolation
) {

    /**
     * Measured quantity a budget constrains.
     */
    public enum Metric {
        REQUEST_LATENCY(false),
        SUCCESS_RATE(true),
        ERROR_RATE(false),
        CACHE_MISS_RATE(false);

        private final boolean minimum;

        Metric(boolean minimum) {
            this.minimum = minimum;
        }

        /**
         * Whether the threshold is a floor rather than a ceiling.
         */
        public boolean isMinimum() {
            return minimum;
        }

        double valueOf(PerformanceSnapshot snapshot) {
            return switch (this) {
                case REQUEST_LATENCY -> snapshot.requestLatency();
                case SUCCESS_RATE -> snapshot.successRate();
                case ERROR_RATE -> snapshot.errorRate();
                case CACHE_MISS_RATE -> snapshot.cacheMissRate();
            };
        }

        boolean isViolatedBy(double value, double threshold) {
            return minimum ? value < threshold : value > threshold;
        }
    }
}

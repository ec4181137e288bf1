package com.analytics.resilience.config;

import java.time.Duration;

/**
 * Performance budgets and alert thresholds for the performance monitor.
 */
public class MonitoringConfig {

    private final long latencyBudgetMs;
    private final double successRateBudget;
    private final double errorRateBudget;
    private final double cacheMissRateBudget;
    private final int consecutiveFailureAlertThreshold;
    private final long highLatencyAlertMs;
    private final double lowSuccessRateAlert;
    private final int maxStoredRequests;
    private final Duration metricsRetention;

    private MonitoringConfig(Builder builder) {
        this.latencyBudgetMs = builder.latencyBudgetMs;
        this.successRateBudget = builder.successRateBudget;
        this.errorRateBudget = builder.errorRateBudget;
        this.cacheMissRateBudget = builder.cacheMissRateBudget;
        this.consecutiveFailureAlertThreshold = builder.consecutiveFailureAlertThreshold;
        this.highLatencyAlertMs = builder.highLatencyAlertMs;
        this.lowSuccessRateAlert = builder.lowSuccessRateAlert;
        this.maxStoredRequests = builder.maxStoredRequests;
        this.metricsRetention = builder.metricsRetention;
    }

    public long getLatencyBudgetMs() {
        return latencyBudgetMs;
    }

    public double getSuccessRateBudget() {
        return successRateBudget;
    }

    public double getErrorRateBudget() {
        return errorRateBudget;
    }

    public double getCacheMissRateBudget() {
        return cacheMissRateBudget;
    }

    public int getConsecutiveFailureAlertThreshold() {
        return consecutiveFailureAlertThreshold;
    }

    public long getHighLatencyAlertMs() {
        return highLatencyAlertMs;
    }

    public double getLowSuccessRateAlert() {
        return lowSuccessRateAlert;
    }

    public int getMaxStoredRequests() {
        return maxStoredRequests;
    }

    public Duration getMetricsRetention() {
        return metricsRetention;
    }

    public static MonitoringConfig defaultConfig() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private long latencyBudgetMs = 5000;
        private double successRateBudget = 0.95;
        private double errorRateBudget = 0.05;
        private double cacheMissRateBudget = 0.3;
        private int consecutiveFailureAlertThreshold = 5;
        private long highLatencyAlertMs = 10000;
        private double lowSuccessRateAlert = 0.8;
        private int maxStoredRequests = 1000;
        private Duration metricsRetention = Duration.ofHours(1);

        public Builder latencyBudgetMs(long budget) {
            this.latencyBudgetMs = budget;
            return this;
        }

        public Builder successRateBudget(double budget) {
            this.successRateBudget = budget;
            return this;
        }

        public Builder errorRateBudget(double budget) {
            this.errorRateBudget = budget;
            return this;
        }

        public Builder cacheMissRateBudget(double budget) {
            this.cacheMissRateBudget = budget;
            return this;
        }

        public Builder consecutiveFailureAlertThreshold(int threshold) {
            this.consecutiveFailureAlertThreshold = threshold;
            return this;
        }

        public Builder highLatencyAlertMs(long latency) {
            this.highLatencyAlertMs = latency;
            return this;
        }

        public Builder lowSuccessRateAlert(double rate) {
            this.lowSuccessRateAlert = rate;
            return this;
        }

        public Builder maxStoredRequests(int max) {
            this.maxStoredRequests = max;
            return this;
        }

        public Builder metricsRetention(Duration retention) {
            this.metricsRetention = retention;
            return this;
        }

        public MonitoringConfig build() {
            if (maxStoredRequests < 1) {
                throw new IllegalArgumentException("Max stored requests must be positive");
            }
            return new MonitoringConfig(this);
        }
    }
}

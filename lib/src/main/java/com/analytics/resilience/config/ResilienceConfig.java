package com.analytics.resilience.config;

import java.time.Duration;

/**
 * Configuration of the resilience façade: breaker defaults, retry, degradation thresholds
 * and the components it coordinates.
 */
public class ResilienceConfig {

    private final CircuitBreakerConfig circuitBreakerConfig;
    private final DegradationConfig degradationConfig;
    private final MonitoringConfig monitoringConfig;
    private final boolean enableCircuitBreaker;
    private final boolean enableRetry;
    private final boolean enableGracefulDegradation;
    private final boolean enablePerformanceMonitoring;
    private final int maxRetryAttempts;
    private final Duration retryBaseDelay;
    private final Duration maxRetryDelay;
    private final int partialDegradationThreshold;
    private final int significantDegradationThreshold;
    private final int criticalDegradationThreshold;
    private final Duration healthCheckInterval;

    private ResilienceConfig(Builder builder) {
        this.circuitBreakerConfig = builder.circuitBreakerConfig;
        this.degradationConfig = builder.degradationConfig;
        this.monitoringConfig = builder.monitoringConfig;
        this.enableCircuitBreaker = builder.enableCircuitBreaker;
        this.enableRetry = builder.enableRetry;
        this.enableGracefulDegradation = builder.enableGracefulDegradation;
        this.enablePerformanceMonitoring = builder.enablePerformanceMonitoring;
        this.maxRetryAttempts = builder.maxRetryAttempts;
        this.retryBaseDelay = builder.retryBaseDelay;
        this.maxRetryDelay = builder.maxRetryDelay;
        this.partialDegradationThreshold = builder.partialDegradationThreshold;
        this.significantDegradationThreshold = builder.significantDegradationThreshold;
        this.criticalDegradationThreshold = builder.criticalDegradationThreshold;
        this.healthCheckInterval = builder.healthCheckInterval;
    }

    public CircuitBreakerConfig getCircuitBreakerConfig() {
        return circuitBreakerConfig;
    }

    public DegradationConfig getDegradationConfig() {
        return degradationConfig;
    }

    public MonitoringConfig getMonitoringConfig() {
        return monitoringConfig;
    }

    public boolean isCircuitBreakerEnabled() {
        return enableCircuitBreaker;
    }

    public boolean isRetryEnabled() {
        return enableRetry;
    }

    public boolean isGracefulDegradationEnabled() {
        return enableGracefulDegradation;
    }

    public boolean isPerformanceMonitoringEnabled() {
        return enablePerformanceMonitoring;
    }

    /**
     * Retries after the first attempt; total attempts are one more.
     */
    public int getMaxRetryAttempts() {
        return maxRetryAttempts;
    }

    public Duration getRetryBaseDelay() {
        return retryBaseDelay;
    }

    public Duration getMaxRetryDelay() {
        return maxRetryDelay;
    }

    public int getPartialDegradationThreshold() {
        return partialDegradationThreshold;
    }

    public int getSignificantDegradationThreshold() {
        return significantDegradationThreshold;
    }

    public int getCriticalDegradationThreshold() {
        return criticalDegradationThreshold;
    }

    public Duration getHealthCheckInterval() {
        return healthCheckInterval;
    }

    /**
     * Production defaults.
     */
    public static ResilienceConfig defaultConfig() {
        return builder().build();
    }

    /**
     * No retries and a quicker breaker; useful for development and tests.
     */
    public static ResilienceConfig relaxedConfig() {
        return builder()
            .circuitBreaker(CircuitBreakerConfig.builder()
                .failureThreshold(10)
                .openTimeout(Duration.ofSeconds(10))
                .successThreshold(1)
                .callTimeout(Duration.ofSeconds(10))
                .build())
            .enableRetry(false)
            .build();
    }

    /**
     * Fails fast: tight breaker, no retries, short health checks.
     */
    public static ResilienceConfig highThroughputConfig() {
        return builder()
            .circuitBreaker(CircuitBreakerConfig.builder()
                .failureThreshold(3)
                .openTimeout(Duration.ofSeconds(20))
                .successThreshold(2)
                .callTimeout(Duration.ofSeconds(5))
                .build())
            .enableRetry(false)
            .healthCheckInterval(Duration.ofSeconds(15))
            .build();
    }

    public Builder toBuilder() {
        return builder()
            .circuitBreaker(circuitBreakerConfig)
            .degradation(degradationConfig)
            .monitoring(monitoringConfig)
            .enableCircuitBreaker(enableCircuitBreaker)
            .enableRetry(enableRetry)
            .enableGracefulDegradation(enableGracefulDegradation)
            .enablePerformanceMonitoring(enablePerformanceMonitoring)
            .maxRetryAttempts(maxRetryAttempts)
            .retryBaseDelay(retryBaseDelay)
            .maxRetryDelay(maxRetryDelay)
            .degradationThresholds(partialDegradationThreshold, significantDegradationThreshold,
                criticalDegradationThreshold)
            .healthCheckInterval(healthCheckInterval);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private CircuitBreakerConfig circuitBreakerConfig = CircuitBreakerConfig.builder()
            .failureThreshold(5)
            .openTimeout(Duration.ofSeconds(60))
            .successThreshold(3)
            .build();
        private DegradationConfig degradationConfig = DegradationConfig.defaultConfig();
        private MonitoringConfig monitoringConfig = MonitoringConfig.defaultConfig();
        private boolean enableCircuitBreaker = true;
        private boolean enableRetry = true;
        private boolean enableGracefulDegradation = true;
        private boolean enablePerformanceMonitoring = true;
        private int maxRetryAttempts = 2;
        private Duration retryBaseDelay = Duration.ofSeconds(1);
        private Duration maxRetryDelay = Duration.ofSeconds(30);
        private int partialDegradationThreshold = 3;
        private int significantDegradationThreshold = 7;
        private int criticalDegradationThreshold = 15;
        private Duration healthCheckInterval = Duration.ofSeconds(30);

        public Builder circuitBreaker(CircuitBreakerConfig config) {
            this.circuitBreakerConfig = config;
            return this;
        }

        public Builder degradation(DegradationConfig config) {
            this.degradationConfig = config;
            return this;
        }

        public Builder monitoring(MonitoringConfig config) {
            this.monitoringConfig = config;
            return this;
        }

        public Builder enableCircuitBreaker(boolean enable) {
            this.enableCircuitBreaker = enable;
            return this;
        }

        public Builder enableRetry(boolean enable) {
            this.enableRetry = enable;
            return this;
        }

        public Builder enableGracefulDegradation(boolean enable) {
            this.enableGracefulDegradation = enable;
            return this;
        }

        public Builder enablePerformanceMonitoring(boolean enable) {
            this.enablePerformanceMonitoring = enable;
            return this;
        }

        public Builder maxRetryAttempts(int attempts) {
            this.maxRetryAttempts = attempts;
            return this;
        }

        public Builder retryBaseDelay(Duration delay) {
            this.retryBaseDelay = delay;
            return this;
        }

        public Builder maxRetryDelay(Duration delay) {
            this.maxRetryDelay = delay;
            return this;
        }

        public Builder degradationThresholds(int partial, int significant, int critical) {
            this.partialDegradationThreshold = partial;
            this.significantDegradationThreshold = significant;
            this.criticalDegradationThreshold = critical;
            return this;
        }

        public Builder healthCheckInterval(Duration interval) {
            this.healthCheckInterval = interval;
            return this;
        }

        public ResilienceConfig build() {
            if (partialDegradationThreshold < 1
                || partialDegradationThreshold > significantDegradationThreshold
                || significantDegradationThreshold > criticalDegradationThreshold) {
                throw new IllegalArgumentException(String.format(
                    "Degradation thresholds must be positive and ascending: %d/%d/%d",
                    partialDegradationThreshold, significantDegradationThreshold, criticalDegradationThreshold));
            }
            if (maxRetryAttempts < 0) {
                throw new IllegalArgumentException("Max retry attempts must not be negative");
            }
            return new ResilienceConfig(this);
        }
    }

    @Override
    public String toString() {
        return String.format("ResilienceConfig{breaker=%s, retry=%s(%d), degradation=%s, thresholds=%d/%d/%d}",
            enableCircuitBreaker, enableRetry, maxRetryAttempts, enableGracefulDegradation,
            partialDegradationThreshold, significantDegradationThreshold, criticalDegradationThreshold);
    }
}

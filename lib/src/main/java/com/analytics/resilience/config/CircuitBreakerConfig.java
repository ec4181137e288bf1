package com.analytics.resilience.config;

import java.time.Duration;

/**
 * Circuit breaker configuration for one named operation.
 */
public class CircuitBreakerConfig {

    private final int failureThreshold;
    private final int successThreshold;
    private final Duration openTimeout;
    private final Duration callTimeout;
    private final int responseTimeWindowSize;

    private CircuitBreakerConfig(Builder builder) {
        this.failureThreshold = builder.failureThreshold;
        this.successThreshold = builder.successThreshold;
        this.openTimeout = builder.openTimeout;
        this.callTimeout = builder.callTimeout;
        this.responseTimeWindowSize = builder.responseTimeWindowSize;
    }

    /**
     * Consecutive failures that open a closed circuit.
     */
    public int getFailureThreshold() {
        return failureThreshold;
    }

    /**
     * Successes needed in half-open state to close the circuit.
     */
    public int getSuccessThreshold() {
        return successThreshold;
    }

    /**
     * Time since the last failure that must elapse before a probe is admitted.
     */
    public Duration getOpenTimeout() {
        return openTimeout;
    }

    /**
     * Deadline applied to every admitted call.
     */
    public Duration getCallTimeout() {
        return callTimeout;
    }

    public int getResponseTimeWindowSize() {
        return responseTimeWindowSize;
    }

    public static CircuitBreakerConfig defaultConfig() {
        return builder().build();
    }

    public Builder toBuilder() {
        return builder()
            .failureThreshold(failureThreshold)
            .successThreshold(successThreshold)
            .openTimeout(openTimeout)
            .callTimeout(callTimeout)
            .responseTimeWindowSize(responseTimeWindowSize);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private int failureThreshold = 5;
        private int successThreshold = 3;
        private Duration openTimeout = Duration.ofSeconds(30);
        private Duration callTimeout = Duration.ofSeconds(30);
        private int responseTimeWindowSize = 1000;

        public Builder failureThreshold(int threshold) {
            this.failureThreshold = threshold;
            return this;
        }

        public Builder successThreshold(int threshold) {
            this.successThreshold = threshold;
            return this;
        }

        public Builder openTimeout(Duration timeout) {
            this.openTimeout = timeout;
            return this;
        }

        public Builder callTimeout(Duration timeout) {
            this.callTimeout = timeout;
            return this;
        }

        public Builder responseTimeWindowSize(int size) {
            this.responseTimeWindowSize = size;
            return this;
        }

        public CircuitBreakerConfig build() {
            if (failureThreshold < 1 || successThreshold < 1) {
                throw new IllegalArgumentException("Failure and success thresholds must be positive");
            }
            if (responseTimeWindowSize < 1) {
                throw new IllegalArgumentException("Response time window size must be positive");
            }
            return new CircuitBreakerConfig(this);
        }
    }

    @Override
    public String toString() {
        return String.format("CircuitBreakerConfig{failureThreshold=%d, successThreshold=%d, openTimeout=%s, callTimeout=%s}",
            failureThreshold, successThreshold, openTimeout, callTimeout);
    }
}

package com.analytics.resilience.config;

import java.time.Duration;
import java.util.List;

/**
 * Settings for the degraded transports (push-only stream and polling) and the cascade between them.
 */
public class TransportConfig {

    private final String pushUrl;
    private final List<String> pushEventTypes;
    private final int pushMaxReconnectAttempts;
    private final Duration pushReconnectDelay;
    private final Duration pollingInterval;
    private final Duration maxPollingInterval;
    private final double pollingBackoffMultiplier;
    private final double pollingRecoveryFactor;
    private final int maxPollingErrors;
    private final boolean adaptivePolling;
    private final Duration liveRetryInterval;
    private final int maxModeHistory;

    private TransportConfig(Builder builder) {
        this.pushUrl = builder.pushUrl;
        this.pushEventTypes = List.copyOf(builder.pushEventTypes);
        this.pushMaxReconnectAttempts = builder.pushMaxReconnectAttempts;
        this.pushReconnectDelay = builder.pushReconnectDelay;
        this.pollingInterval = builder.pollingInterval;
        this.maxPollingInterval = builder.maxPollingInterval;
        this.pollingBackoffMultiplier = builder.pollingBackoffMultiplier;
        this.pollingRecoveryFactor = builder.pollingRecoveryFactor;
        this.maxPollingErrors = builder.maxPollingErrors;
        this.adaptivePolling = builder.adaptivePolling;
        this.liveRetryInterval = builder.liveRetryInterval;
        this.maxModeHistory = builder.maxModeHistory;
    }

    public String getPushUrl() {
        return pushUrl;
    }

    public List<String> getPushEventTypes() {
        return pushEventTypes;
    }

    public int getPushMaxReconnectAttempts() {
        return pushMaxReconnectAttempts;
    }

    public Duration getPushReconnectDelay() {
        return pushReconnectDelay;
    }

    public Duration getPollingInterval() {
        return pollingInterval;
    }

    public Duration getMaxPollingInterval() {
        return maxPollingInterval;
    }

    public double getPollingBackoffMultiplier() {
        return pollingBackoffMultiplier;
    }

    public double getPollingRecoveryFactor() {
        return pollingRecoveryFactor;
    }

    public int getMaxPollingErrors() {
        return maxPollingErrors;
    }

    public boolean isAdaptivePolling() {
        return adaptivePolling;
    }

    /**
     * How often the cascade re-probes the live channel once its own reconnection gave up.
     */
    public Duration getLiveRetryInterval() {
        return liveRetryInterval;
    }

    public int getMaxModeHistory() {
        return maxModeHistory;
    }

    public static TransportConfig defaultConfig() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String pushUrl = "http://localhost:8080/api/v1/analytics/events";
        private List<String> pushEventTypes = List.of("metrics", "alert", "system");
        private int pushMaxReconnectAttempts = 5;
        private Duration pushReconnectDelay = Duration.ofSeconds(2);
        private Duration pollingInterval = Duration.ofSeconds(30);
        private Duration maxPollingInterval = Duration.ofSeconds(60);
        private double pollingBackoffMultiplier = 1.5;
        private double pollingRecoveryFactor = 0.9;
        private int maxPollingErrors = 5;
        private boolean adaptivePolling = true;
        private Duration liveRetryInterval = Duration.ofSeconds(60);
        private int maxModeHistory = 50;

        public Builder pushUrl(String url) {
            this.pushUrl = url;
            return this;
        }

        public Builder pushEventTypes(List<String> eventTypes) {
            this.pushEventTypes = eventTypes;
            return this;
        }

        public Builder pushMaxReconnectAttempts(int attempts) {
            this.pushMaxReconnectAttempts = attempts;
            return this;
        }

        public Builder pushReconnectDelay(Duration delay) {
            this.pushReconnectDelay = delay;
            return this;
        }

        public Builder pollingInterval(Duration interval) {
            this.pollingInterval = interval;
            return this;
        }

        public Builder maxPollingInterval(Duration interval) {
            this.maxPollingInterval = interval;
            return this;
        }

        public Builder pollingBackoffMultiplier(double multiplier) {
            this.pollingBackoffMultiplier = multiplier;
            return this;
        }

        public Builder pollingRecoveryFactor(double factor) {
            this.pollingRecoveryFactor = factor;
            return this;
        }

        public Builder maxPollingErrors(int maxErrors) {
            this.maxPollingErrors = maxErrors;
            return this;
        }

        public Builder adaptivePolling(boolean adaptive) {
            this.adaptivePolling = adaptive;
            return this;
        }

        public Builder liveRetryInterval(Duration interval) {
            this.liveRetryInterval = interval;
            return this;
        }

        public Builder maxModeHistory(int max) {
            this.maxModeHistory = max;
            return this;
        }

        public TransportConfig build() {
            if (pollingInterval.compareTo(maxPollingInterval) > 0) {
                throw new IllegalArgumentException("Polling interval must not exceed the max polling interval");
            }
            if (maxPollingErrors < 1) {
                throw new IllegalArgumentException("Max polling errors must be positive");
            }
            return new TransportConfig(this);
        }
    }
}

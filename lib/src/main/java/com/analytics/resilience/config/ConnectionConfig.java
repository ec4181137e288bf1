package com.analytics.resilience.config;

import java.time.Duration;

/**
 * Live channel settings: connect deadline, heartbeat, reconnection backoff and outbound queue.
 */
public class ConnectionConfig {

    private final String url;
    private final Duration connectionTimeout;
    private final int maxReconnectAttempts;
    private final Duration reconnectBaseDelay;
    private final double reconnectMultiplier;
    private final Duration maxReconnectDelay;
    private final double reconnectJitter;
    private final Duration heartbeatInterval;
    private final Duration pongTimeout;
    private final int maxMissedHeartbeats;
    private final int maxQueuedMessages;
    private final Duration queuedMessageTimeout;

    private ConnectionConfig(Builder builder) {
        this.url = builder.url;
        this.connectionTimeout = builder.connectionTimeout;
        this.maxReconnectAttempts = builder.maxReconnectAttempts;
        this.reconnectBaseDelay = builder.reconnectBaseDelay;
        this.reconnectMultiplier = builder.reconnectMultiplier;
        this.maxReconnectDelay = builder.maxReconnectDelay;
        this.reconnectJitter = builder.reconnectJitter;
        this.heartbeatInterval = builder.heartbeatInterval;
        this.pongTimeout = builder.pongTimeout;
        this.maxMissedHeartbeats = builder.maxMissedHeartbeats;
        this.maxQueuedMessages = builder.maxQueuedMessages;
        this.queuedMessageTimeout = builder.queuedMessageTimeout;
    }

    public String getUrl() {
        return url;
    }

    public Duration getConnectionTimeout() {
        return connectionTimeout;
    }

    public int getMaxReconnectAttempts() {
        return maxReconnectAttempts;
    }

    public Duration getReconnectBaseDelay() {
        return reconnectBaseDelay;
    }

    public double getReconnectMultiplier() {
        return reconnectMultiplier;
    }

    public Duration getMaxReconnectDelay() {
        return maxReconnectDelay;
    }

    /**
     * Fraction of the computed delay used as symmetric random jitter.
     */
    public double getReconnectJitter() {
        return reconnectJitter;
    }

    public Duration getHeartbeatInterval() {
        return heartbeatInterval;
    }

    public Duration getPongTimeout() {
        return pongTimeout;
    }

    public int getMaxMissedHeartbeats() {
        return maxMissedHeartbeats;
    }

    public int getMaxQueuedMessages() {
        return maxQueuedMessages;
    }

    public Duration getQueuedMessageTimeout() {
        return queuedMessageTimeout;
    }

    public static ConnectionConfig defaultConfig() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String url = "ws://localhost:8080/ws/analytics";
        private Duration connectionTimeout = Duration.ofSeconds(10);
        private int maxReconnectAttempts = 10;
        private Duration reconnectBaseDelay = Duration.ofSeconds(1);
        private double reconnectMultiplier = 2.0;
        private Duration maxReconnectDelay = Duration.ofSeconds(60);
        private double reconnectJitter = 0.25;
        private Duration heartbeatInterval = Duration.ofSeconds(30);
        private Duration pongTimeout = Duration.ofSeconds(10);
        private int maxMissedHeartbeats = 3;
        private int maxQueuedMessages = 100;
        private Duration queuedMessageTimeout = Duration.ofSeconds(30);

        public Builder url(String url) {
            this.url = url;
            return this;
        }

        public Builder connectionTimeout(Duration timeout) {
            this.connectionTimeout = timeout;
            return this;
        }

        public Builder maxReconnectAttempts(int attempts) {
            this.maxReconnectAttempts = attempts;
            return this;
        }

        public Builder reconnectBaseDelay(Duration delay) {
            this.reconnectBaseDelay = delay;
            return this;
        }

        public Builder reconnectMultiplier(double multiplier) {
            this.reconnectMultiplier = multiplier;
            return this;
        }

        public Builder maxReconnectDelay(Duration delay) {
            this.maxReconnectDelay = delay;
            return this;
        }

        public Builder reconnectJitter(double jitter) {
            this.reconnectJitter = jitter;
            return this;
        }

        public Builder heartbeatInterval(Duration interval) {
            this.heartbeatInterval = interval;
            return this;
        }

        public Builder pongTimeout(Duration timeout) {
            this.pongTimeout = timeout;
            return this;
        }

        public Builder maxMissedHeartbeats(int missed) {
            this.maxMissedHeartbeats = missed;
            return this;
        }

        public Builder maxQueuedMessages(int max) {
            this.maxQueuedMessages = max;
            return this;
        }

        public Builder queuedMessageTimeout(Duration timeout) {
            this.queuedMessageTimeout = timeout;
            return this;
        }

        public ConnectionConfig build() {
            if (url == null || url.isEmpty()) {
                throw new IllegalArgumentException("Live channel URL is required");
            }
            if (pongTimeout.compareTo(heartbeatInterval) >= 0) {
                throw new IllegalArgumentException("Pong timeout must be shorter than the heartbeat interval");
            }
            if (reconnectJitter < 0 || reconnectJitter >= 1) {
                throw new IllegalArgumentException("Reconnect jitter must be in [0, 1)");
            }
            return new ConnectionConfig(this);
        }
    }
}

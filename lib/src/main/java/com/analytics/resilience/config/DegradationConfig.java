package com.analytics.resilience.config;

import java.time.Duration;

/**
 * Data freshness and health check settings for the degradation manager.
 */
public class DegradationConfig {

    private final Duration freshDataTtl;
    private final Duration staleDataTtl;
    private final Duration maxCacheAge;
    private final Duration healthCheckInterval;
    private final Duration healthCheckTimeout;
    private final boolean enablePlaceholderData;
    private final boolean escalateOnFetchError;

    private DegradationConfig(Builder builder) {
        this.freshDataTtl = builder.freshDataTtl;
        this.staleDataTtl = builder.staleDataTtl;
        this.maxCacheAge = builder.maxCacheAge;
        this.healthCheckInterval = builder.healthCheckInterval;
        this.healthCheckTimeout = builder.healthCheckTimeout;
        this.enablePlaceholderData = builder.enablePlaceholderData;
        this.escalateOnFetchError = builder.escalateOnFetchError;
    }

    /**
     * Age below which cached data counts as fresh.
     */
    public Duration getFreshDataTtl() {
        return freshDataTtl;
    }

    /**
     * Age after which cached data counts as expired, though still servable until max age.
     */
    public Duration getStaleDataTtl() {
        return staleDataTtl;
    }

    /**
     * Hard limit after which cached data is never served.
     */
    public Duration getMaxCacheAge() {
        return maxCacheAge;
    }

    public Duration getHealthCheckInterval() {
        return healthCheckInterval;
    }

    /**
     * Deadline for a health check, also used as the short fetch timeout in partial degradation.
     */
    public Duration getHealthCheckTimeout() {
        return healthCheckTimeout;
    }

    public boolean isPlaceholderDataEnabled() {
        return enablePlaceholderData;
    }

    /**
     * Whether a failed fetch inside {@code getData} escalates the level on its own.
     */
    public boolean isEscalateOnFetchError() {
        return escalateOnFetchError;
    }

    public static DegradationConfig defaultConfig() {
        return builder().build();
    }

    public Builder toBuilder() {
        return builder()
            .freshDataTtl(freshDataTtl)
            .staleDataTtl(staleDataTtl)
            .maxCacheAge(maxCacheAge)
            .healthCheckInterval(healthCheckInterval)
            .healthCheckTimeout(healthCheckTimeout)
            .enablePlaceholderData(enablePlaceholderData)
            .escalateOnFetchError(escalateOnFetchError);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private Duration freshDataTtl = Duration.ofSeconds(30);
        private Duration staleDataTtl = Duration.ofMinutes(5);
        private Duration maxCacheAge = Duration.ofHours(1);
        private Duration healthCheckInterval = Duration.ofSeconds(60);
        private Duration healthCheckTimeout = Duration.ofSeconds(5);
        private boolean enablePlaceholderData = true;
        private boolean escalateOnFetchError = true;

        public Builder freshDataTtl(Duration ttl) {
            this.freshDataTtl = ttl;
            return this;
        }

        public Builder staleDataTtl(Duration ttl) {
            this.staleDataTtl = ttl;
            return this;
        }

        public Builder maxCacheAge(Duration age) {
            this.maxCacheAge = age;
            return this;
        }

        public Builder healthCheckInterval(Duration interval) {
            this.healthCheckInterval = interval;
            return this;
        }

        public Builder healthCheckTimeout(Duration timeout) {
            this.healthCheckTimeout = timeout;
            return this;
        }

        public Builder enablePlaceholderData(boolean enable) {
            this.enablePlaceholderData = enable;
            return this;
        }

        public Builder escalateOnFetchError(boolean escalate) {
            this.escalateOnFetchError = escalate;
            return this;
        }

        public DegradationConfig build() {
            if (freshDataTtl.compareTo(staleDataTtl) > 0) {
                throw new IllegalArgumentException("Fresh data TTL must not exceed stale data TTL");
            }
            if (staleDataTtl.compareTo(maxCacheAge) > 0) {
                throw new IllegalArgumentException("Stale data TTL must not exceed max cache age");
            }
            return new DegradationConfig(this);
        }
    }
}

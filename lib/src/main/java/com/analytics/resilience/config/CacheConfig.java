package com.analytics.resilience.config;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Cache configuration with the built-in per-key strategies for the dashboard's analytics data.
 */
public class CacheConfig {

    private final boolean enabled;
    private final Duration maxCacheAge;
    private final Duration defaultTtl;
    private final Duration defaultStaleTime;
    private final int maxConcurrentWarmups;
    private final Duration warmupDelay;
    private final Duration backgroundRefreshInterval;
    private final List<CacheStrategy> strategies;

    private CacheConfig(Builder builder) {
        this.enabled = builder.enabled;
        this.maxCacheAge = builder.maxCacheAge;
        this.defaultTtl = builder.defaultTtl;
        this.defaultStaleTime = builder.defaultStaleTime;
        this.maxConcurrentWarmups = builder.maxConcurrentWarmups;
        this.warmupDelay = builder.warmupDelay;
        this.backgroundRefreshInterval = builder.backgroundRefreshInterval;
        this.strategies = List.copyOf(builder.strategies);
    }

    public boolean isEnabled() {
        return enabled;
    }

    public Duration getMaxCacheAge() {
        return maxCacheAge;
    }

    public Duration getDefaultTtl() {
        return defaultTtl;
    }

    public Duration getDefaultStaleTime() {
        return defaultStaleTime;
    }

    public int getMaxConcurrentWarmups() {
        return maxConcurrentWarmups;
    }

    /**
     * Pause before a warmup that had to wait for a free slot starts loading.
     */
    public Duration getWarmupDelay() {
        return warmupDelay;
    }

    public Duration getBackgroundRefreshInterval() {
        return backgroundRefreshInterval;
    }

    public List<CacheStrategy> getStrategies() {
        return strategies;
    }

    public static CacheConfig defaultConfig() {
        return builder().build();
    }

    /**
     * Strategies for the well-known analytics keys.
     */
    public static List<CacheStrategy> defaultStrategies() {
        return List.of(
            CacheStrategy.builder("analytics-engagement-realtime")
                .ttl(Duration.ofSeconds(60)).staleTime(Duration.ofSeconds(30))
                .priority(CachePriority.CRITICAL).refreshMode(RefreshMode.BACKGROUND)
                .warmupTriggers("dashboard-load", "user-activity")
                .build(),
            CacheStrategy.builder("analytics-dashboard-summary")
                .ttl(Duration.ofMinutes(5)).staleTime(Duration.ofMinutes(2))
                .priority(CachePriority.HIGH).refreshMode(RefreshMode.BACKGROUND)
                .dependencies("analytics-engagement-realtime")
                .warmupTriggers("dashboard-load")
                .build(),
            CacheStrategy.builder("analytics-progress-metrics")
                .ttl(Duration.ofMinutes(10)).staleTime(Duration.ofMinutes(5))
                .priority(CachePriority.HIGH).refreshMode(RefreshMode.ON_DEMAND)
                .warmupTriggers("progress-view")
                .build(),
            CacheStrategy.builder("analytics-content-performance")
                .ttl(Duration.ofMinutes(30)).staleTime(Duration.ofMinutes(15))
                .priority(CachePriority.NORMAL).refreshMode(RefreshMode.SCHEDULED)
                .warmupTriggers("content-analysis")
                .build(),
            CacheStrategy.builder("analytics-system-metrics")
                .ttl(Duration.ofMinutes(5)).staleTime(Duration.ofMinutes(3))
                .priority(CachePriority.NORMAL).refreshMode(RefreshMode.BACKGROUND)
                .warmupTriggers("admin-dashboard")
                .build(),
            CacheStrategy.builder("analytics-historical-data")
                .ttl(Duration.ofHours(1)).staleTime(Duration.ofMinutes(30))
                .priority(CachePriority.LOW).refreshMode(RefreshMode.ON_DEMAND)
                .build(),
            CacheStrategy.builder("analytics-behavior-insights")
                .ttl(Duration.ofMinutes(30)).staleTime(Duration.ofMinutes(15))
                .priority(CachePriority.NORMAL).refreshMode(RefreshMode.SCHEDULED)
                .dependencies("analytics-engagement-realtime", "analytics-progress-metrics")
                .build());
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private boolean enabled = true;
        private Duration maxCacheAge = Duration.ofHours(1);
        private Duration defaultTtl = Duration.ofMinutes(5);
        private Duration defaultStaleTime = Duration.ofSeconds(30);
        private int maxConcurrentWarmups = 3;
        private Duration warmupDelay = Duration.ofSeconds(1);
        private Duration backgroundRefreshInterval = Duration.ofMinutes(5);
        private final List<CacheStrategy> strategies = new ArrayList<>(defaultStrategies());

        public Builder enabled(boolean enabled) {
            this.enabled = enabled;
            return this;
        }

        public Builder maxCacheAge(Duration age) {
            this.maxCacheAge = age;
            return this;
        }

        public Builder defaultTtl(Duration ttl) {
            this.defaultTtl = ttl;
            return this;
        }

        public Builder defaultStaleTime(Duration staleTime) {
            this.defaultStaleTime = staleTime;
            return this;
        }

        public Builder maxConcurrentWarmups(int max) {
            this.maxConcurrentWarmups = max;
            return this;
        }

        public Builder warmupDelay(Duration delay) {
            this.warmupDelay = delay;
            return this;
        }

        public Builder backgroundRefreshInterval(Duration interval) {
            this.backgroundRefreshInterval = interval;
            return this;
        }

        public Builder strategy(CacheStrategy strategy) {
            this.strategies.removeIf(s -> s.getKeyOrPrefix().equals(strategy.getKeyOrPrefix()));
            this.strategies.add(strategy);
            return this;
        }

        public Builder clearStrategies() {
            this.strategies.clear();
            return this;
        }

        public CacheConfig build() {
            if (defaultStaleTime.compareTo(defaultTtl) > 0) {
                throw new IllegalArgumentException("Default stale time must not exceed default ttl");
            }
            if (maxConcurrentWarmups < 1) {
                throw new IllegalArgumentException("Max concurrent warmups must be positive");
            }
            return new CacheConfig(this);
        }
    }
}

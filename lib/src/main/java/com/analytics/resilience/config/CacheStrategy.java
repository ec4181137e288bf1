package com.analytics.resilience.config;

import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Freshness policy for a cache key or key prefix.
 */
public class CacheStrategy {

    private final String keyOrPrefix;
    private final Duration ttl;
    private final Duration staleTime;
    private final CachePriority priority;
    private final RefreshMode refreshMode;
    private final List<String> dependencies;
    private final List<String> warmupTriggers;

    private CacheStrategy(Builder builder) {
        this.keyOrPrefix = Objects.requireNonNull(builder.keyOrPrefix, "keyOrPrefix");
        this.ttl = builder.ttl;
        this.staleTime = builder.staleTime;
        this.priority = builder.priority;
        this.refreshMode = builder.refreshMode;
        this.dependencies = List.copyOf(builder.dependencies);
        this.warmupTriggers = List.copyOf(builder.warmupTriggers);
    }

    public String getKeyOrPrefix() {
        return keyOrPrefix;
    }

    public Duration getTtl() {
        return ttl;
    }

    public Duration getStaleTime() {
        return staleTime;
    }

    public CachePriority getPriority() {
        return priority;
    }

    public RefreshMode getRefreshMode() {
        return refreshMode;
    }

    /**
     * Keys this entry is derived from; invalidating one of them invalidates this entry.
     */
    public List<String> getDependencies() {
        return dependencies;
    }

    public List<String> getWarmupTriggers() {
        return warmupTriggers;
    }

    public boolean matches(String key) {
        return key.equals(keyOrPrefix) || key.startsWith(keyOrPrefix);
    }

    public Builder toBuilder() {
        return builder(keyOrPrefix)
            .ttl(ttl)
            .staleTime(staleTime)
            .priority(priority)
            .refreshMode(refreshMode)
            .dependencies(dependencies)
            .warmupTriggers(warmupTriggers);
    }

    public static Builder builder(String keyOrPrefix) {
        return new Builder(keyOrPrefix);
    }

    public static class Builder {
        private final String keyOrPrefix;
        private Duration ttl = Duration.ofMinutes(5);
        private Duration staleTime = Duration.ofSeconds(30);
        private CachePriority priority = CachePriority.NORMAL;
        private RefreshMode refreshMode = RefreshMode.ON_DEMAND;
        private List<String> dependencies = List.of();
        private List<String> warmupTriggers = List.of();

        private Builder(String keyOrPrefix) {
            this.keyOrPrefix = keyOrPrefix;
        }

        public Builder ttl(Duration ttl) {
            this.ttl = ttl;
            return this;
        }

        public Builder staleTime(Duration staleTime) {
            this.staleTime = staleTime;
            return this;
        }

        public Builder priority(CachePriority priority) {
            this.priority = priority;
            return this;
        }

        public Builder refreshMode(RefreshMode refreshMode) {
            this.refreshMode = refreshMode;
            return this;
        }

        public Builder dependencies(List<String> dependencies) {
            this.dependencies = dependencies;
            return this;
        }

        public Builder dependencies(String... dependencies) {
            return dependencies(List.of(dependencies));
        }

        public Builder warmupTriggers(List<String> triggers) {
            this.warmupTriggers = triggers;
            return this;
        }

        public Builder warmupTriggers(String... triggers) {
            return warmupTriggers(List.of(triggers));
        }

        public CacheStrategy build() {
            if (staleTime.compareTo(ttl) > 0) {
                throw new IllegalArgumentException("Stale time must not exceed ttl for " + keyOrPrefix);
            }
            return new CacheStrategy(this);
        }
    }

    @Override
    public String toString() {
        return String.format("CacheStrategy{key='%s', ttl=%s, staleTime=%s, priority=%s, refresh=%s, deps=%s}",
            keyOrPrefix, ttl, staleTime, priority, refreshMode, dependencies);
    }
}

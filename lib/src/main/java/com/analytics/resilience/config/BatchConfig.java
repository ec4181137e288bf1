package com.analytics.resilience.config;

import com.analytics.resilience.model.RequestPriority;

import java.time.Duration;

/**
 * Request batching and deduplication settings.
 */
public class BatchConfig {

    private final int maxBatchSize;
    private final Duration highPriorityWait;
    private final Duration normalPriorityWait;
    private final Duration lowPriorityWait;
    private final boolean deduplication;
    private final boolean fallbackToIndividual;

    private BatchConfig(Builder builder) {
        this.maxBatchSize = builder.maxBatchSize;
        this.highPriorityWait = builder.highPriorityWait;
        this.normalPriorityWait = builder.normalPriorityWait;
        this.lowPriorityWait = builder.lowPriorityWait;
        this.deduplication = builder.deduplication;
        this.fallbackToIndividual = builder.fallbackToIndividual;
    }

    public int getMaxBatchSize() {
        return maxBatchSize;
    }

    public Duration getWait(RequestPriority priority) {
        return switch (priority) {
            case HIGH -> highPriorityWait;
            case NORMAL -> normalPriorityWait;
            case LOW -> lowPriorityWait;
        };
    }

    public boolean isDeduplication() {
        return deduplication;
    }

    /**
     * Whether a failed batch call is retried as individual calls instead of rejecting every member.
     */
    public boolean isFallbackToIndividual() {
        return fallbackToIndividual;
    }

    public static BatchConfig defaultConfig() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private int maxBatchSize = 10;
        private Duration highPriorityWait = Duration.ZERO;
        private Duration normalPriorityWait = Duration.ofMillis(100);
        private Duration lowPriorityWait = Duration.ofMillis(300);
        private boolean deduplication = true;
        private boolean fallbackToIndividual = true;

        public Builder maxBatchSize(int size) {
            this.maxBatchSize = size;
            return this;
        }

        public Builder highPriorityWait(Duration wait) {
            this.highPriorityWait = wait;
            return this;
        }

        public Builder normalPriorityWait(Duration wait) {
            this.normalPriorityWait = wait;
            return this;
        }

        public Builder lowPriorityWait(Duration wait) {
            this.lowPriorityWait = wait;
            return this;
        }

        public Builder deduplication(boolean enabled) {
            this.deduplication = enabled;
            return this;
        }

        public Builder fallbackToIndividual(boolean enabled) {
            this.fallbackToIndividual = enabled;
            return this;
        }

        public BatchConfig build() {
            if (maxBatchSize < 1) {
                throw new IllegalArgumentException("Max batch size must be positive");
            }
            if (highPriorityWait.compareTo(normalPriorityWait) > 0 || normalPriorityWait.compareTo(lowPriorityWait) > 0) {
                throw new IllegalArgumentException("Priority waits must satisfy high <= normal <= low");
            }
            return new BatchConfig(this);
        }
    }
}

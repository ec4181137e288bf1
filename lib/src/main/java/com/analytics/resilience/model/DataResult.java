package com.analytics.resilience.model;

import java.time.Instant;
import java.util.Optional;

/**
 * Data handed back to a caller together with where it came from and whether it is degraded.
 * Every cached, fallback or placeholder result carries {@code degraded = true} so the caller
 * can render a staleness indicator.
 *
 * @param <T> payload type
 */
public class DataResult<T> {

    private final T data;
    private final DataSource source;
    private final boolean degraded;
    private final Instant timestamp;
    private final Instant expiresAt;
    private final DegradationLevel degradationLevel;
    private final Throwable error;

    private DataResult(Builder<T> builder) {
        this.data = builder.data;
        this.source = builder.source;
        this.degraded = builder.degraded;
        this.timestamp = builder.timestamp;
        this.expiresAt = builder.expiresAt;
        this.degradationLevel = builder.degradationLevel;
        this.error = builder.error;
    }

    public T getData() {
        return data;
    }

    public DataSource getSource() {
        return source;
    }

    public boolean isDegraded() {
        return degraded;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public Optional<Instant> getExpiresAt() {
        return Optional.ofNullable(expiresAt);
    }

    public DegradationLevel getDegradationLevel() {
        return degradationLevel;
    }

    /**
     * The fetch failure that forced a non-live source, if any.
     */
    public Optional<Throwable> getError() {
        return Optional.ofNullable(error);
    }

    public boolean isLive() {
        return source == DataSource.LIVE;
    }

    public static <T> Builder<T> builder() {
        return new Builder<>();
    }

    public static class Builder<T> {
        private T data;
        private DataSource source = DataSource.LIVE;
        private boolean degraded;
        private Instant timestamp = Instant.now();
        private Instant expiresAt;
        private DegradationLevel degradationLevel = DegradationLevel.OPTIMAL;
        private Throwable error;

        public Builder<T> data(T data) {
            this.data = data;
            return this;
        }

        public Builder<T> source(DataSource source) {
            this.source = source;
            return this;
        }

        public Builder<T> degraded(boolean degraded) {
            this.degraded = degraded;
            return this;
        }

        public Builder<T> timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public Builder<T> expiresAt(Instant expiresAt) {
            this.expiresAt = expiresAt;
            return this;
        }

        public Builder<T> degradationLevel(DegradationLevel degradationLevel) {
            this.degradationLevel = degradationLevel;
            return this;
        }

        public Builder<T> error(Throwable error) {
            this.error = error;
            return this;
        }

        public DataResult<T> build() {
            return new DataResult<>(this);
        }
    }

    @Override
    public String toString() {
        return String.format("DataResult{source=%s, degraded=%s, level=%s, timestamp=%s, error=%s}",
            source, degraded, degradationLevel, timestamp, error != null ? error.getMessage() : null);
    }
}

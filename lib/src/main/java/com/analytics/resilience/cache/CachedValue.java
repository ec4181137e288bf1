package com.analytics.resilience.cache;

import com.analytics.resilience.model.DataSource;
import com.analytics.resilience.model.DegradationLevel;

import java.time.Instant;

/**
 * A cache hit: the value with its age and freshness at lookup time.
 */
public class CachedValue {

    private final Object value;
    private final boolean stale;
    private final long ageMs;
    private final Instant capturedAt;
    private final Instant expiresAt;
    private final DataSource source;
    private final DegradationLevel degradationLevel;

    CachedValue(CacheEntry entry, long now) {
        this.value = entry.getValue();
        this.stale = entry.isStale(now);
        this.ageMs = now - entry.getCapturedAt();
        this.capturedAt = Instant.ofEpochMilli(entry.getCapturedAt());
        this.expiresAt = Instant.ofEpochMilli(entry.getExpiresAt());
        this.source = entry.getSource();
        this.degradationLevel = entry.getDegradationLevel();
    }

    public Object getValue() {
        return value;
    }

    public <T> T getValue(Class<T> type) {
        return type.cast(value);
    }

    public boolean isStale() {
        return stale;
    }

    public long getAgeMs() {
        return ageMs;
    }

    public Instant getCapturedAt() {
        return capturedAt;
    }

    public Instant getExpiresAt() {
        return expiresAt;
    }

    /**
     * Where the value originally came from when it was written.
     */
    public DataSource getSource() {
        return source;
    }

    public DegradationLevel getDegradationLevel() {
        return degradationLevel;
    }

    @Override
    public String toString() {
        return String.format("CachedValue{stale=%s, ageMs=%d, source=%s}", stale, ageMs, source);
    }
}

package com.analytics.resilience.cache;

import com.analytics.resilience.model.DataSource;
import com.analytics.resilience.model.DegradationLevel;

/**
 * Immutable cache record. Times are epoch milliseconds of the cache's clock.
 */
final class CacheEntry {

    private final String key;
    private final Object value;
    private final long capturedAt;
    private final long expiresAt;
    private final long staleAfterMs;
    private final DataSource source;
    private final DegradationLevel degradationLevel;
    private final boolean invalidated;

    CacheEntry(String key, Object value, long capturedAt, long expiresAt, long staleAfterMs, DataSource source,
               DegradationLevel degradationLevel, boolean invalidated) {
        if (expiresAt < capturedAt) {
            throw new IllegalArgumentException("expiresAt must not precede capturedAt for key " + key);
        }
        this.key = key;
        this.value = value;
        this.capturedAt = capturedAt;
        this.expiresAt = expiresAt;
        this.staleAfterMs = staleAfterMs;
        this.source = source;
        this.degradationLevel = degradationLevel;
        this.invalidated = invalidated;
    }

    CacheEntry invalidate() {
        return invalidated ? this
            : new CacheEntry(key, value, capturedAt, expiresAt, staleAfterMs, source, degradationLevel, true);
    }

    boolean isStale(long now) {
        return invalidated || now - capturedAt > staleAfterMs;
    }

    String getKey() {
        return key;
    }

    Object getValue() {
        return value;
    }

    long getCapturedAt() {
        return capturedAt;
    }

    long getExpiresAt() {
        return expiresAt;
    }

    DataSource getSource() {
        return source;
    }

    DegradationLevel getDegradationLevel() {
        return degradationLevel;
    }

    boolean isInvalidated() {
        return invalidated;
    }
}

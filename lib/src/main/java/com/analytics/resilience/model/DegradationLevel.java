package com.analytics.resilience.model;

/**
 * Ordered tiers describing how much live functionality is currently trustworthy.
 * Declaration order is severity order.
 */
public enum DegradationLevel {

    /**
     * Service operating normally, live data is fetched on every request.
     */
    OPTIMAL,

    /**
     * Some features are slower than usual; fresh cache is preferred over live calls.
     */
    PARTIAL,

    /**
     * Live calls are suspended; cached data and fallbacks are served.
     */
    SIGNIFICANT,

    /**
     * Severely degraded; stale cache, fallbacks or placeholders are served.
     */
    CRITICAL,

    /**
     * Service unavailable; only fallbacks and placeholders are served.
     */
    COMPLETE;

    public boolean isWorseThan(DegradationLevel other) {
        return compareTo(other) > 0;
    }

    public DegradationLevel next() {
        DegradationLevel[] levels = values();
        return ordinal() + 1 < levels.length ? levels[ordinal() + 1] : this;
    }

    public static DegradationLevel worst(DegradationLevel a, DegradationLevel b) {
        return a.compareTo(b) >= 0 ? a : b;
    }
}

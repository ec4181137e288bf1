package com.analytics.resilience.degradation;

/**
 * Overall freshness of the cached data, judged by its youngest entry.
 */
public enum CacheStatus {
    FRESH,
    STALE,
    EXPIRED,
    UNAVAILABLE
}

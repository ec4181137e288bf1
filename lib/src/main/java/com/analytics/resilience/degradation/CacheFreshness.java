package com.analytics.resilience.degradation;

/**
 * Cached entries counted by age against the fresh and stale data TTLs.
 */
public record CacheFreshness(int total, int fresh, int stale, int expired, CacheStatus status) {
}

package com.analytics.resilience.cache;

public record CacheStats(
    int totalEntries,
    int staleEntries,
    int activeWarmups,
    int queuedWarmups,
    int backgroundRefreshers,
    long hits,
    long misses) {

    public double hitRate() {
        long total = hits + misses;
        return total > 0 ? (double) hits / total : 0;
    }
}

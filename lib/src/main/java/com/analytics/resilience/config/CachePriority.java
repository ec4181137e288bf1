package com.analytics.resilience.config;

/**
 * Warmup and refresh priority of a cache strategy.
 */
public enum CachePriority {
    CRITICAL,
    HIGH,
    NORMAL,
    LOW
}

package com.analytics.resilience.config;

/**
 * How a cached key is kept fresh.
 */
public enum RefreshMode {
    /**
     * Reloaded in the background once it turns stale.
     */
    BACKGROUND,

    /**
     * Reloaded only when a caller asks for it.
     */
    ON_DEMAND,

    /**
     * Reloaded by an external schedule such as a warmup trigger.
     */
    SCHEDULED
}

package com.analytics.resilience.error;

/**
 * Suggested recovery for a classified failure.
 */
public enum RecoveryAction {

    /**
     * Obtain a new token and retry once.
     */
    REFRESH_TOKEN,

    /**
     * Serve cached data while the upstream recovers.
     */
    FALLBACK_CACHE,

    /**
     * Lower the degradation level so slow calls are avoided.
     */
    DEGRADE_SERVICE,

    NONE
}

package com.analytics.resilience.model;

/**
 * Where the data handed to a caller came from.
 */
public enum DataSource {

    /**
     * Fetched from the upstream service during this request.
     */
    LIVE,

    /**
     * Served from the local cache.
     */
    CACHE,

    /**
     * Caller-provided fallback value.
     */
    FALLBACK,

    /**
     * Synthesized record with zeroed numeric fields.
     */
    PLACEHOLDER
}

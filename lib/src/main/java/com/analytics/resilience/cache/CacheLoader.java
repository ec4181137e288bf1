package com.analytics.resilience.cache;

import reactor.core.publisher.Mono;

/**
 * Loads the current value of a cache key from upstream; used by warmup and background refresh.
 */
@FunctionalInterface
public interface CacheLoader {

    Mono<Object> load(String key);

    /**
     * Loader for caches that are only written to, never warmed.
     */
    static CacheLoader none() {
        return key -> Mono.error(new IllegalStateException("No cache loader configured for key " + key));
    }
}

package com.analytics.resilience.transport;

import reactor.core.publisher.Mono;

import java.util.Objects;
import java.util.function.Supplier;

/**
 * One endpoint polled while push transports are unavailable. Results are written to the cache under
 * {@code cacheKey}.
 */
public record PollingSource(String cacheKey, Supplier<Mono<Object>> fetcher) {

    public PollingSource {
        Objects.requireNonNull(cacheKey, "cacheKey");
        Objects.requireNonNull(fetcher, "fetcher");
    }

    public static PollingSource of(String cacheKey, Supplier<Mono<Object>> fetcher) {
        return new PollingSource(cacheKey, fetcher);
    }
}

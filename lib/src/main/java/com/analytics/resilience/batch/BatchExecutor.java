package com.analytics.resilience.batch;

import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;

/**
 * Upstream call capability used by the {@link RequestBatcher}.
 */
public interface BatchExecutor {

    Mono<Object> execute(String endpoint, Map<String, Object> params);

    /**
     * Whether {@link #executeBatch} can serve several requests to this endpoint in one call.
     */
    default boolean supportsBatch(String endpoint) {
        return false;
    }

    /**
     * Executes the requests in one call. The result maps {@link BatchRequest#getId()} to that
     * request's value; requests missing from the map are executed individually.
     */
    default Mono<Map<String, Object>> executeBatch(String endpoint, List<BatchRequest> requests) {
        return Mono.error(new UnsupportedOperationException("Batch execution not supported for " + endpoint));
    }
}

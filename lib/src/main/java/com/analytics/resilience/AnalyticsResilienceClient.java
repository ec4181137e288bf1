package com.analytics.resilience;

import com.analytics.resilience.cache.AnalyticsCache;
import com.analytics.resilience.cache.CacheStats;
import com.analytics.resilience.config.ClientConfiguration;
import com.analytics.resilience.connection.ConnectionStats;
import com.analytics.resilience.model.ChannelMessage;
import com.analytics.resilience.model.DataResult;
import com.analytics.resilience.model.HealthStatus;
import com.analytics.resilience.model.RequestPriority;
import com.analytics.resilience.model.TransportMode;
import com.analytics.resilience.observability.PerformanceSnapshot;
import com.analytics.resilience.observability.ResilienceEventPublisher;
import com.analytics.resilience.resilience.ResilienceManager;
import com.analytics.resilience.resilience.ResilienceState;
import com.analytics.resilience.sync.CrossInstanceSync;
import com.analytics.resilience.transport.TransportStatus;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;

import java.util.Map;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * Client-side resilience and delivery pipeline for a dashboard talking to a remote analytics service.
 * Requests go through circuit breakers, retries and graceful degradation; live updates arrive over
 * the best available push transport and land in the shared cache.
 */
public interface AnalyticsResilienceClient extends AutoCloseable {

    /**
     * Starts background work: health checks, cache refresh, metrics publishing, cross-instance sync
     * and, when realtime is enabled, the transport cascade.
     * @return Mono completing once the initial transport is selected; never errors
     */
    Mono<Void> start();

    /**
     * Execute an operation with circuit breaking, retry and graceful degradation.
     * @param operationName name of the circuit breaker and retry used for the call
     * @param operation upstream fetch, invoked lazily and possibly more than once
     * @param fallback value served when neither live nor cached data is available; may be null
     * @param cacheKey cache key of the result; the operation name when null
     * @return the data together with its source and degradation level
     */
    <T> Mono<DataResult<T>> execute(String operationName, Supplier<Mono<T>> operation, T fallback, String cacheKey);

    default <T> Mono<DataResult<T>> execute(String operationName, Supplier<Mono<T>> operation, T fallback) {
        return execute(operationName, operation, fallback, null);
    }

    default <T> Mono<DataResult<T>> execute(String operationName, Supplier<Mono<T>> operation) {
        return execute(operationName, operation, null, null);
    }

    /**
     * Submit a request to the batcher; identical in-flight or queued requests share one upstream call.
     */
    Mono<Object> request(String endpoint, Map<String, ?> params, RequestPriority priority);

    default Mono<Object> request(String endpoint, Map<String, ?> params) {
        return request(endpoint, params, RequestPriority.NORMAL);
    }

    /**
     * Subscribe to live channel messages of a type. Has no effect while realtime is disabled.
     */
    Disposable subscribe(String messageType, Consumer<ChannelMessage> handler);

    TransportMode getTransportMode();

    Optional<TransportStatus> getTransportStatus();

    void forceTransportMode(TransportMode mode);

    Optional<ConnectionStats> getConnectionStats();

    ResilienceState getResilienceState();

    PerformanceSnapshot getPerformanceSnapshot();

    CacheStats getCacheStats();

    Mono<HealthStatus> checkHealth();

    /**
     * Reset failure tracking and degradation to optimal.
     */
    void reset();

    ResilienceEventPublisher events();

    Optional<CrossInstanceSync> crossInstanceSync();

    AnalyticsCache getCache();

    ResilienceManager getResilienceManager();

    ClientConfiguration getConfiguration();

    /**
     * Close the client and release all resources. No timer fires afterwards.
     */
    @Override
    void close();
}

package com.analytics.resilience.impl;

import com.analytics.resilience.AnalyticsResilienceClient;
import com.analytics.resilience.AnalyticsResilienceClientBuilder;
import com.analytics.resilience.batch.RequestBatcher;
import com.analytics.resilience.cache.AnalyticsCache;
import com.analytics.resilience.cache.CacheStats;
import com.analytics.resilience.config.ClientConfiguration;
import com.analytics.resilience.connection.ConnectionListener;
import com.analytics.resilience.connection.ConnectionManager;
import com.analytics.resilience.connection.ConnectionStats;
import com.analytics.resilience.degradation.DegradationListener;
import com.analytics.resilience.degradation.DegradationState;
import com.analytics.resilience.model.ChannelMessage;
import com.analytics.resilience.model.ConnectionState;
import com.analytics.resilience.model.DataResult;
import com.analytics.resilience.model.HealthStatus;
import com.analytics.resilience.model.RequestPriority;
import com.analytics.resilience.model.TransportMode;
import com.analytics.resilience.observability.PerformanceMonitor;
import com.analytics.resilience.observability.PerformanceSnapshot;
import com.analytics.resilience.observability.ResilienceEventPublisher;
import com.analytics.resilience.resilience.ResilienceManager;
import com.analytics.resilience.resilience.ResilienceState;
import com.analytics.resilience.sync.CrossInstanceSync;
import com.analytics.resilience.transport.PollingManager;
import com.analytics.resilience.transport.PushChannelManager;
import com.analytics.resilience.transport.TransportFallbackCascade;
import com.analytics.resilience.transport.TransportStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.Disposables;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * Default implementation of the analytics resilience client.
 * Wires the cache, resilience manager, transports, batcher and cross-instance sync together and
 * forwards their state changes to the event publisher and the performance monitor.
 */
public class DefaultAnalyticsResilienceClient implements AnalyticsResilienceClient {

    private static final Logger logger = LoggerFactory.getLogger(DefaultAnalyticsResilienceClient.class);

    private final ClientConfiguration configuration;
    private final Scheduler scheduler;
    private final boolean ownsScheduler;
    private final ResilienceEventPublisher eventPublisher;
    private final PerformanceMonitor performanceMonitor;
    private final AnalyticsCache cache;
    private final ResilienceManager resilienceManager;
    private final RequestBatcher batcher;
    private final ConnectionManager connectionManager;
    private final TransportFallbackCascade transportCascade;
    private final CrossInstanceSync crossInstanceSync;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    public DefaultAnalyticsResilienceClient(AnalyticsResilienceClientBuilder builder) {
        this.configuration = builder.getConfiguration();
        this.ownsScheduler = builder.getScheduler() == null;
        this.scheduler = ownsScheduler ? Schedulers.newSingle("analytics-resilience") : builder.getScheduler();

        try {
            this.eventPublisher = new ResilienceEventPublisher();
            this.performanceMonitor = new PerformanceMonitor(configuration.getResilienceConfig().getMonitoringConfig(),
                builder.getMeterRegistry(), scheduler);
            this.cache = new AnalyticsCache(configuration.getCacheConfig(), builder.getCacheLoader(), scheduler);
            this.resilienceManager = new ResilienceManager(configuration.getResilienceConfig(), cache,
                performanceMonitor, scheduler);
            if (builder.getHealthCheck() != null) {
                resilienceManager.setHealthCheck(builder.getHealthCheck());
            }
            this.batcher = builder.getBatchExecutor() != null
                ? new RequestBatcher(configuration.getBatchConfig(), builder.getBatchExecutor(), scheduler)
                : null;

            if (configuration.isRealtimeEnabled()) {
                this.connectionManager = new ConnectionManager(configuration.getConnectionConfig(),
                    builder.getLiveChannelConnector(), builder.getAuthTokenProvider(), scheduler);
                PushChannelManager push = new PushChannelManager(configuration.getTransportConfig(),
                    builder.getPushChannelConnector(), builder.getAuthTokenProvider(), scheduler);
                PollingManager polling = new PollingManager(configuration.getTransportConfig(),
                    builder.getPollingSources(), scheduler, cache::set);
                this.transportCascade = new TransportFallbackCascade(configuration.getTransportConfig(),
                    connectionManager, push, polling, cache, scheduler);
            } else {
                this.connectionManager = null;
                this.transportCascade = null;
            }

            this.crossInstanceSync = configuration.isCrossInstanceSyncEnabled()
                ? new CrossInstanceSync(configuration.getInstanceId(), builder.getBroadcastChannel(), cache, scheduler)
                : null;

            wireEvents();

            logger.info("Analytics resilience client {} initialized (realtime={}, crossInstanceSync={})",
                configuration.getInstanceId(), configuration.isRealtimeEnabled(),
                configuration.isCrossInstanceSyncEnabled());
        } catch (RuntimeException e) {
            logger.error("Failed to initialize analytics resilience client", e);
            if (ownsScheduler) {
                scheduler.dispose();
            }
            throw e;
        }
    }

    private void wireEvents() {
        performanceMonitor.addAlertListener(eventPublisher::publishAlert);
        resilienceManager.getDegradationManager().addListener(new DegradationListener() {
            @Override
            public void onStateChange(DegradationState previous, DegradationState current) {
                eventPublisher.publishDegradation(previous.getLevel(), current.getLevel(), current.getReason(),
                    current.getSince());
            }
        });
        if (connectionManager != null) {
            connectionManager.addListener(new ConnectionListener() {
                @Override
                public void onStateChange(ConnectionState previous, ConnectionState current) {
                    eventPublisher.publishConnectionStatus(previous, current, now());
                    performanceMonitor.recordConnectionState(current);
                }

                @Override
                public void onMessage(ChannelMessage message) {
                    performanceMonitor.recordMessage();
                }
            });
        }
        if (transportCascade != null) {
            transportCascade.addListener((previous, current, reason) ->
                eventPublisher.publishTransportMode(previous, current, reason, now()));
        }
    }

    @Override
    public Mono<Void> start() {
        checkNotClosed();
        cache.start();
        resilienceManager.start();
        performanceMonitor.start();
        if (crossInstanceSync != null) {
            crossInstanceSync.start();
        }
        return transportCascade != null ? transportCascade.start() : Mono.empty();
    }

    @Override
    public <T> Mono<DataResult<T>> execute(String operationName, Supplier<Mono<T>> operation, T fallback,
                                           String cacheKey) {
        checkNotClosed();
        return resilienceManager.execute(operationName, operation, fallback, cacheKey);
    }

    @Override
    public Mono<Object> request(String endpoint, Map<String, ?> params, RequestPriority priority) {
        checkNotClosed();
        if (batcher == null) {
            return Mono.error(new IllegalStateException("No batch executor configured"));
        }
        return batcher.submit(endpoint, params, priority);
    }

    @Override
    public Disposable subscribe(String messageType, Consumer<ChannelMessage> handler) {
        checkNotClosed();
        if (connectionManager == null) {
            logger.warn("Ignoring subscription to {}: realtime is disabled", messageType);
            return Disposables.disposed();
        }
        return connectionManager.subscribe(messageType, handler);
    }

    @Override
    public TransportMode getTransportMode() {
        return transportCascade != null ? transportCascade.getMode() : TransportMode.OFFLINE;
    }

    @Override
    public Optional<TransportStatus> getTransportStatus() {
        return Optional.ofNullable(transportCascade).map(TransportFallbackCascade::getStatus);
    }

    @Override
    public void forceTransportMode(TransportMode mode) {
        checkNotClosed();
        if (transportCascade == null) {
            throw new IllegalStateException("Realtime is disabled");
        }
        transportCascade.forceMode(mode);
    }

    @Override
    public Optional<ConnectionStats> getConnectionStats() {
        return Optional.ofNullable(connectionManager).map(ConnectionManager::getStats);
    }

    @Override
    public ResilienceState getResilienceState() {
        return resilienceManager.getState();
    }

    @Override
    public PerformanceSnapshot getPerformanceSnapshot() {
        return performanceMonitor.getSnapshot();
    }

    @Override
    public CacheStats getCacheStats() {
        return cache.getStats();
    }

    @Override
    public Mono<HealthStatus> checkHealth() {
        checkNotClosed();
        return resilienceManager.checkHealth();
    }

    @Override
    public void reset() {
        checkNotClosed();
        resilienceManager.reset();
    }

    @Override
    public ResilienceEventPublisher events() {
        return eventPublisher;
    }

    @Override
    public Optional<CrossInstanceSync> crossInstanceSync() {
        return Optional.ofNullable(crossInstanceSync);
    }

    @Override
    public AnalyticsCache getCache() {
        return cache;
    }

    @Override
    public ResilienceManager getResilienceManager() {
        return resilienceManager;
    }

    @Override
    public ClientConfiguration getConfiguration() {
        return configuration;
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        logger.info("Closing analytics resilience client {}", configuration.getInstanceId());
        if (crossInstanceSync != null) {
            crossInstanceSync.stop();
        }
        if (transportCascade != null) {
            transportCascade.destroy();
        }
        if (batcher != null) {
            batcher.destroy();
        }
        resilienceManager.destroy();
        performanceMonitor.destroy();
        cache.destroy();
        eventPublisher.close();
        if (ownsScheduler) {
            scheduler.dispose();
        }
    }

    private Instant now() {
        return Instant.ofEpochMilli(scheduler.now(TimeUnit.MILLISECONDS));
    }

    private void checkNotClosed() {
        if (closed.get()) {
            throw new IllegalStateException("Client is closed");
        }
    }
}

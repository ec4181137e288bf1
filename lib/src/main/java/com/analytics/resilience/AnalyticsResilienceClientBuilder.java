package com.analytics.resilience;

import com.analytics.resilience.batch.BatchExecutor;
import com.analytics.resilience.cache.CacheLoader;
import com.analytics.resilience.config.ClientConfiguration;
import com.analytics.resilience.connection.AuthTokenProvider;
import com.analytics.resilience.connection.LiveChannelConnector;
import com.analytics.resilience.degradation.HealthCheck;
import com.analytics.resilience.impl.DefaultAnalyticsResilienceClient;
import com.analytics.resilience.sync.BroadcastChannel;
import com.analytics.resilience.transport.PollingSource;
import com.analytics.resilience.transport.PushChannelConnector;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import reactor.core.scheduler.Scheduler;

import java.util.ArrayList;
import java.util.List;

/**
 * Builder for creating AnalyticsResilienceClient instances.
 * The upstream capabilities are injected here; everything else comes from the {@link ClientConfiguration}.
 */
public class AnalyticsResilienceClientBuilder {

    private ClientConfiguration configuration = ClientConfiguration.defaultConfig();
    private Scheduler scheduler;
    private MeterRegistry meterRegistry;
    private LiveChannelConnector liveChannelConnector;
    private PushChannelConnector pushChannelConnector;
    private AuthTokenProvider authTokenProvider = AuthTokenProvider.anonymous();
    private CacheLoader cacheLoader = CacheLoader.none();
    private BatchExecutor batchExecutor;
    private HealthCheck healthCheck;
    private BroadcastChannel broadcastChannel;
    private final List<PollingSource> pollingSources = new ArrayList<>();

    /**
     * Create a new client with the given configuration and upstream capabilities.
     */
    public static AnalyticsResilienceClientBuilder builder() {
        return new AnalyticsResilienceClientBuilder();
    }

    public AnalyticsResilienceClientBuilder configuration(ClientConfiguration configuration) {
        this.configuration = configuration;
        return this;
    }

    /**
     * Scheduler used as clock and timer source. When not set, the client creates and owns a
     * single-threaded scheduler.
     */
    public AnalyticsResilienceClientBuilder scheduler(Scheduler scheduler) {
        this.scheduler = scheduler;
        return this;
    }

    public AnalyticsResilienceClientBuilder meterRegistry(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
        return this;
    }

    public AnalyticsResilienceClientBuilder liveChannelConnector(LiveChannelConnector connector) {
        this.liveChannelConnector = connector;
        return this;
    }

    public AnalyticsResilienceClientBuilder pushChannelConnector(PushChannelConnector connector) {
        this.pushChannelConnector = connector;
        return this;
    }

    public AnalyticsResilienceClientBuilder authTokenProvider(AuthTokenProvider provider) {
        this.authTokenProvider = provider;
        return this;
    }

    public AnalyticsResilienceClientBuilder cacheLoader(CacheLoader loader) {
        this.cacheLoader = loader;
        return this;
    }

    public AnalyticsResilienceClientBuilder batchExecutor(BatchExecutor executor) {
        this.batchExecutor = executor;
        return this;
    }

    public AnalyticsResilienceClientBuilder healthCheck(HealthCheck healthCheck) {
        this.healthCheck = healthCheck;
        return this;
    }

    public AnalyticsResilienceClientBuilder broadcastChannel(BroadcastChannel channel) {
        this.broadcastChannel = channel;
        return this;
    }

    public AnalyticsResilienceClientBuilder pollingSource(PollingSource source) {
        this.pollingSources.add(source);
        return this;
    }

    public AnalyticsResilienceClientBuilder pollingSources(List<PollingSource> sources) {
        this.pollingSources.addAll(sources);
        return this;
    }

    public ClientConfiguration getConfiguration() {
        return configuration;
    }

    public Scheduler getScheduler() {
        return scheduler;
    }

    public MeterRegistry getMeterRegistry() {
        return meterRegistry != null ? meterRegistry : new SimpleMeterRegistry();
    }

    public LiveChannelConnector getLiveChannelConnector() {
        return liveChannelConnector;
    }

    public PushChannelConnector getPushChannelConnector() {
        return pushChannelConnector;
    }

    public AuthTokenProvider getAuthTokenProvider() {
        return authTokenProvider;
    }

    public CacheLoader getCacheLoader() {
        return cacheLoader;
    }

    public BatchExecutor getBatchExecutor() {
        return batchExecutor;
    }

    public HealthCheck getHealthCheck() {
        return healthCheck;
    }

    public BroadcastChannel getBroadcastChannel() {
        return broadcastChannel;
    }

    public List<PollingSource> getPollingSources() {
        return List.copyOf(pollingSources);
    }

    public AnalyticsResilienceClient build() {
        if (configuration == null) {
            throw new IllegalArgumentException("Client configuration must be specified");
        }
        if (configuration.isRealtimeEnabled()
            && (liveChannelConnector == null || pushChannelConnector == null)) {
            throw new IllegalArgumentException(
                "Live and push channel connectors are required when realtime is enabled");
        }
        if (configuration.isCrossInstanceSyncEnabled() && broadcastChannel == null) {
            throw new IllegalArgumentException("A broadcast channel is required for cross-instance sync");
        }
        return new DefaultAnalyticsResilienceClient(this);
    }
}

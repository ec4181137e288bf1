package com.analytics.resilience.config;

import java.util.UUID;

/**
 * Top-level configuration for an analytics resilience client instance.
 * Aggregates the settings of every component the client wires together.
 */
public class ClientConfiguration {

    private final String instanceId;
    private final ResilienceConfig resilienceConfig;
    private final ConnectionConfig connectionConfig;
    private final TransportConfig transportConfig;
    private final BatchConfig batchConfig;
    private final CacheConfig cacheConfig;
    private final boolean enableRealtime;
    private final boolean enableCrossInstanceSync;

    private ClientConfiguration(Builder builder) {
        this.instanceId = builder.instanceId;
        this.resilienceConfig = builder.resilienceConfig;
        this.connectionConfig = builder.connectionConfig;
        this.transportConfig = builder.transportConfig;
        this.batchConfig = builder.batchConfig;
        this.cacheConfig = builder.cacheConfig;
        this.enableRealtime = builder.enableRealtime;
        this.enableCrossInstanceSync = builder.enableCrossInstanceSync;
    }

    public String getInstanceId() {
        return instanceId;
    }

    public ResilienceConfig getResilienceConfig() {
        return resilienceConfig;
    }

    public ConnectionConfig getConnectionConfig() {
        return connectionConfig;
    }

    public TransportConfig getTransportConfig() {
        return transportConfig;
    }

    public BatchConfig getBatchConfig() {
        return batchConfig;
    }

    public CacheConfig getCacheConfig() {
        return cacheConfig;
    }

    /**
     * Whether the client starts the live channel and its fallback transports.
     */
    public boolean isRealtimeEnabled() {
        return enableRealtime;
    }

    public boolean isCrossInstanceSyncEnabled() {
        return enableCrossInstanceSync;
    }

    public static ClientConfiguration defaultConfig() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String instanceId = UUID.randomUUID().toString();
        private ResilienceConfig resilienceConfig = ResilienceConfig.defaultConfig();
        private ConnectionConfig connectionConfig = ConnectionConfig.defaultConfig();
        private TransportConfig transportConfig = TransportConfig.defaultConfig();
        private BatchConfig batchConfig = BatchConfig.defaultConfig();
        private CacheConfig cacheConfig = CacheConfig.defaultConfig();
        private boolean enableRealtime = true;
        private boolean enableCrossInstanceSync = false;

        public Builder instanceId(String instanceId) {
            this.instanceId = instanceId;
            return this;
        }

        public Builder resilienceConfig(ResilienceConfig config) {
            this.resilienceConfig = config;
            return this;
        }

        public Builder connectionConfig(ConnectionConfig config) {
            this.connectionConfig = config;
            return this;
        }

        public Builder transportConfig(TransportConfig config) {
            this.transportConfig = config;
            return this;
        }

        public Builder batchConfig(BatchConfig config) {
            this.batchConfig = config;
            return this;
        }

        public Builder cacheConfig(CacheConfig config) {
            this.cacheConfig = config;
            return this;
        }

        public Builder enableRealtime(boolean enable) {
            this.enableRealtime = enable;
            return this;
        }

        public Builder enableCrossInstanceSync(boolean enable) {
            this.enableCrossInstanceSync = enable;
            return this;
        }

        public ClientConfiguration build() {
            if (instanceId == null || instanceId.trim().isEmpty()) {
                throw new IllegalArgumentException("Instance ID must be specified");
            }
            return new ClientConfiguration(this);
        }
    }
}

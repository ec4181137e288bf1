package com.analytics.resilience.config;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ClientConfigurationTest {

    @Test
    void testDefaults() {
        ClientConfiguration config = ClientConfiguration.defaultConfig();

        assertNotNull(config.getInstanceId());
        assertTrue(config.isRealtimeEnabled());
        assertFalse(config.isCrossInstanceSyncEnabled());
        assertEquals("ws://localhost:8080/ws/analytics", config.getConnectionConfig().getUrl());
        assertEquals(Duration.ofSeconds(30), config.getTransportConfig().getPollingInterval());
        assertEquals(10, config.getBatchConfig().getMaxBatchSize());
    }

    @Test
    void testInstanceIdsAreUnique() {
        assertNotEquals(ClientConfiguration.defaultConfig().getInstanceId(),
            ClientConfiguration.defaultConfig().getInstanceId());
    }

    @Test
    void testBlankInstanceIdRejected() {
        assertThrows(IllegalArgumentException.class, () -> ClientConfiguration.builder().instanceId(" ").build());
    }

    @Test
    void testConnectionDefaults() {
        ConnectionConfig config = ConnectionConfig.defaultConfig();

        assertEquals(Duration.ofSeconds(10), config.getConnectionTimeout());
        assertEquals(10, config.getMaxReconnectAttempts());
        assertEquals(Duration.ofSeconds(1), config.getReconnectBaseDelay());
        assertEquals(2.0, config.getReconnectMultiplier());
        assertEquals(Duration.ofSeconds(60), config.getMaxReconnectDelay());
        assertEquals(0.25, config.getReconnectJitter());
        assertEquals(Duration.ofSeconds(30), config.getHeartbeatInterval());
        assertEquals(3, config.getMaxMissedHeartbeats());
        assertEquals(100, config.getMaxQueuedMessages());
    }

    @Test
    void testConnectionValidation() {
        assertThrows(IllegalArgumentException.class, () -> ConnectionConfig.builder().url("").build());
        assertThrows(IllegalArgumentException.class, () ->
            ConnectionConfig.builder().heartbeatInterval(Duration.ofSeconds(5)).pongTimeout(Duration.ofSeconds(5)).build());
        assertThrows(IllegalArgumentException.class, () -> ConnectionConfig.builder().reconnectJitter(1.0).build());
    }

    @Test
    void testTransportDefaultsAndValidation() {
        TransportConfig config = TransportConfig.defaultConfig();
        assertEquals(List.of("metrics", "alert", "system"), config.getPushEventTypes());
        assertEquals(5, config.getPushMaxReconnectAttempts());
        assertEquals(1.5, config.getPollingBackoffMultiplier());
        assertEquals(5, config.getMaxPollingErrors());

        assertThrows(IllegalArgumentException.class, () ->
            TransportConfig.builder().pollingInterval(Duration.ofMinutes(2)).build());
        assertThrows(IllegalArgumentException.class, () -> TransportConfig.builder().maxPollingErrors(0).build());
    }

    @Test
    void testBatchValidation() {
        assertThrows(IllegalArgumentException.class, () -> BatchConfig.builder().maxBatchSize(0).build());
        assertThrows(IllegalArgumentException.class, () ->
            BatchConfig.builder().highPriorityWait(Duration.ofSeconds(1)).build());
    }

    @Test
    void testCacheStrategies() {
        CacheConfig config = CacheConfig.defaultConfig();

        assertEquals(CacheConfig.defaultStrategies().size(), config.getStrategies().size());
        assertTrue(CacheConfig.builder().clearStrategies().build().getStrategies().isEmpty());
        assertThrows(IllegalArgumentException.class, () ->
            CacheStrategy.builder("k").ttl(Duration.ofSeconds(10)).staleTime(Duration.ofSeconds(20)).build());
    }

    @Test
    void testStrategyMatchesPrefix() {
        CacheStrategy strategy = CacheStrategy.builder("analytics-engagement").build();

        assertTrue(strategy.matches("analytics-engagement"));
        assertTrue(strategy.matches("analytics-engagement-cohort-7"));
        assertFalse(strategy.matches("analytics-summary"));
    }
}

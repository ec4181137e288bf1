package com.analytics.resilience.transport;

import com.analytics.resilience.cache.AnalyticsCache;
import com.analytics.resilience.cache.CacheLoader;
import com.analytics.resilience.cache.CachedValue;
import com.analytics.resilience.config.CacheConfig;
import com.analytics.resilience.config.ConnectionConfig;
import com.analytics.resilience.config.TransportConfig;
import com.analytics.resilience.connection.AuthTokenProvider;
import com.analytics.resilience.connection.ConnectionManager;
import com.analytics.resilience.connection.FakeLiveChannelConnector;
import com.analytics.resilience.model.ChannelMessage;
import com.analytics.resilience.model.ConnectionState;
import com.analytics.resilience.model.TransportMode;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;
import reactor.test.scheduler.VirtualTimeScheduler;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;

class TransportFallbackCascadeTest {

    private VirtualTimeScheduler scheduler;
    private FakeLiveChannelConnector liveConnector;
    private FakePushChannelConnector pushConnector;
    private ConnectionManager live;
    private PushChannelManager push;
    private PollingManager polling;
    private AnalyticsCache cache;
    private TransportFallbackCascade cascade;
    private final AtomicBoolean pollingFails = new AtomicBoolean();
    private final List<TransportMode> modes = new ArrayList<>();

    @BeforeEach
    void setUp() {
        scheduler = VirtualTimeScheduler.create();
        liveConnector = new FakeLiveChannelConnector();
        pushConnector = new FakePushChannelConnector();
        ConnectionConfig connectionConfig = ConnectionConfig.builder()
            .maxReconnectAttempts(2)
            .reconnectBaseDelay(Duration.ofSeconds(1))
            .reconnectMultiplier(2.0)
            .reconnectJitter(0)
            .heartbeatInterval(Duration.ofSeconds(30))
            .pongTimeout(Duration.ofSeconds(10))
            .maxMissedHeartbeats(3)
            .build();
        TransportConfig transportConfig = TransportConfig.builder()
            .pushReconnectDelay(Duration.ofSeconds(1))
            .pushMaxReconnectAttempts(2)
            .pollingInterval(Duration.ofSeconds(10))
            .maxPollingErrors(2)
            .liveRetryInterval(Duration.ofSeconds(60))
            .build();
        cache = new AnalyticsCache(CacheConfig.defaultConfig(), CacheLoader.none(), scheduler);
        live = new ConnectionManager(connectionConfig, liveConnector, AuthTokenProvider.anonymous(), scheduler);
        push = new PushChannelManager(transportConfig, pushConnector, AuthTokenProvider.anonymous(), scheduler);
        polling = new PollingManager(transportConfig, List.of(PollingSource.of("engagement", () ->
            pollingFails.get() ? Mono.error(new IOException("poll failed")) : Mono.just(Map.of("activeUsers", 7)))),
            scheduler, cache::set);
        cascade = new TransportFallbackCascade(transportConfig, live, push, polling, cache, scheduler);
        cascade.addListener((previous, current, reason) -> modes.add(current));
    }

    @AfterEach
    void tearDown() {
        cascade.destroy();
        cache.destroy();
        scheduler.dispose();
    }

    @Test
    void testStartsOnLiveChannel() {
        StepVerifier.create(cascade.start()).verifyComplete();

        assertEquals(TransportMode.LIVE_CHANNEL, cascade.getMode());
        assertTrue(live.isConnected());
        assertEquals(0, pushConnector.attempts());
        assertTrue(modes.isEmpty());
    }

    @Test
    void testInitialLiveFailureFallsBackToPush() {
        liveConnector.refuseConnections(true);

        StepVerifier.create(cascade.start()).verifyComplete();

        assertEquals(TransportMode.PUSH_ONLY, cascade.getMode());
        assertTrue(push.isConnected());
        assertEquals(List.of(TransportMode.PUSH_ONLY), modes);
    }

    @Test
    void testInitialLiveAndPushFailureFallsBackToPolling() {
        liveConnector.refuseConnections(true);
        pushConnector.refuseConnections(true);

        StepVerifier.create(cascade.start()).verifyComplete();

        assertEquals(TransportMode.POLLING, cascade.getMode());
        assertTrue(polling.isActive());

        scheduler.advanceTimeBy(Duration.ofSeconds(10));
        assertTrue(cache.get("engagement").isPresent());
    }

    @Test
    void testLiveDropDegradesToPushAndRecovers() {
        cascade.start().block();

        liveConnector.lastChannel().serverClose(1006, "Abnormal closure");
        assertEquals(TransportMode.PUSH_ONLY, cascade.getMode());
        assertEquals(ConnectionState.RECONNECTING, live.getState());

        scheduler.advanceTimeBy(Duration.ofSeconds(1));

        assertEquals(TransportMode.LIVE_CHANNEL, cascade.getMode());
        assertFalse(push.isConnected());
        assertEquals(List.of(TransportMode.PUSH_ONLY, TransportMode.LIVE_CHANNEL), modes);

        List<ModeTransition> history = cascade.getHistory();
        assertEquals(2, history.size());
        assertEquals("Live channel connection lost", history.get(0).reason());
        assertEquals("Live channel connection restored", history.get(1).reason());
    }

    @Test
    void testNormalLiveCloseDoesNotDegrade() {
        cascade.start().block();

        liveConnector.lastChannel().serverClose(1000, "Server shutdown");

        assertEquals(TransportMode.LIVE_CHANNEL, cascade.getMode());
        assertEquals(0, pushConnector.attempts());
    }

    @Test
    void testPushExhaustionFallsBackToPolling() {
        cascade.start().block();
        liveConnector.refuseConnections(true);
        liveConnector.lastChannel().serverClose(1006, "Abnormal closure");
        assertEquals(TransportMode.PUSH_ONLY, cascade.getMode());

        pushConnector.refuseConnections(true);
        pushConnector.lastStream().fail(new IOException("stream reset"));
        scheduler.advanceTimeBy(Duration.ofSeconds(3));

        assertEquals(TransportMode.POLLING, cascade.getMode());
        assertTrue(polling.isActive());
        assertEquals(ConnectionState.DISCONNECTED, live.getState());
    }

    @Test
    void testLiveProbeUpgradesFromPolling() {
        liveConnector.refuseConnections(true);
        pushConnector.refuseConnections(true);
        cascade.start().block();
        assertEquals(TransportMode.POLLING, cascade.getMode());

        liveConnector.refuseConnections(false);
        scheduler.advanceTimeBy(Duration.ofSeconds(59));
        assertEquals(TransportMode.POLLING, cascade.getMode());

        scheduler.advanceTimeBy(Duration.ofSeconds(1));
        assertEquals(TransportMode.LIVE_CHANNEL, cascade.getMode());
        assertFalse(polling.isActive());
        assertTrue(live.isConnected());
    }

    @Test
    void testPollingGiveUpGoesOffline() {
        cascade.start().block();
        pollingFails.set(true);

        cascade.forceMode(TransportMode.POLLING);
        assertEquals(TransportMode.POLLING, cascade.getMode());

        // failed cycles at 10s and 25s
        scheduler.advanceTimeBy(Duration.ofSeconds(25));

        assertEquals(TransportMode.OFFLINE, cascade.getMode());
        assertFalse(polling.isActive());
    }

    @Test
    void testOfflineKeepsProbingLiveChannel() {
        liveConnector.refuseConnections(true);
        pushConnector.refuseConnections(true);
        pollingFails.set(true);
        cascade.start().block();

        scheduler.advanceTimeBy(Duration.ofSeconds(25));
        assertEquals(TransportMode.OFFLINE, cascade.getMode());

        liveConnector.refuseConnections(false);
        pushConnector.refuseConnections(false);
        scheduler.advanceTimeBy(Duration.ofSeconds(35));

        assertEquals(TransportMode.LIVE_CHANNEL, cascade.getMode());
        assertTrue(live.isConnected());
        assertEquals(List.of(TransportMode.POLLING, TransportMode.OFFLINE, TransportMode.LIVE_CHANNEL), modes);
    }

    @Test
    void testForcedOfflineStopsLiveProbe() {
        liveConnector.refuseConnections(true);
        pushConnector.refuseConnections(true);
        cascade.start().block();
        assertEquals(TransportMode.POLLING, cascade.getMode());

        cascade.forceMode(TransportMode.OFFLINE);
        int attempts = liveConnector.openAttempts();
        liveConnector.refuseConnections(false);
        scheduler.advanceTimeBy(Duration.ofMinutes(10));

        assertEquals(TransportMode.OFFLINE, cascade.getMode());
        assertEquals(attempts, liveConnector.openAttempts());
    }

    @Test
    void testForcedPollingClosesLiveChannelUntilProbeRestoresIt() {
        cascade.start().block();
        FakeLiveChannelConnector.FakeChannel channel = liveConnector.lastChannel();

        cascade.forceMode(TransportMode.POLLING);

        assertEquals(TransportMode.POLLING, cascade.getMode());
        assertFalse(live.isConnected());
        assertFalse(channel.isOpen());
        assertTrue(polling.isActive());

        scheduler.advanceTimeBy(Duration.ofSeconds(60));

        assertEquals(TransportMode.LIVE_CHANNEL, cascade.getMode());
        assertTrue(live.isConnected());
        assertFalse(polling.isActive());
        assertEquals(2, liveConnector.openAttempts());
    }

    @Test
    void testHeartbeatLossDegradesAndRestoreUpgrades() {
        cascade.start().block();

        scheduler.advanceTimeBy(Duration.ofSeconds(120));
        assertEquals(TransportMode.PUSH_ONLY, cascade.getMode());
        assertTrue(live.isConnected());

        scheduler.advanceTimeBy(Duration.ofSeconds(30));
        liveConnector.lastChannel().receive(ChannelMessage.pong(0));

        assertEquals(TransportMode.LIVE_CHANNEL, cascade.getMode());
        assertFalse(push.isConnected());
    }

    @Test
    void testForcedOfflineAndBackToLive() {
        cascade.start().block();

        cascade.forceMode(TransportMode.OFFLINE);
        assertEquals(TransportMode.OFFLINE, cascade.getMode());
        assertFalse(live.isConnected());

        cascade.forceMode(TransportMode.LIVE_CHANNEL);
        assertEquals(TransportMode.LIVE_CHANNEL, cascade.getMode());
        assertTrue(live.isConnected());
        assertEquals(2, liveConnector.openAttempts());
    }

    @Test
    void testForcedPushOnly() {
        cascade.start().block();

        cascade.forceMode(TransportMode.PUSH_ONLY);

        assertEquals(TransportMode.PUSH_ONLY, cascade.getMode());
        assertTrue(push.isConnected());
        assertFalse(live.isConnected());
    }

    @Test
    void testLiveUpdatesAreCached() {
        cascade.start().block();

        liveConnector.lastChannel().receive(ChannelMessage.builder()
            .type(ChannelMessage.METRICS)
            .cacheKey("engagement")
            .data("activeUsers", 42)
            .build());

        CachedValue cached = cache.get("engagement").orElseThrow();
        assertEquals(42, ((Map<?, ?>) cached.getValue()).get("activeUsers"));
    }

    @Test
    void testPushUpdatesAreCached() {
        liveConnector.refuseConnections(true);
        cascade.start().block();

        pushConnector.lastStream().emit(ChannelMessage.builder()
            .type(ChannelMessage.ALERT)
            .cacheKey("alerts")
            .data("count", 3)
            .build());
        pushConnector.lastStream().emit(ChannelMessage.builder().type(ChannelMessage.SYSTEM).build());

        assertTrue(cache.get("alerts").isPresent());
        assertEquals(1, cache.size());
    }

    @Test
    void testStatusReflectsAllTransports() {
        liveConnector.refuseConnections(true);
        cascade.start().block();

        TransportStatus status = cascade.getStatus();

        assertEquals(TransportMode.PUSH_ONLY, status.mode());
        assertFalse(status.liveConnected());
        assertTrue(status.push().connected());
        assertFalse(status.polling().active());
        assertEquals(1, status.history().size());
    }

    @Test
    void testDestroyStopsEverything() {
        liveConnector.refuseConnections(true);
        pushConnector.refuseConnections(true);
        cascade.start().block();

        cascade.destroy();
        int attempts = liveConnector.openAttempts();
        scheduler.advanceTimeBy(Duration.ofMinutes(10));

        assertFalse(polling.isActive());
        assertEquals(attempts, liveConnector.openAttempts());
    }
}

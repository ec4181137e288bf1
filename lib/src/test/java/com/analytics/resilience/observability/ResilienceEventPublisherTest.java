package com.analytics.resilience.observability;

import com.analytics.resilience.model.ConnectionState;
import com.analytics.resilience.model.DegradationLevel;
import com.analytics.resilience.model.TransportMode;
import com.analytics.resilience.observability.ResilienceEventPublisher.DegradationEvent;
import com.analytics.resilience.observability.ResilienceEventPublisher.TransportModeEvent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.Disposable;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ResilienceEventPublisherTest {

    private ResilienceEventPublisher publisher;
    private final Instant now = Instant.parse("2024-01-01T00:00:00Z");

    @BeforeEach
    void setUp() {
        publisher = new ResilienceEventPublisher();
    }

    private PerformanceAlert alert(AlertType type) {
        return new PerformanceAlert(type, type.name(), Map.of(), AlertSeverity.WARNING, now);
    }

    @Test
    void testConnectionStatusStream() {
        StepVerifier.create(publisher.getConnectionStatusStream().take(1))
            .then(() -> publisher.publishConnectionStatus(ConnectionState.CONNECTING, ConnectionState.CONNECTED, now))
            .assertNext(event -> {
                assertEquals(ConnectionState.CONNECTING, event.getPrevious());
                assertEquals(ConnectionState.CONNECTED, event.getCurrent());
                assertEquals(now, event.getTimestamp());
            })
            .verifyComplete();
    }

    @Test
    void testTransportModeSubscription() {
        List<TransportModeEvent> events = new ArrayList<>();
        Disposable subscription = publisher.subscribeToTransportModes(events::add);

        publisher.publishTransportMode(TransportMode.LIVE_CHANNEL, TransportMode.PUSH_ONLY, "Live channel error", now);

        assertEquals(1, events.size());
        assertEquals("Live channel error", events.get(0).getReason());
        assertEquals(1, publisher.getSubscriberCount());

        subscription.dispose();
        assertEquals(0, publisher.getSubscriberCount());
    }

    @Test
    void testDegradationSubscription() {
        List<DegradationEvent> events = new ArrayList<>();
        publisher.subscribeToDegradation(events::add);

        publisher.publishDegradation(DegradationLevel.OPTIMAL, DegradationLevel.PARTIAL, "Slow responses", now);

        assertEquals(DegradationLevel.PARTIAL, events.get(0).getCurrent());
        assertEquals("Slow responses", events.get(0).getReason());
    }

    @Test
    void testEventsAreNotReplayedToLateSubscribers() {
        publisher.publishDegradation(DegradationLevel.OPTIMAL, DegradationLevel.PARTIAL, "early", now);

        List<DegradationEvent> events = new ArrayList<>();
        publisher.subscribeToDegradation(events::add);

        assertTrue(events.isEmpty());
    }

    @Test
    void testBudgetViolationStreamFiltersAlerts() {
        List<PerformanceAlert> all = new ArrayList<>();
        List<PerformanceAlert> budgets = new ArrayList<>();
        publisher.subscribeToAlerts(all::add);
        publisher.subscribeToBudgetViolations(budgets::add);

        publisher.publishAlert(alert(AlertType.HIGH_LATENCY));
        publisher.publishAlert(alert(AlertType.BUDGET_VIOLATION));

        assertEquals(2, all.size());
        assertEquals(1, budgets.size());
        assertEquals(AlertType.BUDGET_VIOLATION, budgets.get(0).getType());
    }

    @Test
    void testFailingSubscriberKeepsReceiving() {
        List<PerformanceAlert> received = new ArrayList<>();
        publisher.subscribeToAlerts(alert -> {
            received.add(alert);
            throw new IllegalStateException("listener bug");
        });

        publisher.publishAlert(alert(AlertType.HIGH_LATENCY));
        publisher.publishAlert(alert(AlertType.LOW_SUCCESS_RATE));

        assertEquals(2, received.size());
    }

    @Test
    void testCloseCompletesStreams() {
        StepVerifier.create(publisher.getAlertStream())
            .then(publisher::close)
            .expectComplete()
            .verify(Duration.ofSeconds(1));

        assertEquals(0, publisher.getSubscriberCount());
    }
}

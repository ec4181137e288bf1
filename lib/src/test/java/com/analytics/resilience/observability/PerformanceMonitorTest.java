package com.analytics.resilience.observability;

import com.analytics.resilience.config.MonitoringConfig;
import com.analytics.resilience.error.AnalyticsException.ServiceException;
import com.analytics.resilience.model.ConnectionState;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.test.scheduler.VirtualTimeScheduler;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class PerformanceMonitorTest {

    private VirtualTimeScheduler scheduler;
    private MeterRegistry meterRegistry;
    private PerformanceMonitor monitor;
    private final List<PerformanceAlert> alerts = new ArrayList<>();

    @BeforeEach
    void setUp() {
        scheduler = VirtualTimeScheduler.create();
        meterRegistry = new SimpleMeterRegistry();
        MonitoringConfig config = MonitoringConfig.builder()
            .maxStoredRequests(100)
            .metricsRetention(Duration.ofMinutes(1))
            .build();
        monitor = new PerformanceMonitor(config, meterRegistry, scheduler);
        monitor.addAlertListener(alerts::add);
    }

    @AfterEach
    void tearDown() {
        monitor.destroy();
        scheduler.dispose();
    }

    private void succeed(long latencyMs, boolean cacheHit) {
        String id = monitor.startRequest("dashboard");
        scheduler.advanceTimeBy(Duration.ofMillis(latencyMs));
        monitor.endRequest(id, cacheHit);
    }

    private void fail() {
        String id = monitor.startRequest("dashboard");
        monitor.endRequestWithError(id, new ServiceException("Internal error"), 0);
    }

    private List<AlertType> alertTypes() {
        return alerts.stream().map(PerformanceAlert::getType).collect(Collectors.toList());
    }

    @Test
    void testScoreWithoutRequests() {
        PerformanceSnapshot snapshot = monitor.getSnapshot();

        assertEquals(0, snapshot.requestCount());
        assertEquals(1.0, snapshot.successRate());
        assertEquals(80, snapshot.performanceScore());
    }

    @Test
    void testScoreWeights() {
        assertEquals(100, PerformanceMonitor.score(1.0, 0, 1.0, 0));
        assertEquals(70, PerformanceMonitor.score(1.0, 10_000, 1.0, 0));
        assertEquals(60, PerformanceMonitor.score(0.0, 0, 1.0, 0));
        assertEquals(90, PerformanceMonitor.score(1.0, 0, 1.0, 1.0));
        assertEquals(70, PerformanceMonitor.score(1.0, 20_000, 1.0, 0));
    }

    @Test
    void testSuccessfulRequestIsMeasured() {
        succeed(200, true);

        PerformanceSnapshot snapshot = monitor.getSnapshot();
        assertEquals(1, snapshot.requestCount());
        assertEquals(200.0, snapshot.requestLatency(), 0.001);
        assertEquals(1.0, snapshot.cacheHitRate());
        assertEquals(99, snapshot.performanceScore());
        assertTrue(alerts.isEmpty());

        assertEquals(1.0, meterRegistry.get("analytics.resilience.requests.total").counter().count());
        assertEquals(1, meterRegistry.get("analytics.resilience.request.latency").timer().count());
        assertEquals(1.0, meterRegistry.get("analytics.resilience.cache.lookups").tag("hit", "true").counter().count());
        assertEquals(99.0, meterRegistry.get("analytics.resilience.performance.score").gauge().value());
    }

    @Test
    void testFailureRaisesBudgetAndSuccessRateAlerts() {
        fail();

        assertEquals(1.0, meterRegistry.get("analytics.resilience.requests.failed").counter().count());
        List<AlertType> types = alertTypes();
        assertEquals(3, types.stream().filter(t -> t == AlertType.BUDGET_VIOLATION).count());
        assertTrue(types.contains(AlertType.LOW_SUCCESS_RATE));
        PerformanceAlert lowSuccess = alerts.stream()
            .filter(a -> a.getType() == AlertType.LOW_SUCCESS_RATE).findFirst().orElseThrow();
        assertEquals(AlertSeverity.ERROR, lowSuccess.getSeverity());
        assertTrue(lowSuccess.getSeverity().isSevere());
    }

    @Test
    void testBudgetViolationReportedOncePerViolation() {
        fail();
        alerts.clear();

        fail();

        assertFalse(alertTypes().contains(AlertType.BUDGET_VIOLATION));
        PerformanceBudget successBudget = monitor.getBudgets().stream()
            .filter(b -> b.metric() == PerformanceBudget.Metric.SUCCESS_RATE).findFirst().orElseThrow();
        assertTrue(successBudget.violated());
        assertEquals(1, successBudget.violationCount());
        assertNotNull(successBudget.lastViolation());
    }

    @Test
    void testConsecutiveFailureAlert() {
        for (int i = 0; i < 4; i++) {
            fail();
        }
        assertFalse(alertTypes().contains(AlertType.CONSECUTIVE_FAILURES));

        fail();

        PerformanceAlert alert = alerts.stream()
            .filter(a -> a.getType() == AlertType.CONSECUTIVE_FAILURES).findFirst().orElseThrow();
        assertEquals("5 consecutive request failures detected", alert.getMessage());
        assertEquals(1.0, meterRegistry.get("analytics.resilience.alerts")
            .tag("type", "consecutive_failures").counter().count());
    }

    @Test
    void testSuccessBreaksFailureStreak() {
        for (int i = 0; i < 4; i++) {
            fail();
        }
        succeed(10, false);
        fail();

        assertFalse(alertTypes().contains(AlertType.CONSECUTIVE_FAILURES));
    }

    @Test
    void testHighLatencyAlert() {
        succeed(11_000, true);

        assertTrue(alertTypes().contains(AlertType.HIGH_LATENCY));
        assertTrue(alertTypes().contains(AlertType.BUDGET_VIOLATION));
    }

    @Test
    void testReconnectionRateLowersScore() {
        monitor.recordConnectionState(ConnectionState.CONNECTED);
        monitor.recordConnectionState(ConnectionState.RECONNECTING);
        monitor.recordConnectionState(ConnectionState.CONNECTED);
        monitor.recordMessage();

        PerformanceSnapshot snapshot = monitor.getSnapshot();
        assertEquals(2, snapshot.connectionCount());
        assertEquals(1, snapshot.reconnectionCount());
        assertEquals(1, snapshot.messageCount());
        assertEquals(75, snapshot.performanceScore());
        assertEquals(1.0, meterRegistry.get("analytics.resilience.connection.reconnections").counter().count());
    }

    @Test
    void testRequestsOutsideRetentionAreIgnored() {
        fail();
        scheduler.advanceTimeBy(Duration.ofSeconds(61));

        assertEquals(0, monitor.getSnapshot().requestCount());
    }

    @Test
    void testStoredRequestsAreBounded() {
        MonitoringConfig config = MonitoringConfig.builder().maxStoredRequests(3).build();
        PerformanceMonitor bounded = new PerformanceMonitor(config, meterRegistry, scheduler);
        String first = bounded.startRequest("a");
        for (int i = 0; i < 3; i++) {
            bounded.startRequest("b");
        }

        bounded.endRequest(first, false);

        assertEquals(0, bounded.getSnapshot().requestCount());
        bounded.destroy();
    }

    @Test
    void testRequestCompletedOnlyOnce() {
        String id = monitor.startRequest("dashboard");
        monitor.endRequest(id, false);
        monitor.endRequestWithError(id, new ServiceException("late"), 1);

        assertEquals(1, monitor.getSnapshot().requestCount());
        assertEquals(1.0, monitor.getSnapshot().successRate());
    }

    @Test
    void testCircuitBreakerEventsAreCounted() {
        monitor.recordCircuitBreakerEvent("dashboard", "state_change");
        monitor.recordCircuitBreakerEvent("dashboard", "state_change");

        assertEquals(2.0, meterRegistry.get("analytics.resilience.circuit_breaker")
            .tag("operation", "dashboard").tag("event", "state_change").counter().count());
    }

    @Test
    void testMetricsPublishedPeriodically() {
        List<PerformanceSnapshot> published = new ArrayList<>();
        monitor.addMetricsListener(published::add);
        monitor.start();

        scheduler.advanceTimeBy(Duration.ofSeconds(29));
        assertTrue(published.isEmpty());
        scheduler.advanceTimeBy(Duration.ofSeconds(31));

        assertEquals(2, published.size());
    }

    @Test
    void testClearMetrics() {
        fail();
        monitor.recordConnectionState(ConnectionState.CONNECTED);

        monitor.clearMetrics();

        PerformanceSnapshot snapshot = monitor.getSnapshot();
        assertEquals(0, snapshot.requestCount());
        assertEquals(0, snapshot.connectionCount());
        assertEquals(0, snapshot.budgetViolations());
        assertTrue(monitor.getBudgets().stream().noneMatch(PerformanceBudget::violated));
    }
}

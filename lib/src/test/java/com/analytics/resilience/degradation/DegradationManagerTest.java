package com.analytics.resilience.degradation;

import com.analytics.resilience.cache.AnalyticsCache;
import com.analytics.resilience.cache.CacheLoader;
import com.analytics.resilience.config.CacheConfig;
import com.analytics.resilience.config.DegradationConfig;
import com.analytics.resilience.error.AnalyticsException;
import com.analytics.resilience.model.AnalyticsFeature;
import com.analytics.resilience.model.DataSource;
import com.analytics.resilience.model.DegradationLevel;
import com.analytics.resilience.model.HealthStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;
import reactor.test.scheduler.VirtualTimeScheduler;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

import static org.junit.jupiter.api.Assertions.*;

class DegradationManagerTest {

    private VirtualTimeScheduler scheduler;
    private AnalyticsCache cache;
    private DegradationManager manager;
    private AtomicInteger fetches;

    @BeforeEach
    void setUp() {
        scheduler = VirtualTimeScheduler.create();
        cache = new AnalyticsCache(CacheConfig.builder().clearStrategies().build(), CacheLoader.none(), scheduler);
        manager = new DegradationManager(DegradationConfig.defaultConfig(), cache, scheduler);
        fetches = new AtomicInteger();
    }

    private Supplier<Mono<String>> live(String value) {
        return () -> {
            fetches.incrementAndGet();
            return Mono.just(value);
        };
    }

    private Supplier<Mono<String>> failing(RuntimeException error) {
        return () -> {
            fetches.incrementAndGet();
            return Mono.error(error);
        };
    }

    @Test
    void testOptimalFetchesLiveAndCaches() {
        StepVerifier.create(manager.getData("engagement", live("fresh"), null))
            .assertNext(result -> {
                assertEquals("fresh", result.getData());
                assertEquals(DataSource.LIVE, result.getSource());
                assertFalse(result.isDegraded());
                assertTrue(result.getError().isEmpty());
            })
            .verifyComplete();

        assertEquals("fresh", cache.get("engagement").orElseThrow().getValue());
    }

    @Test
    void testFetchErrorServesCacheAndEscalates() {
        cache.set("engagement", "cached");

        StepVerifier.create(manager.getData("engagement",
                failing(new AnalyticsException.NetworkException("offline")), null))
            .assertNext(result -> {
                assertEquals("cached", result.getData());
                assertEquals(DataSource.CACHE, result.getSource());
                assertTrue(result.isDegraded());
                assertInstanceOf(AnalyticsException.NetworkException.class, result.getError().orElseThrow());
            })
            .verifyComplete();

        assertEquals(DegradationLevel.PARTIAL, manager.getLevel());
        assertEquals("Network connectivity issues", manager.getState().getReason());
    }

    @Test
    void testFetchErrorWithoutCacheServesFallback() {
        StepVerifier.create(manager.getData("engagement",
                failing(new AnalyticsException.ServiceException("500")), "fallback"))
            .assertNext(result -> {
                assertEquals("fallback", result.getData());
                assertEquals(DataSource.FALLBACK, result.getSource());
            })
            .verifyComplete();
    }

    @Test
    void testFetchErrorWithNothingToServePropagatesClassifiedError() {
        StepVerifier.create(manager.getData("engagement", failing(new IllegalStateException("boom")), null))
            .expectError(AnalyticsException.ServiceException.class)
            .verify();
    }

    @Test
    void testPartialServesFreshCacheWithoutFetching() {
        cache.set("engagement", "cached");
        manager.setLevel(DegradationLevel.PARTIAL, "test");

        StepVerifier.create(manager.getData("engagement", live("fresh"), null))
            .assertNext(result -> assertEquals(DataSource.CACHE, result.getSource()))
            .verifyComplete();

        assertEquals(0, fetches.get());
    }

    @Test
    void testPartialFetchIsBoundedByHealthCheckTimeout() {
        cache.set("engagement", "cached");
        cache.invalidateByPattern("engagement");
        manager.setLevel(DegradationLevel.PARTIAL, "test");

        StepVerifier.create(manager.getData("engagement", () -> Mono.<String>never(), null))
            .then(() -> scheduler.advanceTimeBy(Duration.ofSeconds(5)))
            .assertNext(result -> {
                assertEquals("cached", result.getData());
                assertInstanceOf(AnalyticsException.RequestTimeoutException.class, result.getError().orElseThrow());
            })
            .verifyComplete();
    }

    @Test
    void testSignificantNeverFetches() {
        cache.set("engagement", "cached");
        manager.setLevel(DegradationLevel.SIGNIFICANT, "test");

        StepVerifier.create(manager.getData("engagement", live("fresh"), "fallback"))
            .assertNext(result -> {
                assertEquals("cached", result.getData());
                assertEquals(DegradationLevel.SIGNIFICANT, result.getDegradationLevel());
            })
            .verifyComplete();

        StepVerifier.create(manager.getData("progress", live("fresh"), "fallback"))
            .assertNext(result -> assertEquals(DataSource.FALLBACK, result.getSource()))
            .verifyComplete();

        StepVerifier.create(manager.getData("content", live("fresh"), null))
            .expectErrorSatisfies(error -> assertEquals("NO_DATA_AVAILABLE", ((AnalyticsException) error).getCode()))
            .verify();

        assertEquals(0, fetches.get());
    }

    @Test
    void testCriticalFallsBackToPlaceholder() {
        manager.setLevel(DegradationLevel.CRITICAL, "test");

        StepVerifier.create(manager.<Object>getData("engagement-course-1", () -> Mono.just("fresh"), null))
            .assertNext(result -> {
                assertEquals(DataSource.PLACEHOLDER, result.getSource());
                Map<?, ?> data = (Map<?, ?>) result.getData();
                assertEquals(0, data.get("activeUsers1h"));
            })
            .verifyComplete();
    }

    @Test
    void testCompleteIgnoresCache() {
        cache.set("engagement", "cached");
        manager.setLevel(DegradationLevel.COMPLETE, "test");

        StepVerifier.create(manager.getData("engagement", live("fresh"), "fallback"))
            .assertNext(result -> assertEquals(DataSource.FALLBACK, result.getSource()))
            .verifyComplete();
    }

    @Test
    void testCompleteWithoutPlaceholderErrors() {
        DegradationManager strict = new DegradationManager(
            DegradationConfig.builder().enablePlaceholderData(false).build(), cache, scheduler);
        strict.setLevel(DegradationLevel.COMPLETE, "test");

        StepVerifier.create(strict.getData("engagement", live("fresh"), null))
            .expectError(AnalyticsException.ServiceException.class)
            .verify();
    }

    @Test
    void testEscalationRespectsErrorClassCeiling() {
        AnalyticsException network = new AnalyticsException.NetworkException("offline");
        assertTrue(manager.escalate(network));
        assertTrue(manager.escalate(network));
        assertFalse(manager.escalate(network));
        assertEquals(DegradationLevel.SIGNIFICANT, manager.getLevel());

        assertTrue(manager.escalate(new AnalyticsException.ServiceException("500")));
        assertEquals(DegradationLevel.CRITICAL, manager.getLevel());
        assertFalse(manager.escalate(new AnalyticsException.ServiceException("500")));
    }

    @Test
    void testAuthErrorsNeverEscalate() {
        assertFalse(manager.escalate(new AnalyticsException.AuthenticationException("expired")));
        assertFalse(manager.escalate(new AnalyticsException.ValidationException("bad")));
        assertEquals(DegradationLevel.OPTIMAL, manager.getLevel());
    }

    @Test
    void testHealthyCheckRestoresOptimalInOneStep() {
        manager.setLevel(DegradationLevel.CRITICAL, "test");
        manager.setHealthCheck(() -> Mono.just(HealthStatus.HEALTHY));

        StepVerifier.create(manager.checkHealth())
            .expectNext(HealthStatus.HEALTHY)
            .verifyComplete();

        assertEquals(DegradationLevel.OPTIMAL, manager.getLevel());
        assertEquals("Service health restored", manager.getState().getReason());
        assertTrue(manager.getState().getLastHealthCheck().isPresent());
    }

    @Test
    void testDegradedHealthDoesNotChangeLevel() {
        manager.setLevel(DegradationLevel.PARTIAL, "test");
        manager.setHealthCheck(() -> Mono.just(HealthStatus.DEGRADED));

        manager.checkHealth().block();

        assertEquals(DegradationLevel.PARTIAL, manager.getLevel());
    }

    @Test
    void testFailingHealthCheckEscalates() {
        manager.setHealthCheck(() -> Mono.error(new AnalyticsException.ServiceException("503")));

        StepVerifier.create(manager.checkHealth())
            .expectNext(HealthStatus.UNHEALTHY)
            .verifyComplete();

        assertEquals(DegradationLevel.PARTIAL, manager.getLevel());
        assertEquals("Service errors detected", manager.getState().getReason());
    }

    @Test
    void testPeriodicHealthCheck() {
        AtomicInteger checks = new AtomicInteger();
        manager.setHealthCheck(() -> {
            checks.incrementAndGet();
            return Mono.just(HealthStatus.HEALTHY);
        });
        manager.setLevel(DegradationLevel.SIGNIFICANT, "test");
        manager.start();

        scheduler.advanceTimeBy(Duration.ofSeconds(59));
        assertEquals(0, checks.get());
        scheduler.advanceTimeBy(Duration.ofSeconds(1));
        assertEquals(1, checks.get());
        assertEquals(DegradationLevel.OPTIMAL, manager.getLevel());

        manager.stop();
        scheduler.advanceTimeBy(Duration.ofMinutes(5));
        assertEquals(1, checks.get());
    }

    @Test
    void testListenersSeeTransitions() {
        List<String> transitions = new ArrayList<>();
        manager.addListener((previous, current) ->
            transitions.add(previous.getLevel() + "->" + current.getLevel()));

        manager.setLevel(DegradationLevel.PARTIAL, "slow");
        manager.setLevel(DegradationLevel.PARTIAL, "still slow");
        manager.reset();

        assertEquals(List.of("OPTIMAL->PARTIAL", "PARTIAL->OPTIMAL"), transitions);
    }

    @Test
    void testFeatureAvailabilityFollowsLevel() {
        assertTrue(manager.isFeatureAvailable(AnalyticsFeature.REALTIME_UPDATES));

        manager.setLevel(DegradationLevel.CRITICAL, "test");

        assertFalse(manager.isFeatureAvailable(AnalyticsFeature.REALTIME_UPDATES));
        assertTrue(manager.isFeatureAvailable("engagement_metrics"));
        assertEquals("Analytics service is severely degraded. Limited functionality available",
            manager.getStatusMessage());
    }

    @Test
    void testCacheFreshness() {
        cache.set("a", 1);
        scheduler.advanceTimeBy(Duration.ofMinutes(1));
        cache.set("b", 2);
        scheduler.advanceTimeBy(Duration.ofSeconds(10));

        CacheFreshness freshness = manager.getCacheFreshness();

        assertEquals(2, freshness.total());
        assertEquals(1, freshness.fresh());
        assertEquals(1, freshness.stale());
        assertEquals(CacheStatus.FRESH, freshness.status());
    }
}

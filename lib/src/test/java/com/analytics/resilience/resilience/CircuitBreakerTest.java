package com.analytics.resilience.resilience;

import com.analytics.resilience.config.CircuitBreakerConfig;
import com.analytics.resilience.error.AnalyticsException;
import com.analytics.resilience.model.CircuitState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;
import reactor.test.scheduler.VirtualTimeScheduler;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class CircuitBreakerTest {

    private VirtualTimeScheduler scheduler;
    private CircuitBreaker breaker;

    @BeforeEach
    void setUp() {
        scheduler = VirtualTimeScheduler.create();
        CircuitBreakerConfig config = CircuitBreakerConfig.builder()
            .failureThreshold(3)
            .successThreshold(2)
            .openTimeout(Duration.ofSeconds(10))
            .callTimeout(Duration.ofSeconds(5))
            .build();
        breaker = new CircuitBreaker("engagement", config, scheduler);
    }

    private void fail() {
        StepVerifier.create(breaker.execute(() -> Mono.error(new AnalyticsException.ServiceException("boom"))))
            .expectError(AnalyticsException.ServiceException.class)
            .verify();
    }

    private void succeed() {
        StepVerifier.create(breaker.execute(() -> Mono.just("ok")))
            .expectNext("ok")
            .verifyComplete();
    }

    @Test
    void testStartsClosed() {
        assertEquals(CircuitState.CLOSED, breaker.getState());
        assertTrue(breaker.isAvailable());
        assertTrue(breaker.isHealthy());
    }

    @Test
    void testOpensAfterConsecutiveFailures() {
        fail();
        fail();
        assertEquals(CircuitState.CLOSED, breaker.getState());

        fail();
        assertEquals(CircuitState.OPEN, breaker.getState());
        assertFalse(breaker.isAvailable());
    }

    @Test
    void testSuccessResetsFailureCount() {
        fail();
        fail();
        succeed();
        fail();
        fail();

        assertEquals(CircuitState.CLOSED, breaker.getState());
        assertEquals(2, breaker.getStats().failureCount());
    }

    @Test
    void testOpenCircuitRejectsWithoutInvokingOperation() {
        fail();
        fail();
        fail();

        AtomicInteger invocations = new AtomicInteger();
        StepVerifier.create(breaker.execute(() -> {
                invocations.incrementAndGet();
                return Mono.just("ok");
            }))
            .expectError(AnalyticsException.CircuitOpenException.class)
            .verify();

        assertEquals(0, invocations.get());
    }

    @Test
    void testRejectionCarriesRetryAfterHint() {
        fail();
        fail();
        fail();
        scheduler.advanceTimeBy(Duration.ofSeconds(4));

        StepVerifier.create(breaker.execute(() -> Mono.just("ok")))
            .expectErrorSatisfies(error -> {
                AnalyticsException analytics = (AnalyticsException) error;
                assertEquals("CIRCUIT_BREAKER_OPEN", analytics.getCode());
                assertEquals(6, analytics.getRetryAfterSeconds().getAsLong());
            })
            .verify();
    }

    @Test
    void testStaysOpenUntilTimeoutHasStrictlyElapsed() {
        fail();
        fail();
        fail();

        scheduler.advanceTimeBy(Duration.ofSeconds(10));
        StepVerifier.create(breaker.execute(() -> Mono.just("ok")))
            .expectError(AnalyticsException.CircuitOpenException.class)
            .verify();
        assertEquals(CircuitState.OPEN, breaker.getState());

        scheduler.advanceTimeBy(Duration.ofMillis(1));
        succeed();
        assertEquals(CircuitState.HALF_OPEN, breaker.getState());
    }

    @Test
    void testHalfOpenClosesAfterSuccessThreshold() {
        fail();
        fail();
        fail();
        scheduler.advanceTimeBy(Duration.ofSeconds(11));

        succeed();
        assertEquals(CircuitState.HALF_OPEN, breaker.getState());
        succeed();
        assertEquals(CircuitState.CLOSED, breaker.getState());
    }

    @Test
    void testHalfOpenReopensOnFailure() {
        fail();
        fail();
        fail();
        scheduler.advanceTimeBy(Duration.ofSeconds(11));

        succeed();
        fail();

        assertEquals(CircuitState.OPEN, breaker.getState());
    }

    @Test
    void testHalfOpenLimitsConcurrentProbes() {
        fail();
        fail();
        fail();
        scheduler.advanceTimeBy(Duration.ofSeconds(11));

        breaker.execute(() -> Mono.<String>never()).subscribe();
        breaker.execute(() -> Mono.<String>never()).subscribe();

        StepVerifier.create(breaker.execute(() -> Mono.just("ok")))
            .expectError(AnalyticsException.CircuitOpenException.class)
            .verify();
    }

    @Test
    void testCallTimeoutCountsAsFailure() {
        AtomicReference<Throwable> error = new AtomicReference<>();
        breaker.execute(() -> Mono.<String>never()).subscribe(value -> { }, error::set);

        scheduler.advanceTimeBy(Duration.ofSeconds(5));

        assertInstanceOf(AnalyticsException.RequestTimeoutException.class, error.get());
        assertEquals(1, breaker.getStats().failureCount());
    }

    @Test
    void testEmitsTransitionEvents() {
        List<CircuitBreakerEvent.Type> events = new ArrayList<>();
        breaker.addEventListener(CircuitBreakerEvent.Type.CIRCUIT_OPENED, event -> events.add(event.getType()));
        breaker.addEventListener(CircuitBreakerEvent.Type.STATE_CHANGE, event -> {
            events.add(event.getType());
            assertEquals(CircuitState.CLOSED, event.getPreviousState().orElseThrow());
        });

        fail();
        fail();
        fail();

        assertEquals(List.of(CircuitBreakerEvent.Type.CIRCUIT_OPENED, CircuitBreakerEvent.Type.STATE_CHANGE), events);
    }

    @Test
    void testResetClosesCircuit() {
        fail();
        fail();
        fail();

        breaker.reset();

        assertEquals(CircuitState.CLOSED, breaker.getState());
        assertEquals(0, breaker.getStats().failureCount());
        succeed();
    }

    @Test
    void testMetricsTrackErrorRate() {
        succeed();
        fail();

        CircuitBreakerMetrics metrics = breaker.getMetrics();
        assertEquals(0.5, metrics.errorRate(), 0.001);
        assertFalse(breaker.isHealthy());
    }
}

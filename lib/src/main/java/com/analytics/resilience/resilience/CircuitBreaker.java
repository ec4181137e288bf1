package com.analytics.resilience.resilience;

import com.analytics.resilience.config.CircuitBreakerConfig;
import com.analytics.resilience.error.AnalyticsException;
import com.analytics.resilience.model.CircuitState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

/**
 * Consecutive-failure circuit breaker guarding one named operation.
 * <p>
 * CLOSED opens after {@code failureThreshold} consecutive failures. OPEN rejects calls without
 * invoking them until more than {@code openTimeout} has passed since the last failure, then
 * moves to HALF_OPEN. HALF_OPEN admits at most {@code successThreshold} concurrent probes,
 * closes once that many have succeeded and reopens on any failure.
 * <p>
 * The breaker reads time from its {@link Scheduler}, which also runs the per-call timeout.
 */
public class CircuitBreaker {

    private static final Logger logger = LoggerFactory.getLogger(CircuitBreaker.class);
    private static final long REQUEST_RATE_WINDOW_MS = 60_000;

    private final String name;
    private final CircuitBreakerConfig config;
    private final Scheduler scheduler;
    private final ResponseTimeWindow responseTimes;
    private final Map<CircuitBreakerEvent.Type, List<CircuitBreakerEventListener>> listeners = new ConcurrentHashMap<>();

    // guarded by this
    private CircuitState state = CircuitState.CLOSED;
    private int failureCount;
    private int successCount;
    private int inFlightProbes;
    private long lastFailureTime;
    private long lastSuccessTime;
    private long lastStateChange;
    private long totalRequests;
    private long totalFailures;
    private long totalSuccesses;

    public CircuitBreaker(String name, CircuitBreakerConfig config, Scheduler scheduler) {
        this.name = name;
        this.config = config;
        this.scheduler = scheduler;
        this.responseTimes = new ResponseTimeWindow(config.getResponseTimeWindowSize());
        this.lastStateChange = now();
    }

    /**
     * Runs the operation under the breaker. The supplier is not invoked when the call is rejected.
     */
    public <T> Mono<T> execute(Supplier<Mono<T>> operation) {
        return Mono.defer(() -> {
            long start = now();
            Admission admission = admit(start);
            admission.transitions.forEach(this::emitTransition);
            if (admission.rejection != null) {
                emit(CircuitBreakerEvent.Type.REQUEST_FAILURE, null, admission.rejection, null);
                return Mono.error(admission.rejection);
            }

            AtomicBoolean settled = new AtomicBoolean();
            Mono<T> call;
            try {
                call = operation.get();
            } catch (RuntimeException e) {
                call = Mono.error(e);
            }
            long timeoutMs = config.getCallTimeout().toMillis();
            return call
                .timeout(config.getCallTimeout(), scheduler)
                .onErrorMap(TimeoutException.class, e -> new AnalyticsException.RequestTimeoutException(timeoutMs))
                .doOnSuccess(value -> {
                    if (settled.compareAndSet(false, true)) {
                        onSuccess(now() - start, admission.probe);
                    }
                })
                .doOnError(error -> {
                    if (settled.compareAndSet(false, true)) {
                        onFailure(error, now() - start, admission.probe);
                    }
                })
                .doOnCancel(() -> {
                    if (settled.compareAndSet(false, true) && admission.probe) {
                        releaseProbe();
                    }
                });
        });
    }

    private synchronized Admission admit(long now) {
        totalRequests++;
        List<CircuitState[]> transitions = new ArrayList<>();
        if (state == CircuitState.OPEN) {
            long sinceFailure = now - lastFailureTime;
            long openTimeoutMs = config.getOpenTimeout().toMillis();
            if (sinceFailure > openTimeoutMs) {
                transitions.add(transitionTo(CircuitState.HALF_OPEN, now));
            } else {
                return Admission.rejected(new AnalyticsException.CircuitOpenException(name, openTimeoutMs - sinceFailure),
                    transitions);
            }
        }
        if (state == CircuitState.HALF_OPEN) {
            if (successCount + inFlightProbes >= config.getSuccessThreshold()) {
                return Admission.rejected(new AnalyticsException.CircuitOpenException(name, 0), transitions);
            }
            inFlightProbes++;
            return new Admission(true, null, transitions);
        }
        return new Admission(false, null, transitions);
    }

    private void onSuccess(long responseTimeMs, boolean probe) {
        long now = now();
        CircuitState[] transition = null;
        synchronized (this) {
            if (probe && inFlightProbes > 0) {
                inFlightProbes--;
            }
            successCount++;
            totalSuccesses++;
            lastSuccessTime = now;
            failureCount = 0;
            responseTimes.record(now, responseTimeMs);
            if (state == CircuitState.HALF_OPEN && successCount >= config.getSuccessThreshold()) {
                transition = transitionTo(CircuitState.CLOSED, now);
            }
        }
        emit(CircuitBreakerEvent.Type.REQUEST_SUCCESS, null, null, responseTimeMs);
        if (transition != null) {
            emitTransition(transition);
        }
    }

    private void onFailure(Throwable error, long responseTimeMs, boolean probe) {
        long now = now();
        CircuitState[] transition = null;
        synchronized (this) {
            if (probe && inFlightProbes > 0) {
                inFlightProbes--;
            }
            failureCount++;
            totalFailures++;
            lastFailureTime = now;
            responseTimes.record(now, responseTimeMs);
            if (state == CircuitState.HALF_OPEN
                || (state == CircuitState.CLOSED && failureCount >= config.getFailureThreshold())) {
                transition = transitionTo(CircuitState.OPEN, now);
            }
        }
        logger.debug("Circuit breaker {} recorded failure ({}): {}", name, failureCount, error.getMessage());
        emit(CircuitBreakerEvent.Type.REQUEST_FAILURE, null, error, responseTimeMs);
        if (transition != null) {
            emitTransition(transition);
        }
    }

    private synchronized void releaseProbe() {
        if (inFlightProbes > 0) {
            inFlightProbes--;
        }
    }

    /**
     * Caller must hold the monitor. Returns {previous, next}.
     */
    private CircuitState[] transitionTo(CircuitState next, long now) {
        CircuitState previous = state;
        state = next;
        lastStateChange = now;
        successCount = 0;
        inFlightProbes = 0;
        if (next != CircuitState.OPEN) {
            failureCount = 0;
        }
        return new CircuitState[] {previous, next};
    }

    private void emitTransition(CircuitState[] transition) {
        CircuitState previous = transition[0];
        CircuitState next = transition[1];
        if (next == CircuitState.OPEN) {
            logger.warn("Circuit breaker {} opened (was {})", name, previous);
        } else {
            logger.info("Circuit breaker {} transitioned {} -> {}", name, previous, next);
        }
        CircuitBreakerEvent.Type type = switch (next) {
            case OPEN -> CircuitBreakerEvent.Type.CIRCUIT_OPENED;
            case CLOSED -> CircuitBreakerEvent.Type.CIRCUIT_CLOSED;
            case HALF_OPEN -> CircuitBreakerEvent.Type.CIRCUIT_HALF_OPENED;
        };
        emit(type, previous, null, null);
        emit(CircuitBreakerEvent.Type.STATE_CHANGE, previous, null, null);
    }

    private void emit(CircuitBreakerEvent.Type type, CircuitState previous, Throwable error, Long responseTimeMs) {
        List<CircuitBreakerEventListener> registered = listeners.get(type);
        if (registered == null || registered.isEmpty()) {
            return;
        }
        CircuitBreakerEvent event = new CircuitBreakerEvent(name, type, now(), getState(), previous, error,
            responseTimeMs, getStats());
        for (CircuitBreakerEventListener listener : registered) {
            try {
                listener.onEvent(event);
            } catch (Exception e) {
                logger.error("Circuit breaker {} listener failed on {}", name, type, e);
            }
        }
    }

    public void addEventListener(CircuitBreakerEvent.Type type, CircuitBreakerEventListener listener) {
        listeners.computeIfAbsent(type, t -> new CopyOnWriteArrayList<>()).add(listener);
    }

    /**
     * Registers the listener for every event type.
     */
    public void addEventListener(CircuitBreakerEventListener listener) {
        for (CircuitBreakerEvent.Type type : CircuitBreakerEvent.Type.values()) {
            addEventListener(type, listener);
        }
    }

    public void removeEventListener(CircuitBreakerEvent.Type type, CircuitBreakerEventListener listener) {
        List<CircuitBreakerEventListener> registered = listeners.get(type);
        if (registered != null) {
            registered.remove(listener);
        }
    }

    /**
     * Forces the breaker closed and clears its counters.
     */
    public void reset() {
        CircuitState[] transition;
        synchronized (this) {
            transition = transitionTo(CircuitState.CLOSED, now());
        }
        emitTransition(transition);
    }

    /**
     * Forces the breaker open; the open timeout counts from now.
     */
    public void open() {
        CircuitState[] transition;
        synchronized (this) {
            lastFailureTime = now();
            transition = transitionTo(CircuitState.OPEN, lastFailureTime);
        }
        emitTransition(transition);
    }

    public synchronized CircuitState getState() {
        return state;
    }

    public synchronized CircuitBreakerStats getStats() {
        return new CircuitBreakerStats(state, failureCount, successCount, lastFailureTime, lastSuccessTime,
            totalRequests, totalFailures, totalSuccesses, now() - lastStateChange, lastStateChange);
    }

    public CircuitBreakerMetrics getMetrics() {
        long requests;
        long failures;
        synchronized (this) {
            requests = totalRequests;
            failures = totalFailures;
        }
        long[] sorted = responseTimes.sortedDurations();
        double average = 0;
        if (sorted.length > 0) {
            long sum = 0;
            for (long duration : sorted) {
                sum += duration;
            }
            average = (double) sum / sorted.length;
        }
        double requestRate = responseTimes.countSince(now() - REQUEST_RATE_WINDOW_MS) / (REQUEST_RATE_WINDOW_MS / 1000.0);
        double errorRate = requests > 0 ? (double) failures / requests : 0;
        return new CircuitBreakerMetrics(requestRate, errorRate, average, percentile(sorted, 0.95),
            percentile(sorted, 0.99));
    }

    private static long percentile(long[] sorted, double percentile) {
        if (sorted.length == 0) {
            return 0;
        }
        int index = Math.min(sorted.length - 1, (int) Math.floor(sorted.length * percentile));
        return sorted[index];
    }

    /**
     * True unless the breaker is open.
     */
    public boolean isAvailable() {
        return getState() != CircuitState.OPEN;
    }

    public boolean isHealthy() {
        return getState() == CircuitState.CLOSED && getMetrics().errorRate() < 0.1;
    }

    public String getName() {
        return name;
    }

    public CircuitBreakerConfig getConfig() {
        return config;
    }

    public void destroy() {
        listeners.clear();
        responseTimes.clear();
    }

    private long now() {
        return scheduler.now(TimeUnit.MILLISECONDS);
    }

    private static final class Admission {
        final boolean probe;
        final AnalyticsException rejection;
        final List<CircuitState[]> transitions;

        Admission(boolean probe, AnalyticsException rejection, List<CircuitState[]> transitions) {
            this.probe = probe;
            this.rejection = rejection;
            this.transitions = transitions;
        }

        static Admission rejected(AnalyticsException rejection, List<CircuitState[]> transitions) {
            return new Admission(false, rejection, transitions);
        }
    }
}

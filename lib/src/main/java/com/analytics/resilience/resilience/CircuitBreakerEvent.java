package com.analytics.resilience.resilience;

import com.analytics.resilience.model.CircuitState;

import java.util.Optional;

/**
 * Event emitted by a {@link CircuitBreaker} to its listeners.
 */
public class CircuitBreakerEvent {

    public enum Type {
        STATE_CHANGE,
        REQUEST_SUCCESS,
        REQUEST_FAILURE,
        CIRCUIT_OPENED,
        CIRCUIT_CLOSED,
        CIRCUIT_HALF_OPENED
    }

    private final String circuitBreakerName;
    private final Type type;
    private final long timestamp;
    private final CircuitState state;
    private final CircuitState previousState;
    private final Throwable error;
    private final Long responseTimeMs;
    private final CircuitBreakerStats stats;

    CircuitBreakerEvent(String circuitBreakerName, Type type, long timestamp, CircuitState state,
                        CircuitState previousState, Throwable error, Long responseTimeMs,
                        CircuitBreakerStats stats) {
        this.circuitBreakerName = circuitBreakerName;
        this.type = type;
        this.timestamp = timestamp;
        this.state = state;
        this.previousState = previousState;
        this.error = error;
        this.responseTimeMs = responseTimeMs;
        this.stats = stats;
    }

    public String getCircuitBreakerName() {
        return circuitBreakerName;
    }

    public Type getType() {
        return type;
    }

    public long getTimestamp() {
        return timestamp;
    }

    public CircuitState getState() {
        return state;
    }

    public Optional<CircuitState> getPreviousState() {
        return Optional.ofNullable(previousState);
    }

    public Optional<Throwable> getError() {
        return Optional.ofNullable(error);
    }

    public Optional<Long> getResponseTimeMs() {
        return Optional.ofNullable(responseTimeMs);
    }

    public CircuitBreakerStats getStats() {
        return stats;
    }

    @Override
    public String toString() {
        return String.format("CircuitBreakerEvent{name='%s', type=%s, state=%s, previous=%s}",
            circuitBreakerName, type, state, previousState);
    }
}

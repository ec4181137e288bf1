package com.analytics.resilience.model;

/**
 * State of a circuit breaker guarding one named operation.
 */
public enum CircuitState {

    /**
     * Circuit is closed - calls flow through and failures are counted.
     */
    CLOSED,

    /**
     * Circuit is open - calls are rejected immediately until the open timeout elapses.
     */
    OPEN,

    /**
     * Circuit is half-open - a limited number of probing calls test whether the upstream recovered.
     */
    HALF_OPEN
}

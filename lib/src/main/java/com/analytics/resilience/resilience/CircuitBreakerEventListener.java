package com.analytics.resilience.resilience;

@FunctionalInterface
public interface CircuitBreakerEventListener {
    void onEvent(CircuitBreakerEvent event);
}

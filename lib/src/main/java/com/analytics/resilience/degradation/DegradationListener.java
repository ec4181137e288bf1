package com.analytics.resilience.degradation;

@FunctionalInterface
public interface DegradationListener {
    void onStateChange(DegradationState previous, DegradationState current);
}

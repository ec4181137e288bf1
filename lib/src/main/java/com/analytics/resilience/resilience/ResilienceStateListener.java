package com.analytics.resilience.resilience;

@FunctionalInterface
public interface ResilienceStateListener {

    void onStateChange(ResilienceState state);
}

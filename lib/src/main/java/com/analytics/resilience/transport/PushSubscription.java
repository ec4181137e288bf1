package com.analytics.resilience.transport;

/**
 * An open one-way push stream.
 */
public interface PushSubscription {

    void close();

    boolean isActive();
}

package com.analytics.resilience.model;

/**
 * Lifecycle state of the live channel.
 */
public enum ConnectionState {
    DISCONNECTED,
    CONNECTING,
    CONNECTED,
    RECONNECTING,
    ERROR
}

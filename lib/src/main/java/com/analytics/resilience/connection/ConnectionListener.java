package com.analytics.resilience.connection;

import com.analytics.resilience.model.ChannelMessage;
import com.analytics.resilience.model.ConnectionState;

/**
 * Receives connection lifecycle notifications. All methods default to no-ops.
 */
public interface ConnectionListener {

    default void onStateChange(ConnectionState previous, ConnectionState current) {
    }

    default void onConnect() {
    }

    default void onDisconnect(int code, String reason) {
    }

    default void onHealthChange(boolean healthy) {
    }

    /**
     * Reconnection attempts are exhausted; the manager stays disconnected until told to connect again.
     */
    default void onReconnectionExhausted(int attempts) {
    }

    default void onError(Throwable error) {
    }

    default void onMessage(ChannelMessage message) {
    }
}

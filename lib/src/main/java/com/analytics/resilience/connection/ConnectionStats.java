package com.analytics.resilience.connection;

import com.analytics.resilience.model.ConnectionQuality;
import com.analytics.resilience.model.ConnectionState;

/**
 * Counters for the live channel since the manager was created. Times are epoch milliseconds,
 * {@code 0} when the event has not happened yet.
 */
public record ConnectionStats(
    ConnectionState state,
    long totalConnections,
    long successfulConnections,
    long failedConnections,
    long reconnectionAttempts,
    long messagesReceived,
    long messagesSent,
    int queuedMessages,
    long droppedMessages,
    double averageLatency,
    ConnectionQuality quality,
    boolean healthy,
    long lastConnectedAt,
    long lastDisconnectedAt,
    long uptimeMs,
    long currentConnectionDurationMs
) {
}

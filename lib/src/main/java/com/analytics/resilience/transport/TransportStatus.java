package com.analytics.resilience.transport;

import com.analytics.resilience.connection.ConnectionStats;
import com.analytics.resilience.model.TransportMode;

import java.util.List;

/**
 * Point-in-time view of every transport behind the cascade.
 */
public record TransportStatus(
    TransportMode mode,
    boolean liveConnected,
    ConnectionStats liveStats,
    PushChannelStatus push,
    PollingStatus polling,
    int cacheSize,
    List<ModeTransition> history
) {
}

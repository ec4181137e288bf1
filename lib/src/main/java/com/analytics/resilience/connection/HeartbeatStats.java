package com.analytics.resilience.connection;

import com.analytics.resilience.model.ConnectionQuality;

import java.util.List;

/**
 * Snapshot of heartbeat health. Latencies are in milliseconds.
 */
public record HeartbeatStats(
    boolean healthy,
    int missedHeartbeats,
    int maxMissedHeartbeats,
    long lastPingTime,
    long lastPongTime,
    double averageLatency,
    long minLatency,
    long maxLatency,
    ConnectionQuality quality,
    List<Long> latencyHistory
) {
}

package com.analytics.resilience.model;

/**
 * Transport currently used to receive push updates, ordered from full to no fidelity.
 */
public enum TransportMode {

    /**
     * Persistent bidirectional channel with heartbeat.
     */
    LIVE_CHANNEL,

    /**
     * One-way server push stream keyed by event type.
     */
    PUSH_ONLY,

    /**
     * Periodic pull of a fixed set of sources.
     */
    POLLING,

    /**
     * No transport active; callers rely on cache only.
     */
    OFFLINE;

    public boolean isRealtime() {
        return this == LIVE_CHANNEL;
    }
}

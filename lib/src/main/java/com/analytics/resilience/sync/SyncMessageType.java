package com.analytics.resilience.sync;

public enum SyncMessageType {
    FILTER_CHANGE,
    TIME_RANGE_CHANGE,
    INVALIDATE_CACHE,
    OPTIMISTIC_UPDATE,
    INSTANCE_CONNECTED,
    INSTANCE_DISCONNECTED
}

package com.analytics.resilience.model;

/**
 * Priority of a batched request. Declaration order is flush order.
 */
public enum RequestPriority {
    HIGH,
    NORMAL,
    LOW
}

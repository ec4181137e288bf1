package com.analytics.resilience.transport;

public record PushChannelStatus(boolean connected, int reconnectAttempts, long eventsReceived) {
}

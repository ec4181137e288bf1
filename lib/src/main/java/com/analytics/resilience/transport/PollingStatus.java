package com.analytics.resilience.transport;

public record PollingStatus(boolean active, long intervalMs, int errorCount, long cyclesCompleted) {
}

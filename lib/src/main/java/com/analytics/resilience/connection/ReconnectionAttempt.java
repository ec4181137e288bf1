package com.analytics.resilience.connection;

import java.time.Instant;

public record ReconnectionAttempt(int attempt, Instant timestamp, boolean success) {
}

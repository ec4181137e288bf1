package com.analytics.resilience.transport;

import com.analytics.resilience.model.TransportMode;

import java.time.Instant;

public record ModeTransition(TransportMode mode, Instant timestamp, String reason) {
}

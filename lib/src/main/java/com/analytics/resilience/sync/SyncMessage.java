package com.analytics.resilience.sync;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * Message exchanged between client instances sharing a {@link BroadcastChannel}.
 */
public record SyncMessage(SyncMessageType type, Map<String, Object> payload, Instant timestamp, String senderId) {

    public SyncMessage {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(senderId, "senderId");
        payload = payload != null ? Map.copyOf(payload) : Map.of();
    }
}

package com.analytics.resilience.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Message exchanged over the live channel or received from a push stream.
 * Well-known types are {@code ping}, {@code pong}, {@code subscribe}, {@code unsubscribe},
 * {@code metrics}, {@code alert} and {@code system}.
 */
public class ChannelMessage {

    public static final String PING = "ping";
    public static final String PONG = "pong";
    public static final String SUBSCRIBE = "subscribe";
    public static final String UNSUBSCRIBE = "unsubscribe";
    public static final String METRICS = "metrics";
    public static final String ALERT = "alert";
    public static final String SYSTEM = "system";

    private final String type;
    private final String cacheKey;
    private final Map<String, Object> data;
    private final long timestamp;
    private final String correlationId;

    private ChannelMessage(Builder builder) {
        this.type = Objects.requireNonNull(builder.type, "type");
        this.cacheKey = builder.cacheKey;
        this.data = Collections.unmodifiableMap(new LinkedHashMap<>(builder.data));
        this.timestamp = builder.timestamp;
        this.correlationId = builder.correlationId != null ? builder.correlationId : UUID.randomUUID().toString();
    }

    public String getType() {
        return type;
    }

    /**
     * Cache key the payload belongs to, or {@code null} for control messages.
     */
    public String getCacheKey() {
        return cacheKey;
    }

    public Map<String, Object> getData() {
        return data;
    }

    public long getTimestamp() {
        return timestamp;
    }

    public String getCorrelationId() {
        return correlationId;
    }

    public boolean isType(String candidate) {
        return type.equals(candidate);
    }

    public static ChannelMessage ping(long timestamp) {
        return builder().type(PING).timestamp(timestamp).data("timestamp", timestamp).build();
    }

    public static ChannelMessage pong(long timestamp) {
        return builder().type(PONG).timestamp(timestamp).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String type;
        private String cacheKey;
        private final Map<String, Object> data = new LinkedHashMap<>();
        private long timestamp = System.currentTimeMillis();
        private String correlationId;

        public Builder type(String type) {
            this.type = type;
            return this;
        }

        public Builder cacheKey(String cacheKey) {
            this.cacheKey = cacheKey;
            return this;
        }

        public Builder data(String key, Object value) {
            this.data.put(key, value);
            return this;
        }

        public Builder data(Map<String, ?> values) {
            this.data.putAll(values);
            return this;
        }

        public Builder timestamp(long timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public Builder correlationId(String correlationId) {
            this.correlationId = correlationId;
            return this;
        }

        public ChannelMessage build() {
            return new ChannelMessage(this);
        }
    }

    @Override
    public String toString() {
        return String.format("ChannelMessage{type='%s', cacheKey='%s', timestamp=%d, correlationId='%s'}",
            type, cacheKey, timestamp, correlationId);
    }
}

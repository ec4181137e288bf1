package com.analytics.resilience.sync;

import com.analytics.resilience.cache.AnalyticsCache;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.scheduler.Scheduler;

import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;

/**
 * Keeps the caches of several client instances coherent: filter and time range changes, explicit
 * invalidations and optimistic writes made by one instance are replayed by the others.
 */
public class CrossInstanceSync {

    private static final Logger logger = LoggerFactory.getLogger(CrossInstanceSync.class);

    static final List<String> FILTER_SENSITIVE_PATTERNS = List.of("engagement", "progress", "content");
    static final List<String> TIME_SENSITIVE_PATTERNS = List.of("historical", "reports");

    private final String instanceId;
    private final BroadcastChannel channel;
    private final AnalyticsCache cache;
    private final Scheduler scheduler;
    private final Set<String> peers = ConcurrentHashMap.newKeySet();

    private volatile Disposable subscription;

    public CrossInstanceSync(String instanceId, BroadcastChannel channel, AnalyticsCache cache, Scheduler scheduler) {
        this.instanceId = instanceId;
        this.channel = channel;
        this.cache = cache;
        this.scheduler = scheduler;
    }

    /**
     * Starts listening and announces this instance.
     */
    public synchronized void start() {
        if (subscription != null) {
            return;
        }
        subscription = channel.listen(this::handle);
        broadcast(SyncMessageType.INSTANCE_CONNECTED, Map.of("instanceId", instanceId));
        logger.info("Cross-instance sync started for {}", instanceId);
    }

    public synchronized void stop() {
        if (subscription == null) {
            return;
        }
        broadcast(SyncMessageType.INSTANCE_DISCONNECTED, Map.of("instanceId", instanceId));
        subscription.dispose();
        subscription = null;
        peers.clear();
    }

    public void broadcastFilterChange(Map<String, Object> filters) {
        broadcast(SyncMessageType.FILTER_CHANGE, filters);
    }

    public void broadcastTimeRangeChange(Map<String, Object> timeRange) {
        broadcast(SyncMessageType.TIME_RANGE_CHANGE, timeRange);
    }

    /**
     * Asks peers to invalidate keys containing {@code pattern}; {@code null} invalidates everything.
     */
    public void broadcastCacheInvalidation(String pattern) {
        Map<String, Object> payload = new HashMap<>();
        if (pattern != null) {
            payload.put("pattern", pattern);
        }
        broadcast(SyncMessageType.INVALIDATE_CACHE, payload);
    }

    public void broadcastOptimisticUpdate(String cacheKey, Object value) {
        broadcast(SyncMessageType.OPTIMISTIC_UPDATE, Map.of("cacheKey", cacheKey, "value", value));
    }

    public Set<String> getConnectedInstances() {
        return Set.copyOf(peers);
    }

    public String getInstanceId() {
        return instanceId;
    }

    public boolean isRunning() {
        return subscription != null;
    }

    void handle(SyncMessage message) {
        if (instanceId.equals(message.senderId())) {
            return;
        }
        logger.debug("Received {} from {}", message.type(), message.senderId());
        switch (message.type()) {
            case FILTER_CHANGE -> FILTER_SENSITIVE_PATTERNS.forEach(cache::invalidateByPattern);
            case TIME_RANGE_CHANGE -> TIME_SENSITIVE_PATTERNS.forEach(cache::invalidateByPattern);
            case INVALIDATE_CACHE -> {
                Object pattern = message.payload().get("pattern");
                cache.invalidateByPattern(pattern != null ? pattern.toString() : "");
            }
            case OPTIMISTIC_UPDATE -> {
                Object key = message.payload().get("cacheKey");
                if (key == null) {
                    logger.warn("Ignoring optimistic update without a cache key from {}", message.senderId());
                } else {
                    cache.set(key.toString(), message.payload().get("value"));
                }
            }
            case INSTANCE_CONNECTED -> peers.add(message.senderId());
            case INSTANCE_DISCONNECTED -> peers.remove(message.senderId());
        }
    }

    private void broadcast(SyncMessageType type, Map<String, Object> payload) {
        channel.post(new SyncMessage(type, payload, Instant.ofEpochMilli(scheduler.now(TimeUnit.MILLISECONDS)),
            instanceId));
    }
}

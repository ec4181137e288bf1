package com.analytics.resilience.transport;

import com.analytics.resilience.cache.AnalyticsCache;
import com.analytics.resilience.config.TransportConfig;
import com.analytics.resilience.connection.ConnectionListener;
import com.analytics.resilience.connection.ConnectionManager;
import com.analytics.resilience.connection.LiveChannel;
import com.analytics.resilience.model.ChannelMessage;
import com.analytics.resilience.model.ConnectionState;
import com.analytics.resilience.model.TransportMode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Keeps exactly one push transport active, falling back from the live channel to the push-only
 * stream, then to polling, then to offline, and jumping straight back to the live channel as soon
 * as it reconnects.
 * <p>
 * Whatever transport is active, updates carrying a cache key are written to the shared cache.
 */
public class TransportFallbackCascade {

    private static final Logger logger = LoggerFactory.getLogger(TransportFallbackCascade.class);

    private final TransportConfig config;
    private final ConnectionManager live;
    private final PushChannelManager push;
    private final PollingManager polling;
    private final AnalyticsCache cache;
    private final Scheduler scheduler;
    private final List<TransportListener> listeners = new CopyOnWriteArrayList<>();
    private final List<Disposable> pushHandlers = new CopyOnWriteArrayList<>();
    private final Deque<ModeTransition> history = new ArrayDeque<>();
    private final AtomicBoolean pushConnecting = new AtomicBoolean();

    private volatile TransportMode mode = TransportMode.LIVE_CHANNEL;
    private volatile Disposable liveRetry;
    private volatile boolean destroyed;

    public TransportFallbackCascade(TransportConfig config, ConnectionManager live, PushChannelManager push,
                                    PollingManager polling, AnalyticsCache cache, Scheduler scheduler) {
        this.config = config;
        this.live = live;
        this.push = push;
        this.polling = polling;
        this.cache = cache;
        this.scheduler = scheduler;

        live.addListener(new LiveChannelWatcher());
        push.addListener(new PushChannelManager.Listener() {
            @Override
            public void onReconnectionExhausted() {
                if (mode == TransportMode.PUSH_ONLY) {
                    degradeToPolling("Push channel reconnection exhausted");
                }
            }
        });
        for (String eventType : config.getPushEventTypes()) {
            pushHandlers.add(push.subscribe(eventType, this::storeUpdate));
        }
        polling.onGiveUp(() -> {
            if (mode == TransportMode.POLLING) {
                goOffline("Polling failed repeatedly");
            }
        });
    }

    /**
     * Connects the live channel, degrading to the push-only stream if that fails. Never errors.
     */
    public Mono<Void> start() {
        return live.connect()
            .then(Mono.fromRunnable(() -> setMode(TransportMode.LIVE_CHANNEL, "Initial connection")))
            .onErrorResume(e -> degradeToPush("Live channel initial connection failed"))
            .then();
    }

    /**
     * Switches transports on request. Forcing the live channel also reconnects it when needed.
     * Forcing a degraded mode closes the live channel and leaves it to the periodic live probe;
     * forcing offline stops the probe as well.
     */
    public void forceMode(TransportMode target) {
        logger.info("Forcing transport mode {}", target);
        switch (target) {
            case LIVE_CHANNEL -> {
                upgradeToLive("Forced mode change");
                if (!live.isConnected()) {
                    live.connect().subscribe(v -> { }, e -> logger.warn("Forced live reconnect failed: {}",
                        e.getMessage()));
                }
            }
            case PUSH_ONLY -> {
                live.disconnect();
                polling.stop();
                connectPush("Forced mode change").subscribe();
            }
            case POLLING -> {
                live.disconnect();
                switchToPolling("Forced mode change");
            }
            case OFFLINE -> {
                cancelLiveRetry();
                live.disconnect();
                push.disconnect();
                polling.stop();
                setMode(TransportMode.OFFLINE, "Forced offline mode");
            }
        }
    }

    public TransportMode getMode() {
        return mode;
    }

    public synchronized List<ModeTransition> getHistory() {
        return List.copyOf(history);
    }

    public TransportStatus getStatus() {
        return new TransportStatus(mode, live.isConnected(), live.getStats(), push.getStatus(), polling.getStatus(),
            cache.size(), getHistory());
    }

    public void addListener(TransportListener listener) {
        listeners.add(listener);
    }

    public void removeListener(TransportListener listener) {
        listeners.remove(listener);
    }

    public void destroy() {
        destroyed = true;
        cancelLiveRetry();
        pushHandlers.forEach(Disposable::dispose);
        live.destroy();
        push.disconnect();
        polling.stop();
        listeners.clear();
        synchronized (this) {
            history.clear();
        }
    }

    private Mono<Void> degradeToPush(String reason) {
        if (destroyed || mode.compareTo(TransportMode.PUSH_ONLY) >= 0) {
            return Mono.empty();
        }
        return connectPush(reason);
    }

    private Mono<Void> connectPush(String reason) {
        if (!pushConnecting.compareAndSet(false, true)) {
            return Mono.empty();
        }
        return push.connect()
            .then(Mono.fromRunnable(() -> {
                setMode(TransportMode.PUSH_ONLY, reason);
                scheduleLiveRetry();
            }))
            .onErrorResume(e -> {
                switchToPolling("Push channel connection failed");
                return Mono.empty();
            })
            .doFinally(signal -> pushConnecting.set(false))
            .then();
    }

    private void degradeToPolling(String reason) {
        if (destroyed || mode.compareTo(TransportMode.POLLING) >= 0) {
            return;
        }
        switchToPolling(reason);
    }

    private void switchToPolling(String reason) {
        push.disconnect();
        polling.start();
        setMode(TransportMode.POLLING, reason);
        scheduleLiveRetry();
    }

    private void goOffline(String reason) {
        push.disconnect();
        polling.stop();
        setMode(TransportMode.OFFLINE, reason);
        scheduleLiveRetry();
    }

    private void upgradeToLive(String reason) {
        if (destroyed) {
            return;
        }
        cancelLiveRetry();
        push.disconnect();
        polling.stop();
        setMode(TransportMode.LIVE_CHANNEL, reason);
    }

    /**
     * Re-probes the live channel while degraded, but only once its own reconnection loop has given up.
     */
    private synchronized void scheduleLiveRetry() {
        if (liveRetry != null || destroyed) {
            return;
        }
        long intervalMs = config.getLiveRetryInterval().toMillis();
        liveRetry = scheduler.schedulePeriodically(() -> {
            ConnectionState state = live.getState();
            if (mode != TransportMode.LIVE_CHANNEL
                && (state == ConnectionState.DISCONNECTED || state == ConnectionState.ERROR)) {
                logger.debug("Probing live channel from {} mode", mode);
                live.connect().subscribe(v -> { }, e -> logger.debug("Live channel probe failed: {}", e.getMessage()));
            }
        }, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
    }

    private synchronized void cancelLiveRetry() {
        if (liveRetry != null) {
            liveRetry.dispose();
            liveRetry = null;
        }
    }

    private void setMode(TransportMode next, String reason) {
        TransportMode previous;
        synchronized (this) {
            previous = mode;
            if (previous == next) {
                return;
            }
            mode = next;
            history.addLast(new ModeTransition(next, Instant.ofEpochMilli(scheduler.now(TimeUnit.MILLISECONDS)),
                reason));
            while (history.size() > config.getMaxModeHistory()) {
                history.removeFirst();
            }
        }
        logger.info("Transport mode changed: {} -> {} ({})", previous, next, reason);
        for (TransportListener listener : listeners) {
            try {
                listener.onModeChange(previous, next, reason);
            } catch (RuntimeException e) {
                logger.warn("Transport listener failed", e);
            }
        }
    }

    private void storeUpdate(ChannelMessage message) {
        if (message.getCacheKey() != null) {
            cache.set(message.getCacheKey(), message.getData());
        }
    }

    private final class LiveChannelWatcher implements ConnectionListener {

        @Override
        public void onConnect() {
            if (mode != TransportMode.LIVE_CHANNEL) {
                upgradeToLive("Live channel connection restored");
            }
        }

        @Override
        public void onDisconnect(int code, String reason) {
            if (code != LiveChannel.NORMAL_CLOSURE) {
                degradeToPush("Live channel connection lost").subscribe();
            }
        }

        @Override
        public void onError(Throwable error) {
            degradeToPush("Live channel error").subscribe();
        }

        @Override
        public void onHealthChange(boolean healthy) {
            if (!healthy) {
                degradeToPush("Live channel heartbeat lost").subscribe();
            } else if (mode != TransportMode.LIVE_CHANNEL && live.isConnected()) {
                upgradeToLive("Live channel heartbeat restored");
            }
        }

        @Override
        public void onMessage(ChannelMessage message) {
            storeUpdate(message);
        }
    }
}

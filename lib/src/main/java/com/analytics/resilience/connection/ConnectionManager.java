package com.analytics.resilience.connection;

import com.analytics.resilience.config.ConnectionConfig;
import com.analytics.resilience.connection.ConnectionException.ConnectionClosedException;
import com.analytics.resilience.connection.ConnectionException.ConnectionFailedException;
import com.analytics.resilience.connection.ConnectionException.ConnectionTimeoutException;
import com.analytics.resilience.model.ChannelMessage;
import com.analytics.resilience.model.ConnectionQuality;
import com.analytics.resilience.model.ConnectionState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;

/**
 * Owns the live channel: connecting, heartbeats, automatic reconnection with backoff,
 * buffering of outbound messages while offline and topic subscriptions.
 * <p>
 * A close with any code other than {@value LiveChannel#NORMAL_CLOSURE} that was not requested
 * through {@link #disconnect()} starts the reconnection cycle. Once the configured number of
 * attempts is used up the manager stays {@link ConnectionState#DISCONNECTED} and notifies
 * {@link ConnectionListener#onReconnectionExhausted(int)}.
 */
public class ConnectionManager {

    private static final Logger logger = LoggerFactory.getLogger(ConnectionManager.class);
    private static final String CLIENT_DISCONNECT = "Client disconnect";

    private final ConnectionConfig config;
    private final LiveChannelConnector connector;
    private final AuthTokenProvider tokenProvider;
    private final Scheduler scheduler;
    private final ReconnectionBackoff backoff;
    private final HeartbeatMonitor heartbeat;
    private final OutboundMessageQueue outbound;
    private final List<ConnectionListener> listeners = new CopyOnWriteArrayList<>();
    private final Map<String, List<Consumer<ChannelMessage>>> subscriptions = new LinkedHashMap<>();

    private final AtomicReference<ConnectionState> state = new AtomicReference<>(ConnectionState.DISCONNECTED);
    private final AtomicLong generation = new AtomicLong();
    private final AtomicLong totalConnections = new AtomicLong();
    private final AtomicLong successfulConnections = new AtomicLong();
    private final AtomicLong failedConnections = new AtomicLong();
    private final AtomicLong reconnectionAttempts = new AtomicLong();
    private final AtomicLong messagesReceived = new AtomicLong();
    private final AtomicLong messagesSent = new AtomicLong();

    private volatile LiveChannel channel;
    private volatile Disposable reconnectTimer;
    private volatile boolean explicitlyDisconnected;
    private volatile boolean destroyed;
    private volatile long lastConnectedAt;
    private volatile long lastDisconnectedAt;
    private volatile long connectionStartedAt;
    private volatile long uptimeMs;

    public ConnectionManager(ConnectionConfig config, LiveChannelConnector connector,
                             AuthTokenProvider tokenProvider, Scheduler scheduler) {
        this.config = config;
        this.connector = connector;
        this.tokenProvider = tokenProvider != null ? tokenProvider : AuthTokenProvider.anonymous();
        this.scheduler = scheduler;
        this.backoff = new ReconnectionBackoff(config);
        this.heartbeat = new HeartbeatMonitor(config.getHeartbeatInterval(), config.getPongTimeout(),
            config.getMaxMissedHeartbeats(), scheduler);
        this.outbound = new OutboundMessageQueue(config.getMaxQueuedMessages(),
            config.getQueuedMessageTimeout().toMillis());
        this.heartbeat.onHealthChange(this::notifyHealthChange);
    }

    /**
     * Opens the live channel. Completes once the channel is open; a no-op while already connected
     * or connecting.
     */
    public Mono<Void> connect() {
        return Mono.defer(() -> {
            if (destroyed) {
                return Mono.error(new ConnectionClosedException(config.getUrl()));
            }
            ConnectionState current = state.get();
            if (current == ConnectionState.CONNECTED || current == ConnectionState.CONNECTING) {
                return Mono.empty();
            }
            explicitlyDisconnected = false;
            cancelReconnect();
            return openChannel(false);
        });
    }

    /**
     * Closes the channel normally and cancels heartbeat and reconnection timers.
     */
    public void disconnect() {
        explicitlyDisconnected = true;
        generation.incrementAndGet();
        cancelReconnect();
        heartbeat.stop();
        LiveChannel current = channel;
        channel = null;
        if (current != null) {
            try {
                current.close(LiveChannel.NORMAL_CLOSURE, CLIENT_DISCONNECT);
            } catch (RuntimeException e) {
                logger.warn("Error closing live channel: {}", e.getMessage());
            }
            recordDisconnect();
            listeners.forEach(l -> safely(() -> l.onDisconnect(LiveChannel.NORMAL_CLOSURE, CLIENT_DISCONNECT)));
        }
        setState(ConnectionState.DISCONNECTED);
        logger.info("Disconnected from {}", config.getUrl());
    }

    /**
     * Disconnects and releases listeners, subscriptions and queued messages. The manager cannot be
     * reconnected afterwards.
     */
    public void destroy() {
        disconnect();
        destroyed = true;
        listeners.clear();
        synchronized (subscriptions) {
            subscriptions.clear();
        }
        outbound.clear();
    }

    /**
     * Sends immediately when connected, otherwise buffers the message until the next successful
     * connection.
     */
    public void send(ChannelMessage message) {
        if (!trySend(message)) {
            outbound.offer(message, now());
            logger.debug("Queued {} message ({} queued)", message.getType(), outbound.size());
        }
    }

    /**
     * Registers a handler for one message type and asks the server to publish that type.
     * Disposing the returned handle removes the handler; the last removal unsubscribes on the server.
     */
    public Disposable subscribe(String messageType, Consumer<ChannelMessage> handler) {
        synchronized (subscriptions) {
            subscriptions.computeIfAbsent(messageType, t -> new CopyOnWriteArrayList<>()).add(handler);
        }
        sendSubscription(ChannelMessage.SUBSCRIBE, messageType);
        logger.debug("Subscribed to {}", messageType);
        return new Disposable() {
            private volatile boolean disposed;

            @Override
            public void dispose() {
                if (!disposed) {
                    disposed = true;
                    unsubscribe(messageType, handler);
                }
            }

            @Override
            public boolean isDisposed() {
                return disposed;
            }
        };
    }

    public void addListener(ConnectionListener listener) {
        listeners.add(listener);
    }

    public void removeListener(ConnectionListener listener) {
        listeners.remove(listener);
    }

    public ConnectionState getState() {
        return state.get();
    }

    public boolean isConnected() {
        return state.get() == ConnectionState.CONNECTED;
    }

    /**
     * Connected and answering heartbeats.
     */
    public boolean isHealthy() {
        return isConnected() && heartbeat.isHealthy();
    }

    public HeartbeatStats getHeartbeatStats() {
        return heartbeat.getStats();
    }

    public List<ReconnectionAttempt> getReconnectionHistory() {
        return backoff.getHistory();
    }

    public List<String> getActiveSubscriptions() {
        synchronized (subscriptions) {
            return new ArrayList<>(subscriptions.keySet());
        }
    }

    public ConnectionStats getStats() {
        long now = now();
        long started = connectionStartedAt;
        long current = started > 0 ? now - started : 0;
        HeartbeatStats hb = heartbeat.getStats();
        return new ConnectionStats(state.get(), totalConnections.get(), successfulConnections.get(),
            failedConnections.get(), reconnectionAttempts.get(), messagesReceived.get(), messagesSent.get(),
            outbound.size(), outbound.getDropped(), hb.averageLatency(), ConnectionQuality.fromLatency(hb.averageLatency()),
            isHealthy(), lastConnectedAt, lastDisconnectedAt, uptimeMs + current, current);
    }

    public ConnectionConfig getConfig() {
        return config;
    }

    private Mono<Void> openChannel(boolean reconnect) {
        long attempt = generation.incrementAndGet();
        totalConnections.incrementAndGet();
        setState(ConnectionState.CONNECTING);
        String url = config.getUrl();
        long timeoutMs = config.getConnectionTimeout().toMillis();
        ChannelCallbacks callbacks = new ChannelCallbacks(attempt);
        logger.debug("Opening live channel to {} (reconnect={})", url, reconnect);

        return tokenProvider.getToken()
            .map(Optional::of)
            .defaultIfEmpty(Optional.empty())
            .flatMap(token -> connector.open(url, token.orElse(null), callbacks))
            .switchIfEmpty(Mono.error(() -> new IllegalStateException("Connector completed without a channel")))
            .timeout(Duration.ofMillis(timeoutMs), scheduler)
            .onErrorMap(TimeoutException.class, e -> new ConnectionTimeoutException(url, timeoutMs))
            .onErrorMap(e -> !(e instanceof ConnectionException), e -> new ConnectionFailedException(url, e))
            .doOnNext(opened -> onOpened(attempt, opened, reconnect))
            .doOnError(e -> onConnectFailed(attempt, e, reconnect))
            .then();
    }

    private void onOpened(long attempt, LiveChannel opened, boolean reconnect) {
        if (attempt != generation.get() || destroyed) {
            logger.debug("Discarding superseded live channel");
            opened.close(LiveChannel.NORMAL_CLOSURE, CLIENT_DISCONNECT);
            return;
        }
        long now = now();
        channel = opened;
        successfulConnections.incrementAndGet();
        lastConnectedAt = now;
        connectionStartedAt = now;
        if (reconnect) {
            backoff.recordAttempt(true, Instant.ofEpochMilli(now));
        }
        backoff.reset();
        setState(ConnectionState.CONNECTED);
        logger.info("Live channel connected to {}", config.getUrl());

        heartbeat.reset();
        heartbeat.start(() -> trySend(ChannelMessage.ping(now())));
        flushQueue();
        listeners.forEach(l -> safely(l::onConnect));
    }

    private void onConnectFailed(long attempt, Throwable error, boolean reconnect) {
        if (attempt != generation.get()) {
            return;
        }
        failedConnections.incrementAndGet();
        setState(ConnectionState.ERROR);
        logger.warn("Live channel connection failed: {}", error.getMessage());
        listeners.forEach(l -> safely(() -> l.onError(error)));
        if (reconnect) {
            backoff.recordAttempt(false, Instant.ofEpochMilli(now()));
            if (!explicitlyDisconnected && !destroyed) {
                scheduleReconnect();
            }
        }
    }

    private void onClosed(int code, String reason) {
        heartbeat.stop();
        channel = null;
        recordDisconnect();
        logger.info("Live channel closed: {} {}", code, reason);
        listeners.forEach(l -> safely(() -> l.onDisconnect(code, reason)));
        if (code != LiveChannel.NORMAL_CLOSURE && !explicitlyDisconnected && !destroyed) {
            scheduleReconnect();
        } else {
            setState(ConnectionState.DISCONNECTED);
        }
    }

    private void onInbound(ChannelMessage message) {
        messagesReceived.incrementAndGet();
        if (message.isType(ChannelMessage.PONG)) {
            heartbeat.handlePong();
        } else if (message.isType(ChannelMessage.PING)) {
            trySend(ChannelMessage.pong(now()));
        }
        List<Consumer<ChannelMessage>> handlers;
        synchronized (subscriptions) {
            handlers = subscriptions.get(message.getType());
        }
        if (handlers != null) {
            for (Consumer<ChannelMessage> handler : handlers) {
                safely(() -> handler.accept(message));
            }
        }
        listeners.forEach(l -> safely(() -> l.onMessage(message)));
    }

    private void scheduleReconnect() {
        if (!backoff.canReconnect()) {
            int attempts = backoff.getAttempts();
            setState(ConnectionState.DISCONNECTED);
            logger.error("Maximum reconnection attempts ({}) reached for {}", attempts, config.getUrl());
            listeners.forEach(l -> safely(() -> l.onReconnectionExhausted(attempts)));
            return;
        }
        long delay = backoff.nextDelay();
        reconnectionAttempts.incrementAndGet();
        setState(ConnectionState.RECONNECTING);
        logger.info("Reconnecting to {} in {}ms (attempt {}/{})", config.getUrl(), delay, backoff.getAttempts(),
            backoff.getMaxAttempts());
        reconnectTimer = scheduler.schedule(
            () -> openChannel(true).subscribe(v -> { }, e -> logger.debug("Reconnection attempt failed: {}",
                e.getMessage())),
            delay, TimeUnit.MILLISECONDS);
    }

    private void cancelReconnect() {
        Disposable timer = reconnectTimer;
        reconnectTimer = null;
        if (timer != null) {
            timer.dispose();
        }
    }

    private boolean trySend(ChannelMessage message) {
        LiveChannel current = channel;
        if (state.get() != ConnectionState.CONNECTED || current == null || !current.isOpen()) {
            return false;
        }
        try {
            current.send(message);
            messagesSent.incrementAndGet();
            return true;
        } catch (RuntimeException e) {
            logger.warn("Failed to send {} message: {}", message.getType(), e.getMessage());
            return false;
        }
    }

    private void flushQueue() {
        int flushed = outbound.flush(now(), this::trySend);
        if (flushed > 0) {
            logger.debug("Flushed {} queued messages ({} still queued)", flushed, outbound.size());
        }
    }

    private void unsubscribe(String messageType, Consumer<ChannelMessage> handler) {
        boolean last = false;
        synchronized (subscriptions) {
            List<Consumer<ChannelMessage>> handlers = subscriptions.get(messageType);
            if (handlers != null) {
                handlers.remove(handler);
                if (handlers.isEmpty()) {
                    subscriptions.remove(messageType);
                    last = true;
                }
            }
        }
        if (last) {
            sendSubscription(ChannelMessage.UNSUBSCRIBE, messageType);
        }
        logger.debug("Unsubscribed from {}", messageType);
    }

    private void sendSubscription(String action, String messageType) {
        send(ChannelMessage.builder()
            .type(action)
            .data("messageType", messageType)
            .timestamp(now())
            .build());
    }

    private void recordDisconnect() {
        long now = now();
        lastDisconnectedAt = now;
        long started = connectionStartedAt;
        if (started > 0) {
            uptimeMs += now - started;
            connectionStartedAt = 0;
        }
    }

    private void setState(ConnectionState next) {
        ConnectionState previous = state.getAndSet(next);
        if (previous != next) {
            logger.debug("Connection state changed: {} -> {}", previous, next);
            listeners.forEach(l -> safely(() -> l.onStateChange(previous, next)));
        }
    }

    private void notifyHealthChange(boolean healthy) {
        listeners.forEach(l -> safely(() -> l.onHealthChange(healthy)));
    }

    private void safely(Runnable action) {
        try {
            action.run();
        } catch (RuntimeException e) {
            logger.warn("Connection callback failed", e);
        }
    }

    private long now() {
        return scheduler.now(TimeUnit.MILLISECONDS);
    }

    private final class ChannelCallbacks implements LiveChannelHandler {
        private final long attempt;

        private ChannelCallbacks(long attempt) {
            this.attempt = attempt;
        }

        @Override
        public void onMessage(ChannelMessage message) {
            if (attempt == generation.get()) {
                onInbound(message);
            }
        }

        @Override
        public void onClose(int code, String reason) {
            if (attempt == generation.get()) {
                onClosed(code, reason);
            }
        }

        @Override
        public void onError(Throwable error) {
            if (attempt == generation.get()) {
                logger.warn("Live channel error: {}", error.getMessage());
                listeners.forEach(l -> safely(() -> l.onError(error)));
            }
        }
    }
}

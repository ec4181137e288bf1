package com.analytics.resilience.transport;

import com.analytics.resilience.config.TransportConfig;
import com.analytics.resilience.connection.AuthTokenProvider;
import com.analytics.resilience.model.ChannelMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * Manages the one-way push stream used when the live channel is unavailable.
 * <p>
 * A stream error schedules a reconnect after {@code reconnectDelay * 2^(attempt-1)}. When the
 * configured attempts are used up {@link Listener#onReconnectionExhausted()} is called and the
 * manager stays disconnected.
 */
public class PushChannelManager {

    private static final Logger logger = LoggerFactory.getLogger(PushChannelManager.class);

    /**
     * Push stream lifecycle callbacks.
     */
    public interface Listener {
        default void onConnectionChange(boolean connected) {
        }

        default void onReconnectionExhausted() {
        }
    }

    private final TransportConfig config;
    private final PushChannelConnector connector;
    private final AuthTokenProvider tokenProvider;
    private final Scheduler scheduler;
    private final Map<String, List<Consumer<ChannelMessage>>> handlers = new ConcurrentHashMap<>();
    private final List<Listener> listeners = new CopyOnWriteArrayList<>();
    private final AtomicLong generation = new AtomicLong();
    private final AtomicLong eventsReceived = new AtomicLong();

    private volatile PushSubscription subscription;
    private volatile Disposable reconnectTimer;
    private volatile boolean connected;
    private volatile int reconnectAttempts;

    public PushChannelManager(TransportConfig config, PushChannelConnector connector,
                              AuthTokenProvider tokenProvider, Scheduler scheduler) {
        this.config = config;
        this.connector = connector;
        this.tokenProvider = tokenProvider != null ? tokenProvider : AuthTokenProvider.anonymous();
        this.scheduler = scheduler;
    }

    /**
     * Opens the push stream, replacing any existing one. Completes when the stream is open.
     */
    public Mono<Void> connect() {
        return Mono.defer(() -> {
            closeSubscription();
            long attempt = generation.incrementAndGet();
            String url = config.getPushUrl();
            return tokenProvider.getToken()
                .map(Optional::of)
                .defaultIfEmpty(Optional.empty())
                .flatMap(token -> connector.subscribe(url, token.orElse(null), config.getPushEventTypes(),
                    new StreamCallbacks(attempt)))
                .switchIfEmpty(Mono.error(() -> new IllegalStateException("Push connector completed without a stream")))
                .doOnNext(opened -> onOpened(attempt, opened))
                .doOnError(e -> logger.warn("Push channel connection to {} failed: {}", url, e.getMessage()))
                .then();
        });
    }

    public void disconnect() {
        generation.incrementAndGet();
        cancelReconnect();
        closeSubscription();
        reconnectAttempts = 0;
        setConnected(false);
    }

    /**
     * Registers a handler for one push event type. Disposing the handle removes it.
     */
    public Disposable subscribe(String eventType, Consumer<ChannelMessage> handler) {
        List<Consumer<ChannelMessage>> list = handlers.computeIfAbsent(eventType, t -> new CopyOnWriteArrayList<>());
        list.add(handler);
        return () -> list.remove(handler);
    }

    public void addListener(Listener listener) {
        listeners.add(listener);
    }

    public boolean isConnected() {
        return connected;
    }

    public PushChannelStatus getStatus() {
        return new PushChannelStatus(connected, reconnectAttempts, eventsReceived.get());
    }

    private void onOpened(long attempt, PushSubscription opened) {
        if (attempt != generation.get()) {
            opened.close();
            return;
        }
        subscription = opened;
        reconnectAttempts = 0;
        logger.info("Push channel connected to {}", config.getPushUrl());
        setConnected(true);
    }

    private void onStreamError(Throwable error) {
        logger.error("Push channel error: {}", error.getMessage());
        subscription = null;
        setConnected(false);
        scheduleReconnect();
    }

    private void scheduleReconnect() {
        if (reconnectAttempts >= config.getPushMaxReconnectAttempts()) {
            logger.warn("Push channel gave up after {} reconnection attempts", reconnectAttempts);
            listeners.forEach(l -> safely(l::onReconnectionExhausted));
            return;
        }
        reconnectAttempts++;
        long delay = config.getPushReconnectDelay().toMillis() * (1L << (reconnectAttempts - 1));
        logger.debug("Push channel reconnecting in {}ms (attempt {})", delay, reconnectAttempts);
        long scheduledFor = generation.get();
        reconnectTimer = scheduler.schedule(() -> {
            if (scheduledFor != generation.get()) {
                return;
            }
            connect().subscribe(v -> { }, e -> {
                if (!connected) {
                    scheduleReconnect();
                }
            });
        }, delay, TimeUnit.MILLISECONDS);
    }

    private void dispatch(ChannelMessage message) {
        eventsReceived.incrementAndGet();
        List<Consumer<ChannelMessage>> list = handlers.get(message.getType());
        if (list == null) {
            return;
        }
        for (Consumer<ChannelMessage> handler : list) {
            safely(() -> handler.accept(message));
        }
    }

    private void setConnected(boolean value) {
        if (connected != value) {
            connected = value;
            listeners.forEach(l -> safely(() -> l.onConnectionChange(value)));
        }
    }

    private void closeSubscription() {
        PushSubscription current = subscription;
        subscription = null;
        if (current != null) {
            try {
                current.close();
            } catch (RuntimeException e) {
                logger.warn("Error closing push channel: {}", e.getMessage());
            }
        }
    }

    private void cancelReconnect() {
        Disposable timer = reconnectTimer;
        reconnectTimer = null;
        if (timer != null) {
            timer.dispose();
        }
    }

    private void safely(Runnable action) {
        try {
            action.run();
        } catch (RuntimeException e) {
            logger.error("Error in push channel handler", e);
        }
    }

    private final class StreamCallbacks implements PushEventHandler {
        private final long attempt;

        private StreamCallbacks(long attempt) {
            this.attempt = attempt;
        }

        @Override
        public void onEvent(ChannelMessage message) {
            if (attempt == generation.get()) {
                dispatch(message);
            }
        }

        @Override
        public void onError(Throwable error) {
            if (attempt == generation.get()) {
                onStreamError(error);
            }
        }
    }
}

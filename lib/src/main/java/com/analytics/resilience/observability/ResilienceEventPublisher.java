package com.analytics.resilience.observability;

import com.analytics.resilience.model.ConnectionState;
import com.analytics.resilience.model.DegradationLevel;
import com.analytics.resilience.model.TransportMode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;

import java.time.Instant;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.Consumer;

/**
 * Publishes connection, transport, degradation and alert events as reactive streams.
 * <p>
 * Events are delivered only to current subscribers; nothing is replayed to late subscribers.
 */
public class ResilienceEventPublisher {

    private static final Logger logger = LoggerFactory.getLogger(ResilienceEventPublisher.class);

    private final Sinks.Many<ConnectionStatusEvent> connectionSink = Sinks.many().multicast().directBestEffort();
    private final Sinks.Many<TransportModeEvent> transportSink = Sinks.many().multicast().directBestEffort();
    private final Sinks.Many<DegradationEvent> degradationSink = Sinks.many().multicast().directBestEffort();
    private final Sinks.Many<PerformanceAlert> alertSink = Sinks.many().multicast().directBestEffort();
    private final ConcurrentMap<String, String> subscribers = new ConcurrentHashMap<>();

    public ResilienceEventPublisher() {
        logger.debug("ResilienceEventPublisher initialized");
    }

    public void publishConnectionStatus(ConnectionState previous, ConnectionState current, Instant timestamp) {
        emit(connectionSink, new ConnectionStatusEvent(previous, current, timestamp));
    }

    public void publishTransportMode(TransportMode previous, TransportMode current, String reason, Instant timestamp) {
        emit(transportSink, new TransportModeEvent(previous, current, reason, timestamp));
    }

    public void publishDegradation(DegradationLevel previous, DegradationLevel current, String reason,
                                   Instant timestamp) {
        emit(degradationSink, new DegradationEvent(previous, current, reason, timestamp));
    }

    /**
     * Publishes an alert. Budget violations are also visible through {@link #getBudgetViolationStream()}.
     */
    public void publishAlert(PerformanceAlert alert) {
        emit(alertSink, alert);
    }

    public Disposable subscribeToConnectionStatus(Consumer<ConnectionStatusEvent> listener) {
        return subscribe("connection", connectionSink.asFlux(), listener);
    }

    public Disposable subscribeToTransportModes(Consumer<TransportModeEvent> listener) {
        return subscribe("transport", transportSink.asFlux(), listener);
    }

    public Disposable subscribeToDegradation(Consumer<DegradationEvent> listener) {
        return subscribe("degradation", degradationSink.asFlux(), listener);
    }

    public Disposable subscribeToAlerts(Consumer<PerformanceAlert> listener) {
        return subscribe("alert", alertSink.asFlux(), listener);
    }

    public Disposable subscribeToBudgetViolations(Consumer<PerformanceAlert> listener) {
        return subscribe("budget", getBudgetViolationStream(), listener);
    }

    public Flux<ConnectionStatusEvent> getConnectionStatusStream() {
        return connectionSink.asFlux();
    }

    public Flux<TransportModeEvent> getTransportModeStream() {
        return transportSink.asFlux();
    }

    public Flux<DegradationEvent> getDegradationStream() {
        return degradationSink.asFlux();
    }

    public Flux<PerformanceAlert> getAlertStream() {
        return alertSink.asFlux();
    }

    public Flux<PerformanceAlert> getBudgetViolationStream() {
        return alertSink.asFlux().filter(alert -> alert.getType() == AlertType.BUDGET_VIOLATION);
    }

    public int getSubscriberCount() {
        return subscribers.size();
    }

    /**
     * Completes every stream.
     */
    public void close() {
        logger.debug("Closing ResilienceEventPublisher with {} active subscribers", subscribers.size());
        connectionSink.tryEmitComplete();
        transportSink.tryEmitComplete();
        degradationSink.tryEmitComplete();
        alertSink.tryEmitComplete();
        subscribers.clear();
    }

    private <T> void emit(Sinks.Many<T> sink, T event) {
        Sinks.EmitResult result;
        synchronized (sink) {
            result = sink.tryEmitNext(event);
        }
        if (result == Sinks.EmitResult.FAIL_ZERO_SUBSCRIBER) {
            return;
        }
        if (result.isFailure()) {
            logger.warn("Failed to publish {}: {}", event, result);
        } else {
            logger.debug("Published {}", event);
        }
    }

    private <T> Disposable subscribe(String kind, Flux<T> stream, Consumer<T> listener) {
        String subscriberId = kind + "-" + System.nanoTime();
        subscribers.put(subscriberId, kind);
        logger.debug("New {} subscriber: {} (total subscribers: {})", kind, subscriberId, subscribers.size());
        return stream
            .doOnCancel(() -> subscribers.remove(subscriberId))
            .doOnTerminate(() -> subscribers.remove(subscriberId))
            .subscribe(event -> {
                try {
                    listener.accept(event);
                } catch (RuntimeException e) {
                    logger.error("{} subscriber {} failed", kind, subscriberId, e);
                }
            }, error -> logger.error("{} subscriber error", kind, error));
    }

    /**
     * Live channel state change.
     */
    public static class ConnectionStatusEvent {
        private final ConnectionState previous;
        private final ConnectionState current;
        private final Instant timestamp;

        public ConnectionStatusEvent(ConnectionState previous, ConnectionState current, Instant timestamp) {
            this.previous = previous;
            this.current = current;
            this.timestamp = timestamp;
        }

        public ConnectionState getPrevious() {
            return previous;
        }

        public ConnectionState getCurrent() {
            return current;
        }

        public Instant getTimestamp() {
            return timestamp;
        }

        @Override
        public String toString() {
            return String.format("ConnectionStatusEvent{%s -> %s, timestamp=%s}", previous, current, timestamp);
        }
    }

    /**
     * Transport cascade mode change.
     */
    public static class TransportModeEvent {
        private final TransportMode previous;
        private final TransportMode current;
        private final String reason;
        private final Instant timestamp;

        public TransportModeEvent(TransportMode previous, TransportMode current, String reason, Instant timestamp) {
            this.previous = previous;
            this.current = current;
            this.reason = reason;
            this.timestamp = timestamp;
        }

        public TransportMode getPrevious() {
            return previous;
        }

        public TransportMode getCurrent() {
            return current;
        }

        public String getReason() {
            return reason;
        }

        public Instant getTimestamp() {
            return timestamp;
        }

        @Override
        public String toString() {
            return String.format("TransportModeEvent{%s -> %s, reason='%s', timestamp=%s}",
                previous, current, reason, timestamp);
        }
    }

    /**
     * Degradation level change with the reason the manager recorded.
     */
    public static class DegradationEvent {
        private final DegradationLevel previous;
        private final DegradationLevel current;
        private final String reason;
        private final Instant timestamp;

        public DegradationEvent(DegradationLevel previous, DegradationLevel current, String reason,
                                Instant timestamp) {
            this.previous = previous;
            this.current = current;
            this.reason = reason;
            this.timestamp = timestamp;
        }

        public DegradationLevel getPrevious() {
            return previous;
        }

        public DegradationLevel getCurrent() {
            return current;
        }

        public String getReason() {
            return reason;
        }

        public Instant getTimestamp() {
            return timestamp;
        }

        @Override
        public String toString() {
            return String.format("DegradationEvent{%s -> %s, reason='%s', timestamp=%s}",
                previous, current, reason, timestamp);
        }
    }
}

package com.analytics.resilience.sync;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.publisher.Sinks;

import java.util.function.Consumer;

/**
 * {@link BroadcastChannel} for instances living in the same JVM.
 */
public class InMemoryBroadcastChannel implements BroadcastChannel {

    private static final Logger logger = LoggerFactory.getLogger(InMemoryBroadcastChannel.class);

    private final String name;
    private final Sinks.Many<SyncMessage> sink = Sinks.many().multicast().directBestEffort();

    public InMemoryBroadcastChannel(String name) {
        this.name = name;
    }

    @Override
    public synchronized void post(SyncMessage message) {
        Sinks.EmitResult result = sink.tryEmitNext(message);
        if (result.isFailure() && result != Sinks.EmitResult.FAIL_ZERO_SUBSCRIBER) {
            logger.warn("Failed to broadcast {} on {}: {}", message.type(), name, result);
        }
    }

    @Override
    public Disposable listen(Consumer<SyncMessage> listener) {
        return sink.asFlux().subscribe(message -> {
            try {
                listener.accept(message);
            } catch (RuntimeException e) {
                logger.error("Broadcast listener on {} failed", name, e);
            }
        });
    }

    @Override
    public synchronized void close() {
        sink.tryEmitComplete();
    }

    public String getName() {
        return name;
    }
}

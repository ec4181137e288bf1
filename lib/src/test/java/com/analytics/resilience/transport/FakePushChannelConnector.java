package com.analytics.resilience.transport;

import com.analytics.resilience.model.ChannelMessage;
import reactor.core.publisher.Mono;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * In-memory push connector; the test plays the server through the returned streams.
 */
public class FakePushChannelConnector implements PushChannelConnector {

    private final List<FakeStream> streams = new CopyOnWriteArrayList<>();
    private final List<List<String>> requestedTypes = new CopyOnWriteArrayList<>();
    private volatile boolean refuse;

    @Override
    public Mono<PushSubscription> subscribe(String url, String token, List<String> eventTypes,
                                            PushEventHandler handler) {
        requestedTypes.add(eventTypes);
        if (refuse) {
            return Mono.error(new IOException("Push endpoint unavailable"));
        }
        FakeStream stream = new FakeStream(handler);
        streams.add(stream);
        return Mono.just(stream);
    }

    public void refuseConnections(boolean refuse) {
        this.refuse = refuse;
    }

    public int attempts() {
        return requestedTypes.size();
    }

    public List<List<String>> requestedTypes() {
        return requestedTypes;
    }

    public FakeStream lastStream() {
        return streams.get(streams.size() - 1);
    }

    public List<FakeStream> streams() {
        return streams;
    }

    public static class FakeStream implements PushSubscription {
        private final PushEventHandler handler;
        private volatile boolean active = true;

        FakeStream(PushEventHandler handler) {
            this.handler = handler;
        }

        @Override
        public void close() {
            active = false;
        }

        @Override
        public boolean isActive() {
            return active;
        }

        public void emit(ChannelMessage message) {
            handler.onEvent(message);
        }

        public void fail(Throwable error) {
            active = false;
            handler.onError(error);
        }
    }
}

package com.analytics.resilience.sync;

import reactor.core.Disposable;

import java.util.function.Consumer;

/**
 * Fan-out channel connecting client instances. Every posted message reaches every listener,
 * including listeners belonging to the sender.
 */
public interface BroadcastChannel {

    void post(SyncMessage message);

    Disposable listen(Consumer<SyncMessage> listener);

    void close();
}

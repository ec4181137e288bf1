package com.analytics.resilience.transport;

import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Opens server push streams. The Mono completes once the stream is open.
 */
@FunctionalInterface
public interface PushChannelConnector {

    /**
     * @param token access token, or {@code null} when none is available
     */
    Mono<PushSubscription> subscribe(String url, String token, List<String> eventTypes, PushEventHandler handler);
}

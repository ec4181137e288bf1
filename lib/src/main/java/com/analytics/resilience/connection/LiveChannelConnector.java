package com.analytics.resilience.connection;

import reactor.core.publisher.Mono;

/**
 * Opens live channels. The returned Mono completes once the channel is open; the handler receives
 * everything that happens on the channel afterwards.
 */
@FunctionalInterface
public interface LiveChannelConnector {

    /**
     * @param token access token, or {@code null} when the provider supplied none
     */
    Mono<LiveChannel> open(String url, String token, LiveChannelHandler handler);
}

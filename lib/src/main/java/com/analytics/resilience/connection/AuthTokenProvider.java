package com.analytics.resilience.connection;

import reactor.core.publisher.Mono;

/**
 * Supplies the access token presented when opening a channel. An empty result connects without a token.
 */
@FunctionalInterface
public interface AuthTokenProvider {

    Mono<String> getToken();

    static AuthTokenProvider anonymous() {
        return Mono::empty;
    }
}

package com.analytics.resilience.error;

/**
 * Failure classes understood by the resilience layer.
 */
public enum ErrorType {

    /**
     * Connectivity problems such as DNS failures, refused or reset connections.
     */
    NETWORK,

    /**
     * An explicit deadline was exceeded.
     */
    TIMEOUT,

    /**
     * Credentials missing or expired; recoverable by refreshing the token once.
     */
    AUTHENTICATION,

    /**
     * Caller is not allowed to see the data; never retried.
     */
    AUTHORIZATION,

    /**
     * Malformed request; never retried.
     */
    VALIDATION,

    /**
     * Upstream 5xx-class failure, often with a retry-after hint.
     */
    SERVICE
}

package com.analytics.resilience.connection;

/**
 * Exception thrown when the live channel cannot be established or used.
 */
public class ConnectionException extends RuntimeException {

    public ConnectionException(String message) {
        super(message);
    }

    public ConnectionException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * The channel did not open within the connection timeout.
     */
    public static class ConnectionTimeoutException extends ConnectionException {
        public ConnectionTimeoutException(String url, long timeoutMs) {
            super(String.format("Connection to '%s' not established within %dms", url, timeoutMs));
        }
    }

    /**
     * The connector or the token provider failed.
     */
    public static class ConnectionFailedException extends ConnectionException {
        public ConnectionFailedException(String url, Throwable cause) {
            super(String.format("Failed to connect to '%s': %s", url, cause.getMessage()), cause);
        }
    }

    /**
     * Reconnection gave up after the configured number of attempts.
     */
    public static class ReconnectionExhaustedException extends ConnectionException {
        public ReconnectionExhaustedException(String url, int attempts) {
            super(String.format("Gave up reconnecting to '%s' after %d attempts", url, attempts));
        }
    }

    /**
     * The manager was destroyed and can no longer connect.
     */
    public static class ConnectionClosedException extends ConnectionException {
        public ConnectionClosedException(String url) {
            super(String.format("Connection manager for '%s' is destroyed", url));
        }
    }
}

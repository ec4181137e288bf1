package com.analytics.resilience.error;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.OptionalLong;

/**
 * Base exception for failures talking to the analytics service.
 * Subclasses fix the {@link ErrorType} and whether the failure is recoverable.
 */
public class AnalyticsException extends RuntimeException {

    private final ErrorType type;
    private final boolean recoverable;
    private final Long retryAfterSeconds;
    private final String code;
    private final String correlationId;
    private final Map<String, Object> details;
    private final Instant timestamp;

    protected AnalyticsException(ErrorType type, boolean recoverable, String message, Options options, Throwable cause) {
        super(message, cause);
        this.type = type;
        this.recoverable = recoverable;
        this.retryAfterSeconds = options.retryAfterSeconds;
        this.code = options.code;
        this.correlationId = options.correlationId;
        this.details = Collections.unmodifiableMap(new LinkedHashMap<>(options.details));
        this.timestamp = Instant.now();
    }

    public ErrorType getType() {
        return type;
    }

    public boolean isRecoverable() {
        return recoverable;
    }

    /**
     * Server-provided or class-default hint on how long to wait before retrying.
     */
    public OptionalLong getRetryAfterSeconds() {
        return retryAfterSeconds != null ? OptionalLong.of(retryAfterSeconds) : OptionalLong.empty();
    }

    public String getCode() {
        return code;
    }

    public String getCorrelationId() {
        return correlationId;
    }

    public Map<String, Object> getDetails() {
        return details;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public static Options options() {
        return new Options();
    }

    /**
     * Optional attributes shared by all analytics exceptions.
     */
    public static class Options {
        private Long retryAfterSeconds;
        private String code;
        private String correlationId;
        private final Map<String, Object> details = new LinkedHashMap<>();

        public Options retryAfterSeconds(long seconds) {
            this.retryAfterSeconds = seconds;
            return this;
        }

        public Options code(String code) {
            this.code = code;
            return this;
        }

        public Options correlationId(String correlationId) {
            this.correlationId = correlationId;
            return this;
        }

        public Options detail(String key, Object value) {
            this.details.put(key, value);
            return this;
        }

        Options retryAfterIfAbsent(long seconds) {
            if (retryAfterSeconds == null) {
                retryAfterSeconds = seconds;
            }
            return this;
        }
    }

    /**
     * Connectivity failure such as a refused, reset or unresolvable connection.
     */
    public static class NetworkException extends AnalyticsException {
        public NetworkException(String message) {
            this(message, options(), null);
        }

        public NetworkException(String message, Options options, Throwable cause) {
            super(ErrorType.NETWORK, true, message, options.retryAfterIfAbsent(5), cause);
        }
    }

    /**
     * An explicit deadline was exceeded.
     */
    public static class RequestTimeoutException extends AnalyticsException {
        public RequestTimeoutException(long timeoutMs) {
            this(String.format("Operation timed out after %dms", timeoutMs),
                options().code("TIMEOUT").detail("timeoutMs", timeoutMs), null);
        }

        public RequestTimeoutException(String message, Options options, Throwable cause) {
            super(ErrorType.TIMEOUT, true, message, options.retryAfterIfAbsent(10), cause);
        }
    }

    /**
     * Missing or expired credentials.
     */
    public static class AuthenticationException extends AnalyticsException {
        public AuthenticationException(String message) {
            this(message, options());
        }

        public AuthenticationException(String message, Options options) {
            super(ErrorType.AUTHENTICATION, true, message, options, null);
        }
    }

    /**
     * Caller lacks permission for the requested data.
     */
    public static class AuthorizationException extends AnalyticsException {
        public AuthorizationException(String message) {
            this(message, options());
        }

        public AuthorizationException(String message, Options options) {
            super(ErrorType.AUTHORIZATION, false, message, options, null);
        }
    }

    /**
     * Request rejected as malformed.
     */
    public static class ValidationException extends AnalyticsException {
        public ValidationException(String message) {
            this(message, options());
        }

        public ValidationException(String message, Options options) {
            super(ErrorType.VALIDATION, false, message, options, null);
        }
    }

    /**
     * Upstream service failure.
     */
    public static class ServiceException extends AnalyticsException {
        public ServiceException(String message) {
            this(message, options(), null);
        }

        public ServiceException(String message, Options options, Throwable cause) {
            super(ErrorType.SERVICE, true, message, options, cause);
        }

        /**
         * Builds a service failure for an HTTP 5xx status with the status-specific retry hint.
         */
        public static ServiceException fromStatus(int status, String message) {
            Options options = options().code("HTTP_" + status).detail("status", status);
            switch (status) {
                case 500 -> options.retryAfterSeconds(30);
                case 502 -> options.retryAfterSeconds(15);
                case 503 -> options.retryAfterSeconds(60);
                case 504 -> options.retryAfterSeconds(30);
                default -> { }
            }
            String text = message != null ? message : String.format("Analytics service error (HTTP %d)", status);
            return new ServiceException(text, options, null);
        }
    }

    /**
     * Thrown without calling upstream while a circuit breaker is open.
     */
    public static class CircuitOpenException extends ServiceException {
        public CircuitOpenException(String operationName, long remainingMs) {
            super(String.format("Circuit breaker '%s' is open - service unavailable", operationName),
                options().code("CIRCUIT_BREAKER_OPEN")
                    .detail("operation", operationName)
                    .retryAfterSeconds(Math.max(1, (remainingMs + 999) / 1000)),
                null);
        }
    }
}

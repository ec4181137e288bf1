package com.analytics.resilience.error;

import com.analytics.resilience.error.AnalyticsException.AuthenticationException;
import com.analytics.resilience.error.AnalyticsException.AuthorizationException;
import com.analytics.resilience.error.AnalyticsException.NetworkException;
import com.analytics.resilience.error.AnalyticsException.RequestTimeoutException;
import com.analytics.resilience.error.AnalyticsException.ServiceException;
import com.analytics.resilience.error.AnalyticsException.ValidationException;

import java.io.IOException;
import java.net.ConnectException;
import java.net.UnknownHostException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;

/**
 * Maps arbitrary failures and HTTP statuses onto the {@link AnalyticsException} taxonomy.
 */
public final class AnalyticsErrors {

    private AnalyticsErrors() {
    }

    /**
     * Classifies an HTTP status code.
     * 401 authentication, 403 authorization, 408 timeout, other 4xx validation, 5xx service.
     */
    public static AnalyticsException fromStatus(int status, String message) {
        if (status == 401) {
            return new AuthenticationException(message != null ? message : "Authentication required");
        }
        if (status == 403) {
            return new AuthorizationException(message != null ? message : "Access denied");
        }
        if (status == 408) {
            return new RequestTimeoutException(message != null ? message : "Request timed out",
                AnalyticsException.options().code("HTTP_408"), null);
        }
        if (status >= 400 && status < 500) {
            return new ValidationException(message != null ? message : String.format("Invalid request (HTTP %d)", status),
                AnalyticsException.options().code("HTTP_" + status).detail("status", status));
        }
        if (status >= 500) {
            return ServiceException.fromStatus(status, message);
        }
        return new ServiceException(message != null ? message : "Unknown error occurred",
            AnalyticsException.options().code("UNKNOWN_ERROR").detail("status", status), null);
    }

    /**
     * Converts any throwable into an analytics exception, unwrapping async wrappers.
     * Unknown failures are classified as service errors.
     */
    public static AnalyticsException classify(Throwable error) {
        Throwable cause = unwrap(error);
        if (cause instanceof AnalyticsException) {
            return (AnalyticsException) cause;
        }
        String message = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
        if (cause instanceof TimeoutException) {
            return new RequestTimeoutException(message, AnalyticsException.options().code("TIMEOUT"), cause);
        }
        if (cause instanceof UnknownHostException) {
            return new NetworkException(message, AnalyticsException.options().code("DNS_ERROR"), cause);
        }
        if (cause instanceof ConnectException) {
            return new NetworkException(message, AnalyticsException.options().code("CONNECTION_REFUSED"), cause);
        }
        if (cause instanceof IOException) {
            return new NetworkException(message, AnalyticsException.options().code("NETWORK_ERROR"), cause);
        }
        return new ServiceException(message,
            AnalyticsException.options().code("UNKNOWN_ERROR").detail("originalError", cause.getClass().getName()),
            cause);
    }

    public static boolean isRecoverable(Throwable error) {
        return classify(error).isRecoverable();
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
            && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}

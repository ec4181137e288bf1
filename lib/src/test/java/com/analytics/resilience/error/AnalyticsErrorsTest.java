package com.analytics.resilience.error;

import com.analytics.resilience.error.AnalyticsException.AuthenticationException;
import com.analytics.resilience.error.AnalyticsException.AuthorizationException;
import com.analytics.resilience.error.AnalyticsException.CircuitOpenException;
import com.analytics.resilience.error.AnalyticsException.NetworkException;
import com.analytics.resilience.error.AnalyticsException.RequestTimeoutException;
import com.analytics.resilience.error.AnalyticsException.ServiceException;
import com.analytics.resilience.error.AnalyticsException.ValidationException;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.ConnectException;
import java.net.UnknownHostException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;

import static org.junit.jupiter.api.Assertions.*;

class AnalyticsErrorsTest {

    @Test
    void testFromStatusMapping() {
        assertInstanceOf(AuthenticationException.class, AnalyticsErrors.fromStatus(401, null));
        assertInstanceOf(AuthorizationException.class, AnalyticsErrors.fromStatus(403, null));
        assertInstanceOf(RequestTimeoutException.class, AnalyticsErrors.fromStatus(408, null));
        assertInstanceOf(ValidationException.class, AnalyticsErrors.fromStatus(422, null));
        assertInstanceOf(ServiceException.class, AnalyticsErrors.fromStatus(502, null));
    }

    @Test
    void testRecoverability() {
        assertTrue(AnalyticsErrors.fromStatus(401, null).isRecoverable());
        assertFalse(AnalyticsErrors.fromStatus(403, null).isRecoverable());
        assertFalse(AnalyticsErrors.fromStatus(400, null).isRecoverable());
        assertTrue(AnalyticsErrors.fromStatus(500, null).isRecoverable());
        assertTrue(new NetworkException("reset").isRecoverable());
        assertTrue(new RequestTimeoutException(5000).isRecoverable());
    }

    @Test
    void testServiceStatusRetryHints() {
        assertEquals(30, AnalyticsErrors.fromStatus(500, null).getRetryAfterSeconds().getAsLong());
        assertEquals(15, AnalyticsErrors.fromStatus(502, null).getRetryAfterSeconds().getAsLong());
        assertEquals(60, AnalyticsErrors.fromStatus(503, null).getRetryAfterSeconds().getAsLong());
        assertEquals(30, AnalyticsErrors.fromStatus(504, null).getRetryAfterSeconds().getAsLong());
        assertTrue(AnalyticsErrors.fromStatus(599, null).getRetryAfterSeconds().isEmpty());
    }

    @Test
    void testDefaultRetryHints() {
        assertEquals(5, new NetworkException("reset").getRetryAfterSeconds().getAsLong());
        assertEquals(10, new RequestTimeoutException(5000).getRetryAfterSeconds().getAsLong());
        assertEquals(2, new NetworkException("reset", AnalyticsException.options().retryAfterSeconds(2), null)
            .getRetryAfterSeconds().getAsLong());
        assertTrue(new ValidationException("bad").getRetryAfterSeconds().isEmpty());
    }

    @Test
    void testStatusCodesAndMessages() {
        AnalyticsException validation = AnalyticsErrors.fromStatus(422, null);
        assertEquals("HTTP_422", validation.getCode());
        assertEquals(422, validation.getDetails().get("status"));
        assertEquals("Invalid request (HTTP 422)", validation.getMessage());

        assertEquals("Token expired", AnalyticsErrors.fromStatus(401, "Token expired").getMessage());
        assertEquals("Analytics service error (HTTP 503)", AnalyticsErrors.fromStatus(503, null).getMessage());
    }

    @Test
    void testClassifyNativeFailures() {
        assertEquals(ErrorType.TIMEOUT, AnalyticsErrors.classify(new TimeoutException("slow")).getType());
        assertEquals("DNS_ERROR", AnalyticsErrors.classify(new UnknownHostException("analytics.test")).getCode());
        assertEquals("CONNECTION_REFUSED", AnalyticsErrors.classify(new ConnectException("refused")).getCode());
        assertEquals(ErrorType.NETWORK, AnalyticsErrors.classify(new IOException("reset")).getType());

        AnalyticsException unknown = AnalyticsErrors.classify(new IllegalStateException("boom"));
        assertEquals(ErrorType.SERVICE, unknown.getType());
        assertEquals("UNKNOWN_ERROR", unknown.getCode());
        assertEquals(IllegalStateException.class.getName(), unknown.getDetails().get("originalError"));
    }

    @Test
    void testClassifyUnwrapsAsyncWrappers() {
        ValidationException cause = new ValidationException("bad range");

        assertSame(cause, AnalyticsErrors.classify(new CompletionException(cause)));
        assertSame(cause, AnalyticsErrors.classify(new ExecutionException(new CompletionException(cause))));
    }

    @Test
    void testClassifyKeepsAnalyticsExceptions() {
        NetworkException error = new NetworkException("reset");

        assertSame(error, AnalyticsErrors.classify(error));
    }

    @Test
    void testCircuitOpenException() {
        CircuitOpenException error = new CircuitOpenException("dashboard", 2500);

        assertEquals(ErrorType.SERVICE, error.getType());
        assertEquals("CIRCUIT_BREAKER_OPEN", error.getCode());
        assertEquals(3, error.getRetryAfterSeconds().getAsLong());
        assertEquals("dashboard", error.getDetails().get("operation"));
        assertTrue(error.getMessage().contains("'dashboard'"));
    }
}

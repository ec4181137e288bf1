package com.analytics.resilience.error;

import io.github.resilience4j.core.IntervalFunction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Map;

/**
 * Decides whether a failed operation should be retried, after how long,
 * and what recovery the caller should attempt.
 */
public class ErrorHandler {

    private static final Logger logger = LoggerFactory.getLogger(ErrorHandler.class);

    public static final int DEFAULT_MAX_ATTEMPTS = 3;

    private static final Map<ErrorType, String> USER_MESSAGES = Map.of(
        ErrorType.NETWORK, "Connection issue. Please check your internet connection and try again.",
        ErrorType.AUTHENTICATION, "Please sign in to access analytics data.",
        ErrorType.AUTHORIZATION, "You don't have permission to view this analytics data.",
        ErrorType.VALIDATION, "Invalid request. Please check your input and try again.",
        ErrorType.SERVICE, "Analytics service is temporarily unavailable. Please try again later.",
        ErrorType.TIMEOUT, "Request timed out. Please try again."
    );

    private final int maxAttempts;
    private final IntervalFunction backoff;
    private final Duration maxRetryDelay;

    public ErrorHandler() {
        this(DEFAULT_MAX_ATTEMPTS, Duration.ofSeconds(1), Duration.ofMinutes(1));
    }

    /**
     * @param maxAttempts total attempts including the first call
     * @param baseDelay delay before the first retry; doubles per attempt with up to 50% jitter
     * @param maxRetryDelay upper bound for any computed or server-provided delay
     */
    public ErrorHandler(int maxAttempts, Duration baseDelay, Duration maxRetryDelay) {
        this.maxAttempts = maxAttempts;
        this.backoff = IntervalFunction.ofExponentialRandomBackoff(baseDelay, 2.0, 0.5);
        this.maxRetryDelay = maxRetryDelay;
    }

    /**
     * Evaluates a failure of the given attempt (1-based).
     */
    public RetryDecision handle(Throwable failure, String operation, int attempt) {
        AnalyticsException error = AnalyticsErrors.classify(failure);
        logger.warn("Operation {} failed on attempt {}/{}: type={}, code={}, recoverable={}, message={}",
            operation, attempt, maxAttempts, error.getType(), error.getCode(), error.isRecoverable(), error.getMessage());

        boolean retry = shouldRetry(error, attempt);
        return new RetryDecision(error, retry, retry ? retryDelay(error, attempt) : Duration.ZERO, recoveryAction(error));
    }

    public boolean shouldRetry(AnalyticsException error, int attempt) {
        if (attempt >= maxAttempts || !error.isRecoverable()) {
            return false;
        }
        return switch (error.getType()) {
            case AUTHENTICATION -> attempt == 1;
            case NETWORK, SERVICE, TIMEOUT -> true;
            case AUTHORIZATION, VALIDATION -> false;
        };
    }

    /**
     * Server-provided retry-after wins; otherwise exponential backoff with jitter. Capped at the max delay.
     */
    public Duration retryDelay(AnalyticsException error, int attempt) {
        long millis = error.getRetryAfterSeconds().isPresent()
            ? error.getRetryAfterSeconds().getAsLong() * 1000
            : backoff.apply(Math.max(1, attempt));
        return Duration.ofMillis(Math.min(millis, maxRetryDelay.toMillis()));
    }

    public RecoveryAction recoveryAction(AnalyticsException error) {
        return switch (error.getType()) {
            case AUTHENTICATION -> RecoveryAction.REFRESH_TOKEN;
            case SERVICE, NETWORK -> RecoveryAction.FALLBACK_CACHE;
            case TIMEOUT -> RecoveryAction.DEGRADE_SERVICE;
            case AUTHORIZATION, VALIDATION -> RecoveryAction.NONE;
        };
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    /**
     * Message suitable for showing to an end user.
     */
    public static String userMessage(Throwable failure) {
        AnalyticsException error = AnalyticsErrors.classify(failure);
        return USER_MESSAGES.getOrDefault(error.getType(), "An unexpected error occurred.");
    }

    /**
     * Outcome of evaluating a failure.
     */
    public record RetryDecision(AnalyticsException error, boolean shouldRetry, Duration delay,
                                RecoveryAction recoveryAction) {
    }
}

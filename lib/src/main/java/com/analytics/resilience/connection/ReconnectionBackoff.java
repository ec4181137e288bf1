package com.analytics.resilience.connection;

import com.analytics.resilience.config.ConnectionConfig;
import io.github.resilience4j.core.IntervalFunction;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * Exponential reconnection backoff with symmetric jitter:
 * attempt {@code n} waits {@code min(base * factor^(n-1), maxDelay) * (1 +/- jitter)}.
 */
public class ReconnectionBackoff {

    static final int MAX_HISTORY = 50;

    private final IntervalFunction intervalFunction;
    private final int maxAttempts;
    private final Deque<ReconnectionAttempt> history = new ArrayDeque<>();
    private int attempts;

    public ReconnectionBackoff(ConnectionConfig config) {
        this(config.getReconnectBaseDelay().toMillis(), config.getReconnectMultiplier(),
            config.getMaxReconnectDelay().toMillis(), config.getReconnectJitter(), config.getMaxReconnectAttempts());
    }

    public ReconnectionBackoff(long baseDelayMs, double multiplier, long maxDelayMs, double jitter, int maxAttempts) {
        this.intervalFunction = jitter > 0
            ? IntervalFunction.ofExponentialRandomBackoff(baseDelayMs, multiplier, jitter, maxDelayMs)
            : IntervalFunction.ofExponentialBackoff(baseDelayMs, multiplier, maxDelayMs);
        this.maxAttempts = maxAttempts;
    }

    /**
     * Delay before the given 1-based attempt.
     */
    public long delayForAttempt(int attempt) {
        return intervalFunction.apply(attempt);
    }

    public synchronized boolean canReconnect() {
        return attempts < maxAttempts;
    }

    /**
     * Consumes one attempt and returns its delay.
     */
    public synchronized long nextDelay() {
        if (attempts >= maxAttempts) {
            throw new IllegalStateException("No reconnection attempts left");
        }
        attempts++;
        return delayForAttempt(attempts);
    }

    public synchronized void recordAttempt(boolean success, Instant timestamp) {
        history.addLast(new ReconnectionAttempt(attempts, timestamp, success));
        while (history.size() > MAX_HISTORY) {
            history.removeFirst();
        }
    }

    public synchronized void reset() {
        attempts = 0;
    }

    public synchronized int getAttempts() {
        return attempts;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public synchronized List<ReconnectionAttempt> getHistory() {
        return List.copyOf(history);
    }
}

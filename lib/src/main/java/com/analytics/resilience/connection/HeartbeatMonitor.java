package com.analytics.resilience.connection;

import com.analytics.resilience.model.ConnectionQuality;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.scheduler.Scheduler;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * Ping/pong liveness tracking for the live channel.
 * <p>
 * The next ping is scheduled one interval after the previous pong arrived or its deadline passed,
 * so a slow peer never accumulates overlapping pings. After {@code maxMissed} consecutive missed
 * pongs the channel is reported unhealthy; the channel itself is left open.
 */
class HeartbeatMonitor {

    private static final Logger logger = LoggerFactory.getLogger(HeartbeatMonitor.class);
    static final int MAX_LATENCY_HISTORY = 100;

    private final long intervalMs;
    private final long pongTimeoutMs;
    private final int maxMissed;
    private final Scheduler scheduler;
    private final Deque<Long> latencyHistory = new ArrayDeque<>();

    private Runnable pingSender = () -> { };
    private Consumer<Boolean> healthListener = healthy -> { };

    private Disposable nextPing;
    private Disposable pongDeadline;
    private boolean running;
    private boolean awaitingPong;
    private boolean healthy = true;
    private int missed;
    private long lastPingTime;
    private long lastPongTime;
    private double averageLatency;

    HeartbeatMonitor(Duration interval, Duration pongTimeout, int maxMissed, Scheduler scheduler) {
        this.intervalMs = interval.toMillis();
        this.pongTimeoutMs = pongTimeout.toMillis();
        this.maxMissed = maxMissed;
        this.scheduler = scheduler;
    }

    void onHealthChange(Consumer<Boolean> listener) {
        this.healthListener = listener;
    }

    synchronized void start(Runnable sendPing) {
        stop();
        this.pingSender = sendPing;
        this.running = true;
        scheduleNextPing();
    }

    synchronized void stop() {
        running = false;
        awaitingPong = false;
        dispose(nextPing);
        dispose(pongDeadline);
        nextPing = null;
        pongDeadline = null;
    }

    void handlePong() {
        boolean restored;
        long latency;
        synchronized (this) {
            if (!running || !awaitingPong) {
                return;
            }
            awaitingPong = false;
            dispose(pongDeadline);
            pongDeadline = null;
            lastPongTime = now();
            latency = lastPongTime - lastPingTime;
            recordLatency(latency);
            missed = 0;
            restored = !healthy;
            healthy = true;
            scheduleNextPing();
        }
        if (restored) {
            logger.info("Heartbeat health restored");
            notifyHealth(true);
        }
    }

    synchronized void reset() {
        missed = 0;
        healthy = true;
        lastPingTime = 0;
        lastPongTime = 0;
        averageLatency = 0;
        latencyHistory.clear();
    }

    synchronized boolean isHealthy() {
        return healthy;
    }

    synchronized HeartbeatStats getStats() {
        long min = latencyHistory.stream().mapToLong(Long::longValue).min().orElse(0);
        long max = latencyHistory.stream().mapToLong(Long::longValue).max().orElse(0);
        return new HeartbeatStats(healthy, missed, maxMissed, lastPingTime, lastPongTime, averageLatency, min, max,
            ConnectionQuality.fromLatency(averageLatency), List.copyOf(latencyHistory));
    }

    private void sendPing() {
        Runnable sender;
        synchronized (this) {
            if (!running) {
                return;
            }
            lastPingTime = now();
            awaitingPong = true;
            pongDeadline = scheduler.schedule(this::handleMissedPong, pongTimeoutMs, TimeUnit.MILLISECONDS);
            sender = pingSender;
        }
        try {
            sender.run();
        } catch (RuntimeException e) {
            logger.warn("Failed to send heartbeat ping: {}", e.getMessage());
        }
    }

    private void handleMissedPong() {
        boolean lost;
        synchronized (this) {
            if (!running || !awaitingPong) {
                return;
            }
            awaitingPong = false;
            pongDeadline = null;
            missed++;
            lost = healthy && missed >= maxMissed;
            if (lost) {
                healthy = false;
            }
            logger.debug("Missed heartbeat {}/{}", missed, maxMissed);
            scheduleNextPing();
        }
        if (lost) {
            logger.warn("Heartbeat lost after {} missed pongs", maxMissed);
            notifyHealth(false);
        }
    }

    private void scheduleNextPing() {
        nextPing = scheduler.schedule(this::sendPing, intervalMs, TimeUnit.MILLISECONDS);
    }

    private void recordLatency(long latency) {
        latencyHistory.addLast(latency);
        while (latencyHistory.size() > MAX_LATENCY_HISTORY) {
            latencyHistory.removeFirst();
        }
        averageLatency = averageLatency == 0 ? latency : averageLatency * 0.9 + latency * 0.1;
    }

    private void notifyHealth(boolean value) {
        try {
            healthListener.accept(value);
        } catch (RuntimeException e) {
            logger.warn("Heartbeat health listener failed", e);
        }
    }

    private long now() {
        return scheduler.now(TimeUnit.MILLISECONDS);
    }

    private static void dispose(Disposable disposable) {
        if (disposable != null) {
            disposable.dispose();
        }
    }
}

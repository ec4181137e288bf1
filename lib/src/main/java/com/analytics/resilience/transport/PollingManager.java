package com.analytics.resilience.transport;

import com.analytics.resilience.config.TransportConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.BiConsumer;

/**
 * Last-resort transport: pulls every {@link PollingSource} on an adaptive interval.
 * <p>
 * A cycle fails only when every source fails. Each failed cycle stretches the interval by the
 * backoff multiplier up to the maximum; successful cycles shrink it back towards the base interval.
 * After {@code maxPollingErrors} consecutive failed cycles polling stops and the give-up callback runs.
 */
public class PollingManager {

    private static final Logger logger = LoggerFactory.getLogger(PollingManager.class);

    private final TransportConfig config;
    private final List<PollingSource> sources;
    private final Scheduler scheduler;
    private final BiConsumer<String, Object> dataHandler;
    private final long baseIntervalMs;
    private final AtomicLong generation = new AtomicLong();
    private final AtomicLong cycles = new AtomicLong();

    private volatile Runnable onGiveUp = () -> { };
    private volatile boolean active;
    private volatile long intervalMs;
    private volatile int errorCount;
    private volatile Disposable nextPoll;
    private volatile Disposable inFlight;

    public PollingManager(TransportConfig config, List<PollingSource> sources, Scheduler scheduler,
                          BiConsumer<String, Object> dataHandler) {
        this.config = config;
        this.sources = List.copyOf(sources);
        this.scheduler = scheduler;
        this.dataHandler = dataHandler;
        this.baseIntervalMs = config.getPollingInterval().toMillis();
        this.intervalMs = baseIntervalMs;
    }

    /**
     * Called once when polling stops after too many failed cycles.
     */
    public void onGiveUp(Runnable callback) {
        this.onGiveUp = callback;
    }

    public synchronized void start() {
        if (active) {
            return;
        }
        active = true;
        errorCount = 0;
        intervalMs = baseIntervalMs;
        generation.incrementAndGet();
        scheduleNextPoll();
        logger.info("Polling started with interval {}ms over {} sources", intervalMs, sources.size());
    }

    public synchronized void stop() {
        if (!active) {
            return;
        }
        active = false;
        generation.incrementAndGet();
        dispose(nextPoll);
        dispose(inFlight);
        nextPoll = null;
        inFlight = null;
        logger.info("Polling stopped");
    }

    public boolean isActive() {
        return active;
    }

    public PollingStatus getStatus() {
        return new PollingStatus(active, intervalMs, errorCount, cycles.get());
    }

    private void scheduleNextPoll() {
        long cycle = generation.get();
        nextPoll = scheduler.schedule(() -> poll(cycle), intervalMs, TimeUnit.MILLISECONDS);
    }

    private void poll(long cycle) {
        if (!active || cycle != generation.get()) {
            return;
        }
        inFlight = Flux.fromIterable(sources)
            .flatMap(this::pollSource)
            .reduce(0, (succeeded, ok) -> ok ? succeeded + 1 : succeeded)
            .subscribe(succeeded -> onCycleComplete(cycle, succeeded),
                e -> logger.error("Polling cycle aborted", e));
    }

    private Mono<Boolean> pollSource(PollingSource source) {
        return Mono.defer(() -> source.fetcher().get())
            .doOnNext(data -> dataHandler.accept(source.cacheKey(), data))
            .thenReturn(true)
            .onErrorResume(e -> {
                logger.warn("Failed to poll {}: {}", source.cacheKey(), e.getMessage());
                return Mono.just(false);
            });
    }

    private void onCycleComplete(long cycle, int succeeded) {
        boolean gaveUp = false;
        synchronized (this) {
            if (!active || cycle != generation.get()) {
                return;
            }
            cycles.incrementAndGet();
            if (sources.isEmpty() || succeeded > 0) {
                errorCount = 0;
                if (config.isAdaptivePolling() && intervalMs > baseIntervalMs) {
                    intervalMs = Math.max((long) (intervalMs * config.getPollingRecoveryFactor()), baseIntervalMs);
                }
            } else {
                errorCount++;
                logger.error("Polling cycle failed ({}/{})", errorCount, config.getMaxPollingErrors());
                if (errorCount >= config.getMaxPollingErrors()) {
                    stop();
                    gaveUp = true;
                } else {
                    intervalMs = Math.min((long) (intervalMs * config.getPollingBackoffMultiplier()),
                        config.getMaxPollingInterval().toMillis());
                }
            }
            if (active) {
                scheduleNextPoll();
            }
        }
        if (gaveUp) {
            logger.error("Too many polling errors, giving up");
            onGiveUp.run();
        }
    }

    private static void dispose(Disposable disposable) {
        if (disposable != null) {
            disposable.dispose();
        }
    }
}

package com.analytics.resilience.batch;

import com.analytics.resilience.config.BatchConfig;
import com.analytics.resilience.model.RequestPriority;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.core.scheduler.Scheduler;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

/**
 * Coalesces upstream requests per endpoint.
 * <p>
 * Identical requests (same endpoint and parameters, whatever their key order) that are still
 * pending share one result. Each endpoint's queue is ordered by priority, then arrival, and
 * flushes when it reaches {@code maxBatchSize}, when a member with a zero wait arrives, or at the
 * earliest member deadline.
 */
public class RequestBatcher {

    private static final Logger logger = LoggerFactory.getLogger(RequestBatcher.class);

    private static final Comparator<BatchRequest> QUEUE_ORDER = Comparator
        .comparing(BatchRequest::getPriority)
        .thenComparingLong(BatchRequest::getEnqueuedAt)
        .thenComparingLong(BatchRequest::getSequence);

    private final BatchConfig config;
    private final BatchExecutor executor;
    private final Scheduler scheduler;
    private final Map<String, Mono<Object>> inFlight = new ConcurrentHashMap<>();
    private final Map<String, EndpointQueue> queues = new ConcurrentHashMap<>();
    private final AtomicLong sequence = new AtomicLong();
    private final AtomicLong submitted = new AtomicLong();
    private final AtomicLong deduplicated = new AtomicLong();
    private final AtomicLong batchesFlushed = new AtomicLong();
    private final AtomicLong batchCalls = new AtomicLong();
    private final AtomicLong individualExecutions = new AtomicLong();

    private volatile boolean destroyed;

    public RequestBatcher(BatchConfig config, BatchExecutor executor, Scheduler scheduler) {
        this.config = config;
        this.executor = executor;
        this.scheduler = scheduler;
    }

    public Mono<Object> submit(String endpoint, Map<String, ?> params) {
        return submit(endpoint, params, RequestPriority.NORMAL);
    }

    public Mono<Object> submit(String endpoint, Map<String, ?> params, RequestPriority priority) {
        return Mono.defer(() -> {
            if (destroyed) {
                return Mono.error(new IllegalStateException("Request batcher destroyed"));
            }
            submitted.incrementAndGet();
            Map<String, Object> copy = params == null
                ? Map.of()
                : Collections.unmodifiableMap(new HashMap<>(params));
            String dedupKey = dedupKey(endpoint, copy);
            Sinks.One<Object> sink = Sinks.one();
            Mono<Object> shared = sink.asMono();
            if (config.isDeduplication()) {
                Mono<Object> existing = inFlight.putIfAbsent(dedupKey, shared);
                if (existing != null) {
                    deduplicated.incrementAndGet();
                    logger.debug("Deduplicated request to {}", endpoint);
                    return existing;
                }
            }
            long now = now();
            BatchRequest request = new BatchRequest(UUID.randomUUID().toString(), endpoint, copy, priority, now,
                now + config.getWait(priority).toMillis(), sequence.incrementAndGet(), dedupKey, sink);
            try {
                enqueue(request);
            } catch (RuntimeException e) {
                logger.error("Failed to enqueue request to {}", endpoint, e);
                fail(request, e);
            }
            return shared;
        });
    }

    private void enqueue(BatchRequest request) {
        EndpointQueue queue = queues.computeIfAbsent(request.getEndpoint(), EndpointQueue::new);
        boolean flushNow;
        synchronized (queue) {
            queue.requests.add(request);
            queue.requests.sort(QUEUE_ORDER);
            flushNow = queue.requests.size() >= config.getMaxBatchSize() || request.getDeadline() <= request.getEnqueuedAt();
            if (!flushNow) {
                queue.armTimer(request.getDeadline());
            }
        }
        if (flushNow) {
            flush(queue);
        }
    }

    /**
     * Flushes every endpoint's pending requests without waiting for their deadlines.
     */
    public void flushAll() {
        for (EndpointQueue queue : queues.values()) {
            boolean flushed;
            do {
                flushed = flush(queue);
            } while (flushed);
        }
    }

    private boolean flush(EndpointQueue queue) {
        List<BatchRequest> batch;
        synchronized (queue) {
            queue.cancelTimer();
            if (queue.requests.isEmpty()) {
                return false;
            }
            int size = Math.min(config.getMaxBatchSize(), queue.requests.size());
            batch = new ArrayList<>(queue.requests.subList(0, size));
            queue.requests.subList(0, size).clear();
            if (!queue.requests.isEmpty()) {
                long earliest = queue.requests.stream().mapToLong(BatchRequest::getDeadline).min().getAsLong();
                queue.armTimer(earliest);
            }
        }
        batchesFlushed.incrementAndGet();
        execute(queue.endpoint, batch);
        return true;
    }

    private void execute(String endpoint, List<BatchRequest> batch) {
        if (!executor.supportsBatch(endpoint)) {
            runIndividually(endpoint, batch);
            return;
        }
        batchCalls.incrementAndGet();
        logger.debug("Executing batch of {} requests to {}", batch.size(), endpoint);
        AtomicBoolean answered = new AtomicBoolean();
        Mono.defer(() -> executor.executeBatch(endpoint, batch))
            .subscribe(results -> {
                answered.set(true);
                List<BatchRequest> missing = new ArrayList<>();
                for (BatchRequest request : batch) {
                    if (results.containsKey(request.getId())) {
                        complete(request, results.get(request.getId()));
                    } else {
                        missing.add(request);
                    }
                }
                if (!missing.isEmpty()) {
                    logger.debug("{} requests missing from batch response of {}, executing individually",
                        missing.size(), endpoint);
                    runIndividually(endpoint, missing);
                }
            }, error -> {
                if (config.isFallbackToIndividual()) {
                    logger.warn("Batch call to {} failed, falling back to individual calls: {}", endpoint,
                        error.getMessage());
                    runIndividually(endpoint, batch);
                } else {
                    logger.warn("Batch call to {} failed, rejecting {} requests: {}", endpoint, batch.size(),
                        error.getMessage());
                    batch.forEach(request -> fail(request, error));
                }
            }, () -> {
                if (!answered.get()) {
                    runIndividually(endpoint, batch);
                }
            });
    }

    private void runIndividually(String endpoint, Collection<BatchRequest> requests) {
        for (BatchRequest request : requests) {
            individualExecutions.incrementAndGet();
            Mono.defer(() -> executor.execute(endpoint, request.getParams()))
                .subscribe(value -> complete(request, value),
                    error -> fail(request, error),
                    () -> complete(request, null));
        }
    }

    private void complete(BatchRequest request, Object value) {
        releaseDedup(request);
        if (value == null) {
            request.result.tryEmitEmpty();
        } else {
            request.result.tryEmitValue(value);
        }
    }

    private void fail(BatchRequest request, Throwable error) {
        releaseDedup(request);
        request.result.tryEmitError(error);
    }

    private void releaseDedup(BatchRequest request) {
        inFlight.computeIfPresent(request.dedupKey, (key, mono) -> null);
    }

    /**
     * Deduplication key: the endpoint plus the parameters with keys sorted at every level.
     */
    static String dedupKey(String endpoint, Map<String, ?> params) {
        return endpoint + ":" + canonical(params == null ? Map.of() : params);
    }

    private static String canonical(Object value) {
        if (value instanceof Map) {
            Map<String, Object> sorted = new TreeMap<>();
            ((Map<?, ?>) value).forEach((k, v) -> sorted.put(String.valueOf(k), v));
            return sorted.entrySet().stream()
                .map(e -> e.getKey() + "=" + canonical(e.getValue()))
                .collect(Collectors.joining(",", "{", "}"));
        }
        if (value instanceof Collection) {
            return ((Collection<?>) value).stream().map(RequestBatcher::canonical).collect(Collectors.joining(",", "[", "]"));
        }
        return Objects.toString(value);
    }

    public BatchStats getStats() {
        int pending = 0;
        for (EndpointQueue queue : queues.values()) {
            synchronized (queue) {
                pending += queue.requests.size();
            }
        }
        return new BatchStats(submitted.get(), deduplicated.get(), batchesFlushed.get(), batchCalls.get(),
            individualExecutions.get(), pending);
    }

    /**
     * Cancels flush timers and rejects every request still queued.
     */
    public void destroy() {
        destroyed = true;
        IllegalStateException error = new IllegalStateException("Request batcher destroyed");
        for (EndpointQueue queue : queues.values()) {
            List<BatchRequest> pending;
            synchronized (queue) {
                queue.cancelTimer();
                pending = new ArrayList<>(queue.requests);
                queue.requests.clear();
            }
            pending.forEach(request -> fail(request, error));
        }
        queues.clear();
        inFlight.clear();
    }

    private long now() {
        return scheduler.now(TimeUnit.MILLISECONDS);
    }

    private final class EndpointQueue {
        final String endpoint;
        final List<BatchRequest> requests = new ArrayList<>();
        Disposable timer;
        long timerDeadline = Long.MAX_VALUE;

        EndpointQueue(String endpoint) {
            this.endpoint = endpoint;
        }

        // caller holds the queue's monitor
        void armTimer(long deadline) {
            if (timer != null && timerDeadline <= deadline) {
                return;
            }
            cancelTimer();
            timerDeadline = deadline;
            long delay = Math.max(0, deadline - now());
            timer = scheduler.schedule(() -> flush(this), delay, TimeUnit.MILLISECONDS);
        }

        void cancelTimer() {
            if (timer != null) {
                timer.dispose();
                timer = null;
            }
            timerDeadline = Long.MAX_VALUE;
        }
    }
}

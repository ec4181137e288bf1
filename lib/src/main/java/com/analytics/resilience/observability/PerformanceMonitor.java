package com.analytics.resilience.observability;

import com.analytics.resilience.config.MonitoringConfig;
import com.analytics.resilience.error.AnalyticsException;
import com.analytics.resilience.model.ConnectionState;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.scheduler.Scheduler;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * Tracks request outcomes, cache hits and connection churn, evaluates performance budgets and raises
 * alerts. Every measurement is also recorded in the Micrometer registry.
 * <p>
 * The performance score weights success rate 40%, latency 30% (10 s counts as zero), cache hit rate
 * 20% and reconnection rate 10%.
 */
public class PerformanceMonitor {

    private static final Logger logger = LoggerFactory.getLogger(PerformanceMonitor.class);
    private static final String PREFIX = "analytics.resilience";
    private static final long METRICS_PUBLISH_INTERVAL_MS = 30_000;
    private static final double LATENCY_SCORE_CEILING_MS = 10_000;

    private final MonitoringConfig config;
    private final MeterRegistry meterRegistry;
    private final Scheduler scheduler;

    private final Map<String, RequestRecord> requests = new LinkedHashMap<>();
    private final Map<PerformanceBudget.Metric, BudgetState> budgets = new LinkedHashMap<>();
    private final List<Consumer<PerformanceAlert>> alertListeners = new CopyOnWriteArrayList<>();
    private final List<Consumer<PerformanceSnapshot>> metricsListeners = new CopyOnWriteArrayList<>();
    private final AtomicLong sequence = new AtomicLong();
    private final AtomicLong connections = new AtomicLong();
    private final AtomicLong reconnections = new AtomicLong();
    private final AtomicLong messages = new AtomicLong();
    private final AtomicInteger scoreGauge = new AtomicInteger(100);

    private final Counter totalRequests;
    private final Counter failedRequests;
    private final Timer requestLatency;
    private final Counter reconnectionCounter;

    private volatile Disposable publisher;

    public PerformanceMonitor(MonitoringConfig config, Scheduler scheduler) {
        this(config, new SimpleMeterRegistry(), scheduler);
    }

    public PerformanceMonitor(MonitoringConfig config, MeterRegistry meterRegistry, Scheduler scheduler) {
        this.config = config;
        this.meterRegistry = meterRegistry;
        this.scheduler = scheduler;

        this.totalRequests = Counter.builder(PREFIX + ".requests.total")
            .description("Total number of analytics requests")
            .register(meterRegistry);
        this.failedRequests = Counter.builder(PREFIX + ".requests.failed")
            .description("Total number of failed analytics requests")
            .register(meterRegistry);
        this.requestLatency = Timer.builder(PREFIX + ".request.latency")
            .description("Analytics request latency")
            .register(meterRegistry);
        this.reconnectionCounter = Counter.builder(PREFIX + ".connection.reconnections")
            .description("Live channel reconnection attempts")
            .register(meterRegistry);
        Gauge.builder(PREFIX + ".performance.score", scoreGauge, AtomicInteger::doubleValue)
            .description("Weighted performance score (0-100)")
            .register(meterRegistry);

        initializeBudgets();
        logger.info("Performance monitor initialized with {} budgets", budgets.size());
    }

    /**
     * Starts publishing snapshots to metrics listeners every 30 seconds.
     */
    public void start() {
        if (publisher == null) {
            publisher = scheduler.schedulePeriodically(this::publishSnapshot, METRICS_PUBLISH_INTERVAL_MS,
                METRICS_PUBLISH_INTERVAL_MS, TimeUnit.MILLISECONDS);
        }
    }

    /**
     * @return an id to pass to {@link #endRequest} or {@link #endRequestWithError}
     */
    public String startRequest(String operation) {
        String id = operation + "-" + sequence.incrementAndGet();
        synchronized (this) {
            requests.put(id, new RequestRecord(operation, now()));
            cleanupOldRequests();
        }
        return id;
    }

    public void endRequest(String id, boolean cacheHit) {
        if (complete(id, true, cacheHit, 0)) {
            recordCacheOperation(cacheHit);
            afterRequest();
        }
    }

    public void endRequestWithError(String id, AnalyticsException error, int retryCount) {
        if (complete(id, false, false, retryCount)) {
            logger.debug("Request {} failed with {}: {}", id, error.getType(), error.getMessage());
            afterRequest();
        }
    }

    /**
     * Feeds live channel state changes into the connection and reconnection rates.
     */
    public void recordConnectionState(ConnectionState state) {
        if (state == ConnectionState.CONNECTED) {
            connections.incrementAndGet();
        } else if (state == ConnectionState.RECONNECTING) {
            reconnections.incrementAndGet();
            reconnectionCounter.increment();
        }
    }

    public void recordMessage() {
        messages.incrementAndGet();
    }

    public void recordCacheOperation(boolean hit) {
        Counter.builder(PREFIX + ".cache.lookups")
            .tag("hit", String.valueOf(hit))
            .description("Cache lookups served to callers")
            .register(meterRegistry)
            .increment();
    }

    public void recordCircuitBreakerEvent(String operation, String event) {
        Counter.builder(PREFIX + ".circuit_breaker")
            .tag("operation", operation)
            .tag("event", event)
            .description("Circuit breaker events")
            .register(meterRegistry)
            .increment();
    }

    public synchronized PerformanceSnapshot getSnapshot() {
        long now = now();
        long retention = config.getMetricsRetention().toMillis();
        int total = 0;
        int successful = 0;
        int cacheHits = 0;
        int retries = 0;
        long totalDuration = 0;
        for (RequestRecord record : requests.values()) {
            if (record.endTime < 0 || now - record.endTime >= retention) {
                continue;
            }
            total++;
            totalDuration += record.endTime - record.startTime;
            retries += record.retryCount;
            if (record.success) {
                successful++;
            }
            if (record.cacheHit) {
                cacheHits++;
            }
        }
        double avgLatency = total > 0 ? (double) totalDuration / total : 0;
        double successRate = total > 0 ? (double) successful / total : 1;
        double errorRate = total > 0 ? (double) (total - successful) / total : 0;
        double cacheHitRate = total > 0 ? (double) cacheHits / total : 0;
        long connectionCount = connections.get();
        double reconnectionRate = connectionCount > 0 ? (double) reconnections.get() / connectionCount : 0;
        int score = score(successRate, avgLatency, cacheHitRate, reconnectionRate);
        int violations = (int) budgets.values().stream().filter(b -> b.violated).count();
        return new PerformanceSnapshot(avgLatency, total, successRate, errorRate, retries, connectionCount,
            reconnections.get(), messages.get(), cacheHitRate, 1 - cacheHitRate, violations, score);
    }

    public int getPerformanceScore() {
        return getSnapshot().performanceScore();
    }

    public synchronized List<PerformanceBudget> getBudgets() {
        List<PerformanceBudget> result = new ArrayList<>();
        for (Map.Entry<PerformanceBudget.Metric, BudgetState> entry : budgets.entrySet()) {
            BudgetState state = entry.getValue();
            result.add(new PerformanceBudget(state.name, entry.getKey(), state.threshold, state.current,
                state.violated, state.violationCount, state.lastViolation));
        }
        return result;
    }

    public void addAlertListener(Consumer<PerformanceAlert> listener) {
        alertListeners.add(listener);
    }

    public void removeAlertListener(Consumer<PerformanceAlert> listener) {
        alertListeners.remove(listener);
    }

    public void addMetricsListener(Consumer<PerformanceSnapshot> listener) {
        metricsListeners.add(listener);
    }

    public void removeMetricsListener(Consumer<PerformanceSnapshot> listener) {
        metricsListeners.remove(listener);
    }

    public synchronized void clearMetrics() {
        requests.clear();
        connections.set(0);
        reconnections.set(0);
        messages.set(0);
        budgets.values().forEach(BudgetState::reset);
        scoreGauge.set(100);
        logger.info("Performance metrics cleared");
    }

    public MeterRegistry getMeterRegistry() {
        return meterRegistry;
    }

    public MonitoringConfig getConfig() {
        return config;
    }

    public void destroy() {
        Disposable current = publisher;
        publisher = null;
        if (current != null) {
            current.dispose();
        }
        synchronized (this) {
            requests.clear();
        }
        alertListeners.clear();
        metricsListeners.clear();
    }

    static int score(double successRate, double avgLatencyMs, double cacheHitRate, double reconnectionRate) {
        double latency = Math.max(0, 1 - avgLatencyMs / LATENCY_SCORE_CEILING_MS);
        double reconnection = Math.max(0, 1 - reconnectionRate);
        double weighted = successRate * 0.4 + latency * 0.3 + cacheHitRate * 0.2 + reconnection * 0.1;
        return (int) Math.round(weighted * 100);
    }

    private boolean complete(String id, boolean success, boolean cacheHit, int retryCount) {
        long duration;
        synchronized (this) {
            RequestRecord record = requests.get(id);
            if (record == null || record.endTime >= 0) {
                return false;
            }
            record.endTime = now();
            record.success = success;
            record.cacheHit = cacheHit;
            record.retryCount = retryCount;
            duration = record.endTime - record.startTime;
        }
        totalRequests.increment();
        if (!success) {
            failedRequests.increment();
        }
        requestLatency.record(Duration.ofMillis(duration));
        return true;
    }

    private void afterRequest() {
        PerformanceSnapshot snapshot = getSnapshot();
        scoreGauge.set(snapshot.performanceScore());
        List<PerformanceAlert> alerts = new ArrayList<>(updateBudgets(snapshot));
        alerts.addAll(checkAlerts(snapshot));
        alerts.forEach(this::triggerAlert);
    }

    private synchronized List<PerformanceAlert> updateBudgets(PerformanceSnapshot snapshot) {
        List<PerformanceAlert> alerts = new ArrayList<>();
        for (Map.Entry<PerformanceBudget.Metric, BudgetState> entry : budgets.entrySet()) {
            PerformanceBudget.Metric metric = entry.getKey();
            BudgetState budget = entry.getValue();
            double value = metric.valueOf(snapshot);
            budget.current = value;
            boolean violated = metric.isViolatedBy(value, budget.threshold);
            if (violated && !budget.violated) {
                budget.violated = true;
                budget.violationCount++;
                budget.lastViolation = Instant.ofEpochMilli(now());
                Map<String, Object> details = new LinkedHashMap<>();
                details.put("budget", budget.name);
                details.put("threshold", budget.threshold);
                details.put("current", value);
                details.put("violationCount", budget.violationCount);
                alerts.add(alert(AlertType.BUDGET_VIOLATION, "Performance budget violated: " + budget.name,
                    details, AlertSeverity.WARNING));
            } else if (!violated && budget.violated) {
                budget.violated = false;
            }
        }
        return alerts;
    }

    private synchronized List<PerformanceAlert> checkAlerts(PerformanceSnapshot snapshot) {
        List<PerformanceAlert> alerts = new ArrayList<>();
        int threshold = config.getConsecutiveFailureAlertThreshold();
        int trailingFailures = trailingFailures(threshold);
        if (trailingFailures >= threshold) {
            alerts.add(alert(AlertType.CONSECUTIVE_FAILURES,
                threshold + " consecutive request failures detected",
                Map.of("consecutiveFailures", trailingFailures), AlertSeverity.ERROR));
        }
        if (snapshot.requestLatency() > config.getHighLatencyAlertMs()) {
            alerts.add(alert(AlertType.HIGH_LATENCY,
                "High request latency detected: " + Math.round(snapshot.requestLatency()) + "ms",
                Map.of("latency", snapshot.requestLatency(), "threshold", config.getHighLatencyAlertMs()),
                AlertSeverity.WARNING));
        }
        if (snapshot.successRate() < config.getLowSuccessRateAlert()) {
            alerts.add(alert(AlertType.LOW_SUCCESS_RATE,
                "Low success rate detected: " + Math.round(snapshot.successRate() * 100) + "%",
                Map.of("successRate", snapshot.successRate(), "threshold", config.getLowSuccessRateAlert()),
                AlertSeverity.ERROR));
        }
        return alerts;
    }

    /**
     * Number of failures at the tail of the completed requests, counting at most {@code limit}.
     */
    private int trailingFailures(int limit) {
        List<RequestRecord> completed = new ArrayList<>();
        for (RequestRecord record : requests.values()) {
            if (record.endTime >= 0) {
                completed.add(record);
            }
        }
        int count = 0;
        for (int i = completed.size() - 1; i >= 0 && count < limit; i--) {
            if (completed.get(i).success) {
                break;
            }
            count++;
        }
        return count;
    }

    private PerformanceAlert alert(AlertType type, String message, Map<String, Object> details,
                                   AlertSeverity severity) {
        return new PerformanceAlert(type, message, details, severity, Instant.ofEpochMilli(now()));
    }

    private void triggerAlert(PerformanceAlert alert) {
        logger.warn("Performance alert triggered: {}", alert);
        Counter.builder(PREFIX + ".alerts")
            .tag("type", alert.getType().name().toLowerCase())
            .tag("severity", alert.getSeverity().name().toLowerCase())
            .description("Performance alerts raised")
            .register(meterRegistry)
            .increment();
        for (Consumer<PerformanceAlert> listener : alertListeners) {
            try {
                listener.accept(alert);
            } catch (RuntimeException e) {
                logger.error("Error in alert listener", e);
            }
        }
    }

    private void publishSnapshot() {
        PerformanceSnapshot snapshot = getSnapshot();
        for (Consumer<PerformanceSnapshot> listener : metricsListeners) {
            try {
                listener.accept(snapshot);
            } catch (RuntimeException e) {
                logger.error("Error in metrics listener", e);
            }
        }
    }

    private void initializeBudgets() {
        budgets.put(PerformanceBudget.Metric.REQUEST_LATENCY,
            new BudgetState("Request Latency", config.getLatencyBudgetMs()));
        budgets.put(PerformanceBudget.Metric.SUCCESS_RATE,
            new BudgetState("Success Rate", config.getSuccessRateBudget()));
        budgets.put(PerformanceBudget.Metric.ERROR_RATE,
            new BudgetState("Error Rate", config.getErrorRateBudget()));
        budgets.put(PerformanceBudget.Metric.CACHE_MISS_RATE,
            new BudgetState("Cache Miss Rate", config.getCacheMissRateBudget()));
    }

    private void cleanupOldRequests() {
        long cutoff = now() - config.getMetricsRetention().toMillis();
        requests.values().removeIf(r -> r.endTime >= 0 && r.endTime < cutoff);
        Iterator<String> oldest = requests.keySet().iterator();
        while (requests.size() > config.getMaxStoredRequests() && oldest.hasNext()) {
            oldest.next();
            oldest.remove();
        }
    }

    private long now() {
        return scheduler.now(TimeUnit.MILLISECONDS);
    }

    private static final class RequestRecord {
        private final String operation;
        private final long startTime;
        private long endTime = -1;
        private boolean success;
        private boolean cacheHit;
        private int retryCount;

        private RequestRecord(String operation, long startTime) {
            this.operation = operation;
            this.startTime = startTime;
        }

        @Override
        public String toString() {
            return operation + "@" + startTime;
        }
    }

    private static final class BudgetState {
        private final String name;
        private final double threshold;
        private double current;
        private boolean violated;
        private int violationCount;
        private Instant lastViolation;

        private BudgetState(String name, double threshold) {
            this.name = name;
            this.threshold = threshold;
        }

        private void reset() {
            current = 0;
            violated = false;
            violationCount = 0;
            lastViolation = null;
        }
    }
}

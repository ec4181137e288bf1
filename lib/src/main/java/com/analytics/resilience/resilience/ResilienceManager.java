package com.analytics.resilience.resilience;

import com.analytics.resilience.cache.AnalyticsCache;
import com.analytics.resilience.config.ResilienceConfig;
import com.analytics.resilience.degradation.DegradationListener;
import com.analytics.resilience.degradation.DegradationManager;
import com.analytics.resilience.degradation.DegradationState;
import com.analytics.resilience.degradation.HealthCheck;
import com.analytics.resilience.error.AnalyticsErrors;
import com.analytics.resilience.error.AnalyticsException;
import com.analytics.resilience.error.ErrorHandler;
import com.analytics.resilience.error.ErrorType;
import com.analytics.resilience.model.CircuitState;
import com.analytics.resilience.model.DataResult;
import com.analytics.resilience.model.DataSource;
import com.analytics.resilience.model.DegradationLevel;
import com.analytics.resilience.model.HealthStatus;
import com.analytics.resilience.observability.PerformanceAlert;
import com.analytics.resilience.observability.PerformanceMonitor;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.retry.RetryRegistry;
import io.micrometer.core.instrument.Gauge;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.core.scheduler.Scheduler;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * Single entry point combining circuit breakers, retries, graceful degradation and performance
 * monitoring around analytics operations.
 * <p>
 * Every call is routed through the degradation manager, which decides whether to fetch live or to
 * serve cache, fallback or placeholder data. Consecutive failures raise the degradation level in
 * steps; each failure class has a ceiling it can never push the level past.
 */
public class ResilienceManager {

    private static final Logger logger = LoggerFactory.getLogger(ResilienceManager.class);
    private static final int MAX_RECENT_ERRORS = 10;
    private static final int HEALTHY_SCORE = 70;

    private final ResilienceConfig config;
    private final PerformanceMonitor monitor;
    private final CircuitBreakerRegistry circuitBreakers;
    private final DegradationManager degradation;
    private final RetryRegistry retryRegistry;
    private final ErrorHandler errorHandler;
    private final Scheduler scheduler;
    private final AtomicBoolean destroyed = new AtomicBoolean();
    private final Sinks.One<Boolean> shutdown = Sinks.one();
    private final List<ResilienceStateListener> listeners = new CopyOnWriteArrayList<>();
    private final LinkedList<AnalyticsException> recentErrors = new LinkedList<>();
    private final AtomicInteger consecutiveFailures = new AtomicInteger();
    private final DegradationListener degradationListener = this::onDegradationChange;
    private final Consumer<PerformanceAlert> alertListener = this::onPerformanceAlert;

    private volatile ResilienceState state;

    public ResilienceManager(ResilienceConfig config, AnalyticsCache cache, PerformanceMonitor monitor,
                             Scheduler scheduler) {
        this.config = config;
        this.monitor = monitor;
        this.scheduler = scheduler;
        this.circuitBreakers = new CircuitBreakerRegistry(config.getCircuitBreakerConfig(), scheduler);
        this.degradation = new DegradationManager(config.getDegradationConfig().toBuilder()
            .healthCheckInterval(config.getHealthCheckInterval())
            .escalateOnFetchError(false)
            .build(), cache, scheduler);
        this.errorHandler = new ErrorHandler(config.getMaxRetryAttempts() + 1, config.getRetryBaseDelay(),
            config.getMaxRetryDelay());
        this.retryRegistry = RetryRegistry.of(createRetryConfig());
        retryRegistry.getEventPublisher().onEntryAdded(added -> added.getAddedEntry().getEventPublisher()
            .onRetry(event -> logger.debug("Retrying {} (attempt {}) after {}: {}", event.getName(),
                event.getNumberOfRetryAttempts(), event.getWaitInterval(),
                event.getLastThrowable() != null ? event.getLastThrowable().getMessage() : "unknown")));

        circuitBreakers.addEventListener(this::onCircuitBreakerEvent);
        degradation.addListener(degradationListener);
        monitor.addAlertListener(alertListener);

        Gauge.builder("analytics.resilience.health.score", this, m -> m.getState().healthScore())
            .description("Aggregated resilience health score (0-100)")
            .register(monitor.getMeterRegistry());
        Gauge.builder("analytics.resilience.degradation.level", degradation, d -> d.getLevel().ordinal())
            .description("Current degradation level (0 = optimal, 4 = complete)")
            .register(monitor.getMeterRegistry());

        this.state = computeState();
        logger.info("Resilience manager initialized: {}", config);
    }

    private RetryConfig createRetryConfig() {
        return RetryConfig.custom()
            .maxAttempts(config.getMaxRetryAttempts() + 1)
            .retryOnException(ResilienceManager::isRetryable)
            .intervalBiFunction((attempt, outcome) -> outcome.isLeft()
                ? errorHandler.retryDelay(AnalyticsErrors.classify(outcome.getLeft()), attempt).toMillis()
                : config.getRetryBaseDelay().toMillis())
            .build();
    }

    static boolean isRetryable(Throwable throwable) {
        if (throwable instanceof AnalyticsException.CircuitOpenException) {
            return false;
        }
        AnalyticsException error = AnalyticsErrors.classify(throwable);
        if (!error.isRecoverable()) {
            return false;
        }
        return switch (error.getType()) {
            case NETWORK, SERVICE, TIMEOUT -> true;
            case AUTHENTICATION, AUTHORIZATION, VALIDATION -> false;
        };
    }

    public void start() {
        degradation.start();
    }

    public <T> Mono<DataResult<T>> execute(String operationName, Supplier<Mono<T>> operation) {
        return execute(operationName, operation, null, null);
    }

    public <T> Mono<DataResult<T>> execute(String operationName, Supplier<Mono<T>> operation, T fallback) {
        return execute(operationName, operation, fallback, null);
    }

    /**
     * Runs an operation with the full resilience stack.
     *
     * @param cacheKey key the result is cached under; defaults to the operation name
     * @return the data together with where it came from. Errors only when nothing at all can be served,
     * or immediately for authentication, authorization and validation failures.
     */
    public <T> Mono<DataResult<T>> execute(String operationName, Supplier<Mono<T>> operation, T fallback,
                                           String cacheKey) {
        return Mono.defer(() -> {
            String requestId = config.isPerformanceMonitoringEnabled() ? monitor.startRequest(operationName) : null;
            AtomicBoolean attempted = new AtomicBoolean();
            AtomicInteger attempts = new AtomicInteger();

            Supplier<Mono<T>> guarded = () -> {
                attempted.set(true);
                Mono<T> call = Mono.defer(() -> {
                    attempts.incrementAndGet();
                    return protect(operationName, operation);
                });
                if (config.isRetryEnabled()) {
                    call = withRetry(call, retryRegistry.retry(operationName));
                }
                return call;
            };

            String key = cacheKey != null ? cacheKey : operationName;
            return degradation.getData(key, guarded, fallback)
                .onErrorResume(error -> {
                    AnalyticsException classified = AnalyticsErrors.classify(error);
                    recordFailure(requestId, operationName, classified, retries(attempts));
                    return Mono.error(isPassThrough(classified) ? userFacing(classified) : classified);
                })
                .flatMap(result -> {
                    Optional<Throwable> error = result.getError();
                    if (error.isPresent()) {
                        AnalyticsException classified = AnalyticsErrors.classify(error.get());
                        recordFailure(requestId, operationName, classified, retries(attempts));
                        if (isPassThrough(classified)) {
                            return Mono.error(userFacing(classified));
                        }
                    } else if (attempted.get() && result.isLive()) {
                        recordSuccess(requestId);
                    } else {
                        endRequest(requestId, result.getSource() == DataSource.CACHE);
                    }
                    return Mono.just(result);
                });
        });
    }

    private <T> Mono<T> protect(String operationName, Supplier<Mono<T>> operation) {
        if (config.isCircuitBreakerEnabled()) {
            return circuitBreakers.execute(operationName, operation);
        }
        return Mono.defer(operation);
    }

    /**
     * Retries on the client scheduler so waits follow its clock and stop when the manager is destroyed.
     */
    private <T> Mono<T> withRetry(Mono<T> call, Retry retry) {
        return Mono.defer(() -> {
            Retry.AsyncContext<T> context = retry.asyncContext();
            return call
                .retryWhen(reactor.util.retry.Retry.from(signals -> signals
                    .concatMap(signal -> retryDelay(context, signal.failure()))))
                .doOnSuccess(value -> context.onComplete());
        });
    }

    private Mono<Long> retryDelay(Retry.AsyncContext<?> context, Throwable error) {
        long delayMillis = context.onError(error);
        if (delayMillis < 1 || destroyed.get()) {
            return Mono.error(error);
        }
        return Mono.delay(Duration.ofMillis(delayMillis), scheduler)
            .takeUntilOther(shutdown.asMono())
            .switchIfEmpty(Mono.error(error));
    }

    private static int retries(AtomicInteger attempts) {
        return Math.max(0, attempts.get() - 1);
    }

    private static boolean isPassThrough(AnalyticsException error) {
        return error.getType() == ErrorType.AUTHENTICATION
            || error.getType() == ErrorType.AUTHORIZATION
            || error.getType() == ErrorType.VALIDATION;
    }

    static AnalyticsException userFacing(AnalyticsException error) {
        AnalyticsException.Options options = AnalyticsException.options()
            .code(error.getCode())
            .correlationId(error.getCorrelationId())
            .detail("originalMessage", error.getMessage());
        String message = ErrorHandler.userMessage(error);
        return switch (error.getType()) {
            case AUTHENTICATION -> new AnalyticsException.AuthenticationException(message, options);
            case AUTHORIZATION -> new AnalyticsException.AuthorizationException(message, options);
            default -> new AnalyticsException.ValidationException(message, options);
        };
    }

    private void recordSuccess(String requestId) {
        consecutiveFailures.set(0);
        endRequest(requestId, false);
        updateState();
    }

    private void endRequest(String requestId, boolean cacheHit) {
        if (requestId != null) {
            monitor.endRequest(requestId, cacheHit);
        }
    }

    private void recordFailure(String requestId, String operationName, AnalyticsException error, int retryCount) {
        // pass-through failures leave the streak unchanged
        int failures = isPassThrough(error) ? consecutiveFailures.get() : consecutiveFailures.incrementAndGet();
        synchronized (recentErrors) {
            recentErrors.addFirst(error);
            while (recentErrors.size() > MAX_RECENT_ERRORS) {
                recentErrors.removeLast();
            }
        }
        logger.warn("Operation {} failed ({} consecutive): type={}, message={}",
            operationName, failures, error.getType(), error.getMessage());
        if (requestId != null) {
            monitor.endRequestWithError(requestId, error, retryCount);
        }
        if (config.isGracefulDegradationEnabled() && !isPassThrough(error)) {
            escalate(failures, error.getType());
        }
        updateState();
    }

    private void escalate(int failures, ErrorType type) {
        DegradationLevel target;
        String reason;
        if (failures >= config.getCriticalDegradationThreshold()) {
            target = DegradationLevel.CRITICAL;
            reason = "Critical failure threshold reached";
        } else if (failures >= config.getSignificantDegradationThreshold()) {
            target = DegradationLevel.SIGNIFICANT;
            reason = "Significant failure threshold reached";
        } else if (failures >= config.getPartialDegradationThreshold()) {
            target = DegradationLevel.PARTIAL;
            reason = "Partial failure threshold reached";
        } else {
            return;
        }
        DegradationLevel ceiling = DegradationManager.escalationCeiling(type);
        if (target.isWorseThan(ceiling)) {
            target = ceiling;
        }
        if (target.isWorseThan(degradation.getLevel())) {
            degradation.setLevel(target, reason);
        }
    }

    private void onDegradationChange(DegradationState previous, DegradationState current) {
        if (current.getLevel() == DegradationLevel.OPTIMAL) {
            consecutiveFailures.set(0);
        }
        updateState();
    }

    private void onPerformanceAlert(PerformanceAlert alert) {
        if (alert.getSeverity().isSevere() && degradation.getLevel() == DegradationLevel.OPTIMAL
            && config.isGracefulDegradationEnabled()) {
            degradation.setLevel(DegradationLevel.PARTIAL, "Performance alert: " + alert.getMessage());
        }
    }

    private void onCircuitBreakerEvent(CircuitBreakerEvent event) {
        if (config.isPerformanceMonitoringEnabled()) {
            monitor.recordCircuitBreakerEvent(event.getCircuitBreakerName(),
                event.getType().name().toLowerCase(Locale.ROOT));
        }
        if (event.getType() == CircuitBreakerEvent.Type.STATE_CHANGE) {
            updateState();
        }
    }

    public void setHealthCheck(HealthCheck healthCheck) {
        degradation.setHealthCheck(healthCheck);
    }

    /**
     * Runs the degradation health check once; a healthy result restores the optimal level.
     */
    public Mono<HealthStatus> checkHealth() {
        return degradation.checkHealth().doOnNext(status -> updateState());
    }

    public ResilienceState getState() {
        return state;
    }

    public int getHealthScore() {
        return state.healthScore();
    }

    public boolean isHealthy() {
        return state.healthy();
    }

    public List<String> getRecommendations() {
        return state.recommendations();
    }

    public int getConsecutiveFailures() {
        return consecutiveFailures.get();
    }

    public List<AnalyticsException> getRecentErrors() {
        synchronized (recentErrors) {
            return List.copyOf(recentErrors);
        }
    }

    public CircuitBreakerRegistry getCircuitBreakers() {
        return circuitBreakers;
    }

    public DegradationManager getDegradationManager() {
        return degradation;
    }

    public PerformanceMonitor getPerformanceMonitor() {
        return monitor;
    }

    public ErrorHandler getErrorHandler() {
        return errorHandler;
    }

    public ResilienceConfig getConfig() {
        return config;
    }

    public void addStateListener(ResilienceStateListener listener) {
        listeners.add(listener);
    }

    public void removeStateListener(ResilienceStateListener listener) {
        listeners.remove(listener);
    }

    /**
     * Clears failure tracking, returns to the optimal level and drops collected metrics.
     * Circuit breakers keep their state.
     */
    public void reset() {
        consecutiveFailures.set(0);
        synchronized (recentErrors) {
            recentErrors.clear();
        }
        degradation.reset();
        monitor.clearMetrics();
        updateState();
        logger.info("Resilience state reset");
    }

    public void destroy() {
        if (!destroyed.compareAndSet(false, true)) {
            return;
        }
        shutdown.tryEmitValue(Boolean.TRUE);
        monitor.removeAlertListener(alertListener);
        degradation.removeListener(degradationListener);
        degradation.destroy();
        circuitBreakers.destroy();
        listeners.clear();
        logger.info("Resilience manager destroyed");
    }

    private void updateState() {
        ResilienceState next = computeState();
        state = next;
        for (ResilienceStateListener listener : listeners) {
            try {
                listener.onStateChange(next);
            } catch (RuntimeException e) {
                logger.error("Resilience state listener failed", e);
            }
        }
    }

    private ResilienceState computeState() {
        DegradationLevel level = degradation.getLevel();
        CircuitState circuitState = aggregateCircuitState(circuitBreakers.getAllStates().values());
        int performanceScore = 100;
        double errorRate = 0;
        if (config.isPerformanceMonitoringEnabled()) {
            var snapshot = monitor.getSnapshot();
            performanceScore = snapshot.performanceScore();
            errorRate = snapshot.errorRate();
        }
        int failures = consecutiveFailures.get();
        int score = healthScore(level, performanceScore, circuitState, failures);
        return new ResilienceState(
            score >= HEALTHY_SCORE,
            score,
            level,
            circuitState,
            performanceScore,
            getRecentErrors(),
            errorRate,
            failures,
            degradation.getStatusMessage(),
            recommendations(level, performanceScore, errorRate, circuitState, failures));
    }

    static CircuitState aggregateCircuitState(Collection<CircuitState> states) {
        if (states.contains(CircuitState.OPEN)) {
            return CircuitState.OPEN;
        }
        if (states.contains(CircuitState.HALF_OPEN)) {
            return CircuitState.HALF_OPEN;
        }
        return CircuitState.CLOSED;
    }

    static int healthScore(DegradationLevel level, int performanceScore, CircuitState circuitState,
                           int consecutiveFailures) {
        double score = 100;
        score -= switch (level) {
            case OPTIMAL -> 0;
            case PARTIAL -> 20;
            case SIGNIFICANT -> 40;
            case CRITICAL -> 70;
            case COMPLETE -> 100;
        };
        score -= (100 - performanceScore) * 0.3;
        score -= switch (circuitState) {
            case OPEN -> 30;
            case HALF_OPEN -> 15;
            case CLOSED -> 0;
        };
        score -= Math.min(30, consecutiveFailures * 2);
        return (int) Math.round(Math.max(0, Math.min(100, score)));
    }

    static List<String> recommendations(DegradationLevel level, int performanceScore, double errorRate,
                                        CircuitState circuitState, int consecutiveFailures) {
        List<String> recommendations = new ArrayList<>();
        if (level != DegradationLevel.OPTIMAL) {
            recommendations.add("Service is degraded - consider checking network connectivity");
        }
        if (performanceScore < 80) {
            recommendations.add("Performance is below optimal - consider clearing cache or reducing load");
        }
        if (errorRate > 0.1) {
            recommendations.add("High error rate detected - check service logs and configuration");
        }
        if (circuitState == CircuitState.OPEN) {
            recommendations.add("Circuit breaker is open - service will recover automatically");
        }
        if (consecutiveFailures > 5) {
            recommendations.add("Multiple consecutive failures - consider manual intervention");
        }
        return List.copyOf(recommendations);
    }
}

package com.analytics.resilience.degradation;

import com.analytics.resilience.cache.AnalyticsCache;
import com.analytics.resilience.cache.CachedValue;
import com.analytics.resilience.config.CacheStrategy;
import com.analytics.resilience.config.DegradationConfig;
import com.analytics.resilience.error.AnalyticsErrors;
import com.analytics.resilience.error.AnalyticsException;
import com.analytics.resilience.error.ErrorType;
import com.analytics.resilience.model.AnalyticsFeature;
import com.analytics.resilience.model.DataResult;
import com.analytics.resilience.model.DataSource;
import com.analytics.resilience.model.DegradationLevel;
import com.analytics.resilience.model.HealthStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Serves analytics data according to the current degradation level.
 * <p>
 * The level only rises on evidence (fetch or health check errors, or an explicit
 * {@link #setLevel}) and only falls on a healthy health check or {@link #reset()}, which
 * return straight to {@link DegradationLevel#OPTIMAL}.
 */
public class DegradationManager {

    private static final Logger logger = LoggerFactory.getLogger(DegradationManager.class);

    private final DegradationConfig config;
    private final AnalyticsCache cache;
    private final Scheduler scheduler;
    private final CacheStrategy defaultStrategy;
    private final List<DegradationListener> listeners = new CopyOnWriteArrayList<>();

    private volatile DegradationState state;
    private volatile HealthCheck healthCheck;
    private volatile Disposable healthCheckTask;

    public DegradationManager(DegradationConfig config, AnalyticsCache cache, Scheduler scheduler) {
        this.config = config;
        this.cache = cache;
        this.scheduler = scheduler;
        this.defaultStrategy = CacheStrategy.builder("")
            .ttl(config.getStaleDataTtl())
            .staleTime(config.getFreshDataTtl())
            .build();
        this.state = new DegradationState(DegradationLevel.OPTIMAL, "Service operating normally", now(), List.of(),
            null, CacheStatus.UNAVAILABLE);
    }

    public void setHealthCheck(HealthCheck healthCheck) {
        this.healthCheck = healthCheck;
    }

    /**
     * Starts the periodic health check that restores {@link DegradationLevel#OPTIMAL}.
     */
    public void start() {
        if (healthCheckTask != null) {
            return;
        }
        long intervalMs = config.getHealthCheckInterval().toMillis();
        healthCheckTask = scheduler.schedulePeriodically(() -> checkHealth().subscribe(), intervalMs, intervalMs,
            TimeUnit.MILLISECONDS);
        logger.debug("Degradation health check started every {}ms", intervalMs);
    }

    public void stop() {
        Disposable task = healthCheckTask;
        if (task != null) {
            task.dispose();
            healthCheckTask = null;
        }
    }

    public <T> Mono<DataResult<T>> getData(String key, Supplier<Mono<T>> fetcher, T fallback) {
        return Mono.defer(() -> {
            DegradationLevel level = state.getLevel();
            return switch (level) {
                case OPTIMAL -> fetchLive(key, fetcher, fallback, level, false);
                case PARTIAL -> getPartialData(key, fetcher, fallback);
                case SIGNIFICANT -> fromCacheOrFallback(key, fallback, level, null)
                    .map(Mono::just)
                    .orElseGet(() -> Mono.error(noData(key, "No cached or fallback data available")));
                case CRITICAL -> fromCacheOrFallback(key, fallback, level, null)
                    .or(() -> this.<T>placeholder(key, level))
                    .map(Mono::just)
                    .orElseGet(() -> Mono.error(noData(key, "No data available in critical degradation mode")));
                case COMPLETE -> this.<T>fallback(fallback, level, null)
                    .or(() -> this.<T>placeholder(key, level))
                    .map(Mono::just)
                    .orElseGet(() -> Mono.error(noData(key, "Analytics service completely unavailable")));
            };
        });
    }

    private <T> Mono<DataResult<T>> getPartialData(String key, Supplier<Mono<T>> fetcher, T fallback) {
        Optional<CachedValue> cached = freshEnough(key);
        if (cached.isPresent() && !cached.get().isStale()) {
            return Mono.just(this.<T>fromCache(cached.get(), DegradationLevel.PARTIAL, null));
        }
        return fetchLive(key, fetcher, fallback, DegradationLevel.PARTIAL, true);
    }

    private <T> Mono<DataResult<T>> fetchLive(String key, Supplier<Mono<T>> fetcher, T fallback,
                                              DegradationLevel level, boolean bounded) {
        Mono<T> call = Mono.defer(fetcher);
        if (bounded) {
            long timeoutMs = config.getHealthCheckTimeout().toMillis();
            call = call.timeout(config.getHealthCheckTimeout(), scheduler)
                .onErrorMap(TimeoutException.class,
                    e -> new AnalyticsException.RequestTimeoutException(timeoutMs));
        }
        return call
            .map(data -> {
                store(key, data, level);
                return DataResult.<T>builder()
                    .data(data)
                    .source(DataSource.LIVE)
                    .degraded(level != DegradationLevel.OPTIMAL)
                    .timestamp(now())
                    .degradationLevel(level)
                    .build();
            })
            .onErrorResume(error -> handleFetchError(key, error, fallback));
    }

    private <T> Mono<DataResult<T>> handleFetchError(String key, Throwable error, T fallback) {
        AnalyticsException classified = AnalyticsErrors.classify(error);
        logger.debug("Fetch for {} failed: {}", key, classified.getMessage());
        if (config.isEscalateOnFetchError()) {
            escalate(classified);
        }
        DegradationLevel level = state.getLevel();
        return fromCacheOrFallback(key, fallback, level, classified)
            .map(Mono::just)
            .orElseGet(() -> Mono.error(classified));
    }

    private <T> Optional<DataResult<T>> fromCacheOrFallback(String key, T fallback, DegradationLevel level,
                                                            Throwable error) {
        Optional<DataResult<T>> cached = freshEnough(key).map(value -> this.<T>fromCache(value, level, error));
        return cached.isPresent() ? cached : fallback(fallback, level, error);
    }

    private Optional<CachedValue> freshEnough(String key) {
        return cache.get(key).filter(value -> value.getAgeMs() <= config.getMaxCacheAge().toMillis());
    }

    @SuppressWarnings("unchecked")
    private <T> DataResult<T> fromCache(CachedValue cached, DegradationLevel level, Throwable error) {
        return DataResult.<T>builder()
            .data((T) cached.getValue())
            .source(DataSource.CACHE)
            .degraded(true)
            .timestamp(cached.getCapturedAt())
            .expiresAt(cached.getExpiresAt())
            .degradationLevel(level)
            .error(error)
            .build();
    }

    private <T> Optional<DataResult<T>> fallback(T fallback, DegradationLevel level, Throwable error) {
        if (fallback == null) {
            return Optional.empty();
        }
        return Optional.of(DataResult.<T>builder()
            .data(fallback)
            .source(DataSource.FALLBACK)
            .degraded(true)
            .timestamp(now())
            .degradationLevel(level)
            .error(error)
            .build());
    }

    /**
     * The placeholder is a {@code Map}; callers asking for another payload type get a
     * {@link ClassCastException} when they read it.
     */
    @SuppressWarnings("unchecked")
    private <T> Optional<DataResult<T>> placeholder(String key, DegradationLevel level) {
        if (!config.isPlaceholderDataEnabled()) {
            return Optional.empty();
        }
        Instant now = now();
        return Optional.of(DataResult.<T>builder()
            .data((T) PlaceholderDataFactory.create(key, now))
            .source(DataSource.PLACEHOLDER)
            .degraded(true)
            .timestamp(now)
            .degradationLevel(level)
            .build());
    }

    private void store(String key, Object data, DegradationLevel level) {
        CacheStrategy override = cache.getStrategy(key).isPresent() ? null : defaultStrategy;
        cache.set(key, data, DataSource.LIVE, level, override);
        refreshCacheStatus();
    }

    private static AnalyticsException noData(String key, String message) {
        return new AnalyticsException.ServiceException(message,
            AnalyticsException.options().code("NO_DATA_AVAILABLE").detail("key", key), null);
    }

    /**
     * Highest level an error of the given class may push the manager to.
     * {@link DegradationLevel#OPTIMAL} means the class never escalates.
     */
    public static DegradationLevel escalationCeiling(ErrorType type) {
        return switch (type) {
            case NETWORK, TIMEOUT -> DegradationLevel.SIGNIFICANT;
            case SERVICE -> DegradationLevel.CRITICAL;
            case AUTHENTICATION, AUTHORIZATION, VALIDATION -> DegradationLevel.OPTIMAL;
        };
    }

    /**
     * Raises the level by one step unless the error's class is already at its ceiling.
     */
    public boolean escalate(AnalyticsException error) {
        DegradationLevel current = state.getLevel();
        DegradationLevel ceiling = escalationCeiling(error.getType());
        if (!ceiling.isWorseThan(current)) {
            return false;
        }
        DegradationLevel next = current.next();
        String reason = switch (error.getType()) {
            case NETWORK, TIMEOUT -> current == DegradationLevel.OPTIMAL
                ? "Network connectivity issues" : "Persistent network issues";
            case SERVICE -> current == DegradationLevel.OPTIMAL
                ? "Service errors detected" : "Persistent service failures";
            default -> "Unknown service issues";
        };
        return setLevel(next, reason);
    }

    public boolean setLevel(DegradationLevel level, String reason) {
        return setLevel(level, reason, List.of());
    }

    /**
     * @return true if the level changed
     */
    public boolean setLevel(DegradationLevel level, String reason, List<String> affectedFeatures) {
        DegradationState previous;
        DegradationState next;
        synchronized (this) {
            previous = state;
            Instant since = previous.getLevel() == level ? previous.getSince() : now();
            next = new DegradationState(level, reason, since, affectedFeatures,
                previous.getLastHealthCheck().orElse(null), determineCacheStatus());
            state = next;
        }
        if (previous.getLevel() == level) {
            return false;
        }
        logger.warn("Degradation level changed: {} -> {} ({})", previous.getLevel(), level, reason);
        for (DegradationListener listener : listeners) {
            try {
                listener.onStateChange(previous, next);
            } catch (Exception e) {
                logger.error("Degradation listener failed", e);
            }
        }
        return true;
    }

    /**
     * Runs the health check once. A healthy result resets to {@link DegradationLevel#OPTIMAL};
     * a failing check escalates like a fetch error.
     */
    public Mono<HealthStatus> checkHealth() {
        HealthCheck check = healthCheck;
        if (check == null) {
            return Mono.empty();
        }
        return Mono.defer(check::check)
            .timeout(config.getHealthCheckTimeout(), scheduler)
            .doOnNext(status -> {
                synchronized (this) {
                    state = state.withHealthCheck(now());
                }
                if (status == HealthStatus.HEALTHY && state.getLevel() != DegradationLevel.OPTIMAL) {
                    setLevel(DegradationLevel.OPTIMAL, "Service health restored");
                }
            })
            .onErrorResume(error -> {
                AnalyticsException classified = AnalyticsErrors.classify(error);
                logger.warn("Health check failed: {}", classified.getMessage());
                escalate(classified);
                return Mono.just(HealthStatus.UNHEALTHY);
            });
    }

    public void reset() {
        setLevel(DegradationLevel.OPTIMAL, "Manual reset");
    }

    public DegradationState getState() {
        refreshCacheStatus();
        return state;
    }

    public DegradationLevel getLevel() {
        return state.getLevel();
    }

    public boolean isFeatureAvailable(AnalyticsFeature feature) {
        return state.getAvailableFeatures().contains(feature);
    }

    public boolean isFeatureAvailable(String featureId) {
        return state.getAvailableFeatures().stream().anyMatch(f -> f.getId().equals(featureId));
    }

    public String getStatusMessage() {
        return statusMessage(state.getLevel());
    }

    public static String statusMessage(DegradationLevel level) {
        return switch (level) {
            case OPTIMAL -> "Analytics service is operating normally";
            case PARTIAL -> "Some analytics features may be slower than usual";
            case SIGNIFICANT -> "Analytics service is experiencing issues. Showing cached data where available";
            case CRITICAL -> "Analytics service is severely degraded. Limited functionality available";
            case COMPLETE -> "Analytics service is currently unavailable. Please try again later";
        };
    }

    public CacheFreshness getCacheFreshness() {
        int fresh = 0;
        int stale = 0;
        int expired = 0;
        var snapshot = cache.snapshot();
        for (CachedValue value : snapshot.values()) {
            if (value.getAgeMs() <= config.getFreshDataTtl().toMillis()) {
                fresh++;
            } else if (value.getAgeMs() <= config.getStaleDataTtl().toMillis()) {
                stale++;
            } else {
                expired++;
            }
        }
        return new CacheFreshness(snapshot.size(), fresh, stale, expired, statusOf(snapshot.size(), fresh, stale));
    }

    private CacheStatus determineCacheStatus() {
        return getCacheFreshness().status();
    }

    private static CacheStatus statusOf(int total, int fresh, int stale) {
        if (total == 0) {
            return CacheStatus.UNAVAILABLE;
        }
        if (fresh > 0) {
            return CacheStatus.FRESH;
        }
        return stale > 0 ? CacheStatus.STALE : CacheStatus.EXPIRED;
    }

    private void refreshCacheStatus() {
        CacheStatus status = determineCacheStatus();
        synchronized (this) {
            if (state.getCacheStatus() != status) {
                state = state.withCacheStatus(status);
            }
        }
    }

    public void clearCache() {
        cache.clear();
        refreshCacheStatus();
    }

    public void addListener(DegradationListener listener) {
        listeners.add(listener);
    }

    public void removeListener(DegradationListener listener) {
        listeners.remove(listener);
    }

    public DegradationConfig getConfig() {
        return config;
    }

    public void destroy() {
        stop();
        listeners.clear();
    }

    private Instant now() {
        return Instant.ofEpochMilli(scheduler.now(TimeUnit.MILLISECONDS));
    }
}

package com.analytics.resilience.cache;

import com.analytics.resilience.config.CacheConfig;
import com.analytics.resilience.config.CacheStrategy;
import com.analytics.resilience.config.RefreshMode;
import com.analytics.resilience.model.DataSource;
import com.analytics.resilience.model.DegradationLevel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Shared analytics cache with per-key freshness strategies, dependency-aware invalidation,
 * warmup and background refresh.
 * <p>
 * An entry is stale once older than its strategy's stale time or after it has been invalidated,
 * and is evicted on lookup once older than {@code maxCacheAge}. Every transport and the
 * degradation manager write into the same instance.
 */
public class AnalyticsCache {

    private static final Logger logger = LoggerFactory.getLogger(AnalyticsCache.class);

    private final CacheConfig config;
    private final CacheLoader loader;
    private final Scheduler scheduler;
    private final CacheStrategyRegistry strategies;
    private final Map<String, CacheEntry> entries = new ConcurrentHashMap<>();
    private final Map<String, Disposable> backgroundRefreshes = new ConcurrentHashMap<>();
    private final Map<String, Mono<Void>> activeWarmups = new ConcurrentHashMap<>();
    private final AtomicInteger queuedWarmups = new AtomicInteger();
    private final AtomicLong hits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();

    private volatile Disposable periodicRefresh;
    private volatile boolean destroyed;

    public AnalyticsCache(CacheConfig config, CacheLoader loader, Scheduler scheduler) {
        this.config = config;
        this.loader = loader;
        this.scheduler = scheduler;
        this.strategies = new CacheStrategyRegistry(config.getStrategies());
    }

    /**
     * Starts the periodic refresh of keys whose strategy refreshes in the background.
     */
    public void start() {
        if (!config.isEnabled() || periodicRefresh != null) {
            return;
        }
        long intervalMs = config.getBackgroundRefreshInterval().toMillis();
        periodicRefresh = scheduler.schedulePeriodically(this::refreshBackgroundKeys, intervalMs, intervalMs,
            TimeUnit.MILLISECONDS);
        logger.debug("Cache background refresh started every {}ms", intervalMs);
    }

    public Optional<CachedValue> get(String key) {
        CacheEntry entry = entries.get(key);
        if (entry == null) {
            misses.incrementAndGet();
            return Optional.empty();
        }
        long now = now();
        if (now - entry.getCapturedAt() > config.getMaxCacheAge().toMillis()) {
            entries.remove(key, entry);
            cancelBackgroundRefresh(key);
            misses.incrementAndGet();
            logger.debug("Evicted cache entry {} older than max cache age", key);
            return Optional.empty();
        }
        hits.incrementAndGet();
        return Optional.of(new CachedValue(entry, now));
    }

    public void set(String key, Object value) {
        set(key, value, DataSource.LIVE, DegradationLevel.OPTIMAL, null);
    }

    public void set(String key, Object value, CacheStrategy strategyOverride) {
        set(key, value, DataSource.LIVE, DegradationLevel.OPTIMAL, strategyOverride);
    }

    /**
     * Stores a value stamped with the current time. The override, when non-null, replaces the
     * key's registered strategy for this write.
     */
    public void set(String key, Object value, DataSource source, DegradationLevel level,
                    CacheStrategy strategyOverride) {
        CacheStrategy strategy = strategyOverride != null ? strategyOverride : strategies.find(key).orElse(null);
        Duration ttl = strategy != null ? strategy.getTtl() : config.getDefaultTtl();
        Duration staleTime = strategy != null ? strategy.getStaleTime() : config.getDefaultStaleTime();
        long now = now();
        entries.put(key, new CacheEntry(key, value, now, now + ttl.toMillis(), staleTime.toMillis(), source, level,
            false));
        if (strategy != null && strategy.getRefreshMode() == RefreshMode.BACKGROUND) {
            scheduleBackgroundRefresh(key, staleTime);
        }
    }

    /**
     * Marks every entry whose key contains {@code pattern} as stale.
     *
     * @return the keys that were invalidated
     */
    public Set<String> invalidateByPattern(String pattern) {
        Set<String> invalidated = new LinkedHashSet<>();
        for (String key : new ArrayList<>(entries.keySet())) {
            if (key.contains(pattern) && markStale(key)) {
                invalidated.add(key);
            }
        }
        if (!invalidated.isEmpty()) {
            logger.debug("Invalidated {} cache entries matching '{}'", invalidated.size(), pattern);
        }
        return invalidated;
    }

    /**
     * Transitively marks entries stale whose strategy depends on {@code key}.
     *
     * @return the keys that were invalidated
     */
    public Set<String> invalidateDependents(String key) {
        Set<String> visited = new HashSet<>();
        Set<String> invalidated = new LinkedHashSet<>();
        invalidateDependents(key, visited, invalidated);
        return invalidated;
    }

    private void invalidateDependents(String key, Set<String> visited, Set<String> invalidated) {
        if (!visited.add(key)) {
            logger.debug("Dependency cycle detected at {}", key);
            return;
        }
        for (CacheStrategy dependent : strategies.dependentsOf(key)) {
            for (String entryKey : new ArrayList<>(entries.keySet())) {
                if (dependent.matches(entryKey) && markStale(entryKey)) {
                    invalidated.add(entryKey);
                }
            }
            invalidateDependents(dependent.getKeyOrPrefix(), visited, invalidated);
        }
    }

    private boolean markStale(String key) {
        CacheEntry updated = entries.computeIfPresent(key, (k, entry) -> entry.invalidate());
        return updated != null;
    }

    public void remove(String key) {
        entries.remove(key);
        cancelBackgroundRefresh(key);
    }

    public void clear() {
        entries.clear();
        backgroundRefreshes.values().forEach(Disposable::dispose);
        backgroundRefreshes.clear();
        logger.info("Cache cleared");
    }

    /**
     * Loads the given keys that are missing or stale, dependencies first.
     * With a trigger, only keys whose strategy lists that trigger are warmed.
     */
    public Mono<Void> warmup(Collection<String> keys, String trigger) {
        if (!config.isEnabled() || destroyed) {
            return Mono.empty();
        }
        List<String> relevant = new ArrayList<>();
        for (String key : new LinkedHashSet<>(keys)) {
            if (trigger != null && strategies.find(key)
                .map(s -> !s.getWarmupTriggers().contains(trigger)).orElse(true)) {
                continue;
            }
            if (!activeWarmups.containsKey(key)) {
                relevant.add(key);
            }
        }
        if (relevant.isEmpty()) {
            return Mono.empty();
        }
        int maxConcurrent = config.getMaxConcurrentWarmups();
        return Flux.range(0, relevant.size())
            .flatMap(index -> {
                String key = relevant.get(index);
                Mono<Void> warm = Mono.defer(() -> warmupKey(key, new HashSet<>()));
                if (index < maxConcurrent) {
                    return warm;
                }
                queuedWarmups.incrementAndGet();
                return Mono.delay(config.getWarmupDelay(), scheduler)
                    .doFinally(signal -> queuedWarmups.decrementAndGet())
                    .then(warm);
            }, maxConcurrent)
            .then();
    }

    public Mono<Void> warmup(Collection<String> keys) {
        return warmup(keys, null);
    }

    private Mono<Void> warmupKey(String key, Set<String> visiting) {
        if (!visiting.add(key)) {
            logger.debug("Skipping warmup of {}: dependency cycle", key);
            return Mono.empty();
        }
        if (isFresh(key)) {
            return Mono.empty();
        }
        List<String> dependencies = strategies.find(key).map(CacheStrategy::getDependencies).orElse(List.of());
        return Flux.fromIterable(dependencies)
            .concatMap(dependency -> warmupKey(dependency, visiting))
            .then(Mono.defer(() -> load(key)));
    }

    /**
     * Loads one key. Concurrent callers for the same key share the load in flight.
     */
    private Mono<Void> load(String key) {
        return Mono.defer(() -> activeWarmups.computeIfAbsent(key, k -> Mono.defer(() -> loader.load(k))
            .doOnNext(value -> set(k, value))
            .doOnError(error -> logger.warn("Cache warmup failed for key {}: {}", k, error.getMessage()))
            .onErrorResume(error -> Mono.empty())
            .then()
            .doFinally(signal -> activeWarmups.remove(k))
            .cache()));
    }

    private boolean isFresh(String key) {
        CacheEntry entry = entries.get(key);
        long now = now();
        return entry != null && !entry.isStale(now) && now - entry.getCapturedAt() <= config.getMaxCacheAge().toMillis();
    }

    private void scheduleBackgroundRefresh(String key, Duration delay) {
        if (destroyed || !config.isEnabled()) {
            return;
        }
        Disposable timer = scheduler.schedule(() -> refreshKey(key), delay.toMillis(), TimeUnit.MILLISECONDS);
        Disposable previous = backgroundRefreshes.put(key, timer);
        if (previous != null) {
            previous.dispose();
        }
    }

    private void refreshKey(String key) {
        backgroundRefreshes.remove(key);
        Optional<CacheStrategy> strategy = strategies.find(key);
        if (strategy.isEmpty() || strategy.get().getRefreshMode() != RefreshMode.BACKGROUND) {
            return;
        }
        logger.debug("Background refresh of {}", key);
        load(key).subscribe();
    }

    private void refreshBackgroundKeys() {
        List<String> keys = new ArrayList<>();
        for (CacheStrategy strategy : strategies.all()) {
            if (strategy.getRefreshMode() == RefreshMode.BACKGROUND) {
                keys.add(strategy.getKeyOrPrefix());
            }
        }
        if (!keys.isEmpty()) {
            warmup(keys).subscribe();
        }
    }

    private void cancelBackgroundRefresh(String key) {
        Disposable timer = backgroundRefreshes.remove(key);
        if (timer != null) {
            timer.dispose();
        }
    }

    public Optional<CacheStrategy> getStrategy(String key) {
        return strategies.find(key);
    }

    public void addStrategy(CacheStrategy strategy) {
        strategies.add(strategy);
    }

    public void removeStrategy(String keyOrPrefix) {
        strategies.remove(keyOrPrefix).ifPresent(removed -> {
            for (String key : new ArrayList<>(backgroundRefreshes.keySet())) {
                if (removed.matches(key)) {
                    cancelBackgroundRefresh(key);
                }
            }
        });
    }

    public List<CacheStrategy> getStrategies() {
        return strategies.all();
    }

    /**
     * Current entries without touching hit or miss counters or evicting anything.
     */
    public Map<String, CachedValue> snapshot() {
        long now = now();
        Map<String, CachedValue> snapshot = new LinkedHashMap<>();
        entries.forEach((key, entry) -> snapshot.put(key, new CachedValue(entry, now)));
        return snapshot;
    }

    public Set<String> keys() {
        return Set.copyOf(entries.keySet());
    }

    public int size() {
        return entries.size();
    }

    public CacheStats getStats() {
        long now = now();
        int stale = 0;
        for (CacheEntry entry : entries.values()) {
            if (entry.isStale(now)) {
                stale++;
            }
        }
        return new CacheStats(entries.size(), stale, activeWarmups.size(), queuedWarmups.get(),
            backgroundRefreshes.size(), hits.get(), misses.get());
    }

    public CacheConfig getConfig() {
        return config;
    }

    /**
     * Cancels every timer and drops all entries and strategies.
     */
    public void destroy() {
        destroyed = true;
        if (periodicRefresh != null) {
            periodicRefresh.dispose();
            periodicRefresh = null;
        }
        backgroundRefreshes.values().forEach(Disposable::dispose);
        backgroundRefreshes.clear();
        activeWarmups.clear();
        entries.clear();
        strategies.clear();
    }

    long now() {
        return scheduler.now(TimeUnit.MILLISECONDS);
    }
}

package com.analytics.resilience.cache;

import com.analytics.resilience.config.CacheConfig;
import com.analytics.resilience.config.CacheStrategy;
import com.analytics.resilience.config.RefreshMode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;
import reactor.test.scheduler.VirtualTimeScheduler;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class AnalyticsCacheTest {

    private VirtualTimeScheduler scheduler;
    private List<String> loaded;
    private AnalyticsCache cache;

    @BeforeEach
    void setUp() {
        scheduler = VirtualTimeScheduler.create();
        loaded = new CopyOnWriteArrayList<>();
        CacheConfig config = CacheConfig.builder()
            .clearStrategies()
            .defaultTtl(Duration.ofMinutes(5))
            .defaultStaleTime(Duration.ofSeconds(30))
            .maxCacheAge(Duration.ofHours(1))
            .maxConcurrentWarmups(2)
            .strategy(CacheStrategy.builder("engagement")
                .ttl(Duration.ofSeconds(60)).staleTime(Duration.ofSeconds(20))
                .warmupTriggers("dashboard-load")
                .build())
            .strategy(CacheStrategy.builder("summary")
                .dependencies("engagement")
                .warmupTriggers("dashboard-load")
                .build())
            .strategy(CacheStrategy.builder("insights")
                .dependencies("summary")
                .build())
            .build();
        cache = new AnalyticsCache(config, key -> {
            loaded.add(key);
            return Mono.just("loaded-" + key);
        }, scheduler);
    }

    @Test
    void testSetAndGet() {
        cache.set("engagement", Map.of("activeUsers", 12));

        Optional<CachedValue> value = cache.get("engagement");

        assertTrue(value.isPresent());
        assertEquals(Map.of("activeUsers", 12), value.get().getValue());
        assertFalse(value.get().isStale());
        assertEquals(0, value.get().getAgeMs());
        assertEquals(value.get().getCapturedAt().plusSeconds(60), value.get().getExpiresAt());
    }

    @Test
    void testMissingKeyCountsMiss() {
        assertTrue(cache.get("unknown").isEmpty());

        CacheStats stats = cache.getStats();
        assertEquals(0, stats.hits());
        assertEquals(1, stats.misses());
        assertEquals(0.0, stats.hitRate());
    }

    @Test
    void testEntryBecomesStaleAfterStrategyStaleTime() {
        cache.set("engagement", "v1");

        scheduler.advanceTimeBy(Duration.ofSeconds(20));
        assertFalse(cache.get("engagement").orElseThrow().isStale());

        scheduler.advanceTimeBy(Duration.ofSeconds(1));
        assertTrue(cache.get("engagement").orElseThrow().isStale());
    }

    @Test
    void testDefaultStaleTimeForKeysWithoutStrategy() {
        cache.set("other", "v1");

        scheduler.advanceTimeBy(Duration.ofSeconds(31));

        assertTrue(cache.get("other").orElseThrow().isStale());
    }

    @Test
    void testEntriesOlderThanMaxAgeAreEvicted() {
        cache.set("other", "v1");

        scheduler.advanceTimeBy(Duration.ofHours(1).plusMillis(1));

        assertTrue(cache.get("other").isEmpty());
        assertEquals(0, cache.size());
    }

    @Test
    void testInvalidateByPatternMarksMatchingKeysStale() {
        cache.set("engagement-course-1", "a");
        cache.set("engagement-course-2", "b");
        cache.set("progress", "c");

        Set<String> invalidated = cache.invalidateByPattern("course");

        assertEquals(Set.of("engagement-course-1", "engagement-course-2"), invalidated);
        assertTrue(cache.get("engagement-course-1").orElseThrow().isStale());
        assertFalse(cache.get("progress").orElseThrow().isStale());
        assertEquals("a", cache.get("engagement-course-1").orElseThrow().getValue());
    }

    @Test
    void testInvalidateDependentsIsTransitive() {
        cache.set("engagement", "e");
        cache.set("summary", "s");
        cache.set("insights", "i");

        Set<String> invalidated = cache.invalidateDependents("engagement");

        assertEquals(Set.of("summary", "insights"), invalidated);
        assertFalse(cache.get("engagement").orElseThrow().isStale());
    }

    @Test
    void testInvalidateDependentsStopsOnCycle() {
        cache.addStrategy(CacheStrategy.builder("a").dependencies("b").build());
        cache.addStrategy(CacheStrategy.builder("b").dependencies("a").build());
        cache.set("a", 1);
        cache.set("b", 2);

        Set<String> invalidated = cache.invalidateDependents("a");

        assertEquals(Set.of("b", "a"), invalidated);
    }

    @Test
    void testWarmupLoadsDependenciesFirst() {
        StepVerifier.create(cache.warmup(List.of("insights")))
            .verifyComplete();

        assertEquals(List.of("engagement", "summary", "insights"), loaded);
        assertEquals("loaded-insights", cache.get("insights").orElseThrow().getValue());
    }

    @Test
    void testConcurrentWarmupsWaitForSharedDependency() {
        List<String> calls = new CopyOnWriteArrayList<>();
        Map<String, Boolean> baseCachedAtLoad = new ConcurrentHashMap<>();
        AtomicReference<AnalyticsCache> ref = new AtomicReference<>();
        AnalyticsCache shared = new AnalyticsCache(CacheConfig.builder()
            .clearStrategies()
            .maxConcurrentWarmups(2)
            .strategy(CacheStrategy.builder("derivedA").dependencies("base").build())
            .strategy(CacheStrategy.builder("derivedB").dependencies("base").build())
            .build(), key -> {
                calls.add(key);
                if (key.equals("base")) {
                    return Mono.<Object>just("loaded-base").delayElement(Duration.ofSeconds(1), scheduler);
                }
                baseCachedAtLoad.put(key, ref.get().get("base").isPresent());
                return Mono.just("loaded-" + key);
            }, scheduler);
        ref.set(shared);

        StepVerifier.create(shared.warmup(List.of("derivedA", "derivedB")))
            .then(() -> assertEquals(List.of("base"), calls))
            .then(() -> scheduler.advanceTimeBy(Duration.ofSeconds(1)))
            .verifyComplete();

        assertEquals(3, calls.size());
        assertEquals(1, calls.stream().filter("base"::equals).count());
        assertEquals(Map.of("derivedA", true, "derivedB", true), baseCachedAtLoad);
        assertEquals(0, shared.getStats().activeWarmups());
    }

    @Test
    void testWarmupSkipsFreshKeys() {
        cache.set("engagement", "fresh");

        StepVerifier.create(cache.warmup(List.of("summary")))
            .verifyComplete();

        assertEquals(List.of("summary"), loaded);
        assertEquals("fresh", cache.get("engagement").orElseThrow().getValue());
    }

    @Test
    void testWarmupWithTriggerOnlyLoadsMatchingStrategies() {
        StepVerifier.create(cache.warmup(List.of("engagement", "insights"), "dashboard-load"))
            .verifyComplete();

        assertEquals(List.of("engagement"), loaded);
    }

    @Test
    void testWarmupBeyondConcurrencyLimitIsDelayed() {
        StepVerifier.create(cache.warmup(List.of("k1", "k2", "k3")))
            .then(() -> assertEquals(List.of("k1", "k2"), loaded))
            .then(() -> scheduler.advanceTimeBy(Duration.ofSeconds(1)))
            .verifyComplete();

        assertEquals(List.of("k1", "k2", "k3"), loaded);
    }

    @Test
    void testWarmupSurvivesLoaderFailure() {
        AnalyticsCache failing = new AnalyticsCache(CacheConfig.builder().clearStrategies().build(),
            key -> Mono.error(new IllegalStateException("upstream down")), scheduler);

        StepVerifier.create(failing.warmup(List.of("engagement")))
            .verifyComplete();

        assertEquals(0, failing.size());
    }

    @Test
    void testBackgroundRefreshReloadsWhenStale() {
        AtomicInteger version = new AtomicInteger();
        AnalyticsCache refreshing = new AnalyticsCache(CacheConfig.builder()
            .clearStrategies()
            .strategy(CacheStrategy.builder("live")
                .ttl(Duration.ofSeconds(60)).staleTime(Duration.ofSeconds(10))
                .refreshMode(RefreshMode.BACKGROUND)
                .build())
            .build(), key -> Mono.just("v" + version.incrementAndGet()), scheduler);

        refreshing.set("live", "v0");
        assertEquals(1, refreshing.getStats().backgroundRefreshers());

        scheduler.advanceTimeBy(Duration.ofSeconds(10));

        assertEquals("v1", refreshing.get("live").orElseThrow().getValue());
    }

    @Test
    void testStrategyLookupByPrefix() {
        assertEquals("engagement", cache.getStrategy("engagement-course-7").orElseThrow().getKeyOrPrefix());
        assertTrue(cache.getStrategy("unrelated").isEmpty());
    }

    @Test
    void testDestroyCancelsTimersAndClearsEntries() {
        cache.addStrategy(CacheStrategy.builder("live").staleTime(Duration.ofSeconds(5))
            .refreshMode(RefreshMode.BACKGROUND).build());
        cache.set("live", "v0");
        cache.start();

        cache.destroy();
        scheduler.advanceTimeBy(Duration.ofMinutes(10));

        assertTrue(loaded.isEmpty());
        assertEquals(0, cache.size());
    }
}

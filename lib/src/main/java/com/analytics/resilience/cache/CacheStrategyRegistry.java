package com.analytics.resilience.cache;

import com.analytics.resilience.config.CacheStrategy;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Strategy lookup by exact key, then by the first registered prefix that matches.
 */
public class CacheStrategyRegistry {

    private final Map<String, CacheStrategy> strategies = new LinkedHashMap<>();

    public CacheStrategyRegistry(Collection<CacheStrategy> initial) {
        initial.forEach(this::add);
    }

    public synchronized void add(CacheStrategy strategy) {
        strategies.put(strategy.getKeyOrPrefix(), strategy);
    }

    public synchronized Optional<CacheStrategy> remove(String keyOrPrefix) {
        return Optional.ofNullable(strategies.remove(keyOrPrefix));
    }

    public synchronized Optional<CacheStrategy> find(String key) {
        CacheStrategy exact = strategies.get(key);
        if (exact != null) {
            return Optional.of(exact);
        }
        for (CacheStrategy strategy : strategies.values()) {
            if (key.startsWith(strategy.getKeyOrPrefix())) {
                return Optional.of(strategy);
            }
        }
        return Optional.empty();
    }

    /**
     * Strategies that list {@code key} among their dependencies.
     */
    public synchronized List<CacheStrategy> dependentsOf(String key) {
        List<CacheStrategy> dependents = new ArrayList<>();
        for (CacheStrategy strategy : strategies.values()) {
            if (strategy.getDependencies().contains(key)) {
                dependents.add(strategy);
            }
        }
        return dependents;
    }

    public synchronized List<CacheStrategy> all() {
        return List.copyOf(strategies.values());
    }

    public synchronized void clear() {
        strategies.clear();
    }
}

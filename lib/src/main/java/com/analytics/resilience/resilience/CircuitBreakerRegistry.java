package com.analytics.resilience.resilience;

import com.analytics.resilience.config.CircuitBreakerConfig;
import com.analytics.resilience.model.CircuitState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Supplier;

/**
 * Holds one {@link CircuitBreaker} per operation name, created lazily from a default configuration.
 */
public class CircuitBreakerRegistry {

    private static final Logger logger = LoggerFactory.getLogger(CircuitBreakerRegistry.class);

    private final CircuitBreakerConfig defaultConfig;
    private final Scheduler scheduler;
    private final Map<String, CircuitBreaker> circuitBreakers = new ConcurrentHashMap<>();
    private final List<CircuitBreakerEventListener> registryListeners = new CopyOnWriteArrayList<>();

    public CircuitBreakerRegistry(CircuitBreakerConfig defaultConfig, Scheduler scheduler) {
        this.defaultConfig = defaultConfig;
        this.scheduler = scheduler;
    }

    public CircuitBreaker circuitBreaker(String operationName) {
        return circuitBreaker(operationName, defaultConfig);
    }

    /**
     * Returns the breaker for the operation, creating it with {@code config} if it does not exist yet.
     */
    public CircuitBreaker circuitBreaker(String operationName, CircuitBreakerConfig config) {
        return circuitBreakers.computeIfAbsent(operationName, name -> {
            CircuitBreaker breaker = new CircuitBreaker(name, config, scheduler);
            breaker.addEventListener(CircuitBreakerEvent.Type.STATE_CHANGE, event ->
                logger.debug("Circuit breaker {} state transition: {} -> {}",
                    name, event.getPreviousState().orElse(null), event.getState()));
            registryListeners.forEach(breaker::addEventListener);
            logger.debug("Created circuit breaker for operation {}", name);
            return breaker;
        });
    }

    public <T> Mono<T> execute(String operationName, Supplier<Mono<T>> operation) {
        return circuitBreaker(operationName).execute(operation);
    }

    /**
     * Registers a listener on every existing and future breaker.
     */
    public void addEventListener(CircuitBreakerEventListener listener) {
        registryListeners.add(listener);
        circuitBreakers.values().forEach(breaker -> breaker.addEventListener(listener));
    }

    public Map<String, CircuitBreakerStats> getAllStats() {
        Map<String, CircuitBreakerStats> stats = new LinkedHashMap<>();
        circuitBreakers.forEach((name, breaker) -> stats.put(name, breaker.getStats()));
        return stats;
    }

    public Map<String, CircuitState> getAllStates() {
        Map<String, CircuitState> states = new LinkedHashMap<>();
        circuitBreakers.forEach((name, breaker) -> states.put(name, breaker.getState()));
        return states;
    }

    public boolean isHealthy() {
        return circuitBreakers.values().stream().allMatch(CircuitBreaker::isHealthy);
    }

    public Collection<CircuitBreaker> getAll() {
        return circuitBreakers.values();
    }

    public void resetAll() {
        circuitBreakers.values().forEach(CircuitBreaker::reset);
        logger.info("Reset {} circuit breakers", circuitBreakers.size());
    }

    public void destroy() {
        circuitBreakers.values().forEach(CircuitBreaker::destroy);
        circuitBreakers.clear();
        registryListeners.clear();
    }
}

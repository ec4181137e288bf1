package com.analytics.resilience.degradation;

import com.analytics.resilience.model.HealthStatus;
import reactor.core.publisher.Mono;

/**
 * Probe of the analytics service's health, run periodically by the degradation manager.
 */
@FunctionalInterface
public interface HealthCheck {
    Mono<HealthStatus> check();
}

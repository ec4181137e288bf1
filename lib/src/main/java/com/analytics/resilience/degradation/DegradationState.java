package com.analytics.resilience.degradation;

import com.analytics.resilience.model.AnalyticsFeature;
import com.analytics.resilience.model.DegradationLevel;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Snapshot of the degradation manager's state.
 */
public class DegradationState {

    private final DegradationLevel level;
    private final String reason;
    private final Instant since;
    private final List<String> affectedFeatures;
    private final Set<AnalyticsFeature> availableFeatures;
    private final Instant lastHealthCheck;
    private final CacheStatus cacheStatus;

    DegradationState(DegradationLevel level, String reason, Instant since, List<String> affectedFeatures,
                     Instant lastHealthCheck, CacheStatus cacheStatus) {
        this.level = level;
        this.reason = reason;
        this.since = since;
        this.affectedFeatures = List.copyOf(affectedFeatures);
        this.availableFeatures = Set.copyOf(AnalyticsFeature.availableAt(level));
        this.lastHealthCheck = lastHealthCheck;
        this.cacheStatus = cacheStatus;
    }

    DegradationState withHealthCheck(Instant checkedAt) {
        return new DegradationState(level, reason, since, affectedFeatures, checkedAt, cacheStatus);
    }

    DegradationState withCacheStatus(CacheStatus status) {
        return new DegradationState(level, reason, since, affectedFeatures, lastHealthCheck, status);
    }

    public DegradationLevel getLevel() {
        return level;
    }

    public String getReason() {
        return reason;
    }

    /**
     * When the current level was entered.
     */
    public Instant getSince() {
        return since;
    }

    public List<String> getAffectedFeatures() {
        return affectedFeatures;
    }

    public Set<AnalyticsFeature> getAvailableFeatures() {
        return availableFeatures;
    }

    public Optional<Instant> getLastHealthCheck() {
        return Optional.ofNullable(lastHealthCheck);
    }

    public CacheStatus getCacheStatus() {
        return cacheStatus;
    }

    @Override
    public String toString() {
        return String.format("DegradationState{level=%s, reason='%s', since=%s, cacheStatus=%s}",
            level, reason, since, cacheStatus);
    }
}

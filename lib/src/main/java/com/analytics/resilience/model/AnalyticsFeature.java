package com.analytics.resilience.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * Dashboard features whose availability depends on the degradation level.
 */
public enum AnalyticsFeature {
    ENGAGEMENT_METRICS("engagement_metrics"),
    PROGRESS_METRICS("progress_metrics"),
    CONTENT_METRICS("content_metrics"),
    SYSTEM_METRICS("system_metrics"),
    REALTIME_UPDATES("realtime_updates"),
    ALERTS("alerts"),
    INSIGHTS("insights"),
    REPORTS("reports"),
    EXPORTS("exports"),
    USER_ANALYTICS("user_analytics");

    private final String id;

    AnalyticsFeature(String id) {
        this.id = id;
    }

    public String getId() {
        return id;
    }

    /**
     * Features still offered at the given level.
     */
    public static Set<AnalyticsFeature> availableAt(DegradationLevel level) {
        return switch (level) {
            case OPTIMAL -> EnumSet.allOf(AnalyticsFeature.class);
            case PARTIAL -> EnumSet.complementOf(EnumSet.of(REALTIME_UPDATES));
            case SIGNIFICANT -> EnumSet.of(ENGAGEMENT_METRICS, PROGRESS_METRICS, CONTENT_METRICS,
                INSIGHTS, USER_ANALYTICS);
            case CRITICAL -> EnumSet.of(ENGAGEMENT_METRICS, PROGRESS_METRICS, USER_ANALYTICS);
            case COMPLETE -> EnumSet.noneOf(AnalyticsFeature.class);
        };
    }
}

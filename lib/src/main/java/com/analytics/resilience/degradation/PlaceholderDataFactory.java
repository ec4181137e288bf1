package com.analytics.resilience.degradation;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Builds zeroed records shown when no live, cached or fallback data exists.
 */
public final class PlaceholderDataFactory {

    private PlaceholderDataFactory() {
    }

    public static Map<String, Object> create(String key, Instant timestamp) {
        Map<String, Object> placeholder = new LinkedHashMap<>();
        if (key.contains("engagement")) {
            placeholder.put("timestamp", timestamp.toString());
            placeholder.put("activeUsers1h", 0);
            placeholder.put("activeUsers24h", 0);
            placeholder.put("newUsers24h", 0);
            placeholder.put("sessionsStarted1h", 0);
            placeholder.put("avgSessionDurationMinutes", 0.0);
            placeholder.put("bounceRate", 0.0);
            placeholder.put("retentionRateD1", 0.0);
            placeholder.put("retentionRateD7", 0.0);
            placeholder.put("retentionRateD30", 0.0);
        } else if (key.contains("progress")) {
            placeholder.put("timestamp", timestamp.toString());
            placeholder.put("totalCompletions24h", 0);
            placeholder.put("avgAccuracy", 0.0);
            placeholder.put("avgResponseTimeMs", 0.0);
            placeholder.put("masteryAchievements24h", 0);
            placeholder.put("strugglingUsers", 0);
            placeholder.put("topPerformers", 0);
            placeholder.put("contentCompletionRate", 0.0);
            placeholder.put("skillProgressRate", 0.0);
        }
        return Collections.unmodifiableMap(placeholder);
    }
}

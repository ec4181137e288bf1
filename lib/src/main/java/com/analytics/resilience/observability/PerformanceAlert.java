package com.analytics.resilience.observability;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Alert raised by the {@link PerformanceMonitor}.
 */
public class PerformanceAlert {
    private final AlertType type;
    private final String message;
    private final Map<String, Object> details;
    private final AlertSeverity severity;
    private final Instant timestamp;

    public PerformanceAlert(AlertType type, String message, Map<String, Object> details, AlertSeverity severity,
                            Instant timestamp) {
        this.type = type;
        this.message = message;
        this.details = Collections.unmodifiableMap(new LinkedHashMap<>(details));
        this.severity = severity;
        this.timestamp = timestamp;
    }

    public AlertType getType() {
        return type;
    }

    public String getMessage() {
        return message;
    }

    public Map<String, Object> getDetails() {
        return details;
    }

    public AlertSeverity getSeverity() {
        return severity;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    @Override
    public String toString() {
        return String.format("PerformanceAlert{type=%s, severity=%s, message='%s', timestamp=%s}",
            type, severity, message, timestamp);
    }
}

package com.analytics.resilience.batch;

import com.analytics.resilience.model.RequestPriority;
import reactor.core.publisher.Sinks;

import java.util.Map;

/**
 * One queued request waiting to be flushed with its endpoint's batch.
 */
public class BatchRequest {

    private final String id;
    private final String endpoint;
    private final Map<String, Object> params;
    private final RequestPriority priority;
    private final long enqueuedAt;
    private final long deadline;
    private final long sequence;
    final String dedupKey;
    final Sinks.One<Object> result;

    BatchRequest(String id, String endpoint, Map<String, Object> params, RequestPriority priority, long enqueuedAt,
                 long deadline, long sequence, String dedupKey, Sinks.One<Object> result) {
        this.id = id;
        this.endpoint = endpoint;
        this.params = params;
        this.priority = priority;
        this.enqueuedAt = enqueuedAt;
        this.deadline = deadline;
        this.sequence = sequence;
        this.dedupKey = dedupKey;
        this.result = result;
    }

    /**
     * Identifier a batch response uses to address this request's result.
     */
    public String getId() {
        return id;
    }

    public String getEndpoint() {
        return endpoint;
    }

    public Map<String, Object> getParams() {
        return params;
    }

    public RequestPriority getPriority() {
        return priority;
    }

    public long getEnqueuedAt() {
        return enqueuedAt;
    }

    long getDeadline() {
        return deadline;
    }

    long getSequence() {
        return sequence;
    }

    @Override
    public String toString() {
        return String.format("BatchRequest{id='%s', endpoint='%s', priority=%s}", id, endpoint, priority);
    }
}

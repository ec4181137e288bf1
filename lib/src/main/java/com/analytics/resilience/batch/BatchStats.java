package com.analytics.resilience.batch;

/**
 * Counters of a {@link RequestBatcher} since creation.
 */
public record BatchStats(
    long submitted,
    long deduplicated,
    long batchesFlushed,
    long batchCalls,
    long individualExecutions,
    int pending) {
}

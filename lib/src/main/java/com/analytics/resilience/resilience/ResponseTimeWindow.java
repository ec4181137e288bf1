package com.analytics.resilience.resilience;

import java.util.Arrays;

/**
 * Fixed-size ring buffer of call durations with the time each call finished.
 */
class ResponseTimeWindow {

    private final long[] durations;
    private final long[] timestamps;
    private int next;
    private int size;

    ResponseTimeWindow(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("Window capacity must be positive");
        }
        this.durations = new long[capacity];
        this.timestamps = new long[capacity];
    }

    synchronized void record(long timestamp, long durationMs) {
        durations[next] = durationMs;
        timestamps[next] = timestamp;
        next = (next + 1) % durations.length;
        if (size < durations.length) {
            size++;
        }
    }

    synchronized long[] sortedDurations() {
        long[] copy = new long[size];
        for (int i = 0; i < size; i++) {
            copy[i] = durations[i];
        }
        Arrays.sort(copy);
        return copy;
    }

    synchronized int countSince(long timestamp) {
        int count = 0;
        for (int i = 0; i < size; i++) {
            if (timestamps[i] >= timestamp) {
                count++;
            }
        }
        return count;
    }

    synchronized int size() {
        return size;
    }

    synchronized void clear() {
        next = 0;
        size = 0;
    }
}

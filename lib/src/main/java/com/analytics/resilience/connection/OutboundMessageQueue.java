package com.analytics.resilience.connection;

import com.analytics.resilience.model.ChannelMessage;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.function.Predicate;

/**
 * Bounded FIFO of messages sent while the channel was down. When full, the oldest message is dropped.
 */
class OutboundMessageQueue {

    private final int capacity;
    private final long maxAgeMs;
    private final Deque<QueuedMessage> messages = new ArrayDeque<>();
    private long dropped;

    OutboundMessageQueue(int capacity, long maxAgeMs) {
        this.capacity = capacity;
        this.maxAgeMs = maxAgeMs;
    }

    synchronized void offer(ChannelMessage message, long now) {
        while (messages.size() >= capacity) {
            messages.removeFirst();
            dropped++;
        }
        messages.addLast(new QueuedMessage(message, now));
    }

    /**
     * Hands queued messages to the sender oldest first, dropping expired ones on the way. Stops at the
     * first message the sender refuses; it stays at the front, with everything behind it, under its
     * original enqueue time.
     *
     * @return number of messages the sender accepted
     */
    synchronized int flush(long now, Predicate<ChannelMessage> sender) {
        int sent = 0;
        while (!messages.isEmpty()) {
            QueuedMessage queued = messages.peekFirst();
            if (now - queued.enqueuedAt >= maxAgeMs) {
                messages.removeFirst();
                dropped++;
            } else if (sender.test(queued.message)) {
                messages.removeFirst();
                sent++;
            } else {
                break;
            }
        }
        return sent;
    }

    synchronized int size() {
        return messages.size();
    }

    synchronized long getDropped() {
        return dropped;
    }

    synchronized void clear() {
        messages.clear();
    }

    private record QueuedMessage(ChannelMessage message, long enqueuedAt) {
    }
}

package com.analytics.resilience.connection;

import com.analytics.resilience.model.ChannelMessage;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class OutboundMessageQueueTest {

    private static ChannelMessage message(String id) {
        return ChannelMessage.builder().type(ChannelMessage.SUBSCRIBE).correlationId(id).build();
    }

    private static List<String> flushAll(OutboundMessageQueue queue, long now) {
        List<String> sent = new ArrayList<>();
        queue.flush(now, message -> sent.add(message.getCorrelationId()));
        return sent;
    }

    @Test
    void testFlushSendsMessagesInOrder() {
        OutboundMessageQueue queue = new OutboundMessageQueue(10, 30_000);
        queue.offer(message("a"), 0);
        queue.offer(message("b"), 10);

        assertEquals(List.of("a", "b"), flushAll(queue, 100));
        assertEquals(0, queue.size());
    }

    @Test
    void testOldestMessageDroppedWhenFull() {
        OutboundMessageQueue queue = new OutboundMessageQueue(2, 30_000);
        queue.offer(message("a"), 0);
        queue.offer(message("b"), 0);
        queue.offer(message("c"), 0);

        assertEquals(2, queue.size());
        assertEquals(1, queue.getDropped());
        assertEquals(List.of("b", "c"), flushAll(queue, 0));
    }

    @Test
    void testExpiredMessagesAreDroppedOnFlush() {
        OutboundMessageQueue queue = new OutboundMessageQueue(10, 30_000);
        queue.offer(message("old"), 0);
        queue.offer(message("new"), 20_000);

        assertEquals(List.of("new"), flushAll(queue, 30_000));
        assertEquals(1, queue.getDropped());
    }

    @Test
    void testRefusedMessageStaysAtFrontWithOriginalAge() {
        OutboundMessageQueue queue = new OutboundMessageQueue(10, 30_000);
        queue.offer(message("a"), 0);
        queue.offer(message("b"), 1_000);
        queue.offer(message("c"), 2_000);
        List<String> sent = new ArrayList<>();

        int flushed = queue.flush(5_000, message -> {
            if (message.getCorrelationId().equals("b")) {
                return false;
            }
            sent.add(message.getCorrelationId());
            return true;
        });
        queue.offer(message("d"), 6_000);

        assertEquals(1, flushed);
        assertEquals(List.of("a"), sent);
        assertEquals(3, queue.size());
        // b was queued at 1s, so by 31s it has expired while c and d have not
        assertEquals(List.of("c", "d"), flushAll(queue, 31_000));
        assertEquals(1, queue.getDropped());
    }
}

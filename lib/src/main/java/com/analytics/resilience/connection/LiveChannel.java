package com.analytics.resilience.connection;

import com.analytics.resilience.model.ChannelMessage;

/**
 * An open bidirectional channel to the analytics service.
 */
public interface LiveChannel {

    int NORMAL_CLOSURE = 1000;

    /**
     * Sends a message; throws if the underlying transport rejects it.
     */
    void send(ChannelMessage message);

    void close(int code, String reason);

    boolean isOpen();
}

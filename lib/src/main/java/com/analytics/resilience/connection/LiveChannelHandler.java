package com.analytics.resilience.connection;

import com.analytics.resilience.model.ChannelMessage;

/**
 * Callbacks a {@link LiveChannelConnector} delivers for an open channel.
 */
public interface LiveChannelHandler {

    void onMessage(ChannelMessage message);

    void onClose(int code, String reason);

    void onError(Throwable error);
}

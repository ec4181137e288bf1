package com.analytics.resilience.transport;

import com.analytics.resilience.model.ChannelMessage;

/**
 * Callbacks for an open push stream. The message type carries the event name.
 */
public interface PushEventHandler {

    void onEvent(ChannelMessage message);

    /**
     * The stream failed; no further events arrive on this subscription.
     */
    void onError(Throwable error);
}

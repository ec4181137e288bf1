package com.analytics.resilience.transport;

import com.analytics.resilience.model.TransportMode;

@FunctionalInterface
public interface TransportListener {

    void onModeChange(TransportMode previous, TransportMode current, String reason);
}

package com.e2eq.aggregate.store;

import com.e2eq.aggregate.spi.GraphEventListener;

/**
 * Delivers entity mutation notifications to subscribed listeners, synchronously within the
 * mutating call.
 */
public interface GraphEventSource {
    void addListener(GraphEventListener listener);
    void removeListener(GraphEventListener listener);
}

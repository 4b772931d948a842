package com.e2eq.aggregate.spi;

/**
 * SPI called by a graph event source when entities change.
 * Notifications are delivered synchronously inside the mutating call, so a listener's
 * reaction is part of the same unit of work as the mutation. Exceptions thrown by a
 * listener propagate to the caller that mutated the graph.
 */
public interface GraphEventListener {

    /**
     * Called once after an entity and its initial properties were created.
     */
    default void onNodeCreated(String nodeId, String type) { }

    /**
     * Called after a property value changed. {@code oldValue} is {@code null} when the property
     * was absent, {@code newValue} is {@code null} when it was removed.
     */
    default void onPropertyChanged(String nodeId, String type, String key, Object oldValue, Object newValue) { }

    /**
     * Called before the entity and its relations are removed, so they can still be read.
     */
    default void onNodeDeleted(String nodeId, String type) { }
}

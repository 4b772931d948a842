package com.e2eq.aggregate.core;

import com.e2eq.aggregate.store.GraphEventSource;
import jakarta.enterprise.context.ApplicationScoped;
import org.jboss.logging.Logger;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-wide aggregation state: the current top-level aggregation of each root and the event
 * subscription of each aggregation.
 *
 * <p>An aggregation has at most one subscription. Subscribing again with the same type is a no-op,
 * subscribing with another type replaces the old one. When a spec is chained under another, its
 * subscription is removed here and the owner subscribes in its place.</p>
 */
@ApplicationScoped
public class AggregationRegistry {

    private static final Logger LOG = Logger.getLogger(AggregationRegistry.class);

    private record Subscription(GraphEventSource events, AggregateEventBridge bridge) {}

    /** root id -> latest top-level aggregation created for it */
    private final Map<String, AggregationSpec> currentByRoot = new ConcurrentHashMap<>();

    /** aggregation -> its event subscription (identity keyed) */
    private final Map<AggregationSpec, Subscription> subscriptions = Collections.synchronizedMap(new IdentityHashMap<>());

    public void setCurrent(String rootId, AggregationSpec spec) {
        currentByRoot.put(rootId, spec);
    }

    public Optional<AggregationSpec> current(String rootId) {
        return Optional.ofNullable(currentByRoot.get(rootId));
    }

    public AggregateEventBridge subscribe(GraphEventSource events, AggregationSpec spec, String entityType) {
        if (events == null || spec == null) {
            throw new IllegalArgumentException("Event source and aggregation cannot be null");
        }
        synchronized (subscriptions) {
            Subscription existing = subscriptions.get(spec);
            if (existing != null) {
                if (existing.events() == events && existing.bridge().matches(entityType)) {
                    return existing.bridge();
                }
                existing.events().removeListener(existing.bridge());
            }
            AggregateEventBridge bridge = new AggregateEventBridge(spec, entityType);
            events.addListener(bridge);
            subscriptions.put(spec, new Subscription(events, bridge));
            LOG.infof("Subscribed %s to %s events", spec, entityType);
            return bridge;
        }
    }

    public boolean unsubscribe(AggregationSpec spec) {
        Subscription removed = subscriptions.remove(spec);
        if (removed == null) return false;
        removed.events().removeListener(removed.bridge());
        LOG.infof("Unsubscribed %s from %s events", spec, removed.bridge().entityType());
        return true;
    }

    public boolean isSubscribed(AggregationSpec spec) {
        return subscriptions.containsKey(spec);
    }

    public Optional<String> subscribedType(AggregationSpec spec) {
        Subscription s = subscriptions.get(spec);
        return s == null ? Optional.empty() : Optional.of(s.bridge().entityType());
    }

    public int subscriptionCount() {
        return subscriptions.size();
    }

    /**
     * Removes every subscription and forgets all roots. Group state in the store is kept.
     */
    public void clear() {
        List<AggregationSpec> specs;
        synchronized (subscriptions) {
            specs = new ArrayList<>(subscriptions.keySet());
        }
        for (AggregationSpec spec : specs) unsubscribe(spec);
        currentByRoot.clear();
    }
}

package com.e2eq.aggregate.core;

import com.e2eq.aggregate.spi.GraphEventListener;
import org.jboss.logging.Logger;

import java.util.Objects;

/**
 * Forwards store notifications about one entity type to the aggregation that groups it.
 * Notifications for other types, including the group nodes the aggregation writes itself, are ignored.
 */
public final class AggregateEventBridge implements GraphEventListener {

    private static final Logger LOG = Logger.getLogger(AggregateEventBridge.class);

    private final AggregationSpec spec;
    private final String entityType;

    public AggregateEventBridge(AggregationSpec spec, String entityType) {
        this.spec = Objects.requireNonNull(spec, "spec");
        if (entityType == null || entityType.isBlank()) {
            throw new IllegalArgumentException("Entity type cannot be blank");
        }
        this.entityType = entityType;
    }

    public AggregationSpec spec() {
        return spec;
    }

    public String entityType() {
        return entityType;
    }

    public boolean matches(String type) {
        return entityType.equals(type);
    }

    @Override
    public void onNodeCreated(String nodeId, String type) {
        if (!matches(type)) return;
        LOG.debugf("%s created, updating %s", nodeId, spec);
        spec.onNodeCreated(nodeId);
    }

    @Override
    public void onPropertyChanged(String nodeId, String type, String key, Object oldValue, Object newValue) {
        if (!matches(type)) return;
        if (!spec.dependsOn(key)) return;
        LOG.debugf("%s.%s changed from %s to %s, updating %s", nodeId, key, oldValue, newValue, spec);
        spec.onPropertyChanged(nodeId, key, oldValue, newValue);
    }

    @Override
    public void onNodeDeleted(String nodeId, String type) {
        if (!matches(type)) return;
        LOG.debugf("%s deleted, updating %s", nodeId, spec);
        spec.onNodeDeleted(nodeId);
    }

    @Override
    public String toString() {
        return "AggregateEventBridge[" + entityType + " -> " + spec + "]";
    }
}

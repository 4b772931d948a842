package com.e2eq.aggregate.core;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * Where an aggregation takes its population from: nothing yet (entities are appended later),
 * a fixed batch consumed by the next execute, live events for one entity type, or another
 * aggregation that becomes the next level down of a chain.
 */
public final class AggregationSource {

    public enum Kind { NONE, BATCH, EVENTS, CHAIN }

    private static final AggregationSource NONE = new AggregationSource(Kind.NONE, null, null, null);

    private final Kind kind;
    private final List<String> batch;
    private final String entityType;
    private final AggregationSpec child;

    private AggregationSource(Kind kind, List<String> batch, String entityType, AggregationSpec child) {
        this.kind = kind;
        this.batch = batch;
        this.entityType = entityType;
        this.child = child;
    }

    public static AggregationSource none() {
        return NONE;
    }

    public static AggregationSource of(Collection<String> nodeIds) {
        Objects.requireNonNull(nodeIds, "nodeIds");
        return new AggregationSource(Kind.BATCH, List.copyOf(new ArrayList<>(nodeIds)), null, null);
    }

    public static AggregationSource ofType(String entityType) {
        if (entityType == null || entityType.isBlank()) {
            throw new IllegalArgumentException("Entity type filter cannot be blank");
        }
        return new AggregationSource(Kind.EVENTS, null, entityType, null);
    }

    public static AggregationSource of(AggregationSpec child) {
        return new AggregationSource(Kind.CHAIN, null, null, Objects.requireNonNull(child, "child"));
    }

    public Kind kind() { return kind; }
    public List<String> batch() { return batch; }
    public String entityType() { return entityType; }
    public AggregationSpec child() { return child; }

    @Override
    public String toString() {
        switch (kind) {
            case BATCH: return "batch of " + batch.size();
            case EVENTS: return "events of " + entityType;
            case CHAIN: return "chain over " + child;
            default: return "none";
        }
    }
}

package com.e2eq.aggregate.core;

import java.util.List;
import java.util.Optional;

/**
 * Declarative form of an aggregation, one level per record. {@code child} is the next level down;
 * only the top level may carry a {@code filter} (the entity type whose events keep the tree current).
 */
public record AggregationDefinition(String id,
                                    Optional<String> filter,
                                    List<String> groupBy,
                                    Optional<String> mapValue,
                                    Optional<AggregationDefinition> child) {

    public AggregationDefinition {
        groupBy = groupBy == null ? List.of() : List.copyOf(groupBy);
        filter = filter == null ? Optional.empty() : filter;
        mapValue = mapValue == null ? Optional.empty() : mapValue;
        child = child == null ? Optional.empty() : child;
    }

    public int depth() {
        return 1 + child.map(AggregationDefinition::depth).orElse(0);
    }
}

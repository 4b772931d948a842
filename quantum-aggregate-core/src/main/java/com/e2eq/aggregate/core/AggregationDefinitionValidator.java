package com.e2eq.aggregate.core;

import com.e2eq.aggregate.exceptions.AggregateConfigurationException;

import java.util.*;

/**
 * Validator for aggregation definitions: ids, grouping keys, filter placement and mapper references.
 */
public final class AggregationDefinitionValidator {
    private AggregationDefinitionValidator() {}

    public static void validate(List<AggregationDefinition> definitions, ValueMapperRegistry mappers) {
        if (definitions == null) return;
        Set<String> ids = new HashSet<>();
        for (AggregationDefinition def : definitions) {
            require(def.id() != null && !def.id().isBlank(), "Aggregation id must be non-empty");
            require(ids.add(def.id()), "Duplicate aggregation id '" + def.id() + "'");
            def.filter().ifPresent(f -> require(!f.isBlank(), "Filter of aggregation '" + def.id() + "' must be non-empty"));
            validateLevel(def.id(), def, 0, mappers);
        }
    }

    private static void validateLevel(String id, AggregationDefinition level, int depth, ValueMapperRegistry mappers) {
        require(!level.groupBy().isEmpty(), "Aggregation '" + id + "' level " + depth + " has no groupBy");
        for (String key : level.groupBy()) {
            require(key != null && !key.isBlank(), "Aggregation '" + id + "' level " + depth + " has a blank groupBy key");
        }
        if (depth > 0) {
            require(level.filter().isEmpty(), "Aggregation '" + id + "' level " + depth
                    + " declares a filter; only the top level may");
        }
        level.mapValue().ifPresent(name -> {
            ValueMapper mapper = mappers.require(name);
            if (mapper.arity() != level.groupBy().size()) {
                throw AggregateConfigurationException.arityMismatch(level.groupBy().size(), mapper.arity());
            }
        });
        level.child().ifPresent(c -> validateLevel(id, c, depth + 1, mappers));
    }

    private static void require(boolean condition, String message) {
        if (!condition) throw new AggregateConfigurationException(message);
    }
}

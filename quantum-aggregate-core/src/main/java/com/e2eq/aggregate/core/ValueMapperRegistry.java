package com.e2eq.aggregate.core;

import com.e2eq.aggregate.exceptions.AggregateConfigurationException;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Named value mappers, so that aggregations declared in YAML can refer to mapping logic
 * that only exists in code.
 */
public class ValueMapperRegistry {

    private final Map<String, ValueMapper> byName = new ConcurrentHashMap<>();

    public ValueMapperRegistry() {
        register("identity", ValueMapper.unary(v -> v));
        register("string", ValueMapper.unary(String::valueOf));
        register("lowercase", ValueMapper.unary(v -> String.valueOf(v).toLowerCase(Locale.ROOT)));
        register("uppercase", ValueMapper.unary(v -> String.valueOf(v).toUpperCase(Locale.ROOT)));
    }

    public ValueMapperRegistry register(String name, ValueMapper mapper) {
        if (name == null || name.isBlank()) throw new IllegalArgumentException("Mapper name cannot be blank");
        if (mapper == null) throw new IllegalArgumentException("Mapper cannot be null");
        byName.put(name, mapper);
        return this;
    }

    public Optional<ValueMapper> find(String name) {
        return Optional.ofNullable(byName.get(name));
    }

    public ValueMapper require(String name) {
        return find(name).orElseThrow(() -> new AggregateConfigurationException(
                "Unknown value mapper '" + name + "'. Registered: " + names()));
    }

    public Set<String> names() {
        return new TreeSet<>(byName.keySet());
    }
}

package com.e2eq.aggregate.core;

import com.e2eq.aggregate.exceptions.AggregateConfigurationException;

import java.util.*;

/**
 * Turns an entity's property values into the keys of the groups it belongs to.
 *
 * <ul>
 *   <li>If any grouping property is missing the entity is excluded: no keys.</li>
 *   <li>With a mapper, the extracted values are passed to it in key order; a collection result
 *       means several groups.</li>
 *   <li>Without a mapper every extracted value is a key of its own, so grouping by two properties
 *       places the entity in one group per property.</li>
 *   <li>Elements that are collections are flattened one level; nulls are dropped.</li>
 * </ul>
 */
public final class GroupKeyDeriver {

    private final List<String> keys;
    private final ValueMapper mapper;

    public GroupKeyDeriver(List<String> keys, ValueMapper mapper) {
        if (keys == null || keys.isEmpty()) {
            throw new AggregateConfigurationException("At least one group by property is required");
        }
        for (String k : keys) {
            if (k == null || k.isBlank()) {
                throw new AggregateConfigurationException("Group by property names must not be blank: " + keys);
            }
        }
        if (mapper != null && mapper.arity() != keys.size()) {
            throw AggregateConfigurationException.arityMismatch(keys.size(), mapper.arity());
        }
        this.keys = List.copyOf(keys);
        this.mapper = mapper;
    }

    public List<String> keys() {
        return keys;
    }

    public Optional<ValueMapper> mapper() {
        return Optional.ofNullable(mapper);
    }

    public boolean dependsOn(String property) {
        return keys.contains(property);
    }

    public Set<Object> deriveKeys(Map<String, ?> values) {
        List<Object> extracted = new ArrayList<>(keys.size());
        for (String k : keys) {
            Object v = values.get(k);
            if (v == null) return Set.of();
            extracted.add(v);
        }

        Collection<?> raw = extracted;
        if (mapper != null) {
            Object mapped = mapper.map(Collections.unmodifiableList(extracted));
            raw = (mapped instanceof Collection) ? (Collection<?>) mapped : Collections.singletonList(mapped);
        }

        Set<Object> out = new LinkedHashSet<>();
        for (Object v : raw) {
            if (v instanceof Collection) {
                for (Object e : (Collection<?>) v) if (e != null) out.add(e);
            } else if (v != null) {
                out.add(v);
            }
        }
        return out;
    }

    @Override
    public String toString() {
        return "group by " + keys + (mapper != null ? " mapped" : "");
    }
}

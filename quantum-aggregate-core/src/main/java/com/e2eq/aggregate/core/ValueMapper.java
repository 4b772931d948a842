package com.e2eq.aggregate.core;

import java.util.List;
import java.util.function.BiFunction;
import java.util.function.Function;

/**
 * Maps the values of the grouping properties to a group key, or to a {@link java.util.Collection}
 * of keys when one entity belongs to several groups. Values are passed in grouping-key order and
 * the mapper's arity must equal the number of grouping properties.
 */
public interface ValueMapper {

    int arity();

    Object map(List<Object> values);

    @SuppressWarnings("unchecked")
    static <T> ValueMapper unary(Function<T, ?> fn) {
        return ofArity(1, values -> fn.apply((T) values.get(0)));
    }

    @SuppressWarnings("unchecked")
    static <T, U> ValueMapper binary(BiFunction<T, U, ?> fn) {
        return ofArity(2, values -> fn.apply((T) values.get(0), (U) values.get(1)));
    }

    static ValueMapper ofArity(int arity, Function<List<Object>, ?> fn) {
        if (arity < 1) throw new IllegalArgumentException("Mapper arity must be at least 1, got " + arity);
        return new ValueMapper() {
            @Override
            public int arity() {
                return arity;
            }

            @Override
            public Object map(List<Object> values) {
                return fn.apply(values);
            }
        };
    }
}

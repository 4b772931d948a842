package com.e2eq.aggregate.exceptions;

/**
 * Thrown when an aggregation is configured in a way that can never produce groups.
 * <p>
 * Raised at configuration time (or at the first key derivation when the problem can only be
 * seen then) and never retried. The most common case is a value mapper whose arity does not
 * match the number of grouping properties.
 * </p>
 */
public class AggregateConfigurationException extends RuntimeException {
    private static final long serialVersionUID = 1L;

    private final Integer expectedArity;
    private final Integer actualArity;

    public AggregateConfigurationException(String message) {
        super(message);
        this.expectedArity = null;
        this.actualArity = null;
    }

    public AggregateConfigurationException(String message, Throwable cause) {
        super(message, cause);
        this.expectedArity = null;
        this.actualArity = null;
    }

    private AggregateConfigurationException(String message, int expectedArity, int actualArity) {
        super(message);
        this.expectedArity = expectedArity;
        this.actualArity = actualArity;
    }

    public static AggregateConfigurationException arityMismatch(int expected, int actual) {
        return new AggregateConfigurationException(String.format(
            "Wrong number of arguments of map value function, expected %d args but it takes %d args",
            expected, actual), expected, actual);
    }

    /**
     * Number of grouping properties, when this is an arity mismatch.
     */
    public Integer getExpectedArity() {
        return expectedArity;
    }

    /**
     * Arity of the offending mapper, when this is an arity mismatch.
     */
    public Integer getActualArity() {
        return actualArity;
    }

    public boolean isArityMismatch() {
        return expectedArity != null;
    }
}

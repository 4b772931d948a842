package com.e2eq.aggregate.exceptions;

/**
 * Thrown when the group tree is found in a state its maintenance logic never produces:
 * a size counter about to go negative, two groups for one key under the same parent,
 * two memberships for one key, or a group that vanished while still referenced.
 * <p>
 * Signals a bug or external corruption. It aborts the current operation and must not be
 * swallowed; the store's transaction boundary decides what remains visible.
 * </p>
 */
public class AggregateInvariantViolationException extends RuntimeException {
    private static final long serialVersionUID = 1L;

    private final String nodeId;
    private final Object groupKey;

    public AggregateInvariantViolationException(String message) {
        super(message);
        this.nodeId = null;
        this.groupKey = null;
    }

    public AggregateInvariantViolationException(String nodeId, Object groupKey, String detail) {
        super(buildMessage(nodeId, groupKey, detail));
        this.nodeId = nodeId;
        this.groupKey = groupKey;
    }

    private static String buildMessage(String nodeId, Object groupKey, String detail) {
        return String.format("Aggregate invariant violated at node '%s'%s: %s",
            nodeId, groupKey != null ? " (group key '" + groupKey + "')" : "", detail);
    }

    /**
     * The node at which the violation was detected.
     */
    public String getNodeId() {
        return nodeId;
    }

    /**
     * The group key involved, if any.
     */
    public Object getGroupKey() {
        return groupKey;
    }
}

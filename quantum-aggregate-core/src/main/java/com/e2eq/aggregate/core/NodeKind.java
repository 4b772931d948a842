package com.e2eq.aggregate.core;

/**
 * What a node is to the aggregation engine, decided from the properties the engine writes.
 */
public enum NodeKind {
    /** An ordinary entity; carries no size counter. */
    LEAF,
    /** A group node: size counter plus the key it was created for. */
    GROUP,
    /** An aggregation root: size counter but no group key. */
    ROOT;

    public boolean isCounted() {
        return this != LEAF;
    }
}

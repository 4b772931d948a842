package com.e2eq.aggregate.core;

import org.eclipse.microprofile.config.Config;
import org.eclipse.microprofile.config.ConfigProvider;

/**
 * Names and switches the engine uses when it writes its group tree into the graph store.
 * Read from MicroProfile Config under the {@code quantum.aggregate.} prefix.
 */
public final class AggregateSettings {

    public static final String PREFIX = "quantum.aggregate.";

    public static final String DEFAULT_MEMBER_RELATION = "aggregate";
    public static final String DEFAULT_SIZE_PROPERTY = "aggregate_size";
    public static final String DEFAULT_GROUP_PROPERTY = "aggregate_group";
    public static final String DEFAULT_GROUP_NODE_TYPE = "AggregateGroup";
    public static final String DEFAULT_DEFINITIONS = "/aggregations.yaml";

    private final String memberRelation;
    private final String sizeProperty;
    private final String groupProperty;
    private final String groupNodeType;
    private final boolean fairLocks;
    private final String definitionsLocation;

    public AggregateSettings(String memberRelation,
                             String sizeProperty,
                             String groupProperty,
                             String groupNodeType,
                             boolean fairLocks,
                             String definitionsLocation) {
        this.memberRelation = requireName(memberRelation, "member-relation");
        this.sizeProperty = requireName(sizeProperty, "size-property");
        this.groupProperty = requireName(groupProperty, "group-property");
        this.groupNodeType = requireName(groupNodeType, "group-node-type");
        this.fairLocks = fairLocks;
        this.definitionsLocation = definitionsLocation;
        if (sizeProperty.equals(groupProperty)) {
            throw new IllegalArgumentException("size-property and group-property must differ: " + sizeProperty);
        }
    }

    public static AggregateSettings defaults() {
        return new AggregateSettings(DEFAULT_MEMBER_RELATION, DEFAULT_SIZE_PROPERTY, DEFAULT_GROUP_PROPERTY,
                DEFAULT_GROUP_NODE_TYPE, false, DEFAULT_DEFINITIONS);
    }

    public static AggregateSettings fromConfig() {
        return fromConfig(ConfigProvider.getConfig());
    }

    public static AggregateSettings fromConfig(Config config) {
        return new AggregateSettings(
                config.getOptionalValue(PREFIX + "member-relation", String.class).orElse(DEFAULT_MEMBER_RELATION),
                config.getOptionalValue(PREFIX + "size-property", String.class).orElse(DEFAULT_SIZE_PROPERTY),
                config.getOptionalValue(PREFIX + "group-property", String.class).orElse(DEFAULT_GROUP_PROPERTY),
                config.getOptionalValue(PREFIX + "group-node-type", String.class).orElse(DEFAULT_GROUP_NODE_TYPE),
                config.getOptionalValue(PREFIX + "fair-locks", Boolean.class).orElse(false),
                config.getOptionalValue(PREFIX + "definitions", String.class).orElse(DEFAULT_DEFINITIONS));
    }

    private static String requireName(String value, String what) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(PREFIX + what + " must not be blank");
        }
        return value;
    }

    /** Relation type from a group to an ordinary member. */
    public String memberRelation() { return memberRelation; }
    /** Counter of direct children on roots and groups. */
    public String sizeProperty() { return sizeProperty; }
    /** Key tag on group nodes and on the relations the engine creates. */
    public String groupProperty() { return groupProperty; }
    public String groupNodeType() { return groupNodeType; }
    public boolean fairLocks() { return fairLocks; }
    public String definitionsLocation() { return definitionsLocation; }

    @Override
    public String toString() {
        return "AggregateSettings{memberRelation=" + memberRelation + ", sizeProperty=" + sizeProperty
                + ", groupProperty=" + groupProperty + ", groupNodeType=" + groupNodeType
                + ", fairLocks=" + fairLocks + ", definitions=" + definitionsLocation + "}";
    }
}

package com.e2eq.aggregate.store;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Abstraction over the entity graph the aggregation engine maintains its group tree in.
 * The engine references entities by id only and never owns their lifetime.
 * Implementations can be backed by a database or by in-memory maps.
 */
public interface GraphStore {

    // Entities
    String createNode(String type, Map<String, Object> props);
    boolean exists(String nodeId);
    Optional<String> typeOf(String nodeId);
    void deleteNode(String nodeId);

    // Properties
    Map<String, Object> propertiesOf(String nodeId);
    Optional<Object> getProperty(String nodeId, String key);

    default boolean hasProperty(String nodeId, String key) {
        return getProperty(nodeId, key).isPresent();
    }

    /**
     * Sets a property; a {@code null} value removes it.
     */
    void setProperty(String nodeId, String key, Object value);

    // Relations
    RelationRecord createRelation(String src, String type, String dst, Map<String, Object> props);
    Optional<RelationRecord> findRelation(String relationId);
    void deleteRelation(String relationId);

    // Queries
    List<RelationRecord> listOutgoing(String src);
    List<RelationRecord> listOutgoingBy(String src, String type);
    List<RelationRecord> listIncoming(String dst);
    List<RelationRecord> listIncomingBy(String type, String dst);
}

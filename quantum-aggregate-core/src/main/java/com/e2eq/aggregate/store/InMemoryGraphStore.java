package com.e2eq.aggregate.store;

import com.e2eq.aggregate.spi.GraphEventListener;
import org.jboss.logging.Logger;

import java.util.*;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;

/**
 * A minimal in-memory GraphStore that is also the event source for its own mutations.
 * <p>
 * Mutations happen under the store monitor; listeners are called after the monitor is released
 * so that a listener taking an aggregation lock cannot deadlock against another thread that holds
 * that lock and is waiting on the store. Deletion is announced before the node is removed.
 * </p>
 */
public class InMemoryGraphStore implements GraphStore, GraphEventSource {

    private static final Logger LOG = Logger.getLogger(InMemoryGraphStore.class);

    private final Map<String, NodeData> nodes = new HashMap<>();
    private final Map<String, RelationRecord> relations = new LinkedHashMap<>();
    private final Map<String, List<String>> outgoing = new HashMap<>();
    private final Map<String, List<String>> incoming = new HashMap<>();
    private final List<GraphEventListener> listeners = new CopyOnWriteArrayList<>();
    private final AtomicLong nodeSeq = new AtomicLong();
    private final AtomicLong relationSeq = new AtomicLong();

    private static final class NodeData {
        final String type;
        final Map<String, Object> props = new LinkedHashMap<>();
        NodeData(String type) { this.type = type; }
    }

    @Override
    public void addListener(GraphEventListener listener) {
        if (listener == null) throw new IllegalArgumentException("Listener cannot be null");
        listeners.add(listener);
    }

    @Override
    public void removeListener(GraphEventListener listener) {
        listeners.remove(listener);
    }

    public int listenerCount() {
        return listeners.size();
    }

    @Override
    public String createNode(String type, Map<String, Object> props) {
        String id = "node-" + nodeSeq.incrementAndGet();
        synchronized (this) {
            NodeData data = new NodeData(type);
            if (props != null) {
                props.forEach((k, v) -> { if (v != null) data.props.put(k, v); });
            }
            nodes.put(id, data);
        }
        LOG.debugf("Created node %s of type %s", id, type);
        for (GraphEventListener l : listeners) l.onNodeCreated(id, type);
        return id;
    }

    public String createNode(String type) {
        return createNode(type, Map.of());
    }

    @Override
    public synchronized boolean exists(String nodeId) {
        return nodes.containsKey(nodeId);
    }

    @Override
    public synchronized Optional<String> typeOf(String nodeId) {
        NodeData data = nodes.get(nodeId);
        return data == null ? Optional.empty() : Optional.ofNullable(data.type);
    }

    @Override
    public void deleteNode(String nodeId) {
        String type;
        synchronized (this) {
            NodeData data = nodes.get(nodeId);
            if (data == null) return;
            type = data.type;
        }
        for (GraphEventListener l : listeners) l.onNodeDeleted(nodeId, type);
        synchronized (this) {
            if (nodes.remove(nodeId) == null) return;
            List<String> attached = new ArrayList<>(outgoing.getOrDefault(nodeId, List.of()));
            attached.addAll(incoming.getOrDefault(nodeId, List.of()));
            for (String relId : attached) removeRelation(relId);
            outgoing.remove(nodeId);
            incoming.remove(nodeId);
        }
        LOG.debugf("Deleted node %s", nodeId);
    }

    @Override
    public synchronized Map<String, Object> propertiesOf(String nodeId) {
        NodeData data = nodes.get(nodeId);
        return data == null ? new LinkedHashMap<>() : new LinkedHashMap<>(data.props);
    }

    @Override
    public synchronized Optional<Object> getProperty(String nodeId, String key) {
        NodeData data = nodes.get(nodeId);
        return data == null ? Optional.empty() : Optional.ofNullable(data.props.get(key));
    }

    @Override
    public void setProperty(String nodeId, String key, Object value) {
        Object old;
        String type;
        synchronized (this) {
            NodeData data = nodes.get(nodeId);
            if (data == null) throw new NoSuchElementException("No node with id " + nodeId);
            old = data.props.get(key);
            if (Objects.equals(old, value)) return;
            if (value == null) data.props.remove(key); else data.props.put(key, value);
            type = data.type;
        }
        for (GraphEventListener l : listeners) l.onPropertyChanged(nodeId, type, key, old, value);
    }

    @Override
    public synchronized RelationRecord createRelation(String src, String type, String dst, Map<String, Object> props) {
        if (!nodes.containsKey(src)) throw new NoSuchElementException("No node with id " + src);
        if (!nodes.containsKey(dst)) throw new NoSuchElementException("No node with id " + dst);
        String id = "rel-" + relationSeq.incrementAndGet();
        RelationRecord rec = new RelationRecord(id, src, type, dst, props);
        relations.put(id, rec);
        outgoing.computeIfAbsent(src, k -> new ArrayList<>()).add(id);
        incoming.computeIfAbsent(dst, k -> new ArrayList<>()).add(id);
        return rec.copy();
    }

    @Override
    public synchronized Optional<RelationRecord> findRelation(String relationId) {
        RelationRecord rec = relations.get(relationId);
        return rec == null ? Optional.empty() : Optional.of(rec.copy());
    }

    @Override
    public synchronized void deleteRelation(String relationId) {
        removeRelation(relationId);
    }

    private void removeRelation(String relationId) {
        RelationRecord rec = relations.remove(relationId);
        if (rec == null) return;
        List<String> out = outgoing.get(rec.getSrc());
        if (out != null) out.remove(relationId);
        List<String> in = incoming.get(rec.getDst());
        if (in != null) in.remove(relationId);
    }

    @Override
    public synchronized List<RelationRecord> listOutgoing(String src) {
        return collect(outgoing.get(src), null);
    }

    @Override
    public synchronized List<RelationRecord> listOutgoingBy(String src, String type) {
        return collect(outgoing.get(src), type);
    }

    @Override
    public synchronized List<RelationRecord> listIncoming(String dst) {
        return collect(incoming.get(dst), null);
    }

    @Override
    public synchronized List<RelationRecord> listIncomingBy(String type, String dst) {
        return collect(incoming.get(dst), type);
    }

    private List<RelationRecord> collect(List<String> ids, String type) {
        List<RelationRecord> out = new ArrayList<>();
        if (ids == null) return out;
        for (String id : ids) {
            RelationRecord rec = relations.get(id);
            if (rec != null && (type == null || type.equals(rec.getType()))) out.add(rec.copy());
        }
        return out;
    }

    public synchronized int nodeCount() {
        return nodes.size();
    }
}

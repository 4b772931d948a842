package com.e2eq.aggregate.core;

import com.e2eq.aggregate.exceptions.AggregateConfigurationException;
import com.e2eq.aggregate.store.RelationRecord;
import org.jboss.logging.Logger;

import java.util.*;

/**
 * Describes how entities are grouped under one aggregation root and keeps that grouping current.
 *
 * <pre>{@code
 * AggregationSpec byColour = engine.aggregate(rootId, AggregationSource.ofType("Person"))
 *         .groupBy("colour");
 * engine.groupOf(byColour, "red");   // the group of all red Persons, kept live by events
 * }</pre>
 *
 * <p>A spec built from another spec (see {@link AggregationSource#of(AggregationSpec)}) is the upper
 * level of a chain and owns the lower one: it takes over the lower spec's pending population and event
 * subscription, and every entity is resolved from the top of the chain down. Each entity yields a set of
 * key paths (top key first, one key per level); the entity is a member of the leaf group at the end of
 * each path.</p>
 *
 * <p>All mutations of the tree below the root run under the root's write lock.</p>
 */
public class AggregationSpec {

    private static final Logger LOG = Logger.getLogger(AggregationSpec.class);

    private final AggregationEngine engine;
    private final String rootId;

    // written by the configuration calls and read by event threads outside the root lock
    private volatile List<String> keys;
    private volatile ValueMapper mapper;
    private volatile GroupKeyDeriver deriver;
    private volatile AggregationSpec child;
    private volatile List<String> pending;
    private volatile String filterType;
    private volatile boolean owned;

    AggregationSpec(AggregationEngine engine, String rootId, AggregationSource source) {
        this.engine = Objects.requireNonNull(engine, "engine");
        this.rootId = Objects.requireNonNull(rootId, "rootId");
        switch (source.kind()) {
            case BATCH:
                this.pending = new ArrayList<>(source.batch());
                break;
            case EVENTS:
                this.filterType = source.entityType();
                break;
            case CHAIN:
                adopt(source.child());
                break;
            default:
                break;
        }
    }

    // --- configuration ---

    /**
     * Specifies which properties to group on. Without a mapper every property value is a group key
     * of its own.
     */
    public AggregationSpec groupBy(String... keys) {
        return groupBy(Arrays.asList(keys));
    }

    public AggregationSpec groupBy(List<String> keys) {
        this.deriver = new GroupKeyDeriver(keys, mapper);
        this.keys = List.copyOf(keys);
        return this;
    }

    /**
     * Maps the grouped property values to the group key(s). May be given before or after
     * {@link #groupBy}; the arity is checked as soon as both are known.
     */
    public AggregationSpec mapValue(ValueMapper mapper) {
        if (keys != null) {
            this.deriver = new GroupKeyDeriver(keys, mapper);
        }
        this.mapper = mapper;
        return this;
    }

    public AggregationSpec configure(List<String> keys, ValueMapper mapper, AggregationSpec child) {
        this.deriver = new GroupKeyDeriver(keys, mapper);
        this.keys = List.copyOf(keys);
        this.mapper = mapper;
        if (child != null && child != this.child) {
            adopt(child);
            if (filterType != null) engine.subscribe(this, filterType);
        }
        return this;
    }

    private void adopt(AggregationSpec lower) {
        if (lower == this) {
            throw new AggregateConfigurationException("An aggregation cannot be chained over itself");
        }
        if (lower.owned) {
            throw new AggregateConfigurationException("Aggregation " + lower + " is already chained under another aggregation");
        }
        if (this.child != null) {
            throw new AggregateConfigurationException("Aggregation " + this + " already has a lower level");
        }
        lower.owned = true;
        this.child = lower;
        if (lower.pending != null) {
            if (pending == null) pending = new ArrayList<>();
            pending.addAll(lower.pending);
            lower.pending = null;
        }
        if (lower.filterType != null) {
            engine.unsubscribe(lower);
            if (filterType == null) filterType = lower.filterType;
            lower.filterType = null;
        }
        LOG.debugf("Chained %s under %s", lower, this);
    }

    // --- bulk population ---

    /**
     * Creates the groups for the pending population given at construction. The population is
     * consumed, so calling this again without new input changes nothing. Also called implicitly
     * by lookups.
     */
    public GroupChanges execute() {
        requireTopLevel();
        return engine.locks().write(rootId, () -> {
            List<String> batch = pending;
            pending = null;
            return apply(batch);
        });
    }

    public GroupChanges execute(Collection<String> nodeIds) {
        if (nodeIds == null) return execute();
        requireTopLevel();
        List<String> batch = new ArrayList<>(nodeIds);
        return engine.locks().write(rootId, () -> apply(batch));
    }

    /**
     * Puts the given entities into their groups.
     *
     * @return this spec, for chaining appends
     */
    public AggregationSpec append(String... nodeIds) {
        return append(Arrays.asList(nodeIds));
    }

    public AggregationSpec append(Collection<String> nodeIds) {
        execute(nodeIds);
        return this;
    }

    private GroupChanges apply(Collection<String> batch) {
        GroupChanges changes = new GroupChanges();
        if (batch == null || batch.isEmpty()) return changes;
        requireConfigured();
        engine.groups().ensureRoot(rootId);
        for (String nodeId : batch) {
            if (!engine.graph().exists(nodeId)) continue;
            for (List<Object> path : keyPathsOf(engine.graph().propertiesOf(nodeId))) {
                addPath(nodeId, path, changes);
            }
        }
        LOG.debugf("Executed %s over %d nodes: %s", this, batch.size(), changes);
        return changes;
    }

    // --- lookups ---

    public boolean includesMember(String nodeId) {
        flushPending();
        return engine.locks().read(rootId, () -> {
            if (!isConfigured()) return false;
            for (List<Object> path : keyPathsOf(engine.graph().propertiesOf(nodeId))) {
                Optional<String> leaf = resolve(path);
                if (leaf.isPresent()
                        && engine.groups().findMembership(leaf.get(), nodeId, path.get(path.size() - 1)).isPresent()) {
                    return true;
                }
            }
            return false;
        });
    }

    public Optional<String> groupOf(Object key) {
        flushPending();
        return engine.locks().read(rootId, () -> engine.groups().findGroup(rootId, key));
    }

    public List<String> groups() {
        flushPending();
        return engine.locks().read(rootId, () -> engine.groups().groupsUnder(rootId));
    }

    /**
     * Stops event delivery to this aggregation. Groups already built stay as they are.
     */
    public void unregister() {
        engine.unsubscribe(this);
    }

    // --- incremental hooks, called by AggregateEventBridge ---

    GroupChanges onNodeCreated(String nodeId) {
        if (!isConfigured()) return GroupChanges.empty();
        return engine.locks().write(rootId, () -> apply(List.of(nodeId)));
    }

    GroupChanges onPropertyChanged(String nodeId, String key, Object oldValue, Object newValue) {
        if (!isConfigured() || !dependsOn(key)) return GroupChanges.empty();
        return engine.locks().write(rootId, () -> {
            GroupChanges changes = new GroupChanges();
            // a late event for a deleted entity; its memberships went with onNodeDeleted
            if (!engine.graph().exists(nodeId)) return changes;
            // the store is authoritative for the new state, events may arrive out of order
            Map<String, Object> current = engine.graph().propertiesOf(nodeId);
            Map<String, Object> previous = new LinkedHashMap<>(current);
            putOrRemove(previous, key, oldValue);

            Set<List<Object>> oldPaths = keyPathsOf(previous);
            Set<List<Object>> newPaths = keyPathsOf(current);
            if (oldPaths.equals(newPaths)) return changes;

            engine.groups().ensureRoot(rootId);
            // add first so that an upper group shared by old and new paths is not emptied and recreated
            for (List<Object> path : newPaths) {
                if (!oldPaths.contains(path)) addPath(nodeId, path, changes);
            }
            for (List<Object> path : oldPaths) {
                if (!newPaths.contains(path)) removePath(nodeId, path, changes);
            }
            LOG.debugf("Property %s of %s changed (%s -> %s): %s", key, nodeId, oldValue, newValue, changes);
            return changes;
        });
    }

    GroupChanges onNodeDeleted(String nodeId) {
        return engine.locks().write(rootId, () -> {
            GroupChanges changes = new GroupChanges();
            for (RelationRecord membership : engine.walker().memberships(nodeId)) {
                // an earlier cascade in this loop may already have removed it
                if (engine.graph().findRelation(membership.getId()).isEmpty()) continue;
                if (!engine.walker().descendsFrom(membership.getSrc(), rootId)) continue;
                engine.groups().detachMember(membership, changes);
            }
            LOG.debugf("Node %s deleted: %s", nodeId, changes);
            return changes;
        });
    }

    // --- key paths ---

    /**
     * Key paths for the given property values, top level first. An entity excluded at any level
     * has no path.
     */
    Set<List<Object>> keyPathsOf(Map<String, ?> values) {
        requireConfigured();
        Set<List<Object>> out = new LinkedHashSet<>();
        Set<Object> keysHere = deriver.deriveKeys(values);
        if (keysHere.isEmpty()) return out;
        if (child == null) {
            for (Object k : keysHere) out.add(List.of(k));
            return out;
        }
        Set<List<Object>> tails = child.keyPathsOf(values);
        for (Object k : keysHere) {
            for (List<Object> tail : tails) {
                List<Object> path = new ArrayList<>(tail.size() + 1);
                path.add(k);
                path.addAll(tail);
                out.add(List.copyOf(path));
            }
        }
        return out;
    }

    private void addPath(String nodeId, List<Object> path, GroupChanges changes) {
        if (!engine.graph().exists(nodeId)) return;
        String parent = rootId;
        for (Object key : path) {
            parent = engine.groups().findOrCreateGroup(parent, key, changes);
        }
        engine.groups().attachMember(parent, nodeId, path.get(path.size() - 1), changes);
    }

    private void removePath(String nodeId, List<Object> path, GroupChanges changes) {
        Optional<String> leaf = resolve(path);
        if (leaf.isEmpty()) return;
        engine.groups().findMembership(leaf.get(), nodeId, path.get(path.size() - 1))
                .ifPresent(membership -> engine.groups().detachMember(membership, changes));
    }

    private Optional<String> resolve(List<Object> path) {
        String parent = rootId;
        for (Object key : path) {
            Optional<String> group = engine.groups().findGroup(parent, key);
            if (group.isEmpty()) return Optional.empty();
            parent = group.get();
        }
        return Optional.of(parent);
    }

    private static void putOrRemove(Map<String, Object> values, String key, Object value) {
        if (value == null) values.remove(key); else values.put(key, value);
    }

    private void flushPending() {
        if (pending != null && !owned) execute();
    }

    // --- state ---

    public boolean isConfigured() {
        return deriver != null && (child == null || child.isConfigured());
    }

    /**
     * True when any level of the chain groups on the property.
     */
    public boolean dependsOn(String property) {
        return (deriver != null && deriver.dependsOn(property)) || (child != null && child.dependsOn(property));
    }

    private void requireConfigured() {
        if (deriver == null) {
            throw new AggregateConfigurationException("No group by properties configured for aggregation on root " + rootId);
        }
    }

    private void requireTopLevel() {
        if (owned) {
            throw new AggregateConfigurationException("Aggregation " + this
                    + " is chained under another aggregation; use the top of the chain");
        }
    }

    public String rootId() {
        return rootId;
    }

    public List<String> groupByKeys() {
        return keys != null ? keys : List.of();
    }

    public Optional<ValueMapper> mapper() {
        return Optional.ofNullable(mapper);
    }

    public Optional<AggregationSpec> child() {
        return Optional.ofNullable(child);
    }

    public Optional<String> filterType() {
        return Optional.ofNullable(filterType);
    }

    public boolean isOwned() {
        return owned;
    }

    public boolean hasPending() {
        return pending != null && !pending.isEmpty();
    }

    @Override
    public String toString() {
        return "Aggregation root " + rootId + " group by " + groupByKeys()
                + " filter " + (filterType != null) + " child: " + (child != null);
    }
}

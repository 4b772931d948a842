package com.e2eq.aggregate.core;

import com.e2eq.aggregate.exceptions.AggregateConfigurationException;
import com.e2eq.aggregate.exceptions.AggregateInvariantViolationException;
import com.e2eq.aggregate.store.GraphStore;
import com.e2eq.aggregate.store.RelationRecord;
import org.jboss.logging.Logger;

import java.util.*;

/**
 * Maintains group nodes in the graph store: find-or-create under a parent, membership,
 * size counters and the upward cascade when a group empties.
 * <p>
 * Every relation written here is tagged with the group key that produced it. A parent's size
 * counter always equals the number of tagged relations leaving it. Callers serialize mutations
 * per root (see {@link RootLocks}); find-or-create and the size increment are not atomic as a pair.
 * </p>
 */
public final class GroupStore {

    private static final Logger LOG = Logger.getLogger(GroupStore.class);

    private final GraphStore store;
    private final AggregateSettings settings;

    public GroupStore(GraphStore store, AggregateSettings settings) {
        this.store = Objects.requireNonNull(store, "store");
        this.settings = Objects.requireNonNull(settings, "settings");
    }

    public GraphStore graph() {
        return store;
    }

    public AggregateSettings settings() {
        return settings;
    }

    public static String relationType(Object key) {
        return String.valueOf(key);
    }

    public NodeKind kindOf(String nodeId) {
        if (!store.hasProperty(nodeId, settings.sizeProperty())) return NodeKind.LEAF;
        return store.hasProperty(nodeId, settings.groupProperty()) ? NodeKind.GROUP : NodeKind.ROOT;
    }

    /**
     * Prepares a node to anchor groups: it must exist, and gets a zero size counter if it has none.
     */
    public void ensureRoot(String rootId) {
        if (rootId == null || !store.exists(rootId)) {
            throw new AggregateConfigurationException("Aggregation root '" + rootId + "' does not exist");
        }
        if (!store.hasProperty(rootId, settings.sizeProperty())) {
            store.setProperty(rootId, settings.sizeProperty(), 0L);
        }
    }

    public Optional<String> findGroup(String parentId, Object key) {
        List<String> found = new ArrayList<>();
        for (RelationRecord r : store.listOutgoingBy(parentId, relationType(key))) {
            if (!Objects.equals(r.getProperty(settings.groupProperty()), key)) continue;
            if (kindOf(r.getDst()) == NodeKind.GROUP) found.add(r.getDst());
        }
        if (found.size() > 1) {
            throw new AggregateInvariantViolationException(parentId, key,
                    "same group key used in several aggregate groups " + found);
        }
        return found.isEmpty() ? Optional.empty() : Optional.of(found.get(0));
    }

    public String findOrCreateGroup(String parentId, Object key, GroupChanges changes) {
        Optional<String> existing = findGroup(parentId, key);
        if (existing.isPresent()) return existing.get();

        requireCounted(parentId, key);
        Map<String, Object> props = new LinkedHashMap<>();
        props.put(settings.sizeProperty(), 0L);
        props.put(settings.groupProperty(), key);
        String groupId = store.createNode(settings.groupNodeType(), props);
        store.createRelation(parentId, relationType(key), groupId, Map.of(settings.groupProperty(), key));
        adjustSize(parentId, key, 1);
        changes.createdGroups().add(groupId);
        LOG.debugf("Created group %s for key '%s' under %s", groupId, key, parentId);
        return groupId;
    }

    /**
     * Relation type used to attach {@code memberId}: the key itself when the member is a group,
     * the member relation otherwise.
     */
    public String membershipType(String memberId, Object key) {
        return kindOf(memberId) == NodeKind.GROUP ? relationType(key) : settings.memberRelation();
    }

    public Optional<RelationRecord> findMembership(String groupId, String memberId, Object key) {
        List<RelationRecord> found = new ArrayList<>();
        for (RelationRecord r : store.listOutgoingBy(groupId, membershipType(memberId, key))) {
            if (r.getDst().equals(memberId) && Objects.equals(r.getProperty(settings.groupProperty()), key)) {
                found.add(r);
            }
        }
        if (found.size() > 1) {
            throw new AggregateInvariantViolationException(memberId, key,
                    "member of the same group several times (" + found.size() + " relations from " + groupId + ")");
        }
        return found.isEmpty() ? Optional.empty() : Optional.of(found.get(0));
    }

    public RelationRecord attachMember(String groupId, String memberId, Object key, GroupChanges changes) {
        if (kindOf(groupId) != NodeKind.GROUP) {
            throw new AggregateInvariantViolationException(groupId, key, "attach target is not a group node");
        }
        Optional<RelationRecord> existing = findMembership(groupId, memberId, key);
        if (existing.isPresent()) {
            LOG.debugf("Node %s already member of group %s, skipping", memberId, groupId);
            return existing.get();
        }
        RelationRecord rel = store.createRelation(groupId, membershipType(memberId, key), memberId,
                Map.of(settings.groupProperty(), key));
        adjustSize(groupId, key, 1);
        changes.attached().add(rel);
        return rel;
    }

    public void detachMember(RelationRecord membership, GroupChanges changes) {
        String groupId = membership.getSrc();
        Object key = membership.getProperty(settings.groupProperty());
        store.deleteRelation(membership.getId());
        changes.detached().add(membership);
        long size = adjustSize(groupId, key, -1);
        if (size == 0 && kindOf(groupId) == NodeKind.GROUP) {
            deleteGroup(groupId, changes);
        }
    }

    /**
     * Removes an emptied group: every parent that counted it is decremented once, parents that
     * are groups and reach zero are removed in turn. Roots are never removed.
     */
    public void deleteGroup(String groupId, GroupChanges changes) {
        if (!store.exists(groupId)) {
            throw new AggregateInvariantViolationException(groupId, null, "group vanished while still referenced");
        }
        Object key = store.getProperty(groupId, settings.groupProperty()).orElse(null);
        Set<String> parents = new LinkedHashSet<>();
        for (RelationRecord r : store.listIncoming(groupId)) {
            if (r.getProperty(settings.groupProperty()) != null && kindOf(r.getSrc()).isCounted()) {
                parents.add(r.getSrc());
            }
        }
        for (String parent : parents) {
            long size = adjustSize(parent, key, -1);
            if (size == 0 && kindOf(parent) == NodeKind.GROUP) {
                deleteGroup(parent, changes);
            }
        }
        store.deleteNode(groupId);
        changes.deletedGroups().add(groupId);
        LOG.debugf("Deleted empty group %s (key '%s')", groupId, key);
    }

    public long sizeOf(String nodeId) {
        return store.getProperty(nodeId, settings.sizeProperty())
                .map(v -> ((Number) v).longValue())
                .orElse(0L);
    }

    public Optional<Object> groupKeyOf(String groupId) {
        return store.getProperty(groupId, settings.groupProperty());
    }

    /**
     * Direct children of a root or group, in creation order.
     */
    public List<String> membersOf(String nodeId) {
        List<String> out = new ArrayList<>();
        for (RelationRecord r : store.listOutgoing(nodeId)) {
            if (r.getProperty(settings.groupProperty()) != null) out.add(r.getDst());
        }
        return out;
    }

    public List<String> groupsUnder(String parentId) {
        List<String> out = new ArrayList<>();
        for (RelationRecord r : store.listOutgoing(parentId)) {
            if (r.getProperty(settings.groupProperty()) != null && kindOf(r.getDst()) == NodeKind.GROUP) {
                out.add(r.getDst());
            }
        }
        return out;
    }

    private void requireCounted(String nodeId, Object key) {
        if (!store.exists(nodeId)) {
            throw new AggregateInvariantViolationException(nodeId, key, "node vanished while still referenced");
        }
        if (!kindOf(nodeId).isCounted()) {
            throw new AggregateInvariantViolationException(nodeId, key, "node has no size counter");
        }
    }

    private long adjustSize(String nodeId, Object key, int delta) {
        requireCounted(nodeId, key);
        long next = sizeOf(nodeId) + delta;
        if (next < 0) {
            throw new AggregateInvariantViolationException(nodeId, key, "size counter would drop below zero");
        }
        store.setProperty(nodeId, settings.sizeProperty(), next);
        return next;
    }
}

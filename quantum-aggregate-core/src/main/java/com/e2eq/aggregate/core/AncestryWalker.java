package com.e2eq.aggregate.core;

import com.e2eq.aggregate.store.GraphStore;
import com.e2eq.aggregate.store.RelationRecord;

import java.util.*;

/**
 * Finds the aggregation roots an entity or group belongs to by walking relations upward.
 * <p>
 * From a group, incoming relations lead to parents: parents that are groups are walked further,
 * parents that are roots are yielded. From any other node, incoming member relations lead to the
 * groups it is a direct member of, and the walk continues from those. Roots carry no marker of their
 * own; a root is a node with a size counter and no group key.
 * </p>
 * The sequence is lazy and reads the store as it goes. Each root is yielded once per iteration;
 * iterating again walks the store again.
 */
public final class AncestryWalker {

    private final GroupStore groups;

    public AncestryWalker(GroupStore groups) {
        this.groups = Objects.requireNonNull(groups, "groups");
    }

    public Iterable<String> ancestorsOf(String nodeId) {
        return () -> new RootIterator(nodeId);
    }

    public boolean descendsFrom(String nodeId, String rootId) {
        for (String root : ancestorsOf(nodeId)) {
            if (root.equals(rootId)) return true;
        }
        return false;
    }

    /**
     * Groups the node is a direct member of.
     */
    public List<String> groupsOf(String nodeId) {
        List<String> out = new ArrayList<>();
        for (RelationRecord r : memberships(nodeId)) out.add(r.getSrc());
        return out;
    }

    /**
     * The group the node joined under {@code key}, if any.
     */
    public Optional<String> groupOf(String nodeId, Object key) {
        String groupProperty = groups.settings().groupProperty();
        for (RelationRecord r : memberships(nodeId)) {
            if (Objects.equals(r.getProperty(groupProperty), key)) return Optional.of(r.getSrc());
        }
        return Optional.empty();
    }

    /**
     * Membership relations pointing at the node: member relations for ordinary nodes, keyed
     * relations from groups when the node is itself a group.
     */
    public List<RelationRecord> memberships(String nodeId) {
        GraphStore store = groups.graph();
        String groupProperty = groups.settings().groupProperty();
        List<RelationRecord> out = new ArrayList<>();
        if (groups.kindOf(nodeId) == NodeKind.GROUP) {
            for (RelationRecord r : store.listIncoming(nodeId)) {
                if (r.getProperty(groupProperty) != null && groups.kindOf(r.getSrc()) == NodeKind.GROUP) out.add(r);
            }
        } else {
            for (RelationRecord r : store.listIncomingBy(groups.settings().memberRelation(), nodeId)) {
                if (groups.kindOf(r.getSrc()) == NodeKind.GROUP) out.add(r);
            }
        }
        return out;
    }

    private final class RootIterator implements Iterator<String> {
        private final Deque<String> pending = new ArrayDeque<>();
        private final Deque<String> found = new ArrayDeque<>();
        private final Set<String> visited = new HashSet<>();
        private final Set<String> yielded = new HashSet<>();

        RootIterator(String start) {
            if (groups.kindOf(start) == NodeKind.GROUP) {
                pending.push(start);
            } else {
                for (RelationRecord r : memberships(start)) pending.push(r.getSrc());
            }
        }

        @Override
        public boolean hasNext() {
            String groupProperty = groups.settings().groupProperty();
            while (found.isEmpty() && !pending.isEmpty()) {
                String group = pending.pop();
                if (!visited.add(group)) continue;
                for (RelationRecord r : groups.graph().listIncoming(group)) {
                    if (r.getProperty(groupProperty) == null) continue;
                    String parent = r.getSrc();
                    NodeKind kind = groups.kindOf(parent);
                    if (kind == NodeKind.GROUP) {
                        pending.push(parent);
                    } else if (kind == NodeKind.ROOT && yielded.add(parent)) {
                        found.addLast(parent);
                    }
                }
            }
            return !found.isEmpty();
        }

        @Override
        public String next() {
            if (!hasNext()) throw new NoSuchElementException();
            return found.removeFirst();
        }
    }
}

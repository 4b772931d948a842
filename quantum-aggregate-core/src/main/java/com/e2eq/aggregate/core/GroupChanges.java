package com.e2eq.aggregate.core;

import com.e2eq.aggregate.store.RelationRecord;

import java.util.ArrayList;
import java.util.List;

/**
 * Tracks groups and memberships created or removed while applying one aggregation operation.
 */
public record GroupChanges(List<String> createdGroups,
                           List<String> deletedGroups,
                           List<RelationRecord> attached,
                           List<RelationRecord> detached) {

    public GroupChanges() {
        this(new ArrayList<>(), new ArrayList<>(), new ArrayList<>(), new ArrayList<>());
    }

    public static GroupChanges empty() {
        return new GroupChanges();
    }

    public boolean isEmpty() {
        return createdGroups.isEmpty() && deletedGroups.isEmpty() && attached.isEmpty() && detached.isEmpty();
    }

    @Override
    public String toString() {
        return "GroupChanges{created=" + createdGroups.size() + ", deleted=" + deletedGroups.size()
                + ", attached=" + attached.size() + ", detached=" + detached.size() + "}";
    }
}

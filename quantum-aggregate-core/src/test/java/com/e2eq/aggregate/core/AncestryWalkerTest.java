package com.e2eq.aggregate.core;

import com.e2eq.aggregate.store.InMemoryGraphStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.*;

import static org.junit.jupiter.api.Assertions.*;

class AncestryWalkerTest {

    private InMemoryGraphStore store;
    private GroupStore groups;
    private AncestryWalker walker;

    @BeforeEach
    void setUp() {
        store = new InMemoryGraphStore();
        groups = new GroupStore(store, AggregateSettings.defaults());
        walker = new AncestryWalker(groups);
    }

    private String newRoot() {
        String root = store.createNode("Root");
        groups.ensureRoot(root);
        return root;
    }

    private static List<String> list(Iterable<String> it) {
        List<String> out = new ArrayList<>();
        it.forEach(out::add);
        return out;
    }

    @Test
    void leafInOneGroupHasItsRoot() {
        String root = newRoot();
        String red = groups.findOrCreateGroup(root, "red", new GroupChanges());
        String leaf = store.createNode("Person");
        groups.attachMember(red, leaf, "red", new GroupChanges());

        assertEquals(List.of(root), list(walker.ancestorsOf(leaf)));
        assertEquals(List.of(root), list(walker.ancestorsOf(red)));
        assertTrue(walker.descendsFrom(leaf, root));
    }

    @Test
    void ungroupedLeafHasNoAncestors() {
        newRoot();
        String leaf = store.createNode("Person");
        assertFalse(walker.ancestorsOf(leaf).iterator().hasNext());
        assertThrows(NoSuchElementException.class, () -> walker.ancestorsOf(leaf).iterator().next());
    }

    @Test
    void leafInTwoTreesYieldsBothRoots() {
        String byColour = newRoot();
        String bySize = newRoot();
        String leaf = store.createNode("Person");
        String red = groups.findOrCreateGroup(byColour, "red", new GroupChanges());
        String large = groups.findOrCreateGroup(bySize, "L", new GroupChanges());
        groups.attachMember(red, leaf, "red", new GroupChanges());
        groups.attachMember(large, leaf, "L", new GroupChanges());

        assertEquals(Set.of(byColour, bySize), new HashSet<>(list(walker.ancestorsOf(leaf))));
        assertEquals(List.of(red, large), walker.groupsOf(leaf));
        assertEquals(Optional.of(large), walker.groupOf(leaf, "L"));
        assertTrue(walker.groupOf(leaf, "blue").isEmpty());
    }

    @Test
    void rootReachedThroughSeveralGroupsIsYieldedOnce() {
        String root = newRoot();
        String leaf = store.createNode("Person");
        for (String key : List.of("a", "b", "c")) {
            String g = groups.findOrCreateGroup(root, key, new GroupChanges());
            groups.attachMember(g, leaf, key, new GroupChanges());
        }
        assertEquals(List.of(root), list(walker.ancestorsOf(leaf)));
    }

    @Test
    void groupOfGroupsReachesEveryRoot() {
        String lower = newRoot();
        String upper = newRoot();
        String x = groups.findOrCreateGroup(lower, "x", new GroupChanges());
        String y = groups.findOrCreateGroup(upper, "y", new GroupChanges());
        groups.attachMember(y, x, "y", new GroupChanges());
        String leaf = store.createNode("Person");
        groups.attachMember(x, leaf, "x", new GroupChanges());

        assertEquals(Set.of(lower, upper), new HashSet<>(list(walker.ancestorsOf(leaf))));
        assertEquals(List.of(y), walker.groupsOf(x));
    }

    @Test
    void nestedGroupsWalkToTheRoot() {
        String root = newRoot();
        String red = groups.findOrCreateGroup(root, "red", new GroupChanges());
        String young = groups.findOrCreateGroup(red, 4, new GroupChanges());
        String leaf = store.createNode("Person");
        groups.attachMember(young, leaf, 4, new GroupChanges());

        assertEquals(List.of(root), list(walker.ancestorsOf(leaf)));
        assertFalse(walker.descendsFrom(leaf, red));
    }

    @Test
    void iteratingAgainReadsTheStoreAgain() {
        String root = newRoot();
        String red = groups.findOrCreateGroup(root, "red", new GroupChanges());
        String leaf = store.createNode("Person");
        Iterable<String> ancestors = walker.ancestorsOf(leaf);
        assertTrue(list(ancestors).isEmpty());

        groups.attachMember(red, leaf, "red", new GroupChanges());
        assertEquals(List.of(root), list(ancestors));
    }
}

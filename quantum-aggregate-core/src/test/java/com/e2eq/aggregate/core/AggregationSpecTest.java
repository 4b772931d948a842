package com.e2eq.aggregate.core;

import com.e2eq.aggregate.exceptions.AggregateConfigurationException;
import com.e2eq.aggregate.store.InMemoryGraphStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.*;

import static com.e2eq.aggregate.core.TreeAssertions.assertTreeConsistent;
import static org.junit.jupiter.api.Assertions.*;

class AggregationSpecTest {

    private InMemoryGraphStore store;
    private AggregationEngine engine;
    private String root;

    @BeforeEach
    void setUp() {
        store = new InMemoryGraphStore();
        engine = new AggregationEngine(store, store, AggregateSettings.defaults());
        root = store.createNode("Root");
    }

    private String person(String colour, Integer age) {
        Map<String, Object> props = new HashMap<>();
        props.put("colour", colour);
        props.put("age", age);
        return store.createNode("Person", props);
    }

    @Test
    void executeGroupsTheBatchOnce() {
        List<String> people = List.of(person("red", 4), person("red", 30), person("blue", 30));
        AggregationSpec spec = engine.aggregate(root, AggregationSource.of(people)).groupBy("colour");
        assertTrue(spec.hasPending());

        GroupChanges first = spec.execute();
        assertEquals(2, first.createdGroups().size());
        assertEquals(3, first.attached().size());
        assertEquals(2L, engine.sizeOf(root));
        assertEquals(2L, engine.sizeOf(spec.groupOf("red").orElseThrow()));

        GroupChanges second = spec.execute();
        assertTrue(second.isEmpty());
        assertEquals(2L, engine.sizeOf(root));
        assertTreeConsistent(engine.groups(), root);
    }

    @Test
    void lookupsExecutePendingPopulation() {
        String p = person("red", 4);
        AggregationSpec spec = engine.aggregate(root, AggregationSource.of(List.of(p))).groupBy("colour");

        assertTrue(spec.includesMember(p));
        assertFalse(spec.hasPending());
        assertEquals(1, spec.groups().size());
    }

    @Test
    void emptyBatchIsANoOp() {
        AggregationSpec spec = engine.aggregate(root, AggregationSource.of(List.of())).groupBy("colour");
        assertTrue(spec.execute().isEmpty());
        assertTrue(spec.execute(List.of()).isEmpty());
        assertEquals(0L, engine.sizeOf(root));
    }

    @Test
    void appendIsIdempotent() {
        String a = person("red", 4);
        AggregationSpec spec = engine.aggregate(root).groupBy("colour");
        spec.append(a).append(a);

        String red = spec.groupOf("red").orElseThrow();
        assertEquals(1L, engine.sizeOf(red));
        assertEquals(List.of(a), engine.membersOf(red));
    }

    @Test
    void entitiesWithoutTheGroupingPropertyAreLeftOut() {
        String noColour = person(null, 4);
        AggregationSpec spec = engine.aggregate(root).groupBy("colour");
        GroupChanges changes = spec.execute(List.of(noColour));

        assertTrue(changes.isEmpty());
        assertFalse(spec.includesMember(noColour));
        assertTrue(spec.groups().isEmpty());
    }

    @Test
    void mapperFansOutToSeveralGroups() {
        String child = person("red", 4);
        String adult = person("red", 40);
        AggregationSpec spec = engine.aggregate(root).groupBy("age")
                .mapValue(ValueMapper.<Integer>unary(age -> age < 18 ? List.of("minor", "all") : List.of("adult", "all")));
        spec.append(child, adult);

        assertEquals(3L, engine.sizeOf(root));
        assertEquals(2L, engine.sizeOf(spec.groupOf("all").orElseThrow()));
        assertEquals(List.of(child), engine.membersOf(spec.groupOf("minor").orElseThrow()));
        assertEquals(List.of(adult), engine.membersOf(spec.groupOf("adult").orElseThrow()));
    }

    @Test
    void mapperArityIsCheckedWhicheverComesFirst() {
        AggregationSpec spec = engine.aggregate(root);
        spec.mapValue(ValueMapper.unary(v -> v));
        assertThrows(AggregateConfigurationException.class, () -> spec.groupBy("colour", "age"));

        AggregationSpec other = engine.aggregate(root).groupBy("colour", "age");
        AggregateConfigurationException ex = assertThrows(AggregateConfigurationException.class,
                () -> other.mapValue(ValueMapper.unary(v -> v)));
        assertTrue(ex.isArityMismatch());
    }

    @Test
    void executeWithoutGroupByFails() {
        AggregationSpec spec = engine.aggregate(root);
        assertThrows(AggregateConfigurationException.class, () -> spec.execute(List.of(person("red", 4))));
    }

    @Test
    void chainBuildsGroupsOfGroups() {
        String a = person("red", 4);
        String b = person("red", 30);
        String c = person("blue", 4);
        AggregationSpec byAge = engine.aggregate(root, AggregationSource.of(List.of(a, b, c))).groupBy("age");
        AggregationSpec byColour = engine.aggregate(root, AggregationSource.of(byAge)).groupBy("colour");

        assertTrue(byAge.isOwned());
        assertFalse(byAge.hasPending());
        assertTrue(byColour.hasPending());
        byColour.execute();

        String red = engine.groupOf(root, "red").orElseThrow();
        String blue = engine.groupOf(root, "blue").orElseThrow();
        assertEquals(2L, engine.sizeOf(root));
        assertEquals(2L, engine.sizeOf(red));
        assertEquals(1L, engine.sizeOf(blue));
        String redYoung = engine.groupOf(red, 4).orElseThrow();
        assertEquals(List.of(a), engine.membersOf(redYoung));
        assertEquals(List.of(c), engine.membersOf(engine.groupOf(blue, 4).orElseThrow()));
        assertTrue(byColour.includesMember(a));
        assertTreeConsistent(engine.groups(), root);
    }

    @Test
    void ownedLevelCannotBeExecutedDirectly() {
        AggregationSpec byAge = engine.aggregate(root).groupBy("age");
        engine.aggregate(root, AggregationSource.of(byAge)).groupBy("colour");

        assertThrows(AggregateConfigurationException.class, () -> byAge.execute(List.of(person("red", 4))));
        assertThrows(AggregateConfigurationException.class, () -> byAge.append(person("red", 4)));
    }

    @Test
    void levelCanBeChainedUnderOneOwnerOnly() {
        AggregationSpec byAge = engine.aggregate(root).groupBy("age");
        engine.aggregate(root, AggregationSource.of(byAge)).groupBy("colour");

        assertThrows(AggregateConfigurationException.class,
                () -> engine.aggregate(root, AggregationSource.of(byAge)));
    }

    @Test
    void threeLevelChainResolvesFullPaths() {
        String a = person("red", 4);
        store.setProperty(a, "size", "S");
        AggregationSpec bySize = engine.aggregate(root).groupBy("size");
        AggregationSpec byAge = engine.aggregate(root, AggregationSource.of(bySize)).groupBy("age");
        AggregationSpec byColour = engine.aggregate(root, AggregationSource.of(byAge)).groupBy("colour");

        byColour.append(a);

        String red = engine.groupOf(root, "red").orElseThrow();
        String young = engine.groupOf(red, 4).orElseThrow();
        String small = engine.groupOf(young, "S").orElseThrow();
        assertEquals(List.of(a), engine.membersOf(small));
        assertEquals(List.of(root), toList(engine.ancestorsOf(a)));
    }

    @Test
    void entityMissingALowerLevelPropertyCreatesNoGroup() {
        String noAge = person("red", null);
        AggregationSpec byAge = engine.aggregate(root).groupBy("age");
        AggregationSpec byColour = engine.aggregate(root, AggregationSource.of(byAge)).groupBy("colour");

        assertTrue(byColour.execute(List.of(noAge)).isEmpty());
        assertTrue(engine.groupOf(root, "red").isEmpty());
    }

    @Test
    void keyPathsCombineEveryLevel() {
        AggregationSpec byAge = engine.aggregate(root).groupBy("age");
        AggregationSpec byTag = engine.aggregate(root, AggregationSource.of(byAge)).groupBy("tags");

        Set<List<Object>> paths = byTag.keyPathsOf(Map.of("tags", List.of("x", "y"), "age", 4));
        assertEquals(Set.of(List.of("x", 4), List.of("y", 4)), paths);
        assertTrue(byTag.dependsOn("age"));
        assertTrue(byTag.dependsOn("tags"));
        assertFalse(byTag.dependsOn("colour"));
    }

    @Test
    void changesDeliveredOutOfOrderFollowTheStoredValue() {
        String p = person("red", 4);
        AggregationSpec spec = engine.aggregate(root).groupBy("colour");
        spec.append(p);
        store.setProperty(p, "colour", "green");
        store.setProperty(p, "colour", "blue");

        spec.onPropertyChanged(p, "colour", "green", "blue");
        spec.onPropertyChanged(p, "colour", "red", "green");

        assertEquals(List.of(spec.groupOf("blue").orElseThrow()), engine.groupsOf(p));
        assertTrue(spec.groupOf("green").isEmpty());
        assertTrue(spec.groupOf("red").isEmpty());
        assertEquals(1L, engine.sizeOf(root));
        assertTreeConsistent(engine.groups(), root);
    }

    @Test
    void lateChangeForADeletedEntityCreatesNoGroup() {
        String p = person("red", 4);
        AggregationSpec spec = engine.aggregate(root).groupBy("colour");
        spec.append(p);
        spec.onNodeDeleted(p);
        store.deleteNode(p);

        GroupChanges changes = assertDoesNotThrow(() -> spec.onPropertyChanged(p, "colour", "red", "green"));

        assertTrue(changes.isEmpty());
        assertTrue(spec.execute(List.of(p)).isEmpty());
        assertTrue(spec.groupOf("green").isEmpty());
        assertEquals(0L, engine.sizeOf(root));
        assertTreeConsistent(engine.groups(), root);
    }

    @Test
    void configurationWrittenOnOneThreadIsSeenOnAnother() throws Exception {
        String p = person("red", 4);
        AggregationSpec spec = engine.aggregate(root);
        Thread configurer = new Thread(() -> spec.groupBy("colour").mapValue(engine.mappers().require("lowercase")));
        configurer.start();
        configurer.join();

        assertTrue(spec.isConfigured());
        assertTrue(spec.mapper().isPresent());
        assertEquals(List.of("colour"), spec.groupByKeys());
        assertEquals(1, spec.onNodeCreated(p).attached().size());
    }

    private static List<String> toList(Iterable<String> it) {
        List<String> out = new ArrayList<>();
        it.forEach(out::add);
        return out;
    }
}

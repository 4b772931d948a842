package com.e2eq.aggregate.core;

import com.e2eq.aggregate.exceptions.AggregateConfigurationException;
import com.e2eq.aggregate.store.GraphEventSource;
import com.e2eq.aggregate.store.GraphStore;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.util.*;

/**
 * Entry point for building and querying aggregations over a graph store.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * @Inject AggregationEngine engine;
 *
 * AggregationSpec byColour = engine.aggregate(rootId, AggregationSource.ofType("Person"))
 *         .groupBy("colour");
 * engine.append(byColour, existingPeople);
 *
 * String red = engine.groupOf(byColour, "red").orElseThrow();
 * long redCount = engine.sizeOf(red);
 * }</pre>
 *
 * <p>Aggregations created with an entity type keep their groups current as entities of that type are
 * created, changed and deleted, until they are unregistered.</p>
 */
@ApplicationScoped
public class AggregationEngine {

    private static final Logger LOG = Logger.getLogger(AggregationEngine.class);

    private final GraphStore store;
    private final GraphEventSource events;
    private final AggregateSettings settings;
    private final AggregationRegistry registry;
    private final GroupStore groups;
    private final AncestryWalker walker;
    private final RootLocks locks;
    private final ValueMapperRegistry mappers;
    private final YamlAggregationLoader loader;

    @Inject
    public AggregationEngine(GraphStore store, GraphEventSource events, AggregationRegistry registry) {
        this(store, events, registry, AggregateSettings.fromConfig(), new ValueMapperRegistry());
    }

    public AggregationEngine(GraphStore store, GraphEventSource events, AggregateSettings settings) {
        this(store, events, new AggregationRegistry(), settings, new ValueMapperRegistry());
    }

    public AggregationEngine(GraphStore store,
                             GraphEventSource events,
                             AggregationRegistry registry,
                             AggregateSettings settings,
                             ValueMapperRegistry mappers) {
        this.store = Objects.requireNonNull(store, "store");
        this.events = Objects.requireNonNull(events, "events");
        this.registry = Objects.requireNonNull(registry, "registry");
        this.settings = Objects.requireNonNull(settings, "settings");
        this.mappers = Objects.requireNonNull(mappers, "mappers");
        this.groups = new GroupStore(store, settings);
        this.walker = new AncestryWalker(groups);
        this.locks = new RootLocks(settings.fairLocks());
        this.loader = new YamlAggregationLoader(mappers);
        LOG.debugf("Aggregation engine started with %s", settings);
    }

    // --- building ---

    public AggregationSpec aggregate(String rootId) {
        return aggregate(rootId, AggregationSource.none());
    }

    /**
     * Creates a new aggregation under {@code rootId}. The root must exist; it gets a zero size counter
     * if it has none. The new aggregation becomes the root's current one.
     */
    public AggregationSpec aggregate(String rootId, AggregationSource source) {
        Objects.requireNonNull(source, "source");
        locks.write(rootId, () -> {
            groups.ensureRoot(rootId);
            return null;
        });
        AggregationSpec spec = new AggregationSpec(this, rootId, source);
        registry.setCurrent(rootId, spec);
        spec.filterType().ifPresent(type -> subscribe(spec, type));
        LOG.debugf("Created %s from %s", spec, source);
        return spec;
    }

    /**
     * Builds the chain a definition describes, lowest level first, and returns its top level.
     */
    public AggregationSpec aggregate(String rootId, AggregationDefinition definition) {
        AggregationSpec spec = buildLevel(rootId, definition, definition.filter().orElse(null));
        LOG.debugf("Built aggregation '%s' (%d levels) on %s", definition.id(), definition.depth(), rootId);
        return spec;
    }

    private AggregationSpec buildLevel(String rootId, AggregationDefinition level, String filter) {
        AggregationSpec spec;
        if (level.child().isPresent()) {
            AggregationSpec lower = buildLevel(rootId, level.child().get(), filter);
            spec = aggregate(rootId, AggregationSource.of(lower));
        } else {
            spec = aggregate(rootId, filter != null ? AggregationSource.ofType(filter) : AggregationSource.none());
        }
        ValueMapper mapper = level.mapValue().map(mappers::require).orElse(null);
        return spec.configure(level.groupBy(), mapper, null);
    }

    /**
     * Returns the root's current aggregation when it already groups by {@code keys} with the same
     * mapper over the same child (none matching none), otherwise creates and configures a new one.
     */
    public AggregationSpec createOrGetAggregation(String rootId, List<String> keys, ValueMapper mapper, AggregationSpec child) {
        Optional<AggregationSpec> current = registry.current(rootId);
        if (current.isPresent()
                && current.get().groupByKeys().equals(keys)
                && current.get().mapper().orElse(null) == mapper
                && current.get().child().orElse(null) == child) {
            return current.get();
        }
        AggregationSpec spec = aggregate(rootId, child != null ? AggregationSource.of(child) : AggregationSource.none());
        return spec.configure(keys, mapper, null);
    }

    public List<AggregationDefinition> loadDefinitions() throws IOException {
        return loadDefinitions(settings.definitionsLocation());
    }

    public List<AggregationDefinition> loadDefinitions(String location) throws IOException {
        return loader.loadFromClasspath(location);
    }

    // --- population ---

    public GroupChanges execute(AggregationSpec spec, Collection<String> nodeIds) {
        return spec.execute(nodeIds);
    }

    public AggregationSpec append(AggregationSpec spec, Collection<String> nodeIds) {
        return spec.append(nodeIds);
    }

    /**
     * Appends to the current aggregation of {@code rootId}.
     */
    public AggregationSpec append(String rootId, Collection<String> nodeIds) {
        AggregationSpec spec = registry.current(rootId).orElseThrow(() ->
                new AggregateConfigurationException("No aggregation defined on root '" + rootId + "'"));
        return spec.append(nodeIds);
    }

    public void unregister(AggregationSpec spec) {
        spec.unregister();
    }

    // --- queries ---

    public Optional<String> groupOf(AggregationSpec spec, Object key) {
        return spec.groupOf(key);
    }

    /**
     * The group for {@code key} directly under a root or group, e.g. to descend a chain one level.
     */
    public Optional<String> groupOf(String parentId, Object key) {
        return groups.findGroup(parentId, key);
    }

    public List<String> membersOf(String groupId) {
        return groups.membersOf(groupId);
    }

    public long sizeOf(String nodeId) {
        return groups.sizeOf(nodeId);
    }

    public Iterable<String> ancestorsOf(String nodeId) {
        return walker.ancestorsOf(nodeId);
    }

    public List<String> groupsOf(String nodeId) {
        return walker.groupsOf(nodeId);
    }

    public Optional<String> memberGroupOf(String nodeId, Object key) {
        return walker.groupOf(nodeId, key);
    }

    /**
     * Values of {@code property} over every entity below a group, walking nested groups. Entities
     * without the property contribute nothing; a list value contributes its elements.
     */
    public List<Object> propertyValues(String groupId, String property) {
        List<Object> out = new ArrayList<>();
        Deque<String> pending = new ArrayDeque<>(List.of(groupId));
        Set<String> visited = new HashSet<>();
        while (!pending.isEmpty()) {
            String current = pending.pop();
            if (!visited.add(current)) continue;
            for (String member : groups.membersOf(current)) {
                if (groups.kindOf(member) == NodeKind.LEAF) {
                    store.getProperty(member, property).ifPresent(v -> {
                        if (v instanceof Collection<?> c) out.addAll(c); else out.add(v);
                    });
                } else {
                    pending.addLast(member);
                }
            }
        }
        return out;
    }

    @PreDestroy
    public void close() {
        registry.clear();
    }

    // --- collaborators for AggregationSpec ---

    void subscribe(AggregationSpec spec, String entityType) {
        registry.subscribe(events, spec, entityType);
    }

    void unsubscribe(AggregationSpec spec) {
        registry.unsubscribe(spec);
    }

    GraphStore graph() {
        return store;
    }

    GroupStore groups() {
        return groups;
    }

    AncestryWalker walker() {
        return walker;
    }

    RootLocks locks() {
        return locks;
    }

    public AggregationRegistry registry() {
        return registry;
    }

    public AggregateSettings settings() {
        return settings;
    }

    public ValueMapperRegistry mappers() {
        return mappers;
    }
}

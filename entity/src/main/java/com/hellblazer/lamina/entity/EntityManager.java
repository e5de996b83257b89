/**
 * Copyright (C) 2026 Hal Hildebrand. All rights reserved.
 *
 * This file is part of the Lamina.
 *
 * This program is free software: you can redistribute it and/or modify it under the terms of the GNU Affero General
 * Public License as published by the Free Software Foundation, either version 3 of the License, or (at your option) any
 * later version.
 *
 * This program is distributed in the hope that it will be useful, but WITHOUT ANY WARRANTY; without even the implied
 * warranty of MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE. See the GNU Affero General Public License for more
 * details.
 *
 * You should have received a copy of the GNU Affero General Public License along with this program. If not, see
 * <http://www.gnu.org/licenses/>.
 */
package com.hellblazer.lamina.entity;

import com.hellblazer.lamina.entity.config.RuntimeConfig;
import com.hellblazer.lamina.entity.event.ComponentAddedEvent;
import com.hellblazer.lamina.entity.event.ComponentRemovedEvent;
import com.hellblazer.lamina.entity.event.EntityEventBus;
import com.hellblazer.lamina.entity.event.EntityTerminatingEvent;
import com.hellblazer.lamina.entity.event.MapInitEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.vecmath.Point3f;
import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Stream;

/**
 * Owns every entity of a simulation: identity, components, lifecycle stage, hierarchy teardown and deferred deletion.
 * <p>
 * An entity moves through {@link EntityLifeStage} strictly forward: {@link #allocateEntity(EntityPrototype)},
 * {@link #initializeEntity(EntityId)}, {@link #startEntity(EntityId)}, {@link #runMapInit(EntityId)}. Deletion is
 * reachable from every stage and runs in two passes over the transform hierarchy:
 * <ol>
 *   <li>flag: pre-order, every descendant is marked {@link EntityLifeStage#TERMINATING} and receives
 *   {@link EntityTerminatingEvent}</li>
 *   <li>delete: post-order, each entity detaches from its parent, deletes its children, tears down its components in
 *   safe order and finally releases its network binding</li>
 * </ol>
 * so no live entity ever observes a half torn down descendant.
 * <p>
 * {@link #tickUpdate()} is called once per simulation tick. It dispatches queued events, drains the deferred deletion
 * queue, culls removed components and updates the live entity gauge.
 * <p>
 * Not thread-safe. Every method must be called on the simulation thread.
 */
public class EntityManager {
    private static final Logger log = LoggerFactory.getLogger(EntityManager.class);

    private final TickClock                     clock;
    private final RuntimeConfig                 config;
    private final PrototypeLoader               prototypes;
    private final MapService                    maps;
    private final EntityIdAllocator             ids;
    private final ComponentStore                store;
    private final EntityEventBus                eventBus;
    private final HierarchyTracker              hierarchy;
    private final EntityMetrics                 metrics;
    private final ExceptionTolerance            tolerance;
    private final Set<EntityId>                 entities           = new LinkedHashSet<>();
    private final Deque<EntityId>               queuedDeletions    = new ArrayDeque<>();
    private final Set<EntityId>                 queuedDeletionsSet = new HashSet<>();
    private final List<EntityLifecycleListener> listeners          = new CopyOnWriteArrayList<>();
    private       boolean                       initialized;
    private       boolean                       started;
    private       boolean                       flushing;

    public EntityManager(TickClock clock) {
        this(clock, RuntimeConfig.defaultConfig(), PrototypeLoader.NONE, MapService.NONE);
    }

    public EntityManager(TickClock clock, RuntimeConfig config) {
        this(clock, config, PrototypeLoader.NONE, MapService.NONE);
    }

    public EntityManager(TickClock clock, RuntimeConfig config, PrototypeLoader prototypes, MapService maps) {
        this.clock = Objects.requireNonNull(clock, "Clock cannot be null");
        this.config = Objects.requireNonNull(config, "Config cannot be null");
        this.prototypes = Objects.requireNonNull(prototypes, "Prototype loader cannot be null");
        this.maps = Objects.requireNonNull(maps, "Map service cannot be null");
        this.ids = new EntityIdAllocator(config.getFirstEntityId(), config.getFirstNetworkId());
        this.store = new ComponentStore();
        this.eventBus = new EntityEventBus(store, this::describe);
        this.hierarchy = new HierarchyTracker(store, eventBus);
        this.metrics = new EntityMetrics();
        this.tolerance = ExceptionTolerance.of(config.isExceptionTolerant());
    }

    // ===== Manager lifecycle =====

    /**
     * @throws IllegalStateException if already initialized
     */
    public void initialize() {
        if (initialized) {
            throw new IllegalStateException("Entity manager is already initialized");
        }
        initialized = true;
        log.debug("Entity manager initialized with {}", config);
    }

    /**
     * Compute the event ordering and start accepting deletions.
     *
     * @throws IllegalStateException   if not initialized or already started
     * @throws CyclicOrderingException if subscription constraints contain a cycle
     */
    public void startup() {
        if (!initialized) {
            throw new IllegalStateException("Entity manager must be initialized before startup");
        }
        if (started) {
            throw new IllegalStateException("Entity manager is already started");
        }
        eventBus.calculateOrdering();
        started = true;
        log.debug("Entity manager started");
    }

    /**
     * Delete every entity and drop every subscription.
     */
    public void shutdown() {
        flushEntities();
        eventBus.clearEventTables();
        started = false;
        initialized = false;
        log.debug("Entity manager shut down");
    }

    public boolean isInitialized() {
        return initialized;
    }

    public boolean isStarted() {
        return started;
    }

    /**
     * Delete every live entity immediately and forget queued deletions.
     */
    public void flushEntities() {
        flushing = true;
        try {
            for (var entity : List.copyOf(entities)) {
                deleteInternal(entity);
            }
        } finally {
            flushing = false;
        }
        queuedDeletions.clear();
        queuedDeletionsSet.clear();
        store.cullRemoved();
        if (!entities.isEmpty()) {
            log.error("Failed to flush all entities, {} remain", entities.size());
        }
        metrics.setLiveEntities(entities.size());
    }

    /**
     * Per tick maintenance: dispatch queued events, drain queued deletions, cull removed components and publish the
     * live entity count.
     */
    public void tickUpdate() {
        eventBus.processEventQueue();
        while (!queuedDeletions.isEmpty()) {
            var entity = queuedDeletions.poll();
            queuedDeletionsSet.remove(entity);
            deleteEntity(entity);
        }
        var culled = store.cullRemoved();
        metrics.setLiveEntities(entities.size());
        if (log.isTraceEnabled()) {
            log.trace("Tick {}: {} live entities, {} components culled", clock.currentTick(), entities.size(),
                      culled);
        }
    }

    // ===== Creation =====

    /**
     * Allocate an entity with no prototype.
     */
    public EntityId allocateEntity() {
        return allocateEntity(null);
    }

    /**
     * Allocate a new entity carrying only its metadata and transform, in stage {@link EntityLifeStage#ALLOCATED}.
     * Listeners are told about the entity before any further component is attached.
     *
     * @param prototype originating prototype, may be null
     */
    public EntityId allocateEntity(EntityPrototype prototype) {
        if (flushing) {
            log.error("Allocating an entity while flushing entities, prototype: {}",
                      prototype == null ? null : prototype.id());
        }
        var entity = ids.allocateEntityId();
        var netEntity = ids.allocateNetworkId();
        ids.bind(entity, netEntity);
        entities.add(entity);

        var metadata = new MetadataComponent();
        metadata.setNetEntity(netEntity);
        metadata.setEntityPrototype(prototype);
        var transform = new TransformComponent();
        link(entity, metadata, EntityLifeStage.ALLOCATED);
        link(entity, transform, EntityLifeStage.ALLOCATED);
        announceAdded(entity, metadata);
        announceAdded(entity, transform);

        for (var listener : listeners) {
            listener.onEntityAdded(entity);
        }
        dirtyEntity(entity);
        return entity;
    }

    /**
     * Allocate an entity and attach the components of its prototype, without initializing it. Components that came
     * from the prototype rather than {@code overrides} have their ticks cleared, marking them identical to the
     * prototype.
     *
     * @param prototypeId prototype to instantiate, or null for an empty entity carrying only {@code overrides}
     * @param overrides   component instances replacing the prototype's component of the same class
     * @throws EntityCreationException if the prototype is unknown or loading fails; the partial entity is deleted
     */
    public EntityId createEntityUninitialized(String prototypeId, Collection<? extends Component> overrides) {
        Objects.requireNonNull(overrides, "Overrides cannot be null");
        EntityPrototype prototype = null;
        if (prototypeId != null) {
            prototype = prototypes.find(prototypeId)
                                  .orElseThrow(() -> new EntityCreationException("Unknown prototype: " + prototypeId));
        }
        var entity = allocateEntity(prototype);
        try {
            if (prototype == null) {
                for (var component : overrides) {
                    addComponent(entity, component);
                }
            } else {
                for (var component : prototypes.loadComponents(entity, prototype, overrides)) {
                    addComponent(entity, component);
                    if (!containsInstance(overrides, component)) {
                        component.clearTicks();
                    }
                }
            }
            return entity;
        } catch (RuntimeException e) {
            var description = toDescriptiveString(entity);
            deleteInternal(entity);
            throw new EntityCreationException("Failed to create entity " + description, e);
        }
    }

    public EntityId createEntityUninitialized(String prototypeId) {
        return createEntityUninitialized(prototypeId, List.of());
    }

    /**
     * Create, initialize and start an entity on a map, running map init if the map is already initialized.
     *
     * @throws EntityCreationException if any step fails; the partial entity is deleted
     */
    public EntityId spawnEntity(String prototypeId, int mapId) {
        var entity = createEntityUninitialized(prototypeId);
        getTransform(entity).setMapId(mapId);
        initializeAndStartEntity(entity, mapId);
        return entity;
    }

    /**
     * Create, initialize and start an entity attached below {@code parent}. The entity inherits the parent's map.
     *
     * @throws EntityCreationException if any step fails; the partial entity is deleted
     */
    public EntityId spawnEntity(String prototypeId, EntityId parent, Point3f position) {
        var entity = createEntityUninitialized(prototypeId);
        try {
            getTransform(entity).setLocalPosition(position);
            hierarchy.setParent(entity, parent);
        } catch (RuntimeException e) {
            var description = toDescriptiveString(entity);
            deleteInternal(entity);
            throw new EntityCreationException("Failed to attach " + description + " to " + parent, e);
        }
        initializeAndStartEntity(entity, null);
        return entity;
    }

    /**
     * Initialize and start an entity, then run map init if its map is initialized.
     *
     * @param mapId map to consult, or null for the map of the entity's transform
     * @throws EntityCreationException if any step fails; the entity is deleted
     */
    public void initializeAndStartEntity(EntityId entity, Integer mapId) {
        try {
            initializeEntity(entity);
            startEntity(entity);
            var map = mapId != null ? mapId : getTransform(entity).getMapId();
            if (maps.isMapInitialized(map)) {
                runMapInit(entity);
            }
        } catch (RuntimeException e) {
            var description = toDescriptiveString(entity);
            deleteInternal(entity);
            throw new EntityCreationException("Exception inside initializing and starting entity " + description, e);
        }
    }

    // ===== Lifecycle transitions =====

    /**
     * Run every component's initialize hook in initialization order.
     *
     * @throws InvalidLifecycleTransitionException unless the entity is {@link EntityLifeStage#ALLOCATED}
     */
    public void initializeEntity(EntityId entity) {
        var metadata = getMetadata(entity);
        requireStage(entity, metadata, EntityLifeStage.ALLOCATED, "initialize");
        metadata.setEntityLifeStage(EntityLifeStage.INITIALIZING);
        for (var component : store.inInitializationOrder(entity)) {
            if (component.getLifeStage() == ComponentLifeStage.ADDED) {
                component.lifeInitialize();
            }
        }
        if (metadata.getEntityLifeStage() != EntityLifeStage.INITIALIZING) {
            log.debug("Entity {} left initialization in stage {}", toDescriptiveString(entity),
                      metadata.getEntityLifeStage());
            return;
        }
        metadata.setEntityLifeStage(EntityLifeStage.INITIALIZED);
        for (var listener : listeners) {
            listener.onEntityInitialized(entity);
        }
    }

    /**
     * Run every component's startup hook in initialization order.
     *
     * @throws InvalidLifecycleTransitionException unless the entity is {@link EntityLifeStage#INITIALIZED}
     */
    public void startEntity(EntityId entity) {
        var metadata = getMetadata(entity);
        requireStage(entity, metadata, EntityLifeStage.INITIALIZED, "start");
        metadata.setEntityLifeStage(EntityLifeStage.STARTING);
        for (var component : store.inInitializationOrder(entity)) {
            if (component.getLifeStage() == ComponentLifeStage.INITIALIZED) {
                component.lifeStartup();
            }
        }
        if (metadata.getEntityLifeStage() == EntityLifeStage.STARTING) {
            metadata.setEntityLifeStage(EntityLifeStage.STARTED);
        }
    }

    /**
     * Raise {@link MapInitEvent} at the entity, once. Repeated calls are no-ops.
     *
     * @throws InvalidLifecycleTransitionException if the entity has not started
     */
    public void runMapInit(EntityId entity) {
        var metadata = getMetadata(entity);
        if (metadata.getEntityLifeStage() == EntityLifeStage.MAP_INITIALIZED) {
            return;
        }
        requireStage(entity, metadata, EntityLifeStage.STARTED, "run map init on");
        metadata.setEntityLifeStage(EntityLifeStage.MAP_INITIALIZED);
        eventBus.raiseLocalEvent(entity, MapInitEvent.INSTANCE, false);
    }

    // ===== Deletion =====

    /**
     * Delete an entity and all of its descendants immediately. No-op for unknown or deleted entities and while the
     * manager is not started.
     *
     * @throws InvalidLifecycleTransitionException in strict mode, if the entity is already terminating
     */
    public void deleteEntity(EntityId entity) {
        if (!started) {
            log.debug("Ignoring deletion of {}, entity manager not started", entity);
            return;
        }
        deleteInternal(entity);
    }

    /**
     * Schedule an entity for deletion during the next {@link #tickUpdate()}. No-op if already queued or deleted.
     */
    public void queueDeleteEntity(EntityId entity) {
        Objects.requireNonNull(entity, "Entity cannot be null");
        if (isDeleted(entity)) {
            return;
        }
        if (!queuedDeletionsSet.add(entity)) {
            return;
        }
        queuedDeletions.add(entity);
        for (var listener : listeners) {
            listener.onEntityQueuedForDeletion(entity);
        }
    }

    public boolean isQueuedForDeletion(EntityId entity) {
        return queuedDeletionsSet.contains(entity);
    }

    public int getQueuedDeletionCount() {
        return queuedDeletions.size();
    }

    private void deleteInternal(EntityId entity) {
        var found = store.tryGet(entity, MetadataComponent.class);
        if (found.isEmpty() || found.get().isEntityDeleted()) {
            return;
        }
        var metadata = found.get();
        if (metadata.getEntityLifeStage() == EntityLifeStage.TERMINATING) {
            var description = toDescriptiveString(entity);
            tolerance.handle("Called delete on already terminating entity " + description,
                             new InvalidLifecycleTransitionException(
                             "Entity " + description + " is already terminating"));
            return;
        }
        var transform = store.get(entity, TransformComponent.class);
        recursiveFlagTermination(entity, metadata, transform);
        recursiveDeleteEntity(entity, metadata, transform);
    }

    private void recursiveFlagTermination(EntityId entity, MetadataComponent metadata, TransformComponent transform) {
        metadata.setEntityLifeStage(EntityLifeStage.TERMINATING);
        eventBus.raiseLocalEvent(entity, new EntityTerminatingEvent(entity), true);

        for (var child : List.copyOf(transform.childrenInternal())) {
            var childMetadata = store.tryGet(child, MetadataComponent.class);
            var childTransform = store.tryGet(child, TransformComponent.class);
            if (childMetadata.isEmpty() || childMetadata.get().isEntityDeleted() || childTransform.isEmpty()) {
                reportInconsistency(
                hierarchy.removeStaleChild(entity, transform, child, toDescriptiveString(entity)));
                continue;
            }
            if (childMetadata.get().getEntityLifeStage() == EntityLifeStage.TERMINATING) {
                log.error("Encountered a terminating child {} while terminating {}", toDescriptiveString(child),
                          toDescriptiveString(entity));
                continue;
            }
            recursiveFlagTermination(child, childMetadata.get(), childTransform.get());
        }
    }

    private void recursiveDeleteEntity(EntityId entity, MetadataComponent metadata, TransformComponent transform) {
        if (metadata.isEntityDeleted()) {
            return;
        }
        try {
            hierarchy.detachParentToNull(entity, transform);
        } catch (RuntimeException e) {
            log.error("Caught exception while detaching {} from its parent", toDescriptiveString(entity), e);
        }

        for (var child : List.copyOf(transform.childrenInternal())) {
            try {
                var childMetadata = store.tryGet(child, MetadataComponent.class);
                var childTransform = store.tryGet(child, TransformComponent.class);
                if (childMetadata.isEmpty() || childTransform.isEmpty()) {
                    transform.childrenInternal().remove(child);
                    continue;
                }
                recursiveDeleteEntity(child, childMetadata.get(), childTransform.get());
            } catch (RuntimeException e) {
                log.error("Caught exception while deleting child {} of {}", child, toDescriptiveString(entity), e);
            }
        }

        for (var component : store.inSafeOrder(entity)) {
            disposeComponent(entity, component, true);
        }

        metadata.setEntityLifeStage(EntityLifeStage.DELETED);
        for (var listener : listeners) {
            try {
                listener.onEntityDeleted(entity, metadata);
            } catch (RuntimeException e) {
                log.error("Caught exception in deletion listener for {}", toDescriptiveString(entity), e);
            }
        }
        eventBus.onEntityDeleted(entity);
        entities.remove(entity);
        metrics.recordDeletion();
        try {
            ids.release(metadata.getNetEntity());
        } catch (UnknownIdException e) {
            log.error("Network binding of {} was already released", toDescriptiveString(entity), e);
        }
    }

    // ===== Components =====

    /**
     * Attach a component, bringing it up to the entity's current stage.
     *
     * @return the component
     * @throws UnknownIdException                  if the entity does not exist
     * @throws InvalidLifecycleTransitionException if the entity is terminating
     * @throws DuplicateComponentException         if the entity already has a component of the same class
     */
    public <C extends Component> C addComponent(EntityId entity, C component) {
        Objects.requireNonNull(component, "Component cannot be null");
        var metadata = getMetadata(entity);
        var stage = metadata.getEntityLifeStage();
        if (stage.isAtLeast(EntityLifeStage.TERMINATING)) {
            throw new InvalidLifecycleTransitionException(
            "Cannot add " + component.getClass().getSimpleName() + " to " + toDescriptiveString(entity)
            + " in stage " + stage);
        }
        attach(entity, component, stage);
        dirtyEntity(entity);
        return component;
    }

    /**
     * Shut down and remove a component. The instance is culled at the end of the tick.
     *
     * @throws IllegalArgumentException   for the mandatory metadata and transform components
     * @throws UnknownIdException         if the entity does not exist
     * @throws ComponentNotFoundException if the entity has no such component
     */
    public <C extends Component> C removeComponent(EntityId entity, Class<C> type) {
        if (type == MetadataComponent.class || type == TransformComponent.class) {
            throw new IllegalArgumentException("Cannot remove mandatory component " + type.getSimpleName());
        }
        getMetadata(entity);
        var component = store.get(entity, type);
        disposeComponent(entity, component, false);
        dirtyEntity(entity);
        return component;
    }

    public <C extends Component> C getComponent(EntityId entity, Class<C> type) {
        return store.get(entity, type);
    }

    public <C extends Component> Optional<C> tryGetComponent(EntityId entity, Class<C> type) {
        return store.tryGet(entity, type);
    }

    public boolean hasComponent(EntityId entity, Class<? extends Component> type) {
        return store.has(entity, type);
    }

    /**
     * @return the entity's live components in safe order
     */
    public List<Component> getComponents(EntityId entity) {
        return store.inSafeOrder(entity);
    }

    /**
     * @return a single-use stream over the entity's live components in safe order
     */
    public Stream<Component> enumerateComponents(EntityId entity) {
        return store.enumerate(entity);
    }

    public List<EntityId> entitiesWith(Class<? extends Component> type) {
        return store.entitiesWith(type);
    }

    public int componentCount(EntityId entity) {
        return store.componentCount(entity);
    }

    /**
     * @throws UnknownIdException if the entity does not exist
     */
    public MetadataComponent getMetadata(EntityId entity) {
        return store.tryGet(entity, MetadataComponent.class)
                    .orElseThrow(() -> new UnknownIdException("Entity " + entity + " does not exist"));
    }

    /**
     * @throws UnknownIdException if the entity does not exist
     */
    public TransformComponent getTransform(EntityId entity) {
        return store.tryGet(entity, TransformComponent.class)
                    .orElseThrow(() -> new UnknownIdException("Entity " + entity + " does not exist"));
    }

    // ===== Dirty tracking =====

    /**
     * Stamp the entity's last-modified tick. Listeners hear about it at most once per tick, and only once the entity
     * is past {@link EntityLifeStage#INITIALIZING}.
     *
     * @throws UnknownIdException if the entity does not exist
     */
    public void dirtyEntity(EntityId entity) {
        var metadata = getMetadata(entity);
        var tick = clock.currentTick();
        if (metadata.getEntityLastModifiedTick() == tick) {
            return;
        }
        metadata.setEntityLastModifiedTick(tick);
        if (metadata.getEntityLifeStage().isAfter(EntityLifeStage.INITIALIZING)) {
            for (var listener : listeners) {
                listener.onEntityDirtied(entity);
            }
        }
    }

    /**
     * Stamp a component's last-modified tick and dirty its entity. Ignored for components being removed and for
     * components that do not take part in network sync.
     *
     * @throws IllegalArgumentException if the component belongs to another entity
     */
    public void dirty(EntityId entity, Component component) {
        if (!entity.equals(component.getOwner())) {
            throw new IllegalArgumentException(
            component.getClass().getSimpleName() + " is owned by " + component.getOwner() + ", not " + entity);
        }
        if (component.getLifeStage().ordinal() >= ComponentLifeStage.REMOVING.ordinal()
        || !component.isNetSyncEnabled()) {
            return;
        }
        component.stampModified(clock.currentTick());
        dirtyEntity(entity);
    }

    // ===== Queries =====

    public boolean entityExists(EntityId entity) {
        return store.has(entity, MetadataComponent.class);
    }

    /**
     * @return true if the entity is deleted or never existed
     */
    public boolean isDeleted(EntityId entity) {
        return store.tryGet(entity, MetadataComponent.class).map(MetadataComponent::isEntityDeleted).orElse(true);
    }

    public boolean isPaused(EntityId entity) {
        return getMetadata(entity).isEntityPaused();
    }

    public void setPaused(EntityId entity, boolean paused) {
        getMetadata(entity).setEntityPaused(paused);
    }

    public EntityLifeStage getLifeStage(EntityId entity) {
        return getMetadata(entity).getEntityLifeStage();
    }

    public int getEntityCount() {
        return entities.size();
    }

    /**
     * @return snapshot of the live entities in allocation order
     */
    public List<EntityId> getEntities() {
        return List.copyOf(entities);
    }

    /**
     * @throws UnknownIdException if the entity has no network binding
     */
    public NetEntityId getNetEntity(EntityId entity) {
        return ids.resolveNetwork(entity);
    }

    /**
     * @throws UnknownIdException if the network identifier is not bound
     */
    public EntityId getEntity(NetEntityId netEntity) {
        return ids.resolveEntity(netEntity);
    }

    public Optional<EntityId> tryGetEntity(NetEntityId netEntity) {
        return ids.tryResolveEntity(netEntity);
    }

    /**
     * Describe an entity from its last known metadata. Valid for entities deleted during the current tick.
     */
    public EntityDescriptor describe(EntityId entity) {
        var found = store.getIncludingRemoved(entity, MetadataComponent.class);
        if (found.isEmpty()) {
            return EntityDescriptor.unknown(entity);
        }
        var metadata = found.get();
        var prototype = metadata.getEntityPrototype();
        return new EntityDescriptor(entity, metadata.getNetEntity(), metadata.isEntityDeleted(),
                                    metadata.getEntityName(), prototype == null ? null : prototype.id());
    }

    public String toDescriptiveString(EntityId entity) {
        return describe(entity).toString();
    }

    // ===== Collaborators =====

    public TickClock getClock() {
        return clock;
    }

    public RuntimeConfig getConfig() {
        return config;
    }

    public EntityEventBus getEventBus() {
        return eventBus;
    }

    public HierarchyTracker getHierarchy() {
        return hierarchy;
    }

    public EntityMetrics getMetrics() {
        return metrics;
    }

    public ExceptionTolerance getTolerance() {
        return tolerance;
    }

    public EntityIdAllocator getIdAllocator() {
        return ids;
    }

    public void addLifecycleListener(EntityLifecycleListener listener) {
        listeners.add(Objects.requireNonNull(listener, "Listener cannot be null"));
    }

    public void removeLifecycleListener(EntityLifecycleListener listener) {
        listeners.remove(listener);
    }

    // ===== Internals =====

    private void attach(EntityId entity, Component component, EntityLifeStage stage) {
        link(entity, component, stage);
        announceAdded(entity, component);
    }

    /**
     * Store the component and bring it up to the entity's stage without raising any event.
     */
    private void link(EntityId entity, Component component, EntityLifeStage stage) {
        store.add(entity, component);
        component.lifeAddToEntity(entity, clock.currentTick());
        if (stage.isAtLeast(EntityLifeStage.INITIALIZING)) {
            component.lifeInitialize();
        }
        if (stage.isAtLeast(EntityLifeStage.STARTING)) {
            component.lifeStartup();
        }
    }

    private void announceAdded(EntityId entity, Component component) {
        eventBus.raiseLocalEvent(entity, new ComponentAddedEvent(entity, component), true);
    }

    /**
     * Shut down, announce and unlink a component. Every step runs even if an earlier one fails; the first failure is
     * logged during entity deletion and rethrown otherwise.
     */
    private void disposeComponent(EntityId entity, Component component, boolean deleting) {
        RuntimeException failure = null;
        if (component.isRunning()) {
            try {
                component.lifeShutdown();
            } catch (RuntimeException e) {
                failure = e;
            }
        }
        eventBus.raiseLocalEvent(entity, new ComponentRemovedEvent(entity, component), true);
        try {
            component.lifeRemoveFromEntity();
        } catch (RuntimeException e) {
            if (failure == null) {
                failure = e;
            } else {
                failure.addSuppressed(e);
            }
        }
        store.remove(entity, component.getClass());
        if (failure == null) {
            return;
        }
        if (!deleting) {
            throw failure;
        }
        log.error("Caught exception while removing {} from {}", component.getClass().getSimpleName(),
                  toDescriptiveString(entity), failure);
    }

    private void reportInconsistency(StructuralInconsistencyException inconsistency) {
        log.error("Repaired hierarchy inconsistency", inconsistency);
        metrics.recordStructuralRepair();
        for (var listener : listeners) {
            try {
                listener.onStructuralInconsistency(inconsistency);
            } catch (RuntimeException e) {
                log.error("Caught exception in inconsistency listener", e);
            }
        }
    }

    private void requireStage(EntityId entity, MetadataComponent metadata, EntityLifeStage expected,
                              String operation) {
        if (metadata.getEntityLifeStage() != expected) {
            throw new InvalidLifecycleTransitionException(
            "Cannot " + operation + " " + toDescriptiveString(entity) + ": expected " + expected + " but was "
            + metadata.getEntityLifeStage());
        }
    }

    private static boolean containsInstance(Collection<? extends Component> components, Component component) {
        for (var c : components) {
            if (c == component) {
                return true;
            }
        }
        return false;
    }
}

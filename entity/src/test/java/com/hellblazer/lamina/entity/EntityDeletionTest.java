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

import com.hellblazer.lamina.entity.TestComponents.ExplodingShutdown;
import com.hellblazer.lamina.entity.TestComponents.Health;
import com.hellblazer.lamina.entity.config.RuntimeConfig;
import com.hellblazer.lamina.entity.event.ComponentRemovedEvent;
import com.hellblazer.lamina.entity.event.EntityParentChangedEvent;
import com.hellblazer.lamina.entity.event.EntityTerminatingEvent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Two phase termination, deferred deletion and hierarchy repair.
 */
class EntityDeletionTest {

    private SimulationClock clock;
    private EntityManager   manager;

    @BeforeEach
    void setUp() {
        clock = new SimulationClock();
        manager = started(RuntimeConfig.defaultConfig());
    }

    private EntityManager started(RuntimeConfig config) {
        var m = new EntityManager(clock, config);
        m.initialize();
        m.startup();
        return m;
    }

    private EntityId childOf(EntityId parent) {
        var child = manager.allocateEntity();
        manager.getHierarchy().setParent(child, parent);
        return child;
    }

    @Test
    @DisplayName("Deleting a parent deletes the child and the child's parent lookup fails")
    void testParentChildScenario() {
        var parent = manager.allocateEntity();
        var child = childOf(parent);
        var childNet = manager.getNetEntity(child);

        manager.deleteEntity(parent);

        assertFalse(manager.entityExists(parent));
        assertFalse(manager.entityExists(child));
        assertThrows(UnknownIdException.class, () -> manager.getHierarchy().getParent(child));
        assertThrows(UnknownIdException.class, () -> manager.getEntity(childNet));
        assertEquals(0, manager.getEntityCount());
    }

    @Test
    void testFlagIsPreOrderAndDeleteIsPostOrder() {
        var root = manager.allocateEntity();
        var a = childOf(root);
        var a1 = childOf(a);
        var b = childOf(root);
        var flagged = new ArrayList<EntityId>();
        var deleted = new ArrayList<EntityId>();
        manager.getEventBus().subscribe(EntityTerminatingEvent.class, event -> flagged.add(event.entity()));
        manager.addLifecycleListener(new EntityLifecycleListener() {
            @Override
            public void onEntityDeleted(EntityId entity, MetadataComponent metadata) {
                deleted.add(entity);
            }
        });

        manager.deleteEntity(root);

        assertEquals(List.of(root, a, a1, b), flagged);
        assertEquals(List.of(a1, a, b, root), deleted);
    }

    @Test
    void testWholeTreeAliveWhileTerminationIsAnnounced() {
        var root = manager.allocateEntity();
        var a = childOf(root);
        var a1 = childOf(a);
        var tree = List.of(root, a, a1);
        var violations = new AtomicInteger();
        manager.getEventBus().subscribe(EntityTerminatingEvent.class, event -> {
            for (var e : tree) {
                if (!manager.entityExists(e)) {
                    violations.incrementAndGet();
                }
            }
        });

        manager.deleteEntity(root);

        assertEquals(0, violations.get());
        tree.forEach(e -> assertFalse(manager.entityExists(e)));
    }

    @Test
    void testNetworkIdentifierResolvableDuringDeletedCallback() {
        var entity = manager.allocateEntity();
        var net = manager.getNetEntity(entity);
        var resolved = new ArrayList<NetEntityId>();
        var stages = new ArrayList<EntityLifeStage>();
        manager.addLifecycleListener(new EntityLifecycleListener() {
            @Override
            public void onEntityDeleted(EntityId e, MetadataComponent metadata) {
                resolved.add(manager.getNetEntity(e));
                stages.add(metadata.getEntityLifeStage());
            }
        });

        manager.deleteEntity(entity);

        assertEquals(List.of(net), resolved);
        assertEquals(List.of(EntityLifeStage.DELETED), stages);
        assertThrows(UnknownIdException.class, () -> manager.getEntity(net));
    }

    @Test
    void testChildDetachesFromSurvivingParent() {
        var parent = manager.allocateEntity();
        var child = childOf(parent);
        var changes = new ArrayList<EntityParentChangedEvent>();
        manager.getEventBus().subscribe(EntityParentChangedEvent.class, changes::add);

        manager.deleteEntity(child);

        assertTrue(manager.entityExists(parent));
        assertTrue(manager.getHierarchy().getChildren(parent).isEmpty());
        assertEquals(List.of(new EntityParentChangedEvent(child, parent, EntityId.INVALID)), changes);
    }

    @Test
    void testTeardownFailuresDoNotStopDeletion() {
        var entity = manager.allocateEntity();
        manager.addComponent(entity, new ExplodingShutdown());
        manager.addComponent(entity, new Health());
        manager.initializeEntity(entity);
        manager.startEntity(entity);
        manager.getEventBus().subscribe(EntityTerminatingEvent.class, event -> {
            throw new IllegalStateException("subscriber failure");
        });
        var removed = new ArrayList<Class<?>>();
        manager.getEventBus().subscribe(ComponentRemovedEvent.class, event -> removed.add(event.component()
                                                                                               .getClass()));

        manager.deleteEntity(entity);

        assertFalse(manager.entityExists(entity));
        assertEquals(List.of(Health.class, ExplodingShutdown.class, TransformComponent.class,
                             MetadataComponent.class), removed);
    }

    @Test
    @DisplayName("Queuing the same entity twice deletes it exactly once")
    void testQueueTwice() {
        var entity = manager.allocateEntity();
        var queued = new AtomicInteger();
        var deleted = new AtomicInteger();
        manager.addLifecycleListener(new EntityLifecycleListener() {
            @Override
            public void onEntityQueuedForDeletion(EntityId e) {
                queued.incrementAndGet();
            }

            @Override
            public void onEntityDeleted(EntityId e, MetadataComponent metadata) {
                deleted.incrementAndGet();
            }
        });

        manager.queueDeleteEntity(entity);
        manager.queueDeleteEntity(entity);

        assertTrue(manager.isQueuedForDeletion(entity));
        assertTrue(manager.entityExists(entity));
        assertEquals(1, queued.get());
        assertEquals(1, manager.getQueuedDeletionCount());

        manager.tickUpdate();

        assertFalse(manager.entityExists(entity));
        assertFalse(manager.isQueuedForDeletion(entity));
        assertEquals(1, deleted.get());
        assertEquals(0, manager.getMetrics().getLiveEntities());
    }

    @Test
    void testQueueDeletedEntityIsNoOp() {
        var entity = manager.allocateEntity();
        manager.deleteEntity(entity);
        manager.queueDeleteEntity(entity);

        assertFalse(manager.isQueuedForDeletion(entity));
        assertEquals(0, manager.getQueuedDeletionCount());
    }

    @Test
    void testDeletingTwiceIsNoOp() {
        var entity = manager.allocateEntity();
        manager.deleteEntity(entity);
        manager.deleteEntity(entity);
        assertEquals(1, manager.getMetrics().snapshot().deletedEntities());
    }

    @Test
    void testReentrantDeleteTolerated() {
        var entity = manager.allocateEntity();
        var failures = new ArrayList<RuntimeException>();
        manager.getEventBus().subscribeEntity(entity, EntityTerminatingEvent.class, (e, event) -> {
            try {
                manager.deleteEntity(e);
            } catch (RuntimeException ex) {
                failures.add(ex);
            }
        });

        manager.deleteEntity(entity);

        assertTrue(failures.isEmpty());
        assertFalse(manager.entityExists(entity));
        assertEquals(1, manager.getMetrics().snapshot().deletedEntities());
    }

    @Test
    void testReentrantDeleteStrict() {
        manager = started(RuntimeConfig.builder().withExceptionTolerant(false).build());
        var entity = manager.allocateEntity();
        var failures = new ArrayList<RuntimeException>();
        manager.getEventBus().subscribeEntity(entity, EntityTerminatingEvent.class, (e, event) -> {
            try {
                manager.deleteEntity(e);
            } catch (InvalidLifecycleTransitionException ex) {
                failures.add(ex);
            }
        });

        manager.deleteEntity(entity);

        assertEquals(1, failures.size());
        assertFalse(manager.entityExists(entity));
    }

    @Test
    @DisplayName("A child reference to a missing entity is repaired and reported")
    void testStaleChildRepaired() {
        var parent = manager.allocateEntity();
        var child = childOf(parent);
        var stale = new EntityId(12345);
        manager.getTransform(parent).childrenInternal().add(stale);
        var reported = new ArrayList<StructuralInconsistencyException>();
        manager.addLifecycleListener(new EntityLifecycleListener() {
            @Override
            public void onStructuralInconsistency(StructuralInconsistencyException inconsistency) {
                reported.add(inconsistency);
            }
        });

        manager.deleteEntity(parent);

        assertFalse(manager.entityExists(parent));
        assertFalse(manager.entityExists(child));
        assertEquals(1, reported.size());
        assertEquals(parent, reported.get(0).getParent());
        assertEquals(stale, reported.get(0).getChild());
        assertEquals(1, manager.getMetrics().snapshot().structuralRepairs());
    }

    @Test
    void testNoSurvivorReferencesDeletedEntities() {
        var keeper = manager.allocateEntity();
        var doomed = childOf(keeper);
        childOf(doomed);
        childOf(doomed);
        var sibling = childOf(keeper);

        manager.deleteEntity(doomed);

        for (var survivor : manager.getEntities()) {
            for (var child : manager.getHierarchy().getChildren(survivor)) {
                assertTrue(manager.entityExists(child));
            }
        }
        assertEquals(List.of(sibling), List.copyOf(manager.getHierarchy().getChildren(keeper)));
        assertEquals(2, manager.getEntityCount());
    }

    @Test
    void testFlushEntities() {
        var root = manager.allocateEntity();
        childOf(root);
        var queued = manager.allocateEntity();
        manager.queueDeleteEntity(queued);

        manager.flushEntities();

        assertEquals(0, manager.getEntityCount());
        assertEquals(0, manager.getQueuedDeletionCount());
        assertFalse(manager.isQueuedForDeletion(queued));
        assertEquals(0, manager.getIdAllocator().getBindingCount());
    }

    @Test
    void testLiveEntityGaugeUpdatedOncePerTick() {
        manager.allocateEntity();
        var doomed = manager.allocateEntity();
        manager.tickUpdate();
        assertEquals(2, manager.getMetrics().getLiveEntities());

        manager.deleteEntity(doomed);
        assertEquals(2, manager.getMetrics().getLiveEntities());

        manager.tickUpdate();
        assertEquals(1, manager.getMetrics().getLiveEntities());
    }
}

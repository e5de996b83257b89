package com.hellblazer.lamina.entity;

import com.hellblazer.lamina.entity.TestComponents.Health;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DirtyTrackingTest {

    private SimulationClock clock;
    private EntityManager   manager;
    private List<EntityId>  dirtied;

    @BeforeEach
    void setUp() {
        clock = new SimulationClock(10);
        manager = new EntityManager(clock);
        manager.initialize();
        manager.startup();
        dirtied = new ArrayList<>();
        manager.addLifecycleListener(new EntityLifecycleListener() {
            @Override
            public void onEntityDirtied(EntityId entity) {
                dirtied.add(entity);
            }
        });
    }

    private EntityId startedEntity() {
        var entity = manager.allocateEntity();
        manager.initializeEntity(entity);
        manager.startEntity(entity);
        return entity;
    }

    @Test
    void testConstructionIsNotReported() {
        var entity = manager.allocateEntity();
        manager.addComponent(entity, new Health());
        clock.advance();
        manager.dirtyEntity(entity);

        assertTrue(dirtied.isEmpty());
        assertEquals(11, manager.getMetadata(entity).getEntityLastModifiedTick());
    }

    @Test
    void testAtMostOncePerTick() {
        var entity = startedEntity();
        clock.advance();

        manager.dirtyEntity(entity);
        manager.dirtyEntity(entity);
        manager.dirtyEntity(entity);
        assertEquals(List.of(entity), dirtied);

        clock.advance();
        manager.dirtyEntity(entity);
        assertEquals(List.of(entity, entity), dirtied);
        assertEquals(12, manager.getMetadata(entity).getEntityLastModifiedTick());
    }

    @Test
    void testComponentDirty() {
        var entity = startedEntity();
        var health = manager.addComponent(entity, new Health());
        assertEquals(10, health.getLastModifiedTick());
        clock.advanceTo(15);

        manager.dirty(entity, health);

        assertEquals(15, health.getLastModifiedTick());
        assertEquals(10, health.getCreationTick());
        assertEquals(15, manager.getMetadata(entity).getEntityLastModifiedTick());
        assertEquals(List.of(entity), dirtied);
    }

    @Test
    void testComponentDirtyIgnoredWhenNotSynced() {
        var entity = startedEntity();
        var health = manager.addComponent(entity, new Health());
        health.setNetSyncEnabled(false);
        clock.advance();

        manager.dirty(entity, health);

        assertEquals(10, health.getLastModifiedTick());
        assertTrue(dirtied.isEmpty());
    }

    @Test
    void testComponentDirtyIgnoredAfterRemoval() {
        var entity = startedEntity();
        var health = manager.addComponent(entity, new Health());
        manager.removeComponent(entity, Health.class);
        clock.advance();
        dirtied.clear();

        manager.dirty(entity, health);

        assertTrue(dirtied.isEmpty());
    }

    @Test
    void testComponentOfAnotherEntityRejected() {
        var first = startedEntity();
        var second = startedEntity();
        var health = manager.addComponent(first, new Health());

        assertThrows(IllegalArgumentException.class, () -> manager.dirty(second, health));
    }
}

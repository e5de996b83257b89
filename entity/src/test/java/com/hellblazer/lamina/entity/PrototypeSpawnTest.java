package com.hellblazer.lamina.entity;

import com.hellblazer.lamina.entity.TestComponents.ExplodingInitialize;
import com.hellblazer.lamina.entity.TestComponents.Health;
import com.hellblazer.lamina.entity.TestComponents.Inventory;
import com.hellblazer.lamina.entity.config.RuntimeConfig;
import com.hellblazer.lamina.entity.event.MapInitEvent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import javax.vecmath.Point3f;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Entity creation through the prototype loader and map service collaborators.
 */
class PrototypeSpawnTest {

    private static final EntityPrototype CRATE = new EntityPrototype("crate", "Crate", "A wooden crate");

    private SimulationClock clock;
    private PrototypeLoader loader;
    private MapService      maps;
    private EntityManager   manager;

    @BeforeEach
    void setUp() {
        clock = new SimulationClock(5);
        loader = mock(PrototypeLoader.class);
        maps = mock(MapService.class);
        when(loader.find("crate")).thenReturn(Optional.of(CRATE));
        when(loader.find("missing")).thenReturn(Optional.empty());
        manager = new EntityManager(clock, RuntimeConfig.defaultConfig(), loader, maps);
        manager.initialize();
        manager.startup();
    }

    @Test
    void testPrototypeComponentsHaveTicksCleared() {
        var override = new Inventory();
        when(loader.loadComponents(any(), eq(CRATE), anyCollection())).thenReturn(List.of(new Health(), override));

        var entity = manager.createEntityUninitialized("crate", List.of(override));

        assertEquals(0, manager.getComponent(entity, Health.class).getLastModifiedTick());
        assertEquals(5, manager.getComponent(entity, Inventory.class).getLastModifiedTick());
        assertEquals("Crate", manager.getMetadata(entity).getEntityName());
        assertEquals("A wooden crate", manager.getMetadata(entity).getEntityDescription());
        assertSame(CRATE, manager.getMetadata(entity).getEntityPrototype());
        assertEquals(EntityLifeStage.ALLOCATED, manager.getLifeStage(entity));
    }

    @Test
    void testUnknownPrototype() {
        assertThrows(EntityCreationException.class, () -> manager.createEntityUninitialized("missing"));
        assertEquals(0, manager.getEntityCount());
    }

    @Test
    void testLoadFailureDeletesPartialEntity() {
        when(loader.loadComponents(any(), any(), anyCollection())).thenThrow(new IllegalStateException("bad data"));
        var deleted = new ArrayList<EntityId>();
        manager.addLifecycleListener(new EntityLifecycleListener() {
            @Override
            public void onEntityDeleted(EntityId entity, MetadataComponent metadata) {
                deleted.add(entity);
            }
        });

        var e = assertThrows(EntityCreationException.class, () -> manager.createEntityUninitialized("crate"));

        assertInstanceOf(IllegalStateException.class, e.getCause());
        assertEquals(1, deleted.size());
        assertEquals(0, manager.getEntityCount());
        assertEquals(0, manager.getIdAllocator().getBindingCount());
    }

    @Test
    void testSpawnOnInitializedMapRunsMapInit() {
        when(loader.loadComponents(any(), any(), anyCollection())).thenReturn(List.of(new Health()));
        when(maps.isMapInitialized(3)).thenReturn(true);

        var entity = manager.spawnEntity("crate", 3);

        assertEquals(EntityLifeStage.MAP_INITIALIZED, manager.getLifeStage(entity));
        assertEquals(3, manager.getTransform(entity).getMapId());
        assertTrue(manager.getComponent(entity, Health.class).isRunning());
        verify(maps).isMapInitialized(3);
    }

    @Test
    void testSpawnOnUninitializedMapStopsAtStarted() {
        when(loader.loadComponents(any(), any(), anyCollection())).thenReturn(List.of());
        when(maps.isMapInitialized(anyInt())).thenReturn(false);

        var entity = manager.spawnEntity("crate", 4);

        assertEquals(EntityLifeStage.STARTED, manager.getLifeStage(entity));
    }

    @Test
    void testSpawnBelowParentUsesParentMap() {
        when(loader.loadComponents(any(), any(), anyCollection())).thenReturn(List.of());
        when(maps.isMapInitialized(9)).thenReturn(true);
        var parent = manager.allocateEntity();
        manager.getTransform(parent).setMapId(9);
        var mapInits = new AtomicInteger();
        manager.getEventBus().subscribeLocal(TransformComponent.class, MapInitEvent.class,
                                             (entity, transform, event) -> mapInits.incrementAndGet());

        var child = manager.spawnEntity("crate", parent, new Point3f(1, 2, 3));

        assertEquals(parent, manager.getHierarchy().getParent(child));
        assertEquals(new Point3f(1, 2, 3), manager.getTransform(child).getLocalPosition());
        assertEquals(EntityLifeStage.MAP_INITIALIZED, manager.getLifeStage(child));
        assertEquals(1, mapInits.get());
    }

    @Test
    void testInitializeFailureDeletesEntity() {
        when(loader.loadComponents(any(), any(), anyCollection())).thenReturn(List.of(new ExplodingInitialize()));

        assertThrows(EntityCreationException.class, () -> manager.spawnEntity("crate", 1));

        assertEquals(0, manager.getEntityCount());
    }
}

package com.hellblazer.lamina.entity;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.HashSet;

import static org.junit.jupiter.api.Assertions.*;

class EntityIdAllocatorTest {

    private EntityIdAllocator ids;

    @BeforeEach
    void setUp() {
        ids = new EntityIdAllocator();
    }

    @Test
    void testIdentifiersAreMonotonicAndUnique() {
        var seen = new HashSet<EntityId>();
        var previous = EntityId.INVALID;
        for (int i = 0; i < 1000; i++) {
            var id = ids.allocateEntityId();
            assertTrue(id.compareTo(previous) > 0);
            assertTrue(seen.add(id));
            previous = id;
        }
        assertTrue(seen.contains(new EntityId(EntityId.FIRST)));
        assertFalse(seen.contains(EntityId.INVALID));
    }

    @Test
    void testResolveBothDirections() {
        var entity = ids.allocateEntityId();
        var net = ids.allocateNetworkId();
        ids.bind(entity, net);

        assertEquals(net, ids.resolveNetwork(entity));
        assertEquals(entity, ids.resolveEntity(net));
        assertTrue(ids.isBound(net));
        assertEquals(1, ids.getBindingCount());
    }

    @Test
    void testUnboundLookupsFail() {
        var entity = ids.allocateEntityId();
        var net = ids.allocateNetworkId();

        assertThrows(UnknownIdException.class, () -> ids.resolveNetwork(entity));
        assertThrows(UnknownIdException.class, () -> ids.resolveEntity(net));
        assertTrue(ids.tryResolveEntity(net).isEmpty());
        assertTrue(ids.tryResolveNetwork(entity).isEmpty());
    }

    @Test
    void testNetworkIdCannotBeBoundTwice() {
        var first = ids.allocateEntityId();
        var second = ids.allocateEntityId();
        var net = ids.allocateNetworkId();
        ids.bind(first, net);

        assertThrows(IllegalStateException.class, () -> ids.bind(second, net));
        assertThrows(IllegalStateException.class, () -> ids.bind(first, ids.allocateNetworkId()));
    }

    @Test
    void testReleaseIsNotReuse() {
        var entity = ids.allocateEntityId();
        var net = ids.allocateNetworkId();
        ids.bind(entity, net);
        ids.release(net);

        assertFalse(ids.isBound(net));
        assertThrows(UnknownIdException.class, () -> ids.resolveEntity(net));
        assertThrows(UnknownIdException.class, () -> ids.release(net));

        var next = ids.allocateNetworkId();
        assertNotEquals(net, next);
        assertTrue(next.compareTo(net) > 0);
    }

    @Test
    void testCustomStartingIdentifiers() {
        var custom = new EntityIdAllocator(50, 7);
        assertEquals(new EntityId(50), custom.allocateEntityId());
        assertEquals(new NetEntityId(7), custom.allocateNetworkId());
        assertThrows(IllegalArgumentException.class, () -> new EntityIdAllocator(0, 1));
    }
}

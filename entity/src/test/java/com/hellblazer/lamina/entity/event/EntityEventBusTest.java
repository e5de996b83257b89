package com.hellblazer.lamina.entity.event;

import com.hellblazer.lamina.entity.Component;
import com.hellblazer.lamina.entity.ComponentStore;
import com.hellblazer.lamina.entity.CyclicOrderingException;
import com.hellblazer.lamina.entity.EntityId;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class EntityEventBusTest {

    record Ping(int value) {
    }

    record Pong(int value) {
    }

    static final class Marker extends Component {
    }

    private final EntityId       entity = new EntityId(1);
    private       ComponentStore store;
    private       EntityEventBus bus;
    private       List<String>   calls;

    @BeforeEach
    void setUp() {
        store = new ComponentStore();
        bus = new EntityEventBus(store, e -> "entity-" + e);
        calls = new ArrayList<>();
    }

    @Test
    void testBroadcastInSubscriptionOrder() {
        bus.subscribe(Ping.class, ping -> calls.add("first:" + ping.value()));
        bus.subscribe(Ping.class, ping -> calls.add("second:" + ping.value()));
        bus.subscribe(Pong.class, pong -> calls.add("pong"));

        bus.raiseEvent(new Ping(1));

        assertEquals(List.of("first:1", "second:1"), calls);
    }

    @Test
    void testBroadcastFailureOfLocalRaiseDescribesEntity() {
        var described = new ArrayList<EntityId>();
        var describing = new EntityEventBus(store, e -> {
            described.add(e);
            return "entity-" + e;
        });
        describing.subscribe(Ping.class, ping -> {
            throw new IllegalStateException("boom");
        });

        describing.raiseLocalEvent(entity, new Ping(1), true);
        assertEquals(List.of(entity), described);

        describing.raiseEvent(new Ping(2));
        assertEquals(List.of(entity), described);
    }

    @Test
    void testExactTypeMatching() {
        bus.subscribe(Object.class, o -> calls.add("object"));
        bus.raiseEvent(new Ping(1));
        assertTrue(calls.isEmpty());
    }

    @Test
    void testFailingSubscriberIsIsolated() {
        bus.subscribe(Ping.class, ping -> {
            throw new IllegalStateException("boom");
        });
        bus.subscribe(Ping.class, ping -> calls.add("survivor"));
        bus.subscribeEntity(entity, Ping.class, (e, ping) -> {
            throw new IllegalStateException("boom");
        });
        bus.subscribeEntity(entity, Ping.class, (e, ping) -> calls.add("local survivor"));

        bus.raiseLocalEvent(entity, new Ping(1), true);

        assertEquals(List.of("local survivor", "survivor"), calls);
    }

    @Test
    void testOrderingConstraints() {
        bus.subscribe(Ping.class, SubscriptionOrder.named("physics").after("input"), ping -> calls.add("physics"));
        bus.subscribe(Ping.class, ping -> calls.add("anonymous"));
        bus.subscribe(Ping.class, SubscriptionOrder.named("input"), ping -> calls.add("input"));

        bus.calculateOrdering();
        bus.raiseEvent(new Ping(0));

        assertTrue(bus.isOrderingCalculated());
        assertEquals(List.of("anonymous", "input", "physics"), calls);
    }

    @Test
    void testCycleFailsAtCalculation() {
        bus.subscribe(Ping.class, SubscriptionOrder.named("a").after("b"), ping -> calls.add("a"));
        bus.subscribe(Ping.class, SubscriptionOrder.named("b").after("a"), ping -> calls.add("b"));

        var e = assertThrows(CyclicOrderingException.class, bus::calculateOrdering);
        assertEquals(Ping.class, e.getEventType());
        assertEquals(2, e.getUnresolved().size());
    }

    @Test
    void testLateSubscriptionIsOrderedOrRejected() {
        bus.subscribe(Ping.class, SubscriptionOrder.named("a"), ping -> calls.add("a"));
        bus.calculateOrdering();

        bus.subscribe(Ping.class, SubscriptionOrder.named("b").before("a"), ping -> calls.add("b"));
        bus.raiseEvent(new Ping(0));
        assertEquals(List.of("b", "a"), calls);

        assertThrows(CyclicOrderingException.class,
                     () -> bus.subscribe(Ping.class, SubscriptionOrder.named("c").before("b").after("a"),
                                         ping -> calls.add("c")));
        calls.clear();
        bus.raiseEvent(new Ping(0));
        assertEquals(List.of("b", "a"), calls);
        assertEquals(2, bus.getSubscriptionCount());
    }

    @Test
    void testLocalDispatchOrder() {
        store.add(entity, new Marker());
        bus.subscribe(Ping.class, ping -> calls.add("broadcast"));
        bus.subscribeLocal(Marker.class, Ping.class, (e, marker, ping) -> calls.add("component"));
        bus.subscribeEntity(entity, Ping.class, (e, ping) -> calls.add("entity"));

        bus.raiseLocalEvent(entity, new Ping(1), true);
        assertEquals(List.of("entity", "component", "broadcast"), calls);

        calls.clear();
        bus.raiseLocalEvent(entity, new Ping(2), false);
        assertEquals(List.of("entity", "component"), calls);
    }

    @Test
    void testComponentScopedRequiresComponent() {
        var other = new EntityId(2);
        bus.subscribeLocal(Marker.class, Ping.class, (e, marker, ping) -> calls.add("component:" + e));

        bus.raiseLocalEvent(other, new Ping(1), false);
        assertTrue(calls.isEmpty());

        store.add(other, new Marker());
        bus.raiseLocalEvent(other, new Ping(1), false);
        assertEquals(List.of("component:2"), calls);
    }

    @Test
    void testQueuedEventsDeferred() {
        bus.subscribe(Ping.class, ping -> {
            calls.add("ping:" + ping.value());
            if (ping.value() == 1) {
                bus.queueEvent(new Ping(2));
            }
        });
        bus.queueEvent(new Ping(1));
        assertTrue(calls.isEmpty());
        assertEquals(1, bus.getQueuedEventCount());

        assertEquals(1, bus.processEventQueue());
        assertEquals(List.of("ping:1"), calls);
        assertEquals(1, bus.getQueuedEventCount());

        bus.processEventQueue();
        assertEquals(List.of("ping:1", "ping:2"), calls);
        assertEquals(0, bus.getQueuedEventCount());
    }

    @Test
    void testEntityDeletionDropsEntitySubscriptions() {
        var subscription = bus.subscribeEntity(entity, Ping.class, (e, ping) -> calls.add("entity"));
        assertTrue(bus.hasEntitySubscriptions(entity));

        bus.onEntityDeleted(entity);
        bus.raiseLocalEvent(entity, new Ping(1), false);

        assertFalse(subscription.isActive());
        assertFalse(bus.hasEntitySubscriptions(entity));
        assertTrue(calls.isEmpty());
    }

    @Test
    void testCancel() {
        var subscription = bus.subscribe(Ping.class, ping -> calls.add("cancelled"));
        bus.subscribe(Ping.class, ping -> calls.add("kept"));

        subscription.cancel();
        subscription.cancel();
        bus.raiseEvent(new Ping(1));

        assertFalse(subscription.isActive());
        assertEquals(Ping.class, subscription.eventType());
        assertEquals(List.of("kept"), calls);
    }

    @Test
    void testCancelDuringDispatch() {
        var holder = new ArrayList<Subscription>();
        bus.subscribe(Ping.class, ping -> {
            calls.add("first");
            holder.get(0).cancel();
        });
        holder.add(bus.subscribe(Ping.class, ping -> calls.add("second")));

        bus.raiseEvent(new Ping(1));

        assertEquals(List.of("first"), calls);
    }
}

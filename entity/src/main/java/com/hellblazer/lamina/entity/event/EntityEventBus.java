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
package com.hellblazer.lamina.entity.event;

import com.hellblazer.lamina.entity.Component;
import com.hellblazer.lamina.entity.ComponentStore;
import com.hellblazer.lamina.entity.CyclicOrderingException;
import com.hellblazer.lamina.entity.EntityId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.function.Function;

/**
 * Synchronous, single-threaded publish/subscribe for lifecycle and domain events.
 * <p>
 * Three kinds of subscription:
 * <ul>
 *   <li><b>broadcast</b> - {@link #subscribe(Class, EventHandler)}, receives {@link #raiseEvent(Object)} and
 *   broadcast local events</li>
 *   <li><b>component scoped</b> - {@link #subscribeLocal(Class, Class, ComponentEventHandler)}, receives events
 *   directed at any entity carrying the component type</li>
 *   <li><b>entity scoped</b> - {@link #subscribeEntity(EntityId, Class, EntityEventHandler)}, receives events directed
 *   at one entity; dropped when that entity is deleted</li>
 * </ul>
 * Subscribers run in subscription order, adjusted by {@link SubscriptionOrder} constraints. The constrained order is
 * computed once by {@link #calculateOrdering()}; later subscriptions are placed as they arrive. An unsatisfiable
 * constraint fails with {@link CyclicOrderingException} at that point, never at dispatch.
 * <p>
 * A subscriber that throws is logged and skipped; the remaining subscribers still run. Events are matched on their
 * exact class.
 */
public class EntityEventBus {
    private static final Logger log = LoggerFactory.getLogger(EntityEventBus.class);

    @FunctionalInterface
    private interface Invoker {
        void invoke(EntityId entity, Component component, Object event);
    }

    private final class Registration implements Subscription {
        private final long                       sequence;
        private final Class<?>                   eventType;
        private final Class<? extends Component> componentType;
        private final EntityId                   entity;
        private final SubscriptionOrder          order;
        private final Invoker                    invoker;
        private       boolean                    active = true;

        private Registration(Class<?> eventType, Class<? extends Component> componentType, EntityId entity,
                             SubscriptionOrder order, Invoker invoker) {
            this.sequence = nextSequence++;
            this.eventType = eventType;
            this.componentType = componentType;
            this.entity = entity;
            this.order = order;
            this.invoker = invoker;
        }

        @Override
        public Class<?> eventType() {
            return eventType;
        }

        @Override
        public void cancel() {
            if (active) {
                active = false;
                detach(this);
            }
        }

        @Override
        public boolean isActive() {
            return active;
        }

        private String label() {
            return order.name() != null ? order.name() : "#" + sequence;
        }

        @Override
        public String toString() {
            return "Subscription[" + label() + " -> " + eventType.getSimpleName() + "]";
        }
    }

    private final ComponentStore                                    store;
    private final Function<EntityId, ?>                             describer;
    private final Map<Class<?>, List<Registration>>                 broadcast    = new HashMap<>();
    private final Map<Class<?>, List<Registration>>                 directed     = new HashMap<>();
    private final Map<EntityId, Map<Class<?>, List<Registration>>> entityScoped = new HashMap<>();
    private final Deque<Object>                                     queue        = new ArrayDeque<>();
    private       long                                              nextSequence;
    private       boolean                                           orderingCalculated;

    /**
     * @param store     component store consulted for component scoped subscriptions
     * @param describer renders an entity for log messages
     */
    public EntityEventBus(ComponentStore store, Function<EntityId, ?> describer) {
        this.store = Objects.requireNonNull(store, "Component store cannot be null");
        this.describer = Objects.requireNonNull(describer, "Describer cannot be null");
    }

    // ===== Subscription =====

    public <E> Subscription subscribe(Class<E> eventType, EventHandler<? super E> handler) {
        return subscribe(eventType, SubscriptionOrder.NONE, handler);
    }

    public <E> Subscription subscribe(Class<E> eventType, SubscriptionOrder order, EventHandler<? super E> handler) {
        Objects.requireNonNull(eventType, "Event type cannot be null");
        Objects.requireNonNull(order, "Order cannot be null");
        Objects.requireNonNull(handler, "Handler cannot be null");
        var registration = new Registration(eventType, null, null, order,
                                            (entity, component, event) -> handler.handle(eventType.cast(event)));
        return register(broadcast, registration);
    }

    public <C extends Component, E> Subscription subscribeLocal(Class<C> componentType, Class<E> eventType,
                                                                ComponentEventHandler<? super C, ? super E> handler) {
        return subscribeLocal(componentType, eventType, SubscriptionOrder.NONE, handler);
    }

    public <C extends Component, E> Subscription subscribeLocal(Class<C> componentType, Class<E> eventType,
                                                                SubscriptionOrder order,
                                                                ComponentEventHandler<? super C, ? super E> handler) {
        Objects.requireNonNull(componentType, "Component type cannot be null");
        Objects.requireNonNull(eventType, "Event type cannot be null");
        Objects.requireNonNull(order, "Order cannot be null");
        Objects.requireNonNull(handler, "Handler cannot be null");
        var registration = new Registration(eventType, componentType, null, order,
                                            (entity, component, event) -> handler.handle(entity,
                                                                                         componentType.cast(component),
                                                                                         eventType.cast(event)));
        return register(directed, registration);
    }

    /**
     * Subscribe to events directed at a single entity. Entity scoped subscribers run in subscription order, before
     * component scoped subscribers.
     */
    public <E> Subscription subscribeEntity(EntityId entity, Class<E> eventType, EntityEventHandler<? super E> handler) {
        Objects.requireNonNull(entity, "Entity cannot be null");
        Objects.requireNonNull(eventType, "Event type cannot be null");
        Objects.requireNonNull(handler, "Handler cannot be null");
        var registration = new Registration(eventType, null, entity, SubscriptionOrder.NONE,
                                            (target, component, event) -> handler.handle(target,
                                                                                         eventType.cast(event)));
        entityScoped.computeIfAbsent(entity, e -> new HashMap<>())
                    .computeIfAbsent(eventType, t -> new ArrayList<>())
                    .add(registration);
        return registration;
    }

    /**
     * Compute the constrained dispatch order of every subscription registered so far.
     *
     * @throws CyclicOrderingException if any event type's constraints contain a cycle
     */
    public void calculateOrdering() {
        for (var entry : broadcast.entrySet()) {
            entry.setValue(topologicalOrder(entry.getKey(), entry.getValue()));
        }
        for (var entry : directed.entrySet()) {
            entry.setValue(topologicalOrder(entry.getKey(), entry.getValue()));
        }
        orderingCalculated = true;
        log.debug("Calculated event ordering for {} broadcast and {} directed event types", broadcast.size(),
                  directed.size());
    }

    public boolean isOrderingCalculated() {
        return orderingCalculated;
    }

    // ===== Dispatch =====

    /**
     * Dispatch to broadcast subscribers immediately.
     */
    public void raiseEvent(Object event) {
        Objects.requireNonNull(event, "Event cannot be null");
        dispatchBroadcast(EntityId.INVALID, event);
    }

    /**
     * Dispatch an event directed at an entity: entity scoped subscribers first, then component scoped subscribers
     * whose component the entity carries, then, if requested, broadcast subscribers.
     */
    public void raiseLocalEvent(EntityId entity, Object event, boolean broadcastToo) {
        Objects.requireNonNull(entity, "Entity cannot be null");
        Objects.requireNonNull(event, "Event cannot be null");
        var type = event.getClass();

        var scoped = entityScoped.get(entity);
        if (scoped != null) {
            var registrations = scoped.get(type);
            if (registrations != null) {
                for (var registration : List.copyOf(registrations)) {
                    invokeDirected(registration, entity, null, event);
                }
            }
        }

        var registrations = directed.get(type);
        if (registrations != null) {
            for (var registration : List.copyOf(registrations)) {
                var component = store.tryGet(entity, registration.componentType);
                if (component.isPresent()) {
                    invokeDirected(registration, entity, component.get(), event);
                }
            }
        }

        if (broadcastToo) {
            dispatchBroadcast(entity, event);
        }
    }

    /**
     * Queue an event for broadcast on the next {@link #processEventQueue()}.
     */
    public void queueEvent(Object event) {
        queue.add(Objects.requireNonNull(event, "Event cannot be null"));
    }

    /**
     * Broadcast the events queued before this call. Events queued by subscribers while the queue is processed are
     * held for the following call.
     *
     * @return number of events dispatched
     */
    public int processEventQueue() {
        int count = queue.size();
        for (int i = 0; i < count; i++) {
            raiseEvent(queue.poll());
        }
        return count;
    }

    public int getQueuedEventCount() {
        return queue.size();
    }

    // ===== Entity tracking =====

    /**
     * Drop every entity scoped subscription of a deleted entity.
     */
    public void onEntityDeleted(EntityId entity) {
        var scoped = entityScoped.remove(entity);
        if (scoped != null) {
            scoped.values().forEach(registrations -> registrations.forEach(r -> r.active = false));
        }
    }

    public boolean hasEntitySubscriptions(EntityId entity) {
        return entityScoped.containsKey(entity);
    }

    public int getSubscriptionCount() {
        int count = 0;
        for (var registrations : broadcast.values()) {
            count += registrations.size();
        }
        for (var registrations : directed.values()) {
            count += registrations.size();
        }
        for (var scoped : entityScoped.values()) {
            for (var registrations : scoped.values()) {
                count += registrations.size();
            }
        }
        return count;
    }

    /**
     * Drop every subscription and queued event, and forget the calculated ordering.
     */
    public void clearEventTables() {
        broadcast.values().forEach(registrations -> registrations.forEach(r -> r.active = false));
        directed.values().forEach(registrations -> registrations.forEach(r -> r.active = false));
        entityScoped.values()
                    .forEach(scoped -> scoped.values()
                                             .forEach(registrations -> registrations.forEach(r -> r.active = false)));
        broadcast.clear();
        directed.clear();
        entityScoped.clear();
        queue.clear();
        orderingCalculated = false;
    }

    // ===== Internals =====

    /**
     * @param origin entity the event was raised on, or {@link EntityId#INVALID} for a plain broadcast
     */
    private void dispatchBroadcast(EntityId origin, Object event) {
        var registrations = broadcast.get(event.getClass());
        if (registrations == null || registrations.isEmpty()) {
            return;
        }
        for (var registration : List.copyOf(registrations)) {
            if (!registration.active) {
                continue;
            }
            try {
                registration.invoker.invoke(EntityId.INVALID, null, event);
            } catch (RuntimeException e) {
                if (origin.isValid()) {
                    log.error("Caught exception in {} while raising {} on entity {}", registration,
                              event.getClass().getSimpleName(), describer.apply(origin), e);
                } else {
                    log.error("Caught exception in {} while raising {}", registration,
                              event.getClass().getSimpleName(), e);
                }
            }
        }
    }

    private void invokeDirected(Registration registration, EntityId entity, Component component, Object event) {
        if (!registration.active) {
            return;
        }
        try {
            registration.invoker.invoke(entity, component, event);
        } catch (RuntimeException e) {
            log.error("Caught exception in {} while raising {} on entity {}", registration,
                      event.getClass().getSimpleName(), describer.apply(entity), e);
        }
    }

    private Subscription register(Map<Class<?>, List<Registration>> table, Registration registration) {
        var registrations = table.computeIfAbsent(registration.eventType, t -> new ArrayList<>());
        registrations.add(registration);
        if (orderingCalculated) {
            try {
                table.put(registration.eventType, topologicalOrder(registration.eventType, registrations));
            } catch (CyclicOrderingException e) {
                registrations.remove(registration);
                registration.active = false;
                throw e;
            }
        }
        return registration;
    }

    private void detach(Registration registration) {
        if (registration.entity != null) {
            var scoped = entityScoped.get(registration.entity);
            if (scoped != null) {
                var registrations = scoped.get(registration.eventType);
                if (registrations != null) {
                    registrations.remove(registration);
                }
            }
            return;
        }
        var table = registration.componentType == null ? broadcast : directed;
        var registrations = table.get(registration.eventType);
        if (registrations != null) {
            registrations.remove(registration);
        }
    }

    /**
     * Stable topological sort: among subscriptions free to run, the earliest subscribed goes first.
     */
    private static List<Registration> topologicalOrder(Class<?> eventType, List<Registration> registrations) {
        var nodes = new ArrayList<>(registrations);
        nodes.sort(Comparator.comparingLong(r -> r.sequence));
        int n = nodes.size();

        var byName = new HashMap<String, List<Integer>>();
        for (int i = 0; i < n; i++) {
            var name = nodes.get(i).order.name();
            if (name != null) {
                byName.computeIfAbsent(name, k -> new ArrayList<>()).add(i);
            }
        }

        var successors = new ArrayList<Set<Integer>>(n);
        for (int i = 0; i < n; i++) {
            successors.add(new HashSet<>());
        }
        var indegree = new int[n];
        for (int i = 0; i < n; i++) {
            var order = nodes.get(i).order;
            for (var name : order.before()) {
                for (var j : byName.getOrDefault(name, List.of())) {
                    if (j != i && successors.get(i).add(j)) {
                        indegree[j]++;
                    }
                }
            }
            for (var name : order.after()) {
                for (var j : byName.getOrDefault(name, List.of())) {
                    if (j != i && successors.get(j).add(i)) {
                        indegree[i]++;
                    }
                }
            }
        }

        var ready = new PriorityQueue<Integer>();
        for (int i = 0; i < n; i++) {
            if (indegree[i] == 0) {
                ready.add(i);
            }
        }
        var sorted = new ArrayList<Registration>(n);
        while (!ready.isEmpty()) {
            int next = ready.poll();
            sorted.add(nodes.get(next));
            for (var successor : successors.get(next)) {
                if (--indegree[successor] == 0) {
                    ready.add(successor);
                }
            }
        }

        if (sorted.size() < n) {
            var unresolved = new ArrayList<String>();
            for (int i = 0; i < n; i++) {
                if (indegree[i] > 0) {
                    unresolved.add(nodes.get(i).label());
                }
            }
            throw new CyclicOrderingException(eventType, unresolved);
        }
        return sorted;
    }
}

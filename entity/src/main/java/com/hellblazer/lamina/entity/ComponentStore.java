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

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Per-type component tables plus a per-entity index.
 * <p>
 * Components are keyed by their concrete class. Removing a component unlinks it from every query immediately but
 * keeps the instance in its type table until {@link #cullRemoved()} runs at the end of the tick, so
 * {@link #getIncludingRemoved(EntityId, Class)} can still reach the final state of a just-deleted entity.
 * <p>
 * <b>Safe order</b> for an entity is its non-mandatory components from most to least recently added, followed by the
 * transform and then the metadata. Teardown walks the safe order; initialization walks its reverse.
 * <p>
 * Not thread-safe. Owned by the simulation thread.
 */
public class ComponentStore {
    private final Map<Class<? extends Component>, Map<EntityId, Component>> tables   = new LinkedHashMap<>();
    private final Map<EntityId, List<Component>>                            byEntity = new HashMap<>();
    private final List<Removal>                                             removed  = new ArrayList<>();

    private record Removal(EntityId entity, Component component) {
    }

    /**
     * Attach a component.
     *
     * @throws DuplicateComponentException if the entity has a live component of the same class
     */
    public void add(EntityId entity, Component component) {
        Objects.requireNonNull(entity, "Entity cannot be null");
        Objects.requireNonNull(component, "Component cannot be null");
        var type = component.getClass();
        var table = tables.computeIfAbsent(type, t -> new HashMap<>());
        var existing = table.get(entity);
        if (existing != null && isLinked(entity, existing)) {
            throw new DuplicateComponentException(entity, type);
        }
        table.put(entity, component);
        byEntity.computeIfAbsent(entity, e -> new ArrayList<>()).add(component);
    }

    /**
     * Unlink a component from queries and schedule it for culling.
     *
     * @return the removed instance
     * @throws ComponentNotFoundException if the entity has no live component of the type
     */
    public <C extends Component> C remove(EntityId entity, Class<C> type) {
        var component = find(entity, type);
        if (component == null) {
            throw new ComponentNotFoundException(entity, type);
        }
        var components = byEntity.get(entity);
        components.remove(component);
        if (components.isEmpty()) {
            byEntity.remove(entity);
        }
        removed.add(new Removal(entity, component));
        return type.cast(component);
    }

    /**
     * @throws ComponentNotFoundException if absent
     */
    public <C extends Component> C get(EntityId entity, Class<C> type) {
        var component = find(entity, type);
        if (component == null) {
            throw new ComponentNotFoundException(entity, type);
        }
        return type.cast(component);
    }

    public <C extends Component> Optional<C> tryGet(EntityId entity, Class<C> type) {
        var component = find(entity, type);
        return component == null ? Optional.empty() : Optional.of(type.cast(component));
    }

    public boolean has(EntityId entity, Class<? extends Component> type) {
        return find(entity, type) != null;
    }

    /**
     * Lookup that also sees components removed during the current tick.
     */
    public <C extends Component> Optional<C> getIncludingRemoved(EntityId entity, Class<C> type) {
        var table = tables.get(type);
        if (table == null) {
            return Optional.empty();
        }
        var component = table.get(entity);
        return component == null ? Optional.empty() : Optional.of(type.cast(component));
    }

    /**
     * Lazily enumerate the entity's live components in safe order. Each call returns a new, single-use stream over a
     * snapshot taken at call time.
     */
    public Stream<Component> enumerate(EntityId entity) {
        return inSafeOrder(entity).stream();
    }

    /**
     * @return snapshot of the entity's live components in safe order
     */
    public List<Component> inSafeOrder(EntityId entity) {
        var components = byEntity.get(entity);
        if (components == null) {
            return List.of();
        }
        var ordered = new ArrayList<Component>(components.size());
        Component transform = null;
        Component metadata = null;
        for (int i = components.size() - 1; i >= 0; i--) {
            var component = components.get(i);
            if (component instanceof MetadataComponent) {
                metadata = component;
            } else if (component instanceof TransformComponent) {
                transform = component;
            } else {
                ordered.add(component);
            }
        }
        if (transform != null) {
            ordered.add(transform);
        }
        if (metadata != null) {
            ordered.add(metadata);
        }
        return ordered;
    }

    /**
     * @return snapshot of the entity's live components in initialization order, the reverse of the safe order
     */
    public List<Component> inInitializationOrder(EntityId entity) {
        var ordered = inSafeOrder(entity);
        Collections.reverse(ordered);
        return ordered;
    }

    public int componentCount(EntityId entity) {
        var components = byEntity.get(entity);
        return components == null ? 0 : components.size();
    }

    /**
     * @return entities with a live component of the type, in no particular order
     */
    public List<EntityId> entitiesWith(Class<? extends Component> type) {
        var table = tables.get(type);
        if (table == null) {
            return List.of();
        }
        var result = new ArrayList<EntityId>(table.size());
        table.forEach((entity, component) -> {
            if (isLinked(entity, component)) {
                result.add(entity);
            }
        });
        return result;
    }

    public int pendingCullCount() {
        return removed.size();
    }

    /**
     * Drop removed components from their type tables.
     *
     * @return number of components culled
     */
    public int cullRemoved() {
        int culled = 0;
        for (var removal : removed) {
            var table = tables.get(removal.component().getClass());
            if (table != null && table.remove(removal.entity(), removal.component())) {
                culled++;
            }
        }
        removed.clear();
        return culled;
    }

    /**
     * Drop every component and table.
     */
    public void clear() {
        tables.clear();
        byEntity.clear();
        removed.clear();
    }

    private Component find(EntityId entity, Class<? extends Component> type) {
        var table = tables.get(type);
        if (table == null) {
            return null;
        }
        var component = table.get(entity);
        return component != null && isLinked(entity, component) ? component : null;
    }

    private boolean isLinked(EntityId entity, Component component) {
        var components = byEntity.get(entity);
        if (components == null) {
            return false;
        }
        for (var c : components) {
            if (c == component) {
                return true;
            }
        }
        return false;
    }
}

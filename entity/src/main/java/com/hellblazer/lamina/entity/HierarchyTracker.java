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

import com.hellblazer.lamina.entity.event.EntityEventBus;
import com.hellblazer.lamina.entity.event.EntityParentChangedEvent;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Maintains the parent/child forest formed by {@link TransformComponent}s.
 * <p>
 * Links are entity identifiers resolved through the {@link ComponentStore}. Every mutation updates the child pointer
 * and the parent's child set together and raises {@link EntityParentChangedEvent} only afterwards, so handlers never
 * observe a half-applied move. Attaching an entity below one of its own descendants is rejected, which keeps the
 * structure acyclic.
 */
public class HierarchyTracker {
    private final ComponentStore store;
    private final EntityEventBus eventBus;

    public HierarchyTracker(ComponentStore store, EntityEventBus eventBus) {
        this.store = Objects.requireNonNull(store, "Component store cannot be null");
        this.eventBus = Objects.requireNonNull(eventBus, "Event bus cannot be null");
    }

    /**
     * @return the parent of a live entity, {@link EntityId#INVALID} for roots
     * @throws UnknownIdException if the entity has no live transform
     */
    public EntityId getParent(EntityId entity) {
        return transformOf(entity).getParent();
    }

    /**
     * @throws UnknownIdException if the entity has no live transform
     */
    public Set<EntityId> getChildren(EntityId entity) {
        return transformOf(entity).getChildren();
    }

    /**
     * Attach {@code child} below {@code parent}, detaching it from its current parent. The child inherits the
     * parent's map.
     *
     * @throws UnknownIdException       if either entity has no live transform
     * @throws IllegalArgumentException if the move would create a cycle
     */
    public void setParent(EntityId child, EntityId parent) {
        Objects.requireNonNull(parent, "Parent cannot be null");
        if (!parent.isValid()) {
            detachParentToNull(child);
            return;
        }
        var childTransform = transformOf(child);
        var parentTransform = transformOf(parent);
        if (child.equals(parent) || isAncestor(child, parent)) {
            throw new IllegalArgumentException("Cannot parent " + child + " to " + parent + ": would create a cycle");
        }
        var oldParent = childTransform.getParent();
        if (oldParent.equals(parent)) {
            return;
        }
        if (oldParent.isValid()) {
            store.tryGet(oldParent, TransformComponent.class)
                 .ifPresent(old -> old.childrenInternal().remove(child));
        }
        parentTransform.childrenInternal().add(child);
        childTransform.setParentInternal(parent);
        childTransform.setMapId(parentTransform.getMapId());

        eventBus.raiseLocalEvent(child, new EntityParentChangedEvent(child, oldParent, parent), true);
    }

    /**
     * Detach an entity from its parent, leaving it a root outside any map. No-op for roots.
     *
     * @throws UnknownIdException if the entity has no live transform
     */
    public void detachParentToNull(EntityId entity) {
        detachParentToNull(entity, transformOf(entity));
    }

    void detachParentToNull(EntityId entity, TransformComponent transform) {
        var oldParent = transform.getParent();
        if (!oldParent.isValid()) {
            return;
        }
        store.tryGet(oldParent, TransformComponent.class).ifPresent(old -> old.childrenInternal().remove(entity));
        transform.setParentInternal(EntityId.INVALID);
        transform.setMapId(MapService.NULLSPACE);

        eventBus.raiseLocalEvent(entity, new EntityParentChangedEvent(entity, oldParent, EntityId.INVALID), true);
    }

    /**
     * @return true if {@code ancestor} appears on the parent chain of {@code entity}
     */
    public boolean isAncestor(EntityId ancestor, EntityId entity) {
        var current = store.tryGet(entity, TransformComponent.class).map(TransformComponent::getParent)
                           .orElse(EntityId.INVALID);
        while (current.isValid()) {
            if (current.equals(ancestor)) {
                return true;
            }
            current = store.tryGet(current, TransformComponent.class).map(TransformComponent::getParent)
                           .orElse(EntityId.INVALID);
        }
        return false;
    }

    /**
     * @return every live descendant of the entity, depth first, pre-order; excludes the entity itself
     */
    public List<EntityId> descendants(EntityId entity) {
        var result = new ArrayList<EntityId>();
        var stack = new ArrayDeque<EntityId>();
        pushChildren(transformOf(entity), stack);
        while (!stack.isEmpty()) {
            var next = stack.pop();
            var transform = store.tryGet(next, TransformComponent.class);
            if (transform.isEmpty()) {
                continue;
            }
            result.add(next);
            pushChildren(transform.get(), stack);
        }
        return result;
    }

    /**
     * Remove a child reference whose entity no longer exists.
     *
     * @return the inconsistency that was repaired
     */
    StructuralInconsistencyException removeStaleChild(EntityId parent, TransformComponent parentTransform,
                                                      EntityId child, Object parentDescription) {
        parentTransform.childrenInternal().remove(child);
        return new StructuralInconsistencyException(
        "A deleted entity was still the transform child of another entity. Parent: " + parentDescription
        + ", child: " + child, parent, child);
    }

    private void pushChildren(TransformComponent transform, ArrayDeque<EntityId> stack) {
        var children = new ArrayList<>(transform.childrenInternal());
        for (int i = children.size() - 1; i >= 0; i--) {
            stack.push(children.get(i));
        }
    }

    private TransformComponent transformOf(EntityId entity) {
        return store.tryGet(entity, TransformComponent.class)
                    .orElseThrow(() -> new UnknownIdException("Entity " + entity + " does not exist"));
    }
}

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

/**
 * Observer for entity lifecycle notifications. All methods are invoked synchronously on the simulation thread.
 */
public interface EntityLifecycleListener {

    /**
     * Raised once the mandatory metadata and transform exist, before any other component is attached.
     */
    default void onEntityAdded(EntityId entity) {
    }

    default void onEntityInitialized(EntityId entity) {
    }

    /**
     * Raised once per queued deletion; not raised for immediate deletions.
     */
    default void onEntityQueuedForDeletion(EntityId entity) {
    }

    /**
     * Raised at most once per tick per entity, and only after the entity has finished initializing.
     */
    default void onEntityDirtied(EntityId entity) {
    }

    /**
     * Raised after every component has been shut down and removed. The network binding is still resolvable while
     * this runs.
     *
     * @param metadata final snapshot of the entity's metadata
     */
    default void onEntityDeleted(EntityId entity, MetadataComponent metadata) {
    }

    /**
     * A hierarchy inconsistency was found and repaired.
     */
    default void onStructuralInconsistency(StructuralInconsistencyException inconsistency) {
    }
}

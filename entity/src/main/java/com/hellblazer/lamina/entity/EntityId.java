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
 * Process-local entity identifier. Identifiers are issued in increasing order by {@link EntityIdAllocator} and are
 * never reused within a runtime.
 *
 * @param id the raw identifier value, {@code 0} is reserved for {@link #INVALID}
 */
public record EntityId(int id) implements Comparable<EntityId> {

    /**
     * Sentinel for "no entity", used as the parent of root transforms.
     */
    public static final EntityId INVALID = new EntityId(0);

    /**
     * First identifier handed out by a default allocator.
     */
    public static final int FIRST = 1;

    public boolean isValid() {
        return id != INVALID.id;
    }

    @Override
    public int compareTo(EntityId other) {
        return Integer.compare(id, other.id);
    }

    @Override
    public String toString() {
        return String.valueOf(id);
    }
}

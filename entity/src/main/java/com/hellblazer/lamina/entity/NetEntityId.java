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
 * Network-stable entity identifier used on the wire. Bound one-to-one to a local {@link EntityId} while the entity is
 * alive.
 *
 * @param id the raw identifier value, {@code 0} is reserved for {@link #INVALID}
 */
public record NetEntityId(int id) implements Comparable<NetEntityId> {

    public static final NetEntityId INVALID = new NetEntityId(0);

    public static final int FIRST = 1;

    public boolean isValid() {
        return id != INVALID.id;
    }

    @Override
    public int compareTo(NetEntityId other) {
        return Integer.compare(id, other.id);
    }

    @Override
    public String toString() {
        return "n" + id;
    }
}

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
 * Stages an entity moves through, in order. Stages only ever move forward. {@link #TERMINATING} and {@link #DELETED}
 * are reachable from any earlier stage.
 */
public enum EntityLifeStage {
    ALLOCATED,
    INITIALIZING,
    INITIALIZED,
    STARTING,
    STARTED,
    MAP_INITIALIZED,
    TERMINATING,
    DELETED;

    public boolean isAfter(EntityLifeStage other) {
        return ordinal() > other.ordinal();
    }

    public boolean isAtLeast(EntityLifeStage other) {
        return ordinal() >= other.ordinal();
    }
}

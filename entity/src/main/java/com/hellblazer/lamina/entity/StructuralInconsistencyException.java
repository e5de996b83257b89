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
 * A hierarchy inconsistency that the runtime detected and repaired, such as a transform that still lists a deleted
 * child. Never thrown by the runtime itself; instances are logged and reported to
 * {@link EntityLifecycleListener#onStructuralInconsistency(StructuralInconsistencyException)}.
 */
public final class StructuralInconsistencyException extends EntityRuntimeException {
    private final EntityId parent;
    private final EntityId child;

    public StructuralInconsistencyException(String message, EntityId parent, EntityId child) {
        super(message);
        this.parent = parent;
        this.child = child;
    }

    public EntityId getParent() {
        return parent;
    }

    public EntityId getChild() {
        return child;
    }
}

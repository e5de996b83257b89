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
 * Base of the entity runtime's closed exception hierarchy. All runtime failures are unchecked; callers that need to
 * react to a specific failure catch the concrete subclass.
 */
public sealed class EntityRuntimeException extends RuntimeException
permits UnknownIdException, DuplicateComponentException, ComponentNotFoundException,
        InvalidLifecycleTransitionException, EntityCreationException, StructuralInconsistencyException,
        CyclicOrderingException {

    public EntityRuntimeException(String message) {
        super(message);
    }

    public EntityRuntimeException(String message, Throwable cause) {
        super(message, cause);
    }
}

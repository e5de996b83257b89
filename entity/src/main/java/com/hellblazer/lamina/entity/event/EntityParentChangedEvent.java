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

import com.hellblazer.lamina.entity.EntityId;

/**
 * Raised after an entity's parent changed; both the old and new parent's child sets are already updated.
 *
 * @param entity    the entity that moved
 * @param oldParent previous parent, or {@link EntityId#INVALID}
 * @param newParent new parent, or {@link EntityId#INVALID} when detached
 */
public record EntityParentChangedEvent(EntityId entity, EntityId oldParent, EntityId newParent) {
}

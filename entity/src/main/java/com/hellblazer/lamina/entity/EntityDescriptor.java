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
 * Human readable description of an entity for logs and diagnostics. Built from the last known metadata, so it stays
 * valid for an entity deleted during the current tick.
 *
 * @param entity      local identifier
 * @param netEntity   network identifier, {@link NetEntityId#INVALID} if unknown
 * @param deleted     whether the entity is deleted or was never known
 * @param name        entity name, may be empty
 * @param prototypeId prototype id, or null
 */
public record EntityDescriptor(EntityId entity, NetEntityId netEntity, boolean deleted, String name,
                               String prototypeId) {

    static EntityDescriptor unknown(EntityId entity) {
        return new EntityDescriptor(entity, NetEntityId.INVALID, true, "", null);
    }

    @Override
    public String toString() {
        var builder = new StringBuilder();
        if (!name.isEmpty()) {
            builder.append(name).append(' ');
        }
        builder.append('(').append(entity).append('/').append(netEntity);
        if (prototypeId != null) {
            builder.append(", ").append(prototypeId);
        }
        builder.append(')');
        if (deleted) {
            builder.append("D");
        }
        return builder.toString();
    }
}

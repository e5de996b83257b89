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

import java.util.Objects;

/**
 * Identity of the template an entity was created from. Component data lives with the {@link PrototypeLoader}.
 *
 * @param id          prototype identifier
 * @param name        default entity name
 * @param description default entity description
 */
public record EntityPrototype(String id, String name, String description) {

    public EntityPrototype {
        Objects.requireNonNull(id, "Prototype id cannot be null");
        name = name == null ? "" : name;
        description = description == null ? "" : description;
    }
}

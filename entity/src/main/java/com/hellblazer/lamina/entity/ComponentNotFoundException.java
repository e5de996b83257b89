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
 * The requested component is not attached to the entity.
 */
public final class ComponentNotFoundException extends EntityRuntimeException {
    private final EntityId                   entity;
    private final Class<? extends Component> componentType;

    public ComponentNotFoundException(EntityId entity, Class<? extends Component> componentType) {
        super("Entity " + entity + " does not have a component of type " + componentType.getSimpleName());
        this.entity = entity;
        this.componentType = componentType;
    }

    public EntityId getEntity() {
        return entity;
    }

    public Class<? extends Component> getComponentType() {
        return componentType;
    }
}

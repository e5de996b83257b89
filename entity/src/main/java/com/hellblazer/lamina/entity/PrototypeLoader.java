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

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Source of entity templates and the component instances they define. Implementations live outside the runtime
 * (data loading, serialization); the runtime only attaches what is returned.
 */
public interface PrototypeLoader {

    /**
     * Loader that knows no prototypes.
     */
    PrototypeLoader NONE = new PrototypeLoader() {
        @Override
        public Optional<EntityPrototype> find(String prototypeId) {
            return Optional.empty();
        }

        @Override
        public List<Component> loadComponents(EntityId entity, EntityPrototype prototype,
                                              Collection<? extends Component> overrides) {
            return List.copyOf(overrides);
        }
    };

    Optional<EntityPrototype> find(String prototypeId);

    /**
     * Produce the components to attach to a freshly allocated entity. Any exception aborts creation; the runtime
     * deletes the partial entity and reports an {@link EntityCreationException}.
     *
     * @param entity    the allocated entity, already carrying metadata and transform
     * @param prototype the prototype being instantiated
     * @param overrides caller-supplied instances that replace the prototype's component of the same class
     * @return new, unattached component instances
     */
    List<Component> loadComponents(EntityId entity, EntityPrototype prototype,
                                   Collection<? extends Component> overrides);
}

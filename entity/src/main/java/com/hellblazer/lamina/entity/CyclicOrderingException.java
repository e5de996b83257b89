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

import java.util.List;

/**
 * Event subscriptions declared before/after constraints that cannot be satisfied.
 */
public final class CyclicOrderingException extends EntityRuntimeException {
    private final Class<?>     eventType;
    private final List<String> unresolved;

    public CyclicOrderingException(Class<?> eventType, List<String> unresolved) {
        super("Cyclic subscription ordering for " + eventType.getSimpleName() + " between " + unresolved);
        this.eventType = eventType;
        this.unresolved = List.copyOf(unresolved);
    }

    public Class<?> getEventType() {
        return eventType;
    }

    /**
     * @return names of the subscriptions that could not be placed
     */
    public List<String> getUnresolved() {
        return unresolved;
    }
}

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
package com.hellblazer.lamina.network;

import java.util.Objects;
import java.util.UUID;

/**
 * A connected remote participant.
 *
 * @param id   stable session identifier
 * @param name display name, for logs
 */
public record Session(UUID id, String name) {

    public Session {
        Objects.requireNonNull(id, "Session id cannot be null");
        name = name == null ? "" : name;
    }

    public static Session newSession(String name) {
        return new Session(UUID.randomUUID(), name);
    }

    @Override
    public String toString() {
        return name.isEmpty() ? id.toString() : name + " (" + id + ")";
    }
}

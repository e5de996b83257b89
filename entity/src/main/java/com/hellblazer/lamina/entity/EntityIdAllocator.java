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

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Issues local and network entity identifiers and maintains the one-to-one binding between them.
 * <p>
 * Both counters only move forward, so an identifier is never handed out twice. Releasing a binding frees the pair
 * for lookups but does not return the network identifier to the counter; two live entities therefore never share a
 * network identifier.
 * <p>
 * Not thread-safe. Owned by the simulation thread.
 */
public class EntityIdAllocator {
    private final Map<EntityId, NetEntityId> toNetwork = new HashMap<>();
    private final Map<NetEntityId, EntityId> toEntity  = new HashMap<>();
    private       int                        nextEntityId;
    private       int                        nextNetworkId;

    public EntityIdAllocator() {
        this(EntityId.FIRST, NetEntityId.FIRST);
    }

    /**
     * @param firstEntityId  first local identifier to issue, must be positive
     * @param firstNetworkId first network identifier to issue, must be positive
     */
    public EntityIdAllocator(int firstEntityId, int firstNetworkId) {
        if (firstEntityId <= 0 || firstNetworkId <= 0) {
            throw new IllegalArgumentException("First identifiers must be positive");
        }
        this.nextEntityId = firstEntityId;
        this.nextNetworkId = firstNetworkId;
    }

    /**
     * @return a fresh local identifier, greater than every identifier issued before
     */
    public EntityId allocateEntityId() {
        if (nextEntityId == Integer.MAX_VALUE) {
            throw new IllegalStateException("Entity identifier space exhausted");
        }
        return new EntityId(nextEntityId++);
    }

    /**
     * @return a fresh network identifier, greater than every identifier issued before
     */
    public NetEntityId allocateNetworkId() {
        if (nextNetworkId == Integer.MAX_VALUE) {
            throw new IllegalStateException("Network identifier space exhausted");
        }
        return new NetEntityId(nextNetworkId++);
    }

    /**
     * Bind a local identifier to a network identifier.
     *
     * @throws IllegalStateException if either side is already bound
     */
    public void bind(EntityId entity, NetEntityId netEntity) {
        Objects.requireNonNull(entity, "Entity cannot be null");
        Objects.requireNonNull(netEntity, "Network entity cannot be null");
        if (toNetwork.containsKey(entity)) {
            throw new IllegalStateException("Entity " + entity + " is already bound to " + toNetwork.get(entity));
        }
        if (toEntity.containsKey(netEntity)) {
            throw new IllegalStateException(
            "Network entity " + netEntity + " is already bound to " + toEntity.get(netEntity));
        }
        toNetwork.put(entity, netEntity);
        toEntity.put(netEntity, entity);
    }

    /**
     * @throws UnknownIdException if the entity is not bound
     */
    public NetEntityId resolveNetwork(EntityId entity) {
        var netEntity = toNetwork.get(entity);
        if (netEntity == null) {
            throw new UnknownIdException("Entity " + entity + " has no network binding");
        }
        return netEntity;
    }

    /**
     * @throws UnknownIdException if the network identifier is not bound
     */
    public EntityId resolveEntity(NetEntityId netEntity) {
        var entity = toEntity.get(netEntity);
        if (entity == null) {
            throw new UnknownIdException("Network entity " + netEntity + " is not bound");
        }
        return entity;
    }

    public Optional<NetEntityId> tryResolveNetwork(EntityId entity) {
        return Optional.ofNullable(toNetwork.get(entity));
    }

    public Optional<EntityId> tryResolveEntity(NetEntityId netEntity) {
        return Optional.ofNullable(toEntity.get(netEntity));
    }

    public boolean isBound(NetEntityId netEntity) {
        return toEntity.containsKey(netEntity);
    }

    /**
     * Drop the binding for a network identifier.
     *
     * @throws UnknownIdException if the network identifier is not bound
     */
    public void release(NetEntityId netEntity) {
        var entity = toEntity.remove(netEntity);
        if (entity == null) {
            throw new UnknownIdException("Network entity " + netEntity + " is not bound");
        }
        toNetwork.remove(entity);
    }

    public int getBindingCount() {
        return toEntity.size();
    }

    @Override
    public String toString() {
        return String.format("EntityIdAllocator[nextEntity=%d, nextNetwork=%d, bound=%d]", nextEntityId,
                             nextNetworkId, toEntity.size());
    }
}

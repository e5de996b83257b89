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
 * Base class for typed data records attached to exactly one entity.
 * <p>
 * The runtime drives each component through {@link ComponentLifeStage} and calls the matching hook. Subclasses
 * override the hooks they care about; the hooks run on the simulation thread and must not block.
 * <p>
 * An entity carries at most one component per concrete class.
 */
public abstract class Component {
    private EntityId           owner          = EntityId.INVALID;
    private ComponentLifeStage lifeStage      = ComponentLifeStage.PRE_ADD;
    private long               creationTick;
    private long               lastModifiedTick;
    private boolean            netSyncEnabled = true;

    public EntityId getOwner() {
        return owner;
    }

    public ComponentLifeStage getLifeStage() {
        return lifeStage;
    }

    public boolean isInitialized() {
        return lifeStage.ordinal() >= ComponentLifeStage.INITIALIZED.ordinal();
    }

    public boolean isRunning() {
        return lifeStage == ComponentLifeStage.RUNNING;
    }

    public boolean isDeleted() {
        return lifeStage == ComponentLifeStage.DELETED;
    }

    public long getCreationTick() {
        return creationTick;
    }

    public long getLastModifiedTick() {
        return lastModifiedTick;
    }

    public boolean isNetSyncEnabled() {
        return netSyncEnabled;
    }

    public void setNetSyncEnabled(boolean netSyncEnabled) {
        this.netSyncEnabled = netSyncEnabled;
    }

    /**
     * Reset the modification ticks to 0, marking the state as identical to its prototype.
     */
    public void clearTicks() {
        creationTick = 0;
        lastModifiedTick = 0;
    }

    protected void onAdd() {
    }

    protected void onInitialize() {
    }

    protected void onStartup() {
    }

    protected void onShutdown() {
    }

    protected void onRemove() {
    }

    void lifeAddToEntity(EntityId entity, long tick) {
        expect(ComponentLifeStage.PRE_ADD, "add");
        owner = entity;
        creationTick = tick;
        lastModifiedTick = tick;
        lifeStage = ComponentLifeStage.ADDED;
        onAdd();
    }

    void lifeInitialize() {
        expect(ComponentLifeStage.ADDED, "initialize");
        lifeStage = ComponentLifeStage.INITIALIZING;
        onInitialize();
        lifeStage = ComponentLifeStage.INITIALIZED;
    }

    void lifeStartup() {
        expect(ComponentLifeStage.INITIALIZED, "start");
        lifeStage = ComponentLifeStage.STARTING;
        onStartup();
        lifeStage = ComponentLifeStage.RUNNING;
    }

    void lifeShutdown() {
        expect(ComponentLifeStage.RUNNING, "shut down");
        lifeStage = ComponentLifeStage.STOPPING;
        onShutdown();
        lifeStage = ComponentLifeStage.STOPPED;
    }

    void lifeRemoveFromEntity() {
        if (lifeStage == ComponentLifeStage.PRE_ADD || lifeStage.ordinal() >= ComponentLifeStage.REMOVING.ordinal()) {
            throw new InvalidLifecycleTransitionException(
            "Cannot remove " + getClass().getSimpleName() + " of " + owner + " in stage " + lifeStage);
        }
        lifeStage = ComponentLifeStage.REMOVING;
        try {
            onRemove();
        } finally {
            lifeStage = ComponentLifeStage.DELETED;
        }
    }

    void stampModified(long tick) {
        lastModifiedTick = tick;
    }

    private void expect(ComponentLifeStage expected, String operation) {
        if (lifeStage != expected) {
            throw new InvalidLifecycleTransitionException(
            "Cannot " + operation + " " + getClass().getSimpleName() + " of " + owner + ": expected " + expected
            + " but was " + lifeStage);
        }
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[owner=" + owner + ", stage=" + lifeStage + "]";
    }
}

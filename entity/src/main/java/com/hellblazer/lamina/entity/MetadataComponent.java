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
 * Identity bookkeeping present on every live entity: lifecycle stage, pause state, last-modified tick, prototype
 * link, name and description. It is the last component removed when the entity is deleted, and the deleted instance
 * stays readable until the end-of-tick cull so the final state can still be described.
 */
public final class MetadataComponent extends Component {
    private EntityLifeStage entityLifeStage = EntityLifeStage.ALLOCATED;
    private boolean         entityPaused;
    private long            entityLastModifiedTick;
    private EntityPrototype entityPrototype;
    private String          entityName        = "";
    private String          entityDescription = "";
    private NetEntityId     netEntity         = NetEntityId.INVALID;

    public EntityLifeStage getEntityLifeStage() {
        return entityLifeStage;
    }

    public boolean isEntityDeleted() {
        return entityLifeStage == EntityLifeStage.DELETED;
    }

    public boolean isEntityPaused() {
        return entityPaused;
    }

    public long getEntityLastModifiedTick() {
        return entityLastModifiedTick;
    }

    public EntityPrototype getEntityPrototype() {
        return entityPrototype;
    }

    public String getEntityName() {
        return entityName;
    }

    public void setEntityName(String entityName) {
        this.entityName = entityName == null ? "" : entityName;
    }

    public String getEntityDescription() {
        return entityDescription;
    }

    public void setEntityDescription(String entityDescription) {
        this.entityDescription = entityDescription == null ? "" : entityDescription;
    }

    public NetEntityId getNetEntity() {
        return netEntity;
    }

    /**
     * Stages never move backwards. Setting the current stage again is allowed.
     */
    void setEntityLifeStage(EntityLifeStage stage) {
        if (stage.ordinal() < entityLifeStage.ordinal()) {
            throw new InvalidLifecycleTransitionException(
            "Entity " + getOwner() + " cannot move back from " + entityLifeStage + " to " + stage);
        }
        entityLifeStage = stage;
    }

    void setEntityPaused(boolean paused) {
        this.entityPaused = paused;
    }

    void setEntityLastModifiedTick(long tick) {
        this.entityLastModifiedTick = tick;
    }

    void setEntityPrototype(EntityPrototype prototype) {
        this.entityPrototype = prototype;
        if (prototype != null) {
            setEntityName(prototype.name());
            setEntityDescription(prototype.description());
        }
    }

    void setNetEntity(NetEntityId netEntity) {
        this.netEntity = netEntity;
    }
}

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

import javax.vecmath.Point3f;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Placement and hierarchy component present on every live entity.
 * <p>
 * Parent and children are held as entity identifiers, never as references. The parent pointer and the parent's child
 * set are kept consistent by {@link HierarchyTracker}; code outside the runtime only reads them.
 */
public final class TransformComponent extends Component {
    private final Set<EntityId> children      = new LinkedHashSet<>();
    private final Point3f       localPosition = new Point3f();
    private       EntityId      parent        = EntityId.INVALID;
    private       boolean       anchored;
    private       int           mapId         = MapService.NULLSPACE;

    /**
     * @return the parent entity, or {@link EntityId#INVALID} for a root
     */
    public EntityId getParent() {
        return parent;
    }

    public boolean hasParent() {
        return parent.isValid();
    }

    /**
     * @return read-only view of the children, in attach order
     */
    public Set<EntityId> getChildren() {
        return Collections.unmodifiableSet(children);
    }

    public int getChildCount() {
        return children.size();
    }

    public boolean isAnchored() {
        return anchored;
    }

    public void setAnchored(boolean anchored) {
        this.anchored = anchored;
    }

    public Point3f getLocalPosition() {
        return new Point3f(localPosition);
    }

    public void setLocalPosition(Point3f position) {
        localPosition.set(position);
    }

    public int getMapId() {
        return mapId;
    }

    public void setMapId(int mapId) {
        this.mapId = mapId;
    }

    Set<EntityId> childrenInternal() {
        return children;
    }

    void setParentInternal(EntityId parent) {
        this.parent = parent;
    }
}

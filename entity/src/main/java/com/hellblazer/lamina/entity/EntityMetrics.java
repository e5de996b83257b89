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

import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Runtime counters. The live entity gauge is refreshed once per tick after the deferred deletion drain; counters are
 * cumulative. Readouts are safe from any thread.
 */
public class EntityMetrics {

    /**
     * Point-in-time readout.
     *
     * @param liveEntities        live entity gauge as of the last tick
     * @param deletedEntities     entities deleted since creation
     * @param structuralRepairs   hierarchy inconsistencies repaired
     * @param lateMessages        network messages that arrived behind the local tick
     * @param droppedMessages     network messages dropped without dispatch
     */
    public record Snapshot(int liveEntities, long deletedEntities, long structuralRepairs, long lateMessages,
                           long droppedMessages) {
    }

    private final AtomicInteger liveEntities      = new AtomicInteger();
    private final AtomicLong    deletedEntities   = new AtomicLong();
    private final AtomicLong    structuralRepairs = new AtomicLong();
    private final AtomicLong    lateMessages      = new AtomicLong();
    private final AtomicLong    droppedMessages   = new AtomicLong();

    public int getLiveEntities() {
        return liveEntities.get();
    }

    public void setLiveEntities(int count) {
        liveEntities.set(count);
    }

    public void recordDeletion() {
        deletedEntities.incrementAndGet();
    }

    public void recordStructuralRepair() {
        structuralRepairs.incrementAndGet();
    }

    public void recordLateMessage() {
        lateMessages.incrementAndGet();
    }

    public void recordDroppedMessage() {
        droppedMessages.incrementAndGet();
    }

    public Snapshot snapshot() {
        return new Snapshot(liveEntities.get(), deletedEntities.get(), structuralRepairs.get(), lateMessages.get(),
                            droppedMessages.get());
    }

    @Override
    public String toString() {
        return snapshot().toString();
    }
}

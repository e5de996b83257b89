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

import java.util.concurrent.atomic.AtomicLong;

/**
 * Thread-safe, monotonically increasing tick counter. The simulation loop owns it and advances it once per tick; the
 * entity runtime only reads it through {@link TickClock}.
 */
public class SimulationClock implements TickClock {
    private final AtomicLong tick;

    /**
     * Create a clock starting at tick 1. Tick 0 is reserved to mean "never modified".
     */
    public SimulationClock() {
        this(1L);
    }

    /**
     * Create a clock with the specified initial tick
     *
     * @param initialTick the initial tick, must be non-negative
     */
    public SimulationClock(long initialTick) {
        if (initialTick < 0) {
            throw new IllegalArgumentException("Tick cannot be negative");
        }
        this.tick = new AtomicLong(initialTick);
    }

    /**
     * Advance the clock by one tick
     *
     * @return the new tick
     */
    public long advance() {
        return tick.incrementAndGet();
    }

    /**
     * Move the clock forward to the given tick.
     *
     * @param newTick target tick, must not be behind the current tick
     * @throws IllegalArgumentException if {@code newTick} would move the clock backwards
     */
    public void advanceTo(long newTick) {
        tick.getAndUpdate(current -> {
            if (newTick < current) {
                throw new IllegalArgumentException(
                "Cannot move clock backwards from " + current + " to " + newTick);
            }
            return newTick;
        });
    }

    @Override
    public long currentTick() {
        return tick.get();
    }

    @Override
    public String toString() {
        return String.format("SimulationClock[tick=%d]", tick.get());
    }
}

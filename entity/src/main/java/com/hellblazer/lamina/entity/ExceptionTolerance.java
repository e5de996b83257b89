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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Single decision point for the failure sites that can run either tolerant (log and continue) or strict (propagate):
 * re-entrant deletion and network message dispatch. Teardown and event subscriber failures are always tolerant and do
 * not go through here.
 */
public final class ExceptionTolerance {
    private static final Logger log = LoggerFactory.getLogger(ExceptionTolerance.class);

    public static final ExceptionTolerance TOLERANT = new ExceptionTolerance(true);
    public static final ExceptionTolerance STRICT   = new ExceptionTolerance(false);

    private final boolean tolerant;

    private ExceptionTolerance(boolean tolerant) {
        this.tolerant = tolerant;
    }

    public static ExceptionTolerance of(boolean tolerant) {
        return tolerant ? TOLERANT : STRICT;
    }

    public boolean isTolerant() {
        return tolerant;
    }

    /**
     * Log the failure and return in tolerant mode; rethrow it in strict mode.
     *
     * @param context description of the failing operation
     * @param failure the failure
     */
    public void handle(String context, RuntimeException failure) {
        if (!tolerant) {
            throw failure;
        }
        log.error("{}", context, failure);
    }

    /**
     * Run the action, routing any failure through {@link #handle(String, RuntimeException)}.
     */
    public void run(String context, Runnable action) {
        try {
            action.run();
        } catch (RuntimeException e) {
            handle(context, e);
        }
    }

    @Override
    public String toString() {
        return tolerant ? "ExceptionTolerance[tolerant]" : "ExceptionTolerance[strict]";
    }
}

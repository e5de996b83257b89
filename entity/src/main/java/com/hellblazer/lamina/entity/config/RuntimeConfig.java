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
package com.hellblazer.lamina.entity.config;

/**
 * Configuration for the entity runtime.
 * <p>
 * {@code exceptionTolerant} selects between logging and continuing (tolerant) or propagating (strict) at the
 * documented tolerance sites: re-entrant deletion and network message dispatch.
 */
public class RuntimeConfig {

    private final boolean exceptionTolerant;
    private final boolean logLateMessages;
    private final int     firstEntityId;
    private final int     firstNetworkId;
    private final boolean warnOnUnknownSession;

    private RuntimeConfig(Builder builder) {
        this.exceptionTolerant = builder.exceptionTolerant;
        this.logLateMessages = builder.logLateMessages;
        this.firstEntityId = builder.firstEntityId;
        this.firstNetworkId = builder.firstNetworkId;
        this.warnOnUnknownSession = builder.warnOnUnknownSession;
    }

    /**
     * @return a configuration with every default
     */
    public static RuntimeConfig defaultConfig() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @return true to log and continue at tolerance sites, false to propagate
     */
    public boolean isExceptionTolerant() {
        return exceptionTolerant;
    }

    /**
     * @return whether network messages stamped behind the local tick are logged
     */
    public boolean isLogLateMessages() {
        return logLateMessages;
    }

    public int getFirstEntityId() {
        return firstEntityId;
    }

    public int getFirstNetworkId() {
        return firstNetworkId;
    }

    /**
     * @return whether messages from a session that never connected are logged at warn rather than debug
     */
    public boolean isWarnOnUnknownSession() {
        return warnOnUnknownSession;
    }

    /**
     * @return a builder seeded with this configuration
     */
    public Builder toBuilder() {
        return builder().withExceptionTolerant(exceptionTolerant)
                        .withLogLateMessages(logLateMessages)
                        .withFirstEntityId(firstEntityId)
                        .withFirstNetworkId(firstNetworkId)
                        .withWarnOnUnknownSession(warnOnUnknownSession);
    }

    @Override
    public String toString() {
        return String.format("RuntimeConfig[tolerant=%s, logLate=%s, firstEntity=%d, firstNetwork=%d, warnUnknown=%s]",
                             exceptionTolerant, logLateMessages, firstEntityId, firstNetworkId,
                             warnOnUnknownSession);
    }

    public static class Builder {
        private boolean exceptionTolerant    = true;
        private boolean logLateMessages      = true;
        private int     firstEntityId        = 1;
        private int     firstNetworkId       = 1;
        private boolean warnOnUnknownSession = true;

        private Builder() {
        }

        public Builder withExceptionTolerant(boolean tolerant) {
            this.exceptionTolerant = tolerant;
            return this;
        }

        public Builder withLogLateMessages(boolean logLateMessages) {
            this.logLateMessages = logLateMessages;
            return this;
        }

        /**
         * @throws IllegalArgumentException if not positive
         */
        public Builder withFirstEntityId(int firstEntityId) {
            if (firstEntityId <= 0) {
                throw new IllegalArgumentException("First entity id must be positive");
            }
            this.firstEntityId = firstEntityId;
            return this;
        }

        /**
         * @throws IllegalArgumentException if not positive
         */
        public Builder withFirstNetworkId(int firstNetworkId) {
            if (firstNetworkId <= 0) {
                throw new IllegalArgumentException("First network id must be positive");
            }
            this.firstNetworkId = firstNetworkId;
            return this;
        }

        public Builder withWarnOnUnknownSession(boolean warnOnUnknownSession) {
            this.warnOnUnknownSession = warnOnUnknownSession;
            return this;
        }

        public RuntimeConfig build() {
            return new RuntimeConfig(this);
        }
    }
}

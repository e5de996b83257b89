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

/**
 * Outbound system message handed to the {@link Transport}.
 *
 * @param sourceTick local tick at send time
 * @param type       always {@link EntityMessageType#SYSTEM_MESSAGE} for messages built by the runtime
 * @param payload    the system message
 */
public record OutboundEntityMessage(long sourceTick, EntityMessageType type, Object payload) {
}

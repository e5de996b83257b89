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

/**
 * Inbound entity message envelope.
 *
 * @param sourceTick tick the sender stamped the message with
 * @param sequence   per-session sequence number, {@code 0} for messages that do not take part in sequencing
 * @param type       message type
 * @param payload    system message payload, may be null for {@link EntityMessageType#ERROR}
 * @param channel    channel the message arrived on
 */
public record EntityMessage(long sourceTick, long sequence, EntityMessageType type, Object payload,
                            NetChannel channel) {

    public EntityMessage {
        Objects.requireNonNull(type, "Type cannot be null");
        Objects.requireNonNull(channel, "Channel cannot be null");
        if (sequence < 0) {
            throw new IllegalArgumentException("Sequence cannot be negative: " + sequence);
        }
    }

    public static EntityMessage system(long sourceTick, long sequence, Object payload, NetChannel channel) {
        return new EntityMessage(sourceTick, sequence, EntityMessageType.SYSTEM_MESSAGE,
                                 Objects.requireNonNull(payload, "Payload cannot be null"), channel);
    }

    public Session session() {
        return channel.session();
    }

    @Override
    public String toString() {
        return String.format("EntityMessage[tick=%d, seq=%d, type=%s, payload=%s]", sourceTick, sequence, type,
                             payload == null ? null : payload.getClass().getSimpleName());
    }
}

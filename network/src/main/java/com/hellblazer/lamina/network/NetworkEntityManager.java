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

import com.hellblazer.lamina.entity.EntityManager;
import com.hellblazer.lamina.entity.MapService;
import com.hellblazer.lamina.entity.PrototypeLoader;
import com.hellblazer.lamina.entity.TickClock;
import com.hellblazer.lamina.entity.UnknownIdException;
import com.hellblazer.lamina.entity.config.RuntimeConfig;
import com.hellblazer.lamina.entity.event.EventHandler;
import com.hellblazer.lamina.entity.event.Subscription;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Entity manager of a networked simulation.
 * <p>
 * Each tick first releases inbound messages that have become due, then runs the regular entity maintenance. A
 * dispatched system message is raised on the event bus twice: as its bare payload, and wrapped in a
 * {@link SessionMessage} naming the sender.
 */
public class NetworkEntityManager extends EntityManager {
    private static final Logger log = LoggerFactory.getLogger(NetworkEntityManager.class);

    private final Transport                  transport;
    private final ReplayRecorder             replay;
    private final NetworkReconciliationQueue reconciliation;

    public NetworkEntityManager(TickClock clock, Transport transport) {
        this(clock, RuntimeConfig.defaultConfig(), PrototypeLoader.NONE, MapService.NONE, transport,
             ReplayRecorder.NONE);
    }

    public NetworkEntityManager(TickClock clock, RuntimeConfig config, PrototypeLoader prototypes, MapService maps,
                                Transport transport, ReplayRecorder replay) {
        super(clock, config, prototypes, maps);
        this.transport = Objects.requireNonNull(transport, "Transport cannot be null");
        this.replay = Objects.requireNonNull(replay, "Replay recorder cannot be null");
        this.reconciliation = new NetworkReconciliationQueue(clock, config, getMetrics(), getTolerance(),
                                                             this::dispatchEntityMessage);
    }

    @Override
    public void tickUpdate() {
        reconciliation.processDue();
        super.tickUpdate();
    }

    // ===== Inbound =====

    /**
     * Receive a message on the simulation thread. Dispatched immediately if its source tick has been reached.
     */
    public void receiveMessage(EntityMessage message) {
        reconciliation.receive(message);
    }

    /**
     * Receive a message from any thread. It is reconciled at the start of the next tick.
     */
    public void deliverMessage(EntityMessage message) {
        reconciliation.deliver(message);
    }

    public void sessionStatusChanged(Session session, SessionStatus status) {
        switch (status) {
            case CONNECTED -> reconciliation.sessionConnected(session);
            case DISCONNECTED -> reconciliation.sessionDisconnected(session);
            default -> log.trace("Session {} is now {}", session, status);
        }
    }

    /**
     * @throws UnknownIdException if the session is not connected
     */
    public long getLastMessageSequence(Session session) {
        return reconciliation.getLastSequence(session);
    }

    /**
     * Subscribe to system messages of one payload type, together with the sending session.
     */
    public <P> Subscription subscribeSessionMessage(Class<P> payloadType,
                                                    EventHandler<? super SessionMessage<P>> handler) {
        Objects.requireNonNull(payloadType, "Payload type cannot be null");
        Objects.requireNonNull(handler, "Handler cannot be null");
        return getEventBus().subscribe(SessionMessage.class, message -> {
            var payload = message.payload();
            if (payloadType.isInstance(payload)) {
                handler.handle(new SessionMessage<>(message.session(), payloadType.cast(payload)));
            }
        });
    }

    public NetworkReconciliationQueue getReconciliationQueue() {
        return reconciliation;
    }

    // ===== Outbound =====

    /**
     * Broadcast a system message to every session and record it for replay.
     */
    public void sendSystemMessage(Object payload) {
        sendSystemMessage(payload, true);
    }

    public void sendSystemMessage(Object payload, boolean recordReplay) {
        var message = outbound(payload);
        if (recordReplay) {
            replay.record(message.sourceTick(), payload);
        }
        transport.sendToAll(message);
    }

    /**
     * Send a system message to one channel. Not recorded for replay.
     */
    public void sendSystemMessage(Object payload, NetChannel channel) {
        Objects.requireNonNull(channel, "Channel cannot be null");
        transport.sendToOne(outbound(payload), channel);
    }

    private OutboundEntityMessage outbound(Object payload) {
        Objects.requireNonNull(payload, "Payload cannot be null");
        return new OutboundEntityMessage(getClock().currentTick(), EntityMessageType.SYSTEM_MESSAGE, payload);
    }

    private void dispatchEntityMessage(EntityMessage message) {
        switch (message.type()) {
            case SYSTEM_MESSAGE -> {
                var payload = message.payload();
                getEventBus().raiseEvent(payload);
                getEventBus().raiseEvent(new SessionMessage<>(message.session(), payload));
            }
            case ERROR -> log.error("Received error message from {}: {}", message.session(), message.payload());
        }
    }
}

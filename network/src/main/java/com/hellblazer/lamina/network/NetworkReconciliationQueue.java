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

import com.hellblazer.lamina.entity.EntityMetrics;
import com.hellblazer.lamina.entity.ExceptionTolerance;
import com.hellblazer.lamina.entity.TickClock;
import com.hellblazer.lamina.entity.UnknownIdException;
import com.hellblazer.lamina.entity.config.RuntimeConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Comparator;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.PriorityQueue;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;

/**
 * Holds inbound entity messages stamped ahead of the local clock and releases them once the clock catches up.
 * <p>
 * Messages are released in (source tick, sequence) order; messages that compare equal keep their arrival order. A
 * message stamped at or behind the current tick is dispatched as soon as it is received, after any held message
 * that sorts before it. Each connected session has a sequence watermark that only moves forward.
 * <p>
 * {@link #deliver(EntityMessage)} is the only thread-safe entry point; it parks the message in an inbox that
 * {@link #processDue()} drains on the simulation thread. Everything else, session status changes included, runs on
 * the simulation thread.
 */
public class NetworkReconciliationQueue {
    private static final Logger log = LoggerFactory.getLogger(NetworkReconciliationQueue.class);

    private record Pending(EntityMessage message, long arrival) {
    }

    private record Delivered(EntityMessage message, long arrivalTick) {
    }

    private static final Comparator<Pending> RELEASE_ORDER = Comparator.comparingLong(
    (Pending p) -> p.message().sourceTick()).thenComparingLong(p -> p.message().sequence()).thenComparingLong(
    Pending::arrival);

    private final TickClock              clock;
    private final RuntimeConfig          config;
    private final EntityMetrics          metrics;
    private final ExceptionTolerance     tolerance;
    private final MessageDispatcher      dispatcher;
    private final PriorityQueue<Pending> pending    = new PriorityQueue<>(RELEASE_ORDER);
    private final Queue<Delivered>       inbox      = new ConcurrentLinkedQueue<>();
    private final Map<Session, Long>     watermarks = new HashMap<>();
    private       long                   arrivals;

    public NetworkReconciliationQueue(TickClock clock, RuntimeConfig config, EntityMetrics metrics,
                                      ExceptionTolerance tolerance, MessageDispatcher dispatcher) {
        this.clock = Objects.requireNonNull(clock, "Clock cannot be null");
        this.config = Objects.requireNonNull(config, "Config cannot be null");
        this.metrics = Objects.requireNonNull(metrics, "Metrics cannot be null");
        this.tolerance = Objects.requireNonNull(tolerance, "Tolerance cannot be null");
        this.dispatcher = Objects.requireNonNull(dispatcher, "Dispatcher cannot be null");
    }

    /**
     * Hand a message over from a transport thread. It is reconciled at the next {@link #processDue()}, and judged
     * late against the tick it was delivered at.
     */
    public void deliver(EntityMessage message) {
        Objects.requireNonNull(message, "Message cannot be null");
        inbox.add(new Delivered(message, clock.currentTick()));
    }

    /**
     * Dispatch the message now if its source tick has been reached, otherwise hold it.
     */
    public void receive(EntityMessage message) {
        Objects.requireNonNull(message, "Message cannot be null");
        var tick = clock.currentTick();
        var incoming = new Pending(message, arrivals++);
        if (message.sourceTick() > tick) {
            pending.add(incoming);
            return;
        }
        while (!pending.isEmpty() && RELEASE_ORDER.compare(pending.peek(), incoming) < 0) {
            dispatch(pending.poll().message());
        }
        checkLate(message, tick);
        dispatch(message);
    }

    /**
     * Reconcile delivered messages, then dispatch every held message whose source tick has been reached.
     *
     * @return number of messages released from the queue
     */
    public int processDue() {
        var tick = clock.currentTick();
        Delivered delivered;
        while ((delivered = inbox.poll()) != null) {
            checkLate(delivered.message(), delivered.arrivalTick());
            pending.add(new Pending(delivered.message(), arrivals++));
        }
        int released = 0;
        while (!pending.isEmpty() && pending.peek().message().sourceTick() <= tick) {
            dispatch(pending.poll().message());
            released++;
        }
        return released;
    }

    /**
     * Start tracking a session with a watermark of 0. A reconnecting session starts over.
     */
    public void sessionConnected(Session session) {
        watermarks.put(Objects.requireNonNull(session, "Session cannot be null"), 0L);
        log.debug("Session {} connected", session);
    }

    /**
     * Stop tracking a session. Its messages still queued are dropped when released.
     */
    public void sessionDisconnected(Session session) {
        watermarks.remove(session);
        log.debug("Session {} disconnected", session);
    }

    /**
     * @return the highest sequence dispatched for the session
     * @throws UnknownIdException if the session is not connected
     */
    public long getLastSequence(Session session) {
        var watermark = watermarks.get(session);
        if (watermark == null) {
            throw new UnknownIdException("Session " + session + " is not connected");
        }
        return watermark;
    }

    public boolean isTracked(Session session) {
        return watermarks.containsKey(session);
    }

    public int getPendingCount() {
        return pending.size();
    }

    public int getInboxSize() {
        return inbox.size();
    }

    /**
     * @return source tick of the next message to be released, or -1 if none are held
     */
    public long peekNextTick() {
        var next = pending.peek();
        return next == null ? -1 : next.message().sourceTick();
    }

    private void checkLate(EntityMessage message, long tick) {
        if (message.sourceTick() >= tick) {
            return;
        }
        metrics.recordLateMessage();
        if (config.isLogLateMessages()) {
            log.warn("Got late entity message! Diff: {}, msgT: {}, cT: {}, session: {}", message.sourceTick() - tick,
                     message.sourceTick(), tick, message.session());
        }
    }

    private void dispatch(EntityMessage message) {
        var channel = message.channel();
        if (!channel.isConnected()) {
            log.debug("Dropping {} from disconnected channel of {}", message, channel.session());
            metrics.recordDroppedMessage();
            return;
        }
        var session = channel.session();
        var watermark = watermarks.get(session);
        if (watermark == null) {
            if (config.isWarnOnUnknownSession()) {
                log.warn("Dropping {} from untracked session {}", message, session);
            } else {
                log.debug("Dropping {} from untracked session {}", message, session);
            }
            metrics.recordDroppedMessage();
            return;
        }
        if (message.sequence() != 0 && message.sequence() > watermark) {
            watermarks.put(session, message.sequence());
        }
        tolerance.run("Caught exception dispatching " + message + " from " + session,
                      () -> dispatcher.dispatch(message));
    }
}

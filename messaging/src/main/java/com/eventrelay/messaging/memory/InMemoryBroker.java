/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.eventrelay.messaging.memory;

import com.eventrelay.messaging.transport.BrokerConnection;
import com.eventrelay.messaging.transport.BrokerConnectionFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-process broker with AMQP-like semantics: durable queues that outlive connections,
 * manual acknowledgement, prefetch, requeue to the head of the queue, and the
 * {@code x-delivery-count} header on redelivered messages. Only the default exchange is
 * supported; a publish to an undeclared queue is returned as unroutable.
 *
 * <p>Fault controls ({@link #dropConnections()}, {@link #setReachable}, {@link #breakConsumerChannels},
 * {@link #failNextChannelOpens}, {@link #setRejectPublishes}, {@link #setHoldConfirms},
 * {@link #setMaxQueueLength}) let callers reproduce broker outages deterministically.</p>
 */
public class InMemoryBroker implements BrokerConnectionFactory {

    private static final Logger log = LoggerFactory.getLogger(InMemoryBroker.class);

    private final Map<String, MemoryQueue> queues = new ConcurrentHashMap<>();
    private final Set<InMemoryConnection> connections = ConcurrentHashMap.newKeySet();
    private final AtomicInteger connectionsOpened = new AtomicInteger();
    private final AtomicInteger pendingChannelFailures = new AtomicInteger();

    private volatile boolean reachable = true;
    private volatile boolean rejectPublishes = false;
    private volatile boolean holdConfirms = false;
    private volatile int maxQueueLength = 0;

    @Override
    public BrokerConnection newConnection(String connectionName) throws IOException {
        if (!reachable) {
            throw new IOException("Connection refused: in-memory broker is unreachable");
        }
        InMemoryConnection connection = new InMemoryConnection(this, connectionName);
        connections.add(connection);
        connectionsOpened.incrementAndGet();
        log.debug("In-memory connection '{}' opened", connectionName);
        return connection;
    }

    @Override
    public String describe() {
        return "memory://in-process";
    }

    // ── Fault controls ──────────────────────────────────────────────

    /** Sever every open connection as a network failure would. Unacked messages are requeued. */
    public void dropConnections() {
        for (InMemoryConnection connection : List.copyOf(connections)) {
            connection.drop(new IOException("Connection reset by in-memory broker"));
        }
    }

    /** While unreachable, new connections are refused. Existing ones are left alone. */
    public void setReachable(boolean reachable) { this.reachable = reachable; }

    /** Close every channel consuming from {@code queue} with a channel-level error. */
    public void breakConsumerChannels(String queue) {
        for (InMemoryConnection connection : List.copyOf(connections)) {
            connection.breakConsumerChannels(queue);
        }
    }

    /** The next {@code count} channel opens fail with an I/O error. */
    public void failNextChannelOpens(int count) { pendingChannelFailures.set(count); }

    /** Nack every publish while set. */
    public void setRejectPublishes(boolean reject) { this.rejectPublishes = reject; }

    /** Accept publishes but withhold their confirms while set. */
    public void setHoldConfirms(boolean hold) { this.holdConfirms = hold; }

    /** Reject publishes once a queue holds this many ready messages; 0 means unbounded. */
    public void setMaxQueueLength(int maxQueueLength) { this.maxQueueLength = maxQueueLength; }

    // ── Inspection ─────────────────────────────────────────────────

    public void declareQueue(String name) {
        queues.computeIfAbsent(name, MemoryQueue::new);
    }

    public boolean hasQueue(String name) { return queues.containsKey(name); }

    /** Ready (not yet delivered) messages. */
    public int queueDepth(String name) {
        MemoryQueue queue = queues.get(name);
        return queue == null ? 0 : queue.depth();
    }

    /** Bodies of ready messages, head first. */
    public List<byte[]> readyMessages(String name) {
        MemoryQueue queue = queues.get(name);
        return queue == null ? List.of() : queue.readyBodies();
    }

    /** Total messages ever accepted by a queue through publish. */
    public long publishedCount(String name) {
        MemoryQueue queue = queues.get(name);
        return queue == null ? 0 : queue.publishedCount();
    }

    public int connectionsOpened() { return connectionsOpened.get(); }

    public int openConnections() { return connections.size(); }

    // ── Package-private hooks for connections and channels ─────────

    MemoryQueue queue(String name) { return queues.get(name); }

    MemoryQueue declare(String name, Map<String, Object> arguments) {
        MemoryQueue queue = queues.computeIfAbsent(name, MemoryQueue::new);
        Object deadLetterKey = arguments == null ? null : arguments.get("x-dead-letter-routing-key");
        if (deadLetterKey != null) {
            queue.setDeadLetterRoutingKey(deadLetterKey.toString());
        }
        return queue;
    }

    boolean consumeChannelOpenFailure() {
        return pendingChannelFailures.getAndUpdate(n -> n > 0 ? n - 1 : 0) > 0;
    }

    boolean isRejectPublishes() { return rejectPublishes; }

    boolean isHoldConfirms() { return holdConfirms; }

    int maxQueueLength() { return maxQueueLength; }

    void connectionClosed(InMemoryConnection connection) {
        connections.remove(connection);
    }
}

/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.eventrelay.messaging.memory;

import com.eventrelay.messaging.transport.MessageProperties;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * A durable FIFO queue. Requeued messages go back to the head so that a single consumer
 * with prefetch 1 observes publish order even across redeliveries.
 */
final class MemoryQueue {

    /** A stored message; {@code deliveryCount} counts deliveries that ended without an ack. */
    record StoredMessage(MessageProperties properties, byte[] body, int deliveryCount) {
        StoredMessage returned() {
            return new StoredMessage(properties, body, deliveryCount + 1);
        }
    }

    private final String name;
    private final Deque<StoredMessage> ready = new ArrayDeque<>();
    private final List<MemoryConsumer> consumers = new ArrayList<>();
    private int nextConsumer;
    private long published;
    private volatile String deadLetterRoutingKey;

    MemoryQueue(String name) {
        this.name = name;
    }

    String name() { return name; }

    /** Queue that receives messages rejected without requeue, or null. */
    String deadLetterRoutingKey() { return deadLetterRoutingKey; }

    void setDeadLetterRoutingKey(String routingKey) { this.deadLetterRoutingKey = routingKey; }

    synchronized boolean offer(StoredMessage message, int maxLength) {
        if (maxLength > 0 && ready.size() >= maxLength) {
            return false;
        }
        ready.addLast(message);
        published++;
        dispatch();
        return true;
    }

    /** Put returned messages back at the head, keeping their relative order. */
    synchronized void requeue(List<StoredMessage> messages) {
        for (int i = messages.size() - 1; i >= 0; i--) {
            ready.addFirst(messages.get(i).returned());
        }
        dispatch();
    }

    synchronized void addConsumer(MemoryConsumer consumer) {
        consumers.add(consumer);
        dispatch();
    }

    synchronized void removeConsumer(MemoryConsumer consumer) {
        consumers.remove(consumer);
    }

    /** Hand ready messages to consumers with spare prefetch capacity, round-robin. */
    synchronized void dispatch() {
        while (!ready.isEmpty()) {
            MemoryConsumer target = nextWithCapacity();
            if (target == null) {
                return;
            }
            target.deliver(this, ready.pollFirst());
        }
    }

    private MemoryConsumer nextWithCapacity() {
        int size = consumers.size();
        for (int i = 0; i < size; i++) {
            MemoryConsumer candidate = consumers.get((nextConsumer + i) % size);
            if (candidate.hasCapacity()) {
                nextConsumer = (nextConsumer + i + 1) % size;
                return candidate;
            }
        }
        return null;
    }

    synchronized int depth() { return ready.size(); }

    synchronized long publishedCount() { return published; }

    synchronized List<byte[]> readyBodies() {
        List<byte[]> bodies = new ArrayList<>(ready.size());
        for (StoredMessage message : ready) {
            bodies.add(message.body().clone());
        }
        return bodies;
    }
}

/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.eventrelay.messaging.memory;

import com.eventrelay.messaging.transport.DeliveryHandler;

/** A consumer registered on a {@link MemoryQueue} through an {@link InMemoryChannel}. */
final class MemoryConsumer {

    private final InMemoryChannel channel;
    private final MemoryQueue queue;
    private final String tag;
    private final DeliveryHandler handler;

    MemoryConsumer(InMemoryChannel channel, MemoryQueue queue, String tag, DeliveryHandler handler) {
        this.channel = channel;
        this.queue = queue;
        this.tag = tag;
        this.handler = handler;
    }

    MemoryQueue queue() { return queue; }

    String tag() { return tag; }

    DeliveryHandler handler() { return handler; }

    boolean hasCapacity() {
        return channel.hasCapacity();
    }

    void deliver(MemoryQueue source, MemoryQueue.StoredMessage message) {
        channel.deliver(this, source, message);
    }
}

/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.eventrelay.messaging.memory;

import com.eventrelay.messaging.transport.BrokerChannel;
import com.eventrelay.messaging.transport.BrokerRejectedException;
import com.eventrelay.messaging.transport.BrokerShutdown;
import com.eventrelay.messaging.transport.Delivery;
import com.eventrelay.messaging.transport.DeliveryHandler;
import com.eventrelay.messaging.transport.MessageProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * Channel on an {@link InMemoryConnection}. Delivery tags are per channel and strictly
 * increasing; closing the channel returns its unacknowledged deliveries to the head of
 * their queues in tag order.
 */
final class InMemoryChannel implements BrokerChannel {

    private static final Logger log = LoggerFactory.getLogger(InMemoryChannel.class);

    private record Unacked(MemoryQueue queue, MemoryQueue.StoredMessage message) {}

    private final InMemoryConnection connection;
    private final int number;
    private final AtomicLong deliveryTags = new AtomicLong();
    private final AtomicLong publishSequence = new AtomicLong(1);
    private final ConcurrentSkipListMap<Long, Unacked> unacked = new ConcurrentSkipListMap<>();
    private final Map<String, MemoryConsumer> consumers = new ConcurrentHashMap<>();
    private final List<Consumer<BrokerShutdown>> shutdownListeners = new CopyOnWriteArrayList<>();
    private final CountDownLatch closed = new CountDownLatch(1);

    private volatile BrokerShutdown shutdown;
    private volatile boolean confirms;
    private volatile int prefetch;

    InMemoryChannel(InMemoryConnection connection, int number) {
        this.connection = connection;
        this.number = number;
    }

    @Override
    public int channelNumber() { return number; }

    @Override
    public void declareQueue(String queue, Map<String, Object> arguments) throws IOException {
        ensureOpen();
        connection.broker().declare(queue, arguments);
    }

    @Override
    public void enableConfirms() throws IOException {
        ensureOpen();
        confirms = true;
    }

    @Override
    public long publishConfirmed(String exchange, String routingKey, MessageProperties properties, byte[] body,
                                 long timeoutMs) throws IOException, TimeoutException, InterruptedException {
        ensureOpen();
        if (!confirms) {
            throw new IllegalStateException("Channel " + number + " is not in confirm mode");
        }
        long sequence = publishSequence.getAndIncrement();
        InMemoryBroker broker = connection.broker();
        MemoryQueue queue = exchange == null || exchange.isEmpty() ? broker.queue(routingKey) : null;
        if (queue == null) {
            throw new BrokerRejectedException("Message returned: NO_ROUTE for '" + routingKey + "'");
        }
        if (broker.isRejectPublishes()) {
            throw new BrokerRejectedException("Broker nacked publish " + sequence + " to '" + routingKey + "'");
        }
        if (!queue.offer(new MemoryQueue.StoredMessage(properties, body.clone(), 0), broker.maxQueueLength())) {
            throw new BrokerRejectedException("Queue '" + routingKey + "' is full");
        }
        if (broker.isHoldConfirms()) {
            if (closed.await(timeoutMs, TimeUnit.MILLISECONDS)) {
                throw new IOException("Channel " + number + " closed while awaiting confirm");
            }
            throw new TimeoutException("No confirm for publish " + sequence + " within " + timeoutMs + "ms");
        }
        return sequence;
    }

    @Override
    public void basicQos(int prefetchCount) throws IOException {
        ensureOpen();
        prefetch = prefetchCount;
    }

    @Override
    public String basicConsume(String queue, String consumerTag, DeliveryHandler handler) throws IOException {
        ensureOpen();
        MemoryQueue source = connection.broker().queue(queue);
        if (source == null) {
            IOException error = new IOException("NOT_FOUND - no queue '" + queue + "'");
            shutdown(new BrokerShutdown(error, false, false));
            throw error;
        }
        String tag = consumerTag == null || consumerTag.isEmpty() ? "amq.ctag-" + UUID.randomUUID() : consumerTag;
        MemoryConsumer consumer = new MemoryConsumer(this, source, tag, handler);
        consumers.put(tag, consumer);
        source.addConsumer(consumer);
        return tag;
    }

    @Override
    public void basicCancel(String consumerTag) throws IOException {
        ensureOpen();
        MemoryConsumer consumer = consumers.remove(consumerTag);
        if (consumer != null) {
            consumer.queue().removeConsumer(consumer);
        }
    }

    @Override
    public void basicAck(long deliveryTag) throws IOException {
        settle(deliveryTag).queue().dispatch();
    }

    @Override
    public void basicNack(long deliveryTag, boolean requeue) throws IOException {
        Unacked delivery = settle(deliveryTag);
        if (requeue) {
            delivery.queue().requeue(List.of(delivery.message()));
            return;
        }
        String deadLetterKey = delivery.queue().deadLetterRoutingKey();
        MemoryQueue deadLetters = deadLetterKey == null ? null : connection.broker().queue(deadLetterKey);
        if (deadLetters != null) {
            MemoryQueue.StoredMessage rejected = delivery.message();
            deadLetters.offer(new MemoryQueue.StoredMessage(rejected.properties(), rejected.body(), 0), 0);
        } else {
            log.debug("Discarding rejected delivery {} from queue '{}'", deliveryTag, delivery.queue().name());
        }
        delivery.queue().dispatch();
    }

    @Override
    public boolean isOpen() {
        return shutdown == null && connection.isOpen();
    }

    @Override
    public void addShutdownListener(Consumer<BrokerShutdown> listener) {
        shutdownListeners.add(listener);
        BrokerShutdown current = shutdown;
        if (current != null && shutdownListeners.remove(listener)) {
            listener.accept(current);
        }
    }

    @Override
    public void close() {
        shutdown(new BrokerShutdown(new IOException("Channel closed by application"), false, true));
    }

    boolean consumes(String queue) {
        return consumers.values().stream().anyMatch(c -> c.queue().name().equals(queue));
    }

    boolean hasCapacity() {
        return isOpen() && (prefetch <= 0 || unacked.size() < prefetch);
    }

    /** Called by the queue under its lock. */
    void deliver(MemoryConsumer consumer, MemoryQueue source, MemoryQueue.StoredMessage message) {
        long tag = deliveryTags.incrementAndGet();
        unacked.put(tag, new Unacked(source, message));
        MessageProperties properties = message.properties();
        if (message.deliveryCount() > 0) {
            Map<String, Object> headers = new HashMap<>(properties.headers());
            headers.put(MessageProperties.DELIVERY_COUNT_HEADER, message.deliveryCount());
            properties = new MessageProperties(properties.messageId(), properties.contentType(),
                    properties.timestamp(), properties.persistent(), headers);
        }
        Delivery delivery = new Delivery(tag, message.deliveryCount() > 0, properties, message.body().clone());
        connection.dispatch(() -> consumer.handler().onDelivery(delivery));
    }

    void shutdown(BrokerShutdown reason) {
        synchronized (this) {
            if (shutdown != null) {
                return;
            }
            shutdown = reason;
        }
        closed.countDown();
        for (MemoryConsumer consumer : consumers.values()) {
            consumer.queue().removeConsumer(consumer);
        }
        consumers.clear();

        Map<MemoryQueue, List<MemoryQueue.StoredMessage>> returned = new LinkedHashMap<>();
        for (Unacked delivery : unacked.values()) {
            returned.computeIfAbsent(delivery.queue(), q -> new ArrayList<>()).add(delivery.message());
        }
        unacked.clear();
        returned.forEach(MemoryQueue::requeue);

        connection.channelClosed(this);
        log.debug("In-memory channel {} closed, {} deliveries returned", number,
                returned.values().stream().mapToInt(List::size).sum());
        for (Consumer<BrokerShutdown> listener : shutdownListeners) {
            try {
                listener.accept(reason);
            } catch (RuntimeException e) {
                log.warn("Shutdown listener on channel {} failed", number, e);
            }
        }
        shutdownListeners.clear();
    }

    private Unacked settle(long deliveryTag) throws IOException {
        ensureOpen();
        Unacked delivery = unacked.remove(deliveryTag);
        if (delivery == null) {
            IOException error = new IOException("PRECONDITION_FAILED - unknown delivery tag " + deliveryTag);
            shutdown(new BrokerShutdown(error, false, false));
            throw error;
        }
        return delivery;
    }

    private void ensureOpen() throws IOException {
        BrokerShutdown reason = shutdown;
        if (reason != null) {
            throw new IOException("Channel " + number + " is closed", reason.cause());
        }
        if (!connection.isOpen()) {
            throw new IOException("Connection of channel " + number + " is closed");
        }
    }
}

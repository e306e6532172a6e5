/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.eventrelay.messaging.memory;

import com.eventrelay.messaging.transport.BrokerChannel;
import com.eventrelay.messaging.transport.BrokerConnection;
import com.eventrelay.messaging.transport.BrokerShutdown;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * Connection to an {@link InMemoryBroker}. Deliveries for all of its channels run on one
 * dispatcher thread, in the order the broker hands them out.
 */
final class InMemoryConnection implements BrokerConnection {

    private static final Logger log = LoggerFactory.getLogger(InMemoryConnection.class);

    private final InMemoryBroker broker;
    private final String name;
    private final ExecutorService dispatcher;
    private final Set<InMemoryChannel> channels = ConcurrentHashMap.newKeySet();
    private final AtomicInteger channelNumbers = new AtomicInteger();
    private final List<Consumer<BrokerShutdown>> shutdownListeners = new CopyOnWriteArrayList<>();
    private volatile BrokerShutdown shutdown;

    InMemoryConnection(InMemoryBroker broker, String name) {
        this.broker = broker;
        this.name = name;
        this.dispatcher = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "memory-broker-" + name);
            t.setDaemon(true);
            return t;
        });
    }

    InMemoryBroker broker() { return broker; }

    @Override
    public BrokerChannel createChannel() throws IOException {
        if (!isOpen()) {
            throw new IOException("Connection '" + name + "' is closed");
        }
        if (broker.consumeChannelOpenFailure()) {
            throw new IOException("Channel open refused by in-memory broker");
        }
        InMemoryChannel channel = new InMemoryChannel(this, channelNumbers.incrementAndGet());
        channels.add(channel);
        return channel;
    }

    @Override
    public boolean isOpen() {
        return shutdown == null;
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
        shutdown(new BrokerShutdown(new IOException("Connection closed by application"), true, true));
    }

    void drop(Throwable cause) {
        shutdown(new BrokerShutdown(cause, true, false));
    }

    void breakConsumerChannels(String queue) {
        for (InMemoryChannel channel : List.copyOf(channels)) {
            if (channel.consumes(queue)) {
                channel.shutdown(new BrokerShutdown(
                        new IOException("Channel error on queue '" + queue + "'"), false, false));
            }
        }
    }

    void dispatch(Runnable delivery) {
        if (!isOpen()) {
            return;
        }
        try {
            dispatcher.execute(() -> {
                try {
                    delivery.run();
                } catch (RuntimeException e) {
                    log.error("Consumer on connection '{}' threw from its delivery handler", name, e);
                }
            });
        } catch (RejectedExecutionException e) {
            log.debug("Dropping delivery dispatch on closed connection '{}'", name);
        }
    }

    void channelClosed(InMemoryChannel channel) {
        channels.remove(channel);
    }

    private void shutdown(BrokerShutdown reason) {
        synchronized (this) {
            if (shutdown != null) {
                return;
            }
            shutdown = reason;
        }
        for (InMemoryChannel channel : List.copyOf(channels)) {
            channel.shutdown(reason);
        }
        dispatcher.shutdownNow();
        broker.connectionClosed(this);
        log.debug("In-memory connection '{}' closed (by application: {})", name, reason.initiatedByApplication());
        for (Consumer<BrokerShutdown> listener : shutdownListeners) {
            notify(listener, reason);
        }
        shutdownListeners.clear();
    }

    private void notify(Consumer<BrokerShutdown> listener, BrokerShutdown reason) {
        try {
            listener.accept(reason);
        } catch (RuntimeException e) {
            log.warn("Shutdown listener on connection '{}' failed", name, e);
        }
    }
}

/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.eventrelay.messaging.register;

import com.eventrelay.messaging.memory.InMemoryBroker;
import com.eventrelay.messaging.transport.BrokerChannel;
import com.eventrelay.messaging.transport.BrokerConnection;
import com.eventrelay.messaging.transport.BrokerConnectionFactory;
import com.eventrelay.messaging.transport.BrokerShutdown;
import com.eventrelay.messaging.transport.DeliveryHandler;
import com.eventrelay.messaging.transport.MessageProperties;

import java.io.IOException;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/** Wraps an {@link InMemoryBroker}; publishes block until {@link #open()} is called. */
class GatedTransport implements BrokerConnectionFactory {

    private final InMemoryBroker broker;
    private final CountDownLatch gate = new CountDownLatch(1);
    private final AtomicInteger waiting = new AtomicInteger();

    GatedTransport(InMemoryBroker broker) {
        this.broker = broker;
    }

    void open() {
        gate.countDown();
    }

    /** Publishes currently held at the gate. */
    int waiting() {
        return waiting.get();
    }

    @Override
    public BrokerConnection newConnection(String connectionName) throws IOException, TimeoutException {
        return new GatedConnection(broker.newConnection(connectionName));
    }

    @Override
    public String describe() {
        return "gated+" + broker.describe();
    }

    private final class GatedConnection implements BrokerConnection {
        private final BrokerConnection delegate;

        GatedConnection(BrokerConnection delegate) {
            this.delegate = delegate;
        }

        @Override
        public BrokerChannel createChannel() throws IOException {
            return new GatedChannel(delegate.createChannel());
        }

        @Override
        public boolean isOpen() { return delegate.isOpen(); }

        @Override
        public void addShutdownListener(Consumer<BrokerShutdown> listener) { delegate.addShutdownListener(listener); }

        @Override
        public void close() { delegate.close(); }
    }

    private final class GatedChannel implements BrokerChannel {
        private final BrokerChannel delegate;

        GatedChannel(BrokerChannel delegate) {
            this.delegate = delegate;
        }

        @Override
        public long publishConfirmed(String exchange, String routingKey, MessageProperties properties, byte[] body,
                                     long timeoutMs) throws IOException, TimeoutException, InterruptedException {
            waiting.incrementAndGet();
            try {
                if (!gate.await(5, TimeUnit.SECONDS)) {
                    throw new TimeoutException("gate never opened");
                }
            } finally {
                waiting.decrementAndGet();
            }
            return delegate.publishConfirmed(exchange, routingKey, properties, body, timeoutMs);
        }

        @Override
        public int channelNumber() { return delegate.channelNumber(); }

        @Override
        public void declareQueue(String queue, Map<String, Object> arguments) throws IOException {
            delegate.declareQueue(queue, arguments);
        }

        @Override
        public void enableConfirms() throws IOException { delegate.enableConfirms(); }

        @Override
        public void basicQos(int prefetchCount) throws IOException { delegate.basicQos(prefetchCount); }

        @Override
        public String basicConsume(String queue, String consumerTag, DeliveryHandler handler) throws IOException {
            return delegate.basicConsume(queue, consumerTag, handler);
        }

        @Override
        public void basicCancel(String consumerTag) throws IOException { delegate.basicCancel(consumerTag); }

        @Override
        public void basicAck(long deliveryTag) throws IOException { delegate.basicAck(deliveryTag); }

        @Override
        public void basicNack(long deliveryTag, boolean requeue) throws IOException {
            delegate.basicNack(deliveryTag, requeue);
        }

        @Override
        public boolean isOpen() { return delegate.isOpen(); }

        @Override
        public void addShutdownListener(Consumer<BrokerShutdown> listener) { delegate.addShutdownListener(listener); }

        @Override
        public void close() { delegate.close(); }
    }
}

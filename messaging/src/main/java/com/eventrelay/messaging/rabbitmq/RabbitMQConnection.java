/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.eventrelay.messaging.rabbitmq;

import com.eventrelay.messaging.transport.BrokerChannel;
import com.eventrelay.messaging.transport.BrokerConnection;
import com.eventrelay.messaging.transport.BrokerShutdown;
import com.rabbitmq.client.AlreadyClosedException;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Connection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.function.Consumer;

final class RabbitMQConnection implements BrokerConnection {

    private static final Logger log = LoggerFactory.getLogger(RabbitMQConnection.class);

    private final Connection connection;

    RabbitMQConnection(Connection connection) {
        this.connection = connection;
    }

    @Override
    public BrokerChannel createChannel() throws IOException {
        Channel channel;
        try {
            channel = connection.createChannel();
        } catch (AlreadyClosedException e) {
            throw new IOException("Connection already closed", e);
        }
        if (channel == null) {
            throw new IOException("No channel available, channel_max reached on " + connection.getClientProvidedName());
        }
        return new RabbitMQChannel(channel);
    }

    @Override
    public boolean isOpen() {
        return connection.isOpen();
    }

    @Override
    public void addShutdownListener(Consumer<BrokerShutdown> listener) {
        connection.addShutdownListener(signal -> listener.accept(
                new BrokerShutdown(signal, true, signal.isInitiatedByApplication())));
    }

    @Override
    public void close() {
        try {
            if (connection.isOpen()) connection.close();
        } catch (IOException | AlreadyClosedException e) {
            log.warn("Error closing RabbitMQ connection", e);
        }
    }
}

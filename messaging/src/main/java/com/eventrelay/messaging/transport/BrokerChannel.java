/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.eventrelay.messaging.transport;

import java.io.IOException;
import java.util.Map;
import java.util.concurrent.TimeoutException;
import java.util.function.Consumer;

/**
 * A lightweight session over a {@link BrokerConnection}. Not meant to be shared by two
 * logical operations at the same time. Any protocol error closes the channel; the
 * connection and sibling channels stay up.
 */
public interface BrokerChannel extends AutoCloseable {

    int channelNumber();

    /** Declare a durable, non-exclusive, non-auto-delete queue. Idempotent. */
    void declareQueue(String queue, Map<String, Object> arguments) throws IOException;

    /** Put the channel in publisher-confirm mode. */
    void enableConfirms() throws IOException;

    /**
     * Publish a persistent, mandatory message and wait for the broker's confirm.
     *
     * @return the publish sequence number of the confirmed message
     * @throws BrokerRejectedException if the broker nacked or returned the message
     * @throws TimeoutException        if no confirm arrived within {@code timeoutMs}
     * @throws IOException             on any transport failure
     */
    long publishConfirmed(String exchange, String routingKey, MessageProperties properties, byte[] body,
                          long timeoutMs) throws IOException, TimeoutException, InterruptedException;

    void basicQos(int prefetchCount) throws IOException;

    /** Start a manual-ack consumer; returns the consumer tag. */
    String basicConsume(String queue, String consumerTag, DeliveryHandler handler) throws IOException;

    void basicCancel(String consumerTag) throws IOException;

    void basicAck(long deliveryTag) throws IOException;

    void basicNack(long deliveryTag, boolean requeue) throws IOException;

    boolean isOpen();

    /** Notified once when the channel closes, including when its connection goes away. */
    void addShutdownListener(Consumer<BrokerShutdown> listener);

    /** Close quietly; unacknowledged deliveries go back to their queue. */
    @Override
    void close();
}

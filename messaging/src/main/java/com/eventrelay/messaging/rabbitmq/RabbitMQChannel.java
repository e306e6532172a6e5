/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.eventrelay.messaging.rabbitmq;

import com.eventrelay.messaging.transport.BrokerChannel;
import com.eventrelay.messaging.transport.BrokerRejectedException;
import com.eventrelay.messaging.transport.BrokerShutdown;
import com.eventrelay.messaging.transport.Delivery;
import com.eventrelay.messaging.transport.DeliveryHandler;
import com.eventrelay.messaging.transport.MessageProperties;
import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.DefaultConsumer;
import com.rabbitmq.client.Envelope;
import com.rabbitmq.client.LongString;
import com.rabbitmq.client.ShutdownSignalException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Date;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.TimeoutException;
import java.util.function.Consumer;

/**
 * {@link BrokerChannel} over an amqp-client {@link Channel}.
 * Publishes are mandatory so that unroutable messages come back as basic.return,
 * which RabbitMQ sends before the confirm of the same message.
 */
final class RabbitMQChannel implements BrokerChannel {

    private static final Logger log = LoggerFactory.getLogger(RabbitMQChannel.class);
    private static final int PERSISTENT = 2;
    private static final int TRANSIENT = 1;

    private final Channel channel;
    private volatile Returned lastReturned;

    private record Returned(String messageId, int replyCode, String replyText) {}

    RabbitMQChannel(Channel channel) {
        this.channel = channel;
        channel.addReturnListener(r -> lastReturned = new Returned(
                r.getProperties().getMessageId(), r.getReplyCode(), r.getReplyText()));
    }

    @Override
    public int channelNumber() {
        return channel.getChannelNumber();
    }

    @Override
    public void declareQueue(String queue, Map<String, Object> arguments) throws IOException {
        try {
            channel.queueDeclare(queue, true, false, false, arguments == null || arguments.isEmpty() ? null : arguments);
        } catch (ShutdownSignalException e) {
            throw new IOException("Channel closed while declaring queue " + queue, e);
        }
    }

    @Override
    public void enableConfirms() throws IOException {
        try {
            channel.confirmSelect();
        } catch (ShutdownSignalException e) {
            throw new IOException("Channel closed while enabling confirms", e);
        }
    }

    @Override
    public long publishConfirmed(String exchange, String routingKey, MessageProperties properties, byte[] body,
                                 long timeoutMs) throws IOException, TimeoutException, InterruptedException {
        try {
            long sequence = channel.getNextPublishSeqNo();
            lastReturned = null;
            channel.basicPublish(exchange, routingKey, true, toAmqp(properties), body);
            if (!channel.waitForConfirms(timeoutMs)) {
                throw new BrokerRejectedException("Broker nacked message " + properties.messageId());
            }
            Returned returned = lastReturned;
            if (returned != null && Objects.equals(returned.messageId(), properties.messageId())) {
                throw new BrokerRejectedException("Message " + properties.messageId() + " returned as unroutable: "
                        + returned.replyCode() + " " + returned.replyText());
            }
            return sequence;
        } catch (ShutdownSignalException e) {
            throw new IOException("Channel closed during publish", e);
        }
    }

    @Override
    public void basicQos(int prefetchCount) throws IOException {
        try {
            channel.basicQos(prefetchCount);
        } catch (ShutdownSignalException e) {
            throw new IOException("Channel closed while setting QoS", e);
        }
    }

    @Override
    public String basicConsume(String queue, String consumerTag, DeliveryHandler handler) throws IOException {
        try {
            return channel.basicConsume(queue, false, consumerTag, new DefaultConsumer(channel) {
                @Override
                public void handleDelivery(String tag, Envelope envelope, AMQP.BasicProperties props, byte[] body) {
                    handler.onDelivery(new Delivery(envelope.getDeliveryTag(), envelope.isRedeliver(),
                            fromAmqp(props), body));
                }

                @Override
                public void handleCancel(String tag) {
                    handler.onCancel(tag);
                }
            });
        } catch (ShutdownSignalException e) {
            throw new IOException("Channel closed while subscribing to " + queue, e);
        }
    }

    @Override
    public void basicCancel(String consumerTag) throws IOException {
        try {
            channel.basicCancel(consumerTag);
        } catch (ShutdownSignalException e) {
            throw new IOException("Channel closed while cancelling consumer " + consumerTag, e);
        }
    }

    @Override
    public void basicAck(long deliveryTag) throws IOException {
        try {
            channel.basicAck(deliveryTag, false);
        } catch (ShutdownSignalException e) {
            throw new IOException("Channel closed before ack of tag " + deliveryTag, e);
        }
    }

    @Override
    public void basicNack(long deliveryTag, boolean requeue) throws IOException {
        try {
            channel.basicNack(deliveryTag, false, requeue);
        } catch (ShutdownSignalException e) {
            throw new IOException("Channel closed before nack of tag " + deliveryTag, e);
        }
    }

    @Override
    public boolean isOpen() {
        return channel.isOpen();
    }

    @Override
    public void addShutdownListener(Consumer<BrokerShutdown> listener) {
        channel.addShutdownListener(signal -> listener.accept(
                new BrokerShutdown(signal, signal.isHardError(), signal.isInitiatedByApplication())));
    }

    @Override
    public void close() {
        try {
            if (channel.isOpen()) channel.close();
        } catch (IOException | TimeoutException | ShutdownSignalException e) {
            log.debug("Error closing RabbitMQ channel {}", channel.getChannelNumber(), e);
        }
    }

    static AMQP.BasicProperties toAmqp(MessageProperties properties) {
        var builder = new AMQP.BasicProperties.Builder()
                .messageId(properties.messageId())
                .contentType(properties.contentType())
                .deliveryMode(properties.persistent() ? PERSISTENT : TRANSIENT);
        if (properties.timestamp() != null) {
            builder.timestamp(Date.from(properties.timestamp()));
        }
        if (!properties.headers().isEmpty()) {
            builder.headers(new HashMap<>(properties.headers()));
        }
        return builder.build();
    }

    static MessageProperties fromAmqp(AMQP.BasicProperties props) {
        Map<String, Object> headers = new HashMap<>();
        if (props.getHeaders() != null) {
            props.getHeaders().forEach((k, v) -> headers.put(k, v instanceof LongString ? v.toString() : v));
        }
        return new MessageProperties(
                props.getMessageId(),
                props.getContentType(),
                props.getTimestamp() == null ? null : props.getTimestamp().toInstant(),
                Integer.valueOf(PERSISTENT).equals(props.getDeliveryMode()),
                headers);
    }
}

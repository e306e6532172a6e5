/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.eventrelay.messaging.transport;

/**
 * One message instance handed to a consumer.
 *
 * @param deliveryTag channel-scoped tag used to ack or nack this instance
 * @param redelivered broker flag: the message was delivered before
 * @param properties  message properties as published
 * @param body        raw message body
 */
public record Delivery(long deliveryTag, boolean redelivered, MessageProperties properties, byte[] body) {}

/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.eventrelay.messaging.transport;

/**
 * Receives deliveries for one consumer, on the transport's dispatch thread.
 */
public interface DeliveryHandler {

    void onDelivery(Delivery delivery);

    /** The broker cancelled the consumer (queue deleted, node failover). */
    default void onCancel(String consumerTag) {}
}

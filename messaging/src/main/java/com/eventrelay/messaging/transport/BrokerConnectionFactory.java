/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.eventrelay.messaging.transport;

import java.io.IOException;
import java.util.concurrent.TimeoutException;

/**
 * Opens connections to a message broker. Implementations exist for RabbitMQ (AMQP 0-9-1)
 * and an in-process broker.
 */
public interface BrokerConnectionFactory {

    /**
     * @param connectionName client-provided name, visible in broker management tools
     * @throws IOException      if the broker cannot be reached or refuses the login
     * @throws TimeoutException if the handshake does not complete in time
     */
    BrokerConnection newConnection(String connectionName) throws IOException, TimeoutException;

    /** Human-readable broker address for logs. */
    String describe();
}

/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.eventrelay.messaging.channel;

import com.eventrelay.common.model.RegisterConfig;
import com.eventrelay.messaging.transport.BrokerChannel;
import com.eventrelay.messaging.transport.BrokerConnection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Map;

/**
 * Declares the work queue and its dead-letter queue, once per connection.
 */
public class QueueTopology {

    private static final Logger log = LoggerFactory.getLogger(QueueTopology.class);

    public static final String DEAD_LETTER_EXCHANGE_ARG = "x-dead-letter-exchange";
    public static final String DEAD_LETTER_ROUTING_KEY_ARG = "x-dead-letter-routing-key";

    private final RegisterConfig config;
    private volatile BrokerConnection declaredOn;

    public QueueTopology(RegisterConfig config) {
        this.config = config;
    }

    public void ensureDeclared(BrokerChannel channel, BrokerConnection connection) throws IOException {
        if (connection != null && connection == declaredOn) {
            return;
        }
        declare(channel);
        declaredOn = connection;
    }

    public void declare(BrokerChannel channel) throws IOException {
        channel.declareQueue(config.getDeadLetterQueue(), Map.of());
        channel.declareQueue(config.getQueueName(), workQueueArguments());
        log.debug("Declared queue '{}' with dead-letter queue '{}'", config.getQueueName(), config.getDeadLetterQueue());
    }

    /** Dead-letter arguments routing broker-side rejections to the dead-letter queue. */
    public Map<String, Object> workQueueArguments() {
        if (!config.isDeclareDeadLetterArguments()) {
            return Map.of();
        }
        return Map.of(DEAD_LETTER_EXCHANGE_ARG, "", DEAD_LETTER_ROUTING_KEY_ARG, config.getDeadLetterQueue());
    }
}

/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.eventrelay.messaging.config;

import com.eventrelay.common.model.RegisterConfig;
import com.eventrelay.messaging.core.EventRegister;
import com.eventrelay.messaging.memory.InMemoryBroker;
import com.eventrelay.messaging.rabbitmq.RabbitMQConnectionFactory;
import com.eventrelay.messaging.register.BrokerEventRegister;
import com.eventrelay.messaging.transport.BrokerConnectionFactory;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.io.File;
import java.io.IOException;

/**
 * Factory to create an {@link EventRegister} based on {@link RegisterConfig}.
 * Supports: RabbitMQ, in-memory.
 */
public final class EventRegisters {

    private EventRegisters() {}

    public static EventRegister create(RegisterConfig config) {
        return create(config, new SimpleMeterRegistry());
    }

    public static EventRegister create(RegisterConfig config, MeterRegistry registry) {
        return new BrokerEventRegister(config, transportFor(config), registry);
    }

    public static EventRegister fromFile(File configFile) throws IOException {
        return create(RegisterConfig.fromFile(configFile));
    }

    static BrokerConnectionFactory transportFor(RegisterConfig config) {
        return switch (config.getBrokerType()) {
            case RABBITMQ -> new RabbitMQConnectionFactory(config);
            case IN_MEMORY -> new InMemoryBroker();
        };
    }
}

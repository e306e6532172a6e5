/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.eventrelay.messaging;

import com.eventrelay.common.model.RegisterConfig;

import java.time.Duration;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.fail;

/** Shared fixtures for tests running against the in-memory broker. */
public final class TestSupport {

    private TestSupport() {}

    /** Small timeouts and backoffs so failure paths finish quickly. */
    public static RegisterConfig inMemoryConfig(String queue) {
        RegisterConfig config = new RegisterConfig();
        config.setBrokerType(RegisterConfig.BrokerType.IN_MEMORY);
        config.setQueueName(queue);
        config.setConnectionName("test-" + queue);
        config.setConnectionTimeoutMs(2000);
        config.setConfirmTimeoutMs(500);
        config.setPublishMaxAttempts(4);
        config.setBackoffBaseMs(10);
        config.setBackoffMaxMs(100);
        config.setMaxAttempts(5);
        config.setChannelPoolSize(4);
        config.setShutdownTimeoutMs(2000);
        return config;
    }

    /** Poll {@code condition} until it holds or {@code timeout} passes. */
    public static void await(BooleanSupplier condition, Duration timeout, String description) {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (!condition.getAsBoolean()) {
            if (System.nanoTime() > deadline) {
                fail("Timed out after " + timeout.toMillis() + "ms waiting for: " + description);
            }
            try {
                Thread.sleep(10);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                fail("Interrupted waiting for: " + description);
            }
        }
    }
}

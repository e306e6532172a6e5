/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.eventrelay.messaging.reader;

import com.eventrelay.common.exception.ReadEventException;
import com.eventrelay.common.model.RegisterConfig;
import com.eventrelay.messaging.channel.ChannelPool;
import com.eventrelay.messaging.channel.QueueTopology;
import com.eventrelay.messaging.codec.EnvelopeCodec;
import com.eventrelay.messaging.connection.ConnectionManager;
import com.eventrelay.messaging.core.EventCallback;
import com.eventrelay.messaging.core.Subscription;
import com.eventrelay.messaging.metrics.RegisterMetrics;
import com.eventrelay.messaging.retry.BackoffPolicy;
import com.eventrelay.messaging.retry.Sleeper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Objects;

/**
 * Consume side of a register. Holds at most one active {@link Subscription}; retry counts
 * survive re-subscription.
 */
public class EventReader implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(EventReader.class);

    private static final int TRACKED_EVENT_LIMIT = 10_000;

    private final RegisterConfig config;
    private final ConnectionManager connectionManager;
    private final ChannelPool channelPool;
    private final QueueTopology topology;
    private final EnvelopeCodec codec;
    private final BackoffPolicy redeliveryBackoff;
    private final Sleeper sleeper;
    private final RegisterMetrics metrics;
    private final AttemptTracker attempts = new AttemptTracker(TRACKED_EVENT_LIMIT);

    private QueueSubscription active;

    public EventReader(RegisterConfig config, ConnectionManager connectionManager, ChannelPool channelPool,
                       QueueTopology topology, EnvelopeCodec codec, BackoffPolicy redeliveryBackoff,
                       Sleeper sleeper, RegisterMetrics metrics) {
        this.config = config;
        this.connectionManager = connectionManager;
        this.channelPool = channelPool;
        this.topology = topology;
        this.codec = codec;
        this.redeliveryBackoff = redeliveryBackoff;
        this.sleeper = sleeper;
        this.metrics = metrics;
    }

    /**
     * @throws IllegalStateException if a subscription is still active
     * @throws ReadEventException    if the consumer cannot be started
     */
    public synchronized Subscription readEvents(EventCallback callback) {
        Objects.requireNonNull(callback, "callback");
        if (active != null && active.isActive()) {
            throw new IllegalStateException("Queue '" + config.getQueueName() + "' already has an active subscription");
        }
        QueueSubscription subscription = new QueueSubscription(config, connectionManager, channelPool, topology,
                codec, redeliveryBackoff, sleeper, metrics, attempts, callback);
        try {
            subscription.start();
        } catch (IOException | RuntimeException e) {
            log.error("Could not start consumer on queue '{}'", config.getQueueName(), e);
            throw new ReadEventException(config.getQueueName(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ReadEventException(config.getQueueName(), e);
        }
        active = subscription;
        return subscription;
    }

    /** Cancel the active subscription, if any, and wait for it to stop. */
    @Override
    public void close() {
        QueueSubscription current;
        synchronized (this) {
            current = active;
            active = null;
        }
        if (current != null) {
            current.cancel();
        }
    }
}

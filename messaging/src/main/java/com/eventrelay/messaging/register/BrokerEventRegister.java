/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.eventrelay.messaging.register;

import com.eventrelay.common.exception.ConnectionException;
import com.eventrelay.common.exception.PoolException;
import com.eventrelay.common.exception.PublishException;
import com.eventrelay.common.model.RegisterConfig;
import com.eventrelay.common.model.RelayEvent;
import com.eventrelay.messaging.channel.ChannelPool;
import com.eventrelay.messaging.channel.QueueTopology;
import com.eventrelay.messaging.codec.EnvelopeCodec;
import com.eventrelay.messaging.codec.JsonEnvelopeCodec;
import com.eventrelay.messaging.connection.ConnectionManager;
import com.eventrelay.messaging.core.Ack;
import com.eventrelay.messaging.core.ConnectionState;
import com.eventrelay.messaging.core.EventCallback;
import com.eventrelay.messaging.core.EventRegister;
import com.eventrelay.messaging.core.Subscription;
import com.eventrelay.messaging.metrics.RegisterMetrics;
import com.eventrelay.messaging.reader.EventReader;
import com.eventrelay.messaging.retry.BackoffPolicy;
import com.eventrelay.messaging.retry.Sleeper;
import com.eventrelay.messaging.transport.BrokerChannel;
import com.eventrelay.messaging.transport.BrokerConnectionFactory;
import com.eventrelay.messaging.transport.BrokerRejectedException;
import com.eventrelay.messaging.transport.MessageProperties;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.TimeoutException;

/**
 * {@link EventRegister} over a broker transport.
 *
 * <p>Publishing waits for the broker's confirm. Transport failures are retried with capped
 * exponential backoff up to {@code publish_max_attempts}; a broker rejection or a missing
 * confirm is surfaced at once. Events without an id get one derived from their content, and
 * ids confirmed within {@code dedup_window_ms} are not published again.</p>
 *
 * <p>Thread-safe: any number of threads may register concurrently.</p>
 */
public class BrokerEventRegister implements EventRegister {

    private static final Logger log = LoggerFactory.getLogger(BrokerEventRegister.class);

    private final RegisterConfig config;
    private final ConnectionManager connectionManager;
    private final ChannelPool channelPool;
    private final QueueTopology topology;
    private final EnvelopeCodec codec;
    private final BackoffPolicy publishBackoff;
    private final Sleeper sleeper;
    private final Clock clock;
    private final RegisterMetrics metrics;
    private final PublishedEventCache publishedEvents;
    private final EventReader reader;
    private volatile boolean closed;

    public BrokerEventRegister(RegisterConfig config, BrokerConnectionFactory transport) {
        this(config, transport, RegisterMetrics.standalone());
    }

    public BrokerEventRegister(RegisterConfig config, BrokerConnectionFactory transport, MeterRegistry registry) {
        this(config, transport, new RegisterMetrics(registry));
    }

    public BrokerEventRegister(RegisterConfig config, BrokerConnectionFactory transport, RegisterMetrics metrics) {
        this(config, transport, new JsonEnvelopeCodec(), metrics, Sleeper.SYSTEM, Clock.systemUTC());
    }

    public BrokerEventRegister(RegisterConfig config, BrokerConnectionFactory transport, EnvelopeCodec codec,
                               RegisterMetrics metrics, Sleeper sleeper, Clock clock) {
        config.validate();
        this.config = config;
        this.codec = codec;
        this.metrics = metrics;
        this.sleeper = sleeper;
        this.clock = clock;
        this.connectionManager = new ConnectionManager(transport, config.getConnectionName(),
                BackoffPolicy.fromConfig(config, BackoffPolicy.Jitter.FULL), config.getReconnectMaxAttempts());
        this.connectionManager.addListener(metrics);
        this.channelPool = new ChannelPool(connectionManager, config.getChannelPoolSize());
        this.topology = new QueueTopology(config);
        this.publishBackoff = BackoffPolicy.fromConfig(config, BackoffPolicy.Jitter.NONE);
        this.publishedEvents = new PublishedEventCache(config.getDedupWindowMs(), clock);
        this.reader = new EventReader(config, connectionManager, channelPool, topology, codec,
                BackoffPolicy.fromConfig(config, BackoffPolicy.Jitter.NONE), sleeper, metrics);
        log.info("Event register created for {} (queue '{}')", transport.describe(), config.getQueueName());
    }

    @Override
    public Ack registerEvent(RelayEvent event) {
        Objects.requireNonNull(event, "event");
        if (event.getPayloadSize() == 0) {
            throw new IllegalArgumentException("Event payload must not be empty");
        }
        String eventId = event.getId() == null || event.getId().isBlank() ? EventIds.derive(event) : event.getId();
        RelayEvent outgoing = eventId.equals(event.getId()) ? event : event.withId(eventId);
        if (closed) {
            metrics.recordFailure(PublishException.Reason.UNREACHABLE);
            throw new PublishException(PublishException.Reason.UNREACHABLE, eventId, "Register is closed", null);
        }

        PublishedEventCache.Result result = publishedEvents.publishOnce(eventId, () -> publish(outgoing));
        if (result.duplicate()) {
            metrics.recordDuplicate();
            log.info("Event {} already registered, returning the earlier ack", eventId);
        }
        return result.ack();
    }

    @Override
    public Subscription readEvents(EventCallback callback) {
        if (closed) {
            throw new IllegalStateException("Register is closed");
        }
        return reader.readEvents(callback);
    }

    public ConnectionState getConnectionState() {
        return connectionManager.getState();
    }

    public RegisterMetrics getMetrics() {
        return metrics;
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        reader.close();
        channelPool.close();
        connectionManager.close();
        log.info("Event register for queue '{}' closed", config.getQueueName());
    }

    private Ack publish(RelayEvent event) {
        long started = System.nanoTime();
        byte[] body = codec.encode(event);
        MessageProperties properties = codec.properties(event);
        String queue = config.getQueueName();
        int maxAttempts = config.getPublishMaxAttempts();
        Duration slotWait = Duration.ofMillis(config.getConnectionTimeoutMs());
        Duration connectionWait = Duration.ofMillis(config.getConfirmTimeoutMs());
        Exception lastFailure = null;
        int attempt = 0;

        while (attempt < maxAttempts && !closed) {
            attempt++;
            BrokerChannel channel = null;
            try {
                channel = channelPool.acquire(slotWait, connectionWait);
                topology.ensureDeclared(channel, channelPool.connectionOf(channel));
                long sequence = channel.publishConfirmed("", queue, properties, body, config.getConfirmTimeoutMs());
                channelPool.release(channel);
                metrics.recordPublished(System.nanoTime() - started);
                log.debug("Event {} confirmed on queue '{}' (sequence {}, attempt {})",
                        event.getId(), queue, sequence, attempt);
                return new Ack(event.getId(), queue, sequence, clock.instant());
            } catch (BrokerRejectedException e) {
                channelPool.release(channel);
                metrics.recordFailure(PublishException.Reason.REJECTED);
                log.error("Broker rejected event {}: {}", event.getId(), e.getMessage());
                throw PublishException.rejected(event.getId(), e);
            } catch (TimeoutException e) {
                channelPool.invalidate(channel);
                metrics.recordFailure(PublishException.Reason.TIMEOUT);
                log.error("No confirm for event {} within {}ms", event.getId(), config.getConfirmTimeoutMs());
                throw PublishException.timeout(event.getId(), config.getConfirmTimeoutMs(), e);
            } catch (IOException | ConnectionException | PoolException e) {
                channelPool.invalidate(channel);
                lastFailure = e;
                if (attempt < maxAttempts && !closed) {
                    long delay = publishBackoff.delayMs(attempt);
                    metrics.recordRetry();
                    log.warn("Publish of event {} failed (attempt {}/{}), retrying in {}ms: {}",
                            event.getId(), attempt, maxAttempts, delay, e.getMessage());
                    try {
                        sleeper.sleep(delay);
                    } catch (InterruptedException ie) {
                        Thread.currentThread().interrupt();
                        lastFailure = ie;
                        break;
                    }
                }
            } catch (InterruptedException e) {
                channelPool.invalidate(channel);
                Thread.currentThread().interrupt();
                lastFailure = e;
                break;
            }
        }

        metrics.recordFailure(PublishException.Reason.UNREACHABLE);
        log.error("Giving up on event {} after {} attempt(s)", event.getId(), attempt);
        throw PublishException.unreachable(event.getId(), attempt, lastFailure);
    }
}

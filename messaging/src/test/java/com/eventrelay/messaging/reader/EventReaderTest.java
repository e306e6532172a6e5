/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.eventrelay.messaging.reader;

import com.eventrelay.common.exception.ConnectionException;
import com.eventrelay.common.exception.ReadEventException;
import com.eventrelay.common.model.RegisterConfig;
import com.eventrelay.common.model.RelayEvent;
import com.eventrelay.messaging.TestSupport;
import com.eventrelay.messaging.codec.JsonEnvelopeCodec;
import com.eventrelay.messaging.core.ConnectionState;
import com.eventrelay.messaging.core.ConsumeOutcome;
import com.eventrelay.messaging.core.Subscription;
import com.eventrelay.messaging.memory.InMemoryBroker;
import com.eventrelay.messaging.metrics.RegisterMetrics;
import com.eventrelay.messaging.register.BrokerEventRegister;
import com.eventrelay.messaging.retry.RecordingSleeper;
import com.eventrelay.messaging.transport.BrokerChannel;
import com.eventrelay.messaging.transport.BrokerConnection;
import com.eventrelay.messaging.transport.MessageProperties;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static com.eventrelay.messaging.TestSupport.await;
import static org.junit.jupiter.api.Assertions.*;

class EventReaderTest {

    private static final String QUEUE = "shipments.events";
    private static final String DLQ = QUEUE + ".dlq";
    private static final Duration WAIT = Duration.ofSeconds(5);

    private final JsonEnvelopeCodec codec = new JsonEnvelopeCodec();
    private InMemoryBroker broker;
    private RecordingSleeper sleeper;
    private RegisterMetrics metrics;
    private BrokerEventRegister register;

    @BeforeEach
    void setUp() {
        broker = new InMemoryBroker();
        sleeper = new RecordingSleeper();
        metrics = RegisterMetrics.standalone();
        register = newRegister(TestSupport.inMemoryConfig(QUEUE));
    }

    @AfterEach
    void tearDown() {
        register.close();
    }

    private BrokerEventRegister newRegister(RegisterConfig config) {
        return new BrokerEventRegister(config, broker, codec, metrics, sleeper, Clock.systemUTC());
    }

    private void reconfigure(RegisterConfig config) {
        register.close();
        register = newRegister(config);
    }

    private void registerEvents(String... ids) {
        for (String id : ids) {
            register.registerEvent(RelayEvent.of(id, "shipping", ("body-" + id).getBytes(StandardCharsets.UTF_8)));
        }
    }

    private List<String> deadLetteredIds() {
        List<String> ids = new ArrayList<>();
        for (byte[] body : broker.readyMessages(DLQ)) {
            ids.add(codec.decode(body).getId());
        }
        return ids;
    }

    @Test
    void deliversInRegistrationOrder() {
        List<String> expected = new ArrayList<>();
        for (int i = 0; i < 20; i++) {
            expected.add("evt-" + i);
        }
        registerEvents(expected.toArray(new String[0]));
        List<String> seen = new CopyOnWriteArrayList<>();

        register.readEvents(event -> {
            seen.add(event.getId());
            return ConsumeOutcome.ACK;
        });

        await(() -> seen.size() == 20, WAIT, "20 deliveries");
        assertEquals(expected, seen);
        await(() -> metrics.getRegistry().get("relay.reader.deliveries")
                .tag("outcome", "ack").counter().count() == 20.0, WAIT, "20 acks recorded");
        assertEquals(0, broker.queueDepth(QUEUE));
    }

    @Test
    void retryLaterRedeliversWithIncreasingAttemptCount() {
        registerEvents("evt-1");
        List<Integer> attempts = new CopyOnWriteArrayList<>();

        register.readEvents(event -> {
            attempts.add(event.getAttemptCount());
            return attempts.size() <= 3 ? ConsumeOutcome.RETRY_LATER : ConsumeOutcome.ACK;
        });

        await(() -> attempts.size() == 4, WAIT, "four deliveries");
        assertEquals(List.of(0, 1, 2, 3), attempts);
        assertEquals(List.of(10L, 20L, 40L), sleeper.delays());
        await(() -> broker.queueDepth(QUEUE) == 0, WAIT, "work queue drained");
        assertTrue(deadLetteredIds().isEmpty());
    }

    @Test
    void retryLaterKeepsOrderingBehindTheRetriedEvent() {
        registerEvents("evt-1", "evt-2");
        List<String> seen = new CopyOnWriteArrayList<>();

        register.readEvents(event -> {
            seen.add(event.getId() + "#" + event.getAttemptCount());
            return event.getId().equals("evt-1") && event.getAttemptCount() == 0
                    ? ConsumeOutcome.RETRY_LATER : ConsumeOutcome.ACK;
        });

        await(() -> seen.size() == 3, WAIT, "three deliveries");
        assertEquals(List.of("evt-1#0", "evt-1#1", "evt-2#0"), seen);
    }

    @Test
    void exhaustedRetriesAreQuarantined() {
        RegisterConfig config = TestSupport.inMemoryConfig(QUEUE);
        config.setMaxAttempts(2);
        reconfigure(config);
        registerEvents("evt-1");
        List<Integer> attempts = new CopyOnWriteArrayList<>();

        register.readEvents(event -> {
            attempts.add(event.getAttemptCount());
            return ConsumeOutcome.RETRY_LATER;
        });

        await(() -> broker.queueDepth(DLQ) == 1, WAIT, "event quarantined");
        assertEquals(List.of(0, 1, 2), attempts);
        assertEquals(List.of("evt-1"), deadLetteredIds());
        await(() -> broker.queueDepth(QUEUE) == 0, WAIT, "work queue drained");
    }

    @Test
    void quarantineOutcomeMovesEventToDeadLetterQueue() {
        registerEvents("evt-1", "evt-2");
        List<String> seen = new CopyOnWriteArrayList<>();

        register.readEvents(event -> {
            seen.add(event.getId());
            return event.getId().equals("evt-1") ? ConsumeOutcome.QUARANTINE : ConsumeOutcome.ACK;
        });

        await(() -> seen.size() == 2, WAIT, "both events handled");
        await(() -> broker.queueDepth(DLQ) == 1, WAIT, "event quarantined");
        assertEquals(List.of("evt-1", "evt-2"), seen);
        assertEquals(List.of("evt-1"), deadLetteredIds());
    }

    @Test
    void undecodableMessageIsQuarantinedWithoutReachingCallback() throws Exception {
        registerEvents("evt-0");
        BrokerConnection raw = broker.newConnection("raw");
        BrokerChannel channel = raw.createChannel();
        channel.enableConfirms();
        channel.publishConfirmed("", QUEUE, new MessageProperties("poison", "text/plain", Instant.now(), true, Map.of()),
                "not an envelope".getBytes(StandardCharsets.UTF_8), 1000);
        raw.close();
        registerEvents("evt-1");
        List<String> seen = new CopyOnWriteArrayList<>();

        register.readEvents(event -> {
            seen.add(event.getId());
            return ConsumeOutcome.ACK;
        });

        await(() -> seen.size() == 2, WAIT, "valid events handled");
        await(() -> broker.queueDepth(DLQ) == 1, WAIT, "poison quarantined");
        assertEquals(List.of("evt-0", "evt-1"), seen);
        assertEquals("not an envelope", new String(broker.readyMessages(DLQ).get(0), StandardCharsets.UTF_8));
        assertEquals(1.0, metrics.getRegistry().get("relay.reader.decode_errors").counter().count());
    }

    @Test
    void throwingCallbackIsRetried() {
        registerEvents("evt-1");
        List<Integer> attempts = new CopyOnWriteArrayList<>();

        register.readEvents(event -> {
            attempts.add(event.getAttemptCount());
            if (attempts.size() == 1) {
                throw new IllegalStateException("downstream unavailable");
            }
            return ConsumeOutcome.ACK;
        });

        await(() -> attempts.size() == 2, WAIT, "redelivery after exception");
        assertEquals(List.of(0, 1), attempts);
        await(() -> broker.queueDepth(QUEUE) == 0, WAIT, "work queue drained");
    }

    @Test
    void errorFromCallbackEndsSubscriptionAndAllowsResubscribing() throws Exception {
        registerEvents("evt-1");
        AssertionError boom = new AssertionError("boom");
        Subscription failed = register.readEvents(event -> {
            throw boom;
        });
        List<Throwable> errors = new CopyOnWriteArrayList<>();
        failed.onTerminalError(errors::add);

        assertTrue(failed.awaitTermination(WAIT));
        await(() -> !errors.isEmpty(), WAIT, "terminal error listener");
        assertFalse(failed.isActive());
        Throwable terminal = failed.terminalError().orElseThrow();
        assertInstanceOf(ReadEventException.class, terminal);
        assertSame(boom, terminal.getCause());
        assertSame(terminal, errors.get(0));

        List<RelayEvent> seen = new CopyOnWriteArrayList<>();
        register.readEvents(event -> {
            seen.add(event);
            return ConsumeOutcome.ACK;
        });
        await(() -> seen.size() == 1, WAIT, "redelivery to new subscription");
        assertEquals("evt-1", seen.get(0).getId());
        assertEquals(1, seen.get(0).getAttemptCount());
    }

    @Test
    void onlyOneActiveSubscription() {
        register.readEvents(event -> ConsumeOutcome.ACK);

        assertThrows(IllegalStateException.class, () -> register.readEvents(event -> ConsumeOutcome.ACK));
    }

    @Test
    void cancelIsIdempotentAndAllowsResubscribing() throws Exception {
        Subscription subscription = register.readEvents(event -> ConsumeOutcome.ACK);

        subscription.cancel();
        subscription.cancel();

        assertFalse(subscription.isActive());
        assertTrue(subscription.awaitTermination(Duration.ofSeconds(1)));
        assertTrue(subscription.terminalError().isEmpty());

        registerEvents("evt-1");
        assertEquals(1, broker.queueDepth(QUEUE));

        List<String> seen = new CopyOnWriteArrayList<>();
        register.readEvents(event -> {
            seen.add(event.getId());
            return ConsumeOutcome.ACK;
        });
        await(() -> seen.size() == 1, WAIT, "delivery to new subscription");
    }

    @Test
    void cancelFromCallbackDoesNotDeadlock() throws Exception {
        registerEvents("evt-1", "evt-2");
        AtomicReference<Subscription> holder = new AtomicReference<>();
        List<String> seen = new CopyOnWriteArrayList<>();
        CountDownLatch subscribed = new CountDownLatch(1);

        holder.set(register.readEvents(event -> {
            try {
                subscribed.await(1, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            seen.add(event.getId());
            holder.get().cancel();
            return ConsumeOutcome.ACK;
        }));
        subscribed.countDown();

        assertTrue(holder.get().awaitTermination(WAIT));
        assertEquals(List.of("evt-1"), seen);
        await(() -> broker.queueDepth(QUEUE) == 1, WAIT, "second event returned to queue");
    }

    @Test
    void inFlightEventIsRedeliveredAfterConnectionLoss() throws Exception {
        registerEvents("evt-1");
        List<RelayEvent> seen = new CopyOnWriteArrayList<>();
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);

        Subscription subscription = register.readEvents(event -> {
            seen.add(event);
            if (seen.size() == 1) {
                entered.countDown();
                try {
                    release.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }
            return ConsumeOutcome.ACK;
        });

        assertTrue(entered.await(5, TimeUnit.SECONDS));
        broker.dropConnections();
        await(() -> broker.openConnections() == 1, WAIT, "reconnected");
        release.countDown();

        await(() -> seen.size() == 2, WAIT, "redelivery after reconnect");
        assertEquals("evt-1", seen.get(1).getId());
        assertEquals(1, seen.get(1).getAttemptCount());
        assertTrue(subscription.isActive());
        await(() -> broker.queueDepth(QUEUE) == 0, WAIT, "work queue drained");
    }

    @Test
    void consumerMovesToNewChannelAfterChannelError() {
        List<String> seen = new CopyOnWriteArrayList<>();
        Subscription subscription = register.readEvents(event -> {
            seen.add(event.getId());
            return ConsumeOutcome.ACK;
        });

        broker.breakConsumerChannels(QUEUE);
        registerEvents("evt-1");

        await(() -> seen.size() == 1, WAIT, "delivery on replacement channel");
        assertTrue(subscription.isActive());
    }

    @Test
    void failedChannelReplacementEndsSubscriptionWithError() throws Exception {
        Subscription subscription = register.readEvents(event -> ConsumeOutcome.ACK);
        List<Throwable> errors = new CopyOnWriteArrayList<>();
        subscription.onTerminalError(errors::add);

        broker.failNextChannelOpens(5);
        broker.breakConsumerChannels(QUEUE);

        assertTrue(subscription.awaitTermination(WAIT));
        await(() -> !errors.isEmpty(), WAIT, "terminal error listener");
        assertFalse(subscription.isActive());
        assertEquals(1, errors.size());
        assertInstanceOf(ReadEventException.class, errors.get(0));
        assertSame(errors.get(0), subscription.terminalError().orElseThrow());

        List<Throwable> late = new ArrayList<>();
        subscription.onTerminalError(late::add);
        assertEquals(1, late.size());
    }

    @Test
    void exhaustedReconnectsEndSubscriptionWithError() throws Exception {
        RegisterConfig config = TestSupport.inMemoryConfig(QUEUE);
        config.setReconnectMaxAttempts(2);
        reconfigure(config);
        Subscription subscription = register.readEvents(event -> ConsumeOutcome.ACK);

        broker.setReachable(false);
        broker.dropConnections();

        assertTrue(subscription.awaitTermination(WAIT));
        assertInstanceOf(ConnectionException.class, subscription.terminalError().orElseThrow());
        assertEquals(ConnectionState.ERROR, register.getConnectionState());
    }

    @Test
    void readEventsFailsWhenBrokerUnreachable() {
        RegisterConfig config = TestSupport.inMemoryConfig(QUEUE);
        config.setConnectionTimeoutMs(100);
        reconfigure(config);
        broker.setReachable(false);

        assertThrows(ReadEventException.class, () -> register.readEvents(event -> ConsumeOutcome.ACK));
    }

    @Test
    void closingRegisterCancelsSubscription() throws Exception {
        Subscription subscription = register.readEvents(event -> ConsumeOutcome.ACK);

        register.close();

        assertTrue(subscription.awaitTermination(WAIT));
        assertFalse(subscription.isActive());
        assertTrue(subscription.terminalError().isEmpty());
    }
}

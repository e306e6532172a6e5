/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.eventrelay.messaging.reader;

import com.eventrelay.common.exception.ConnectionException;
import com.eventrelay.common.exception.DecodeException;
import com.eventrelay.common.exception.ReadEventException;
import com.eventrelay.common.model.RegisterConfig;
import com.eventrelay.common.model.RelayEvent;
import com.eventrelay.messaging.channel.ChannelPool;
import com.eventrelay.messaging.channel.QueueTopology;
import com.eventrelay.messaging.codec.EnvelopeCodec;
import com.eventrelay.messaging.connection.ConnectionManager;
import com.eventrelay.messaging.core.ConnectionListener;
import com.eventrelay.messaging.core.ConnectionState;
import com.eventrelay.messaging.core.ConsumeOutcome;
import com.eventrelay.messaging.core.DeliveryState;
import com.eventrelay.messaging.core.EventCallback;
import com.eventrelay.messaging.core.Subscription;
import com.eventrelay.messaging.metrics.RegisterMetrics;
import com.eventrelay.messaging.retry.BackoffPolicy;
import com.eventrelay.messaging.retry.Sleeper;
import com.eventrelay.messaging.transport.BrokerChannel;
import com.eventrelay.messaging.transport.BrokerRejectedException;
import com.eventrelay.messaging.transport.BrokerShutdown;
import com.eventrelay.messaging.transport.Delivery;
import com.eventrelay.messaging.transport.DeliveryHandler;
import com.eventrelay.messaging.transport.MessageProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;

/**
 * One consumer on the work queue.
 *
 * <p>The transport's delivery thread only appends to an internal buffer; a single worker thread
 * decodes each delivery, runs the callback and settles the delivery according to the outcome.
 * A recovery thread re-establishes the consumer after a channel failure or a reconnect.</p>
 */
final class QueueSubscription implements Subscription, ConnectionListener {

    private static final Logger log = LoggerFactory.getLogger(QueueSubscription.class);

    static final String QUARANTINE_REASON_HEADER = "x-quarantine-reason";
    static final String ORIGINAL_QUEUE_HEADER = "x-original-queue";
    static final String ATTEMPT_COUNT_HEADER = "x-attempt-count";

    private static final long POLL_INTERVAL_MS = 200;
    private static final AtomicInteger SEQUENCE = new AtomicInteger();

    private enum Status { STARTING, ACTIVE, CANCELLING, CANCELLED, FAILED }

    private record Inbound(BrokerChannel channel, Delivery delivery) {}

    @FunctionalInterface
    private interface ChannelSource {
        BrokerChannel lease() throws InterruptedException;
    }

    private final RegisterConfig config;
    private final ConnectionManager connectionManager;
    private final ChannelPool channelPool;
    private final QueueTopology topology;
    private final EnvelopeCodec codec;
    private final BackoffPolicy redeliveryBackoff;
    private final Sleeper sleeper;
    private final RegisterMetrics metrics;
    private final AttemptTracker attempts;
    private final EventCallback callback;

    private final String queue;
    private final String name;
    private final BlockingQueue<Inbound> buffer = new LinkedBlockingQueue<>();
    private final AtomicReference<Status> status = new AtomicReference<>(Status.STARTING);
    private final CountDownLatch terminated = new CountDownLatch(1);
    private final List<Consumer<Throwable>> errorListeners = new ArrayList<>();
    private final ExecutorService recovery;
    private final Object channelLock = new Object();

    private BrokerChannel channel;
    private String consumerTag;
    private volatile Throwable terminalError;
    private volatile boolean backingOff;
    private volatile Thread worker;

    QueueSubscription(RegisterConfig config, ConnectionManager connectionManager, ChannelPool channelPool,
                      QueueTopology topology, EnvelopeCodec codec, BackoffPolicy redeliveryBackoff,
                      Sleeper sleeper, RegisterMetrics metrics, AttemptTracker attempts, EventCallback callback) {
        this.config = config;
        this.connectionManager = connectionManager;
        this.channelPool = channelPool;
        this.topology = topology;
        this.codec = codec;
        this.redeliveryBackoff = redeliveryBackoff;
        this.sleeper = sleeper;
        this.metrics = metrics;
        this.attempts = attempts;
        this.callback = callback;
        this.queue = config.getQueueName();
        this.name = "relay-reader-" + queue + "-" + SEQUENCE.incrementAndGet();
        this.recovery = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, name + "-recovery");
            t.setDaemon(true);
            return t;
        });
    }

    void start() throws IOException, InterruptedException {
        connectionManager.addListener(this);
        try {
            openConsumer();
        } catch (IOException | RuntimeException | InterruptedException e) {
            connectionManager.removeListener(this);
            recovery.shutdownNow();
            status.set(Status.CANCELLED);
            terminated.countDown();
            throw e;
        }
        Thread thread = new Thread(this::runLoop, name);
        thread.setDaemon(true);
        worker = thread;
        status.set(Status.ACTIVE);
        thread.start();
        log.info("Subscribed to queue '{}' ({})", queue, name);
    }

    // ── Subscription ───────────────────────────────────────────────

    @Override
    public String queueName() {
        return queue;
    }

    @Override
    public boolean isActive() {
        return status.get() == Status.ACTIVE;
    }

    @Override
    public void cancel() {
        if (requestStop()) {
            log.info("Cancelling subscription on queue '{}'", queue);
        }
        if (Thread.currentThread() == worker) {
            return;
        }
        try {
            if (!awaitTermination(Duration.ofMillis(config.getShutdownTimeoutMs()))) {
                log.warn("Subscription on queue '{}' did not stop within {}ms", queue, config.getShutdownTimeoutMs());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    @Override
    public Optional<Throwable> terminalError() {
        return Optional.ofNullable(terminalError);
    }

    @Override
    public void onTerminalError(Consumer<Throwable> listener) {
        Throwable error;
        synchronized (errorListeners) {
            errorListeners.add(listener);
            error = terminalError;
        }
        if (error != null) {
            notifyListener(listener, error);
        }
    }

    @Override
    public boolean awaitTermination(Duration timeout) throws InterruptedException {
        return terminated.await(timeout.toNanos(), TimeUnit.NANOSECONDS);
    }

    // ── Connection events ──────────────────────────────────────────

    @Override
    public void onStateChange(ConnectionState previous, ConnectionState current, Throwable cause) {
        switch (current) {
            case RECONNECTING -> log.info("Consumer on queue '{}' paused until the connection is back", queue);
            case CONNECTED -> {
                if (previous == ConnectionState.RECONNECTING) {
                    submitRecovery(this::resumeAfterReconnect);
                }
            }
            case ERROR -> fail(new ConnectionException("Connection lost and reconnect attempts exhausted", cause));
            case CLOSING -> requestStop();
            default -> {
            }
        }
    }

    // ── Worker ─────────────────────────────────────────────────────

    private void runLoop() {
        Throwable failure = null;
        try {
            while (status.get() == Status.ACTIVE) {
                Inbound next = buffer.poll(POLL_INTERVAL_MS, TimeUnit.MILLISECONDS);
                if (next == null) {
                    continue;
                }
                if (isStale(next)) {
                    log.debug("Skipping delivery {} from closed channel {}",
                            next.delivery().deliveryTag(), next.channel().channelNumber());
                    continue;
                }
                process(next);
            }
        } catch (InterruptedException e) {
            log.debug("Reader worker for queue '{}' interrupted", queue);
        } catch (RuntimeException | Error e) {
            failure = e;
        } finally {
            if (status.get() == Status.ACTIVE) {
                fail(new ReadEventException(queue, "reader worker stopped",
                        failure != null ? failure : new IllegalStateException("worker exited while active")));
            } else if (failure != null) {
                log.error("Reader worker for queue '{}' failed while stopping", queue, failure);
            }
            finish();
        }
    }

    private void process(Inbound inbound) {
        Delivery delivery = inbound.delivery();
        RelayEvent event;
        try {
            event = codec.decode(delivery.body());
        } catch (DecodeException e) {
            metrics.recordDecodeError();
            log.error("Undecodable message {} on queue '{}': {}",
                    delivery.properties().messageId(), queue, e.getMessage());
            quarantine(inbound, null, 0, "decode-error: " + e.getMessage());
            return;
        }

        int attempt = attempts.current(event.getId(), event.getAttemptCount(),
                delivery.properties().headerInt(MessageProperties.DELIVERY_COUNT_HEADER, 0));
        RelayEvent delivered = event.withAttemptCount(attempt);
        if (attempt > config.getMaxAttempts()) {
            quarantine(inbound, delivered, attempt,
                    "max attempts exceeded (" + attempt + " > " + config.getMaxAttempts() + ")");
            return;
        }

        switch (invoke(delivered)) {
            case ACK -> acknowledge(inbound, delivered);
            case RETRY_LATER -> retryLater(inbound, delivered);
            case QUARANTINE -> quarantine(inbound, delivered, attempt, "rejected by consumer");
        }
    }

    private ConsumeOutcome invoke(RelayEvent event) {
        try {
            ConsumeOutcome outcome = callback.onEvent(event);
            if (outcome == null) {
                log.warn("Callback returned no outcome for event {}, retrying later", event.getId());
                return ConsumeOutcome.RETRY_LATER;
            }
            return outcome;
        } catch (RuntimeException e) {
            log.error("Callback failed for event {} (attempt {})", event.getId(), event.getAttemptCount(), e);
            return ConsumeOutcome.RETRY_LATER;
        }
    }

    private void acknowledge(Inbound inbound, RelayEvent event) {
        if (settle(inbound, DeliveryState.ACKNOWLEDGED) == DeliveryState.ACKNOWLEDGED) {
            attempts.forget(event.getId());
            metrics.recordDelivery(ConsumeOutcome.ACK);
            log.debug("Acknowledged event {} on queue '{}'", event.getId(), queue);
        }
    }

    private void retryLater(Inbound inbound, RelayEvent event) {
        int next = event.getAttemptCount() + 1;
        if (next > config.getMaxAttempts()) {
            quarantine(inbound, event, event.getAttemptCount(),
                    "max attempts (" + config.getMaxAttempts() + ") reached");
            return;
        }
        attempts.record(event.getId(), next);
        long delay = redeliveryBackoff.delayMs(next);
        log.info("Event {} will be redelivered after {}ms (attempt {}/{})",
                event.getId(), delay, next, config.getMaxAttempts());
        backingOff = true;
        try {
            sleeper.sleep(delay);
        } catch (InterruptedException e) {
            log.debug("Redelivery backoff for event {} cut short", event.getId());
        } finally {
            backingOff = false;
        }
        if (settle(inbound, DeliveryState.REJECTED_REQUEUE) == DeliveryState.REJECTED_REQUEUE) {
            metrics.recordDelivery(ConsumeOutcome.RETRY_LATER);
        }
    }

    /**
     * Copy the original body to the dead-letter queue, then ack the original. The original is
     * only acked once the copy is confirmed.
     */
    private void quarantine(Inbound inbound, RelayEvent event, int attempt, String reason) {
        Delivery delivery = inbound.delivery();
        MessageProperties original = delivery.properties();
        String eventId = event != null ? event.getId() : original.messageId();
        String deadLetterQueue = config.getDeadLetterQueue();

        Map<String, Object> headers = new HashMap<>(original.headers());
        headers.remove(MessageProperties.DELIVERY_COUNT_HEADER);
        headers.put(QUARANTINE_REASON_HEADER, reason);
        headers.put(ORIGINAL_QUEUE_HEADER, queue);
        headers.put(ATTEMPT_COUNT_HEADER, attempt);
        MessageProperties properties = new MessageProperties(original.messageId(), original.contentType(),
                original.timestamp(), true, headers);

        BrokerChannel publisher = null;
        try {
            publisher = channelPool.acquire(Duration.ofMillis(config.getConfirmTimeoutMs()));
            topology.ensureDeclared(publisher, channelPool.connectionOf(publisher));
            publisher.publishConfirmed("", deadLetterQueue, properties, delivery.body(), config.getConfirmTimeoutMs());
            channelPool.release(publisher);
        } catch (BrokerRejectedException e) {
            channelPool.release(publisher);
            DeliveryState fallback = config.isDeclareDeadLetterArguments()
                    ? DeliveryState.REJECTED_DISCARD : DeliveryState.REJECTED_REQUEUE;
            log.error("Dead-letter queue '{}' rejected event {}, settling the original as {}",
                    deadLetterQueue, eventId, fallback, e);
            settle(inbound, fallback);
            return;
        } catch (IOException | TimeoutException | RuntimeException e) {
            channelPool.invalidate(publisher);
            log.error("Could not quarantine event {} to '{}', requeueing it", eventId, deadLetterQueue, e);
            settle(inbound, DeliveryState.REJECTED_REQUEUE);
            return;
        } catch (InterruptedException e) {
            channelPool.invalidate(publisher);
            Thread.currentThread().interrupt();
            settle(inbound, DeliveryState.REJECTED_REQUEUE);
            return;
        }

        if (settle(inbound, DeliveryState.ACKNOWLEDGED) == DeliveryState.ACKNOWLEDGED) {
            if (event != null) {
                attempts.forget(event.getId());
            }
            metrics.recordDelivery(ConsumeOutcome.QUARANTINE);
            log.warn("Event {} quarantined to '{}': {}", eventId, deadLetterQueue, reason);
        }
    }

    private DeliveryState settle(Inbound inbound, DeliveryState target) {
        long tag = inbound.delivery().deliveryTag();
        try {
            switch (target) {
                case ACKNOWLEDGED -> inbound.channel().basicAck(tag);
                case REJECTED_REQUEUE -> inbound.channel().basicNack(tag, true);
                case REJECTED_DISCARD -> inbound.channel().basicNack(tag, false);
                default -> throw new IllegalArgumentException("Cannot settle a delivery as " + target);
            }
            return target;
        } catch (IOException e) {
            log.warn("Could not settle delivery {} as {} on queue '{}', the broker will redeliver it: {}",
                    tag, target, queue, e.getMessage());
            return DeliveryState.UNACKNOWLEDGED;
        }
    }

    private boolean isStale(Inbound inbound) {
        synchronized (channelLock) {
            if (inbound.channel() != channel) {
                return true;
            }
        }
        return !inbound.channel().isOpen();
    }

    /** Runs once on the worker thread when it stops, whatever the reason. */
    private void finish() {
        // closing the channel returns every unsettled delivery to the queue in delivery order
        buffer.clear();
        BrokerChannel current;
        synchronized (channelLock) {
            current = channel;
            channel = null;
            consumerTag = null;
        }
        channelPool.invalidate(current);
        connectionManager.removeListener(this);
        recovery.shutdownNow();
        Status finalStatus;
        synchronized (errorListeners) {
            // a FAILED status and its terminal error are published together under this lock
            status.compareAndSet(Status.CANCELLING, Status.CANCELLED);
            finalStatus = status.get();
        }
        terminated.countDown();
        log.info("Subscription on queue '{}' stopped ({})", queue, finalStatus);
    }

    // ── Consumer setup and recovery ────────────────────────────────

    private void openConsumer() throws IOException, InterruptedException {
        consumeOn(channelPool.acquire(consumerWait()));
    }

    private Duration consumerWait() {
        return Duration.ofMillis(config.getConnectionTimeoutMs());
    }

    private void consumeOn(BrokerChannel opened) throws IOException {
        try {
            topology.ensureDeclared(opened, channelPool.connectionOf(opened));
            opened.basicQos(config.getPrefetchCount());
            opened.addShutdownListener(shutdown -> onChannelShutdown(opened, shutdown));
            synchronized (channelLock) {
                Status current = status.get();
                if (current != Status.STARTING && current != Status.ACTIVE) {
                    throw new IOException("Subscription on queue '" + queue + "' is " + current);
                }
                channel = opened;
            }
            String tag = opened.basicConsume(queue, name + "-" + opened.channelNumber(), new DeliveryHandler() {
                @Override
                public void onDelivery(Delivery delivery) {
                    buffer.offer(new Inbound(opened, delivery));
                }

                @Override
                public void onCancel(String cancelledTag) {
                    log.warn("Broker cancelled consumer {} on queue '{}'", cancelledTag, queue);
                    submitRecovery(() -> replaceChannel(opened));
                }
            });
            synchronized (channelLock) {
                if (channel == opened) {
                    consumerTag = tag;
                }
            }
            log.debug("Consuming queue '{}' on channel {} with prefetch {}",
                    queue, opened.channelNumber(), config.getPrefetchCount());
        } catch (IOException | RuntimeException e) {
            synchronized (channelLock) {
                if (channel == opened) {
                    channel = null;
                }
            }
            channelPool.invalidate(opened);
            throw e;
        }
    }

    private void onChannelShutdown(BrokerChannel closed, BrokerShutdown shutdown) {
        if (shutdown.initiatedByApplication() || shutdown.connectionLevel() || !isActive()) {
            return;
        }
        synchronized (channelLock) {
            if (closed != channel) {
                return;
            }
        }
        log.warn("Consumer channel {} on queue '{}' closed: {}", closed.channelNumber(), queue,
                shutdown.cause() == null ? "unknown cause" : shutdown.cause().getMessage());
        submitRecovery(() -> replaceChannel(closed));
    }

    private void replaceChannel(BrokerChannel failed) {
        synchronized (channelLock) {
            if (failed != channel) {
                return;
            }
            channel = null;
            consumerTag = null;
        }
        if (!isActive()) {
            channelPool.invalidate(failed);
            return;
        }
        reopenConsumer("moved to a new channel", () -> channelPool.replace(failed, consumerWait()));
    }

    private void resumeAfterReconnect() {
        BrokerChannel previous;
        synchronized (channelLock) {
            previous = channel;
            channel = null;
            consumerTag = null;
        }
        channelPool.invalidate(previous);
        reopenConsumer("resumed after reconnect", () -> channelPool.acquire(consumerWait()));
    }

    private void reopenConsumer(String what, ChannelSource source) {
        if (!isActive()) {
            return;
        }
        try {
            consumeOn(source.lease());
            log.info("Consumer on queue '{}' {}", queue, what);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (IOException | RuntimeException e) {
            if (!isActive()) {
                return;
            }
            if (!connectionManager.isConnected()) {
                log.info("Consumer on queue '{}' will resume after reconnect: {}", queue, e.getMessage());
                return;
            }
            fail(new ReadEventException(queue, "consumer channel could not be replaced", e));
        }
    }

    private void submitRecovery(Runnable task) {
        try {
            recovery.execute(task);
        } catch (RejectedExecutionException e) {
            log.debug("Subscription on queue '{}' already stopped, recovery skipped", queue);
        }
    }

    // ── Stopping ───────────────────────────────────────────────────

    private boolean requestStop() {
        if (!status.compareAndSet(Status.ACTIVE, Status.CANCELLING)) {
            return false;
        }
        stopConsuming();
        return true;
    }

    private void fail(Throwable error) {
        List<Consumer<Throwable>> toNotify;
        synchronized (errorListeners) {
            if (!status.compareAndSet(Status.ACTIVE, Status.FAILED)) {
                return;
            }
            terminalError = error;
            toNotify = List.copyOf(errorListeners);
        }
        log.error("Subscription on queue '{}' failed", queue, error);
        stopConsuming();
        for (Consumer<Throwable> listener : toNotify) {
            notifyListener(listener, error);
        }
    }

    private void stopConsuming() {
        BrokerChannel current;
        String tag;
        synchronized (channelLock) {
            current = channel;
            tag = consumerTag;
        }
        if (current != null && tag != null && current.isOpen()) {
            try {
                current.basicCancel(tag);
            } catch (IOException e) {
                log.debug("basic.cancel of {} on queue '{}' failed: {}", tag, queue, e.getMessage());
            }
        }
        Thread thread = worker;
        if (backingOff && thread != null) {
            thread.interrupt();
        }
    }

    private void notifyListener(Consumer<Throwable> listener, Throwable error) {
        try {
            listener.accept(error);
        } catch (RuntimeException e) {
            log.warn("Terminal error listener on queue '{}' failed", queue, e);
        }
    }
}

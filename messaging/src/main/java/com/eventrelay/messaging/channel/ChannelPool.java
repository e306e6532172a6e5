/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.eventrelay.messaging.channel;

import com.eventrelay.common.exception.PoolException;
import com.eventrelay.messaging.connection.ConnectionManager;
import com.eventrelay.messaging.transport.BrokerChannel;
import com.eventrelay.messaging.transport.BrokerConnection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.Deque;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Bounded pool of confirm-mode channels on the managed connection.
 *
 * <p>A channel is leased to one caller at a time. Channels that belong to a connection that
 * has since been replaced are closed instead of being returned to the idle set.</p>
 */
public class ChannelPool implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ChannelPool.class);

    private record IdleChannel(BrokerChannel channel, BrokerConnection owner) {}

    private final ConnectionManager connectionManager;
    private final int maxChannels;
    private final Semaphore permits;
    private final Deque<IdleChannel> idle = new ConcurrentLinkedDeque<>();
    private final Map<BrokerChannel, BrokerConnection> leased = new ConcurrentHashMap<>();
    private volatile boolean closed;

    public ChannelPool(ConnectionManager connectionManager, int maxChannels) {
        if (maxChannels < 1) {
            throw new IllegalArgumentException("maxChannels must be >= 1, got: " + maxChannels);
        }
        this.connectionManager = connectionManager;
        this.maxChannels = maxChannels;
        this.permits = new Semaphore(maxChannels, true);
    }

    /**
     * Lease a channel, waiting up to {@code wait} for a free slot and a live connection.
     *
     * @throws PoolException       if the pool is closed, exhausted, or the channel cannot be opened
     * @throws com.eventrelay.common.exception.ConnectionException if no connection is available in time
     */
    public BrokerChannel acquire(Duration wait) throws InterruptedException {
        long started = System.nanoTime();
        return acquire(wait, () -> Duration.ofNanos(Math.max(0, started + wait.toNanos() - System.nanoTime())));
    }

    /**
     * Lease a channel, waiting up to {@code slotWait} for a free slot and then up to
     * {@code connectionWait} for a live connection.
     */
    public BrokerChannel acquire(Duration slotWait, Duration connectionWait) throws InterruptedException {
        return acquire(slotWait, () -> connectionWait);
    }

    private BrokerChannel acquire(Duration slotWait, Supplier<Duration> connectionWait) throws InterruptedException {
        ensureOpen();
        if (!permits.tryAcquire(slotWait.toNanos(), TimeUnit.NANOSECONDS)) {
            throw new PoolException("No channel available within " + slotWait.toMillis() + "ms ("
                    + maxChannels + " leased)", null);
        }
        try {
            ensureOpen();
            BrokerConnection connection = connectionManager.awaitConnection(connectionWait.get());
            IdleChannel candidate;
            while ((candidate = idle.pollFirst()) != null) {
                if (candidate.owner() == connection && candidate.channel().isOpen()) {
                    leased.put(candidate.channel(), connection);
                    return candidate.channel();
                }
                candidate.channel().close();
            }
            BrokerChannel channel = open(connection);
            leased.put(channel, connection);
            return channel;
        } catch (RuntimeException | InterruptedException e) {
            permits.release();
            throw e;
        }
    }

    /** Return a healthy channel for reuse. */
    public void release(BrokerChannel channel) {
        BrokerConnection owner = leased.remove(channel);
        if (owner == null) {
            log.debug("Ignoring release of channel {} not leased from this pool", channel.channelNumber());
            return;
        }
        permits.release();
        if (!closed && channel.isOpen() && owner == connectionManager.current()) {
            idle.offerFirst(new IdleChannel(channel, owner));
            if (closed) {
                drainIdle();
            }
        } else {
            channel.close();
        }
    }

    /** Close a channel that failed and free its slot. */
    public void invalidate(BrokerChannel channel) {
        if (channel == null) {
            return;
        }
        if (leased.remove(channel) != null) {
            permits.release();
        }
        channel.close();
    }

    /**
     * Discard a failed channel and lease a fresh one in its place.
     *
     * @throws PoolException if the replacement cannot be opened
     */
    public BrokerChannel replace(BrokerChannel failed, Duration wait) throws InterruptedException {
        invalidate(failed);
        return acquire(wait);
    }

    /** Connection a leased channel was opened on, or null if it is not leased. */
    public BrokerConnection connectionOf(BrokerChannel channel) {
        return leased.get(channel);
    }

    public int idleCount() { return idle.size(); }

    public int leasedCount() { return leased.size(); }

    public int getMaxChannels() { return maxChannels; }

    /** Close idle and leased channels. In-flight operations on leased channels fail. */
    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        drainIdle();
        for (BrokerChannel channel : leased.keySet()) {
            channel.close();
        }
        log.debug("Channel pool closed");
    }

    private BrokerChannel open(BrokerConnection connection) {
        BrokerChannel channel;
        try {
            channel = connection.createChannel();
        } catch (IOException e) {
            throw new PoolException("Failed to open channel on " + connectionManager.describe(), e);
        }
        try {
            channel.enableConfirms();
        } catch (IOException e) {
            channel.close();
            throw new PoolException("Failed to enable confirms on channel " + channel.channelNumber(), e);
        }
        log.debug("Opened channel {} on {}", channel.channelNumber(), connectionManager.describe());
        return channel;
    }

    private void drainIdle() {
        IdleChannel entry;
        while ((entry = idle.pollFirst()) != null) {
            entry.channel().close();
        }
    }

    private void ensureOpen() {
        if (closed) {
            throw new PoolException("Channel pool is closed", null);
        }
    }
}

/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.eventrelay.messaging.connection;

import com.eventrelay.common.exception.ConnectionException;
import com.eventrelay.messaging.core.ConnectionListener;
import com.eventrelay.messaging.core.ConnectionState;
import com.eventrelay.messaging.retry.BackoffPolicy;
import com.eventrelay.messaging.transport.BrokerConnection;
import com.eventrelay.messaging.transport.BrokerConnectionFactory;
import com.eventrelay.messaging.transport.BrokerShutdown;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Owns the single broker connection of a register and re-establishes it after failures.
 *
 * <p>Reconnects run on a daemon scheduler with capped, jittered exponential backoff. A
 * {@code maxReconnectAttempts} of 0 retries forever; otherwise the manager moves to
 * {@link ConnectionState#ERROR} once the budget is spent. Listeners are told about every state
 * change, outside of the manager's lock.</p>
 */
public class ConnectionManager implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ConnectionManager.class);

    private final BrokerConnectionFactory factory;
    private final String connectionName;
    private final BackoffPolicy reconnectBackoff;
    private final int maxReconnectAttempts;
    private final List<ConnectionListener> listeners = new CopyOnWriteArrayList<>();
    private final Object lock = new Object();

    // guarded by lock
    private ConnectionState state = ConnectionState.DISCONNECTED;
    private BrokerConnection connection;
    private long generation;
    private Throwable lastFailure;
    private ScheduledExecutorService reconnectExecutor;

    public ConnectionManager(BrokerConnectionFactory factory, String connectionName,
                             BackoffPolicy reconnectBackoff, int maxReconnectAttempts) {
        this.factory = factory;
        this.connectionName = connectionName;
        this.reconnectBackoff = reconnectBackoff;
        this.maxReconnectAttempts = maxReconnectAttempts;
    }

    public void addListener(ConnectionListener listener) { listeners.add(listener); }

    public void removeListener(ConnectionListener listener) { listeners.remove(listener); }

    /**
     * Open the connection if the manager has never connected.
     *
     * @return the live connection
     * @throws ConnectionException if the attempt fails (a reconnect is then scheduled) or the
     *                             manager is not in a state that allows connecting
     */
    public BrokerConnection connect() {
        ConnectionState previous;
        synchronized (lock) {
            if (state == ConnectionState.CONNECTED && connection != null) {
                return connection;
            }
            if (state != ConnectionState.DISCONNECTED) {
                throw new ConnectionException("Cannot connect to " + factory.describe() + " while " + state, lastFailure);
            }
            previous = state;
            state = ConnectionState.CONNECTING;
        }
        fire(previous, ConnectionState.CONNECTING, null);
        try {
            return open();
        } catch (ConnectionException e) {
            log.warn("Connection to {} failed: {}", factory.describe(), e.getMessage());
            scheduleReconnect(1, e);
            throw e;
        }
    }

    /**
     * Wait until the manager is connected, connecting first if it never has.
     *
     * @throws ConnectionException on timeout, or if the manager is closed or gave up reconnecting
     */
    public BrokerConnection awaitConnection(Duration timeout) throws InterruptedException {
        boolean connectNow;
        synchronized (lock) {
            connectNow = state == ConnectionState.DISCONNECTED;
        }
        if (connectNow) {
            try {
                return connect();
            } catch (ConnectionException e) {
                log.debug("Initial connect did not succeed, waiting for reconnect: {}", e.getMessage());
            }
        }
        long deadline = System.nanoTime() + timeout.toNanos();
        synchronized (lock) {
            while (state != ConnectionState.CONNECTED || connection == null) {
                if (state == ConnectionState.CLOSING || state.isTerminal()) {
                    throw new ConnectionException("Connection to " + factory.describe() + " is " + state, lastFailure);
                }
                long remaining = deadline - System.nanoTime();
                if (remaining <= 0) {
                    throw new ConnectionException("No connection to " + factory.describe() + " within "
                            + timeout.toMillis() + "ms (state " + state + ")", lastFailure);
                }
                TimeUnit.NANOSECONDS.timedWait(lock, remaining);
            }
            return connection;
        }
    }

    /** The live connection, or null while not connected. */
    public BrokerConnection current() {
        synchronized (lock) {
            return connection;
        }
    }

    public ConnectionState getState() {
        synchronized (lock) {
            return state;
        }
    }

    public boolean isConnected() {
        return getState() == ConnectionState.CONNECTED;
    }

    /** Incremented on every successful (re)connect. */
    public long getGeneration() {
        synchronized (lock) {
            return generation;
        }
    }

    public String describe() {
        return factory.describe();
    }

    @Override
    public void close() {
        BrokerConnection toClose;
        ConnectionState previous;
        synchronized (lock) {
            if (state == ConnectionState.CLOSING || state == ConnectionState.CLOSED) {
                return;
            }
            previous = state;
            state = ConnectionState.CLOSING;
            toClose = connection;
            connection = null;
            if (reconnectExecutor != null) {
                reconnectExecutor.shutdownNow();
            }
            lock.notifyAll();
        }
        fire(previous, ConnectionState.CLOSING, null);
        if (toClose != null) {
            toClose.close();
        }
        synchronized (lock) {
            state = ConnectionState.CLOSED;
            lock.notifyAll();
        }
        fire(ConnectionState.CLOSING, ConnectionState.CLOSED, null);
        log.info("Connection manager for {} closed", factory.describe());
    }

    private BrokerConnection open() {
        BrokerConnection opened;
        try {
            opened = factory.newConnection(connectionName);
        } catch (ConnectionException e) {
            throw e;
        } catch (IOException | TimeoutException | RuntimeException e) {
            throw new ConnectionException("Failed to connect to " + factory.describe(), e);
        }
        ConnectionState previous;
        synchronized (lock) {
            if (state != ConnectionState.CONNECTING && state != ConnectionState.RECONNECTING) {
                opened.close();
                throw new ConnectionException("Connection manager is " + state);
            }
            previous = state;
            connection = opened;
            generation++;
            lastFailure = null;
            state = ConnectionState.CONNECTED;
            lock.notifyAll();
        }
        opened.addShutdownListener(shutdown -> onShutdown(opened, shutdown));
        log.info("Connected to {} as '{}'", factory.describe(), connectionName);
        fire(previous, ConnectionState.CONNECTED, null);
        return opened;
    }

    private void onShutdown(BrokerConnection closed, BrokerShutdown shutdown) {
        synchronized (lock) {
            if (closed != connection || shutdown.initiatedByApplication()) {
                return;
            }
            connection = null;
        }
        log.warn("Connection to {} lost: {}", factory.describe(),
                shutdown.cause() == null ? "unknown cause" : shutdown.cause().getMessage());
        scheduleReconnect(1, shutdown.cause());
    }

    private void scheduleReconnect(int attempt, Throwable cause) {
        ConnectionState previous;
        ConnectionState next;
        synchronized (lock) {
            if (state == ConnectionState.CLOSING || state.isTerminal()) {
                return;
            }
            previous = state;
            lastFailure = cause;
            if (maxReconnectAttempts > 0 && attempt > maxReconnectAttempts) {
                next = ConnectionState.ERROR;
                state = next;
                lock.notifyAll();
            } else {
                next = ConnectionState.RECONNECTING;
                state = next;
                long delay = reconnectBackoff.delayMs(attempt);
                log.info("Reconnecting to {} in {}ms (attempt {})", factory.describe(), delay, attempt);
                executor().schedule(() -> reconnect(attempt), delay, TimeUnit.MILLISECONDS);
            }
        }
        if (next == ConnectionState.ERROR) {
            log.error("Giving up on {} after {} reconnect attempts", factory.describe(), maxReconnectAttempts, cause);
        }
        if (previous != next) {
            fire(previous, next, cause);
        }
    }

    private void reconnect(int attempt) {
        synchronized (lock) {
            if (state != ConnectionState.RECONNECTING) {
                return;
            }
        }
        try {
            open();
            log.info("Reconnected to {} after {} attempt(s)", factory.describe(), attempt);
        } catch (RuntimeException e) {
            log.warn("Reconnect attempt {} to {} failed: {}", attempt, factory.describe(), e.getMessage());
            scheduleReconnect(attempt + 1, e);
        }
    }

    private ScheduledExecutorService executor() {
        if (reconnectExecutor == null || reconnectExecutor.isShutdown()) {
            reconnectExecutor = Executors.newSingleThreadScheduledExecutor(r -> {
                Thread t = new Thread(r, "relay-reconnect-" + connectionName);
                t.setDaemon(true);
                return t;
            });
        }
        return reconnectExecutor;
    }

    private void fire(ConnectionState previous, ConnectionState current, Throwable cause) {
        for (ConnectionListener listener : listeners) {
            try {
                listener.onStateChange(previous, current, cause);
            } catch (RuntimeException e) {
                log.warn("Connection listener failed on {} -> {}", previous, current, e);
            }
        }
    }
}

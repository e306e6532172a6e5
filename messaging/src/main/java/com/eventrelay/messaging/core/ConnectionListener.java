/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.eventrelay.messaging.core;

/**
 * Observes connectivity transitions of a connection manager.
 * Called on the thread that performed the transition; implementations must not block.
 */
@FunctionalInterface
public interface ConnectionListener {
    /**
     * @param previous state before the transition
     * @param current  state after the transition
     * @param cause    the failure behind the transition, or {@code null}
     */
    void onStateChange(ConnectionState previous, ConnectionState current, Throwable cause);
}

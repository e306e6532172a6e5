/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.eventrelay.messaging.core;

/**
 * Connection lifecycle states for the broker connection.
 */
public enum ConnectionState {
    DISCONNECTED,
    CONNECTING,
    CONNECTED,
    RECONNECTING,
    CLOSING,
    CLOSED,
    ERROR;

    /** No further transitions happen from a terminal state. */
    public boolean isTerminal() {
        return this == CLOSED || this == ERROR;
    }
}

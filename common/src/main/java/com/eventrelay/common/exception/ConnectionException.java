/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.eventrelay.common.exception;

/**
 * The broker connection is not available. Fatal until a reconnect succeeds.
 */
public class ConnectionException extends RelayException {

    public ConnectionException(String message) {
        super("RELAY_CONNECTION", message);
    }

    public ConnectionException(String message, Throwable cause) {
        super("RELAY_CONNECTION", message, cause);
    }

    protected ConnectionException(String errorCode, String message, Throwable cause) {
        super(errorCode, message, cause);
    }

    /** The broker refused the configured credentials. */
    public static ConnectionException credentials(String username, Throwable cause) {
        return new ConnectionException("RELAY_CREDENTIALS",
                "Broker refused credentials for user '" + username + "'", cause);
    }
}

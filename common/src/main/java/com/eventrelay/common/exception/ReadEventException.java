/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.eventrelay.common.exception;

public class ReadEventException extends RelayException {
    public ReadEventException(String queueName, Throwable cause) {
        super("RELAY_READ", "Failed to start reading events from queue '" + queueName + "'", cause);
    }

    /** A subscription that was running and had to stop. */
    public ReadEventException(String queueName, String reason, Throwable cause) {
        super("RELAY_READ", "Stopped reading events from queue '" + queueName + "': " + reason, cause);
    }
}

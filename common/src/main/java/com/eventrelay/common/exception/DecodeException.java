/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.eventrelay.common.exception;

/**
 * A message body could not be turned back into an event. Never retried at transport level.
 */
public class DecodeException extends RelayException {

    public DecodeException(String message) {
        super("RELAY_DECODE", message);
    }

    public DecodeException(String message, Throwable cause) {
        super("RELAY_DECODE", message, cause);
    }
}

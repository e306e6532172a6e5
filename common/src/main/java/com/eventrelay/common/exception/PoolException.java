/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.eventrelay.common.exception;

public class PoolException extends RelayException {
    public PoolException(String message, Throwable cause) {
        super("RELAY_CHANNEL", message, cause);
    }
}

/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.eventrelay.common.exception;

/**
 * Base exception for all event relay errors.
 */
public class RelayException extends RuntimeException {
    private final String errorCode;

    public RelayException(String message) {
        super(message);
        this.errorCode = "RELAY_GENERIC";
    }

    public RelayException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public RelayException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public String getErrorCode() { return errorCode; }
}

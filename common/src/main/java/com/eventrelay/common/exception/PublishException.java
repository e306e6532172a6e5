/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.eventrelay.common.exception;

/**
 * Raised by the publish path. Callers branch on {@link #getReason()}.
 */
public class PublishException extends RelayException {

    public enum Reason {
        /** Broker could not be reached within the retry budget. */
        UNREACHABLE,
        /** Broker explicitly refused the message (nack, queue full, unroutable). */
        REJECTED,
        /** No publisher confirm arrived in time. */
        TIMEOUT
    }

    private final Reason reason;
    private final String eventId;

    public PublishException(Reason reason, String eventId, String message, Throwable cause) {
        super("RELAY_PUBLISH_" + reason.name(), message, cause);
        this.reason = reason;
        this.eventId = eventId;
    }

    public static PublishException unreachable(String eventId, int attempts, Throwable cause) {
        return new PublishException(Reason.UNREACHABLE, eventId,
                "Broker unreachable after " + attempts + " attempt(s) for event '" + eventId + "'", cause);
    }

    public static PublishException rejected(String eventId, Throwable cause) {
        return new PublishException(Reason.REJECTED, eventId,
                "Broker rejected event '" + eventId + "'", cause);
    }

    public static PublishException timeout(String eventId, long timeoutMs, Throwable cause) {
        return new PublishException(Reason.TIMEOUT, eventId,
                "No publisher confirm for event '" + eventId + "' within " + timeoutMs + "ms", cause);
    }

    public Reason getReason() { return reason; }
    public String getEventId() { return eventId; }
}

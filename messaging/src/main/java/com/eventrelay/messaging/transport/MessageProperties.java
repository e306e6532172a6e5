/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.eventrelay.messaging.transport;

import java.time.Instant;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * Transport metadata carried next to a message body.
 */
public record MessageProperties(String messageId, String contentType, Instant timestamp,
                                boolean persistent, Map<String, Object> headers) {

    /** Quorum queues report prior failed deliveries in this header. */
    public static final String DELIVERY_COUNT_HEADER = "x-delivery-count";

    public MessageProperties {
        headers = headers == null ? Map.of() : Collections.unmodifiableMap(new HashMap<>(headers));
    }

    /** Integer header value, or {@code defaultValue} if absent or not numeric. */
    public int headerInt(String name, int defaultValue) {
        Object value = headers.get(name);
        if (value instanceof Number n) return n.intValue();
        if (value != null) {
            try { return Integer.parseInt(value.toString().trim()); }
            catch (NumberFormatException e) { return defaultValue; }
        }
        return defaultValue;
    }

    public String headerString(String name) {
        Object value = headers.get(name);
        return value == null ? null : value.toString();
    }
}

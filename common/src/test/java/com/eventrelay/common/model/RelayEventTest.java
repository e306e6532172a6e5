/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.eventrelay.common.model;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class RelayEventTest {

    @Test
    void payloadIsCopiedOnTheWayInAndOut() {
        byte[] payload = "hello".getBytes(StandardCharsets.UTF_8);
        RelayEvent event = RelayEvent.of("evt-1", "orders", payload);

        payload[0] = 'X';
        assertEquals("hello", new String(event.getPayload(), StandardCharsets.UTF_8));

        event.getPayload()[0] = 'Y';
        assertEquals("hello", new String(event.getPayload(), StandardCharsets.UTF_8));
    }

    @Test
    void rejectsNegativeAttemptCount() {
        assertThrows(IllegalArgumentException.class,
                () -> new RelayEvent("evt-1", new byte[]{1}, Instant.now(), -1, "orders"));
    }

    @Test
    void withAttemptCountKeepsIdentity() {
        RelayEvent original = RelayEvent.of("evt-1", "orders", new byte[]{1, 2, 3});

        RelayEvent retried = original.withAttemptCount(2);

        assertEquals("evt-1", retried.getId());
        assertEquals(2, retried.getAttemptCount());
        assertEquals(original.getCreatedAt(), retried.getCreatedAt());
        assertArrayEquals(original.getPayload(), retried.getPayload());
        assertEquals(0, original.getAttemptCount());
    }

    @Test
    void nullPayloadBecomesEmpty() {
        RelayEvent event = RelayEvent.of("orders", null);

        assertNull(event.getId());
        assertEquals(0, event.getPayloadSize());
        assertNotNull(event.getCreatedAt());
    }

    @Test
    void equalityComparesPayloadContent() {
        Instant now = Instant.now();
        RelayEvent a = new RelayEvent("evt-1", new byte[]{1, 2}, now, 0, "orders");
        RelayEvent b = new RelayEvent("evt-1", new byte[]{1, 2}, now, 0, "orders");
        RelayEvent c = new RelayEvent("evt-1", new byte[]{1, 3}, now, 0, "orders");

        assertEquals(a, b);
        assertEquals(a.hashCode(), b.hashCode());
        assertNotEquals(a, c);
    }
}

/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.eventrelay.messaging.register;

import com.eventrelay.common.exception.PublishException;
import com.eventrelay.messaging.core.Ack;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class PublishedEventCacheTest {

    private final MutableClock clock = new MutableClock();
    private final AtomicInteger publishes = new AtomicInteger();

    private Ack publish() {
        return new Ack("evt-1", "q", publishes.incrementAndGet(), clock.instant());
    }

    @Test
    void repeatWithinWindowReturnsEarlierAck() {
        PublishedEventCache cache = new PublishedEventCache(1000, clock);

        PublishedEventCache.Result first = cache.publishOnce("evt-1", this::publish);
        clock.advance(999);
        PublishedEventCache.Result second = cache.publishOnce("evt-1", this::publish);

        assertFalse(first.duplicate());
        assertTrue(second.duplicate());
        assertSame(first.ack(), second.ack());
        assertEquals(1, publishes.get());
    }

    @Test
    void repeatAfterWindowPublishesAgain() {
        PublishedEventCache cache = new PublishedEventCache(1000, clock);

        cache.publishOnce("evt-1", this::publish);
        clock.advance(1000);
        PublishedEventCache.Result again = cache.publishOnce("evt-1", this::publish);

        assertFalse(again.duplicate());
        assertEquals(2, publishes.get());
    }

    @Test
    void failedPublishIsNotRemembered() {
        PublishedEventCache cache = new PublishedEventCache(1000, clock);

        assertThrows(PublishException.class, () -> cache.publishOnce("evt-1", () -> {
            throw PublishException.rejected("evt-1", null);
        }));
        PublishedEventCache.Result retry = cache.publishOnce("evt-1", this::publish);

        assertFalse(retry.duplicate());
        assertEquals(1, cache.size());
    }

    @Test
    void zeroWindowDisablesDeduplication() {
        PublishedEventCache cache = new PublishedEventCache(0, clock);

        cache.publishOnce("evt-1", this::publish);
        cache.publishOnce("evt-1", this::publish);

        assertEquals(2, publishes.get());
        assertEquals(0, cache.size());
    }

    private static final class MutableClock extends Clock {
        private Instant now = Instant.parse("2025-01-01T00:00:00Z");

        void advance(long millis) {
            now = now.plusMillis(millis);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}

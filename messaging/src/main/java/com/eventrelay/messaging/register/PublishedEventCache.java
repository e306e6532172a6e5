/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.eventrelay.messaging.register;

import com.eventrelay.messaging.core.Ack;

import java.time.Clock;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Remembers confirmed event ids for a time window so that a repeated registration returns
 * the original {@link Ack} without publishing again. Concurrent registrations of the same id
 * share one publish. Failed publishes are forgotten.
 */
final class PublishedEventCache {

    private static final int SWEEP_EVERY = 1024;

    record Result(Ack ack, boolean duplicate) {}

    private record Entry(CompletableFuture<Ack> result, long expiresAtMs) {}

    private final long windowMs;
    private final Clock clock;
    private final Map<String, Entry> entries = new ConcurrentHashMap<>();
    private final AtomicInteger sinceSweep = new AtomicInteger();

    PublishedEventCache(long windowMs, Clock clock) {
        this.windowMs = windowMs;
        this.clock = clock;
    }

    Result publishOnce(String eventId, Supplier<Ack> publish) {
        if (windowMs <= 0) {
            return new Result(publish.get(), false);
        }
        sweepIfDue();
        while (true) {
            long now = clock.millis();
            CompletableFuture<Ack> mine = new CompletableFuture<>();
            Entry pending = new Entry(mine, Long.MAX_VALUE);
            Entry current = entries.compute(eventId,
                    (id, existing) -> existing != null && existing.expiresAtMs() > now ? existing : pending);
            if (current != pending) {
                try {
                    return new Result(current.result().join(), true);
                } catch (CompletionException | CancellationException e) {
                    // the other publish failed; try our own
                    continue;
                }
            }
            try {
                Ack ack = publish.get();
                entries.put(eventId, new Entry(mine, clock.millis() + windowMs));
                mine.complete(ack);
                return new Result(ack, false);
            } catch (RuntimeException e) {
                entries.remove(eventId, pending);
                mine.completeExceptionally(e);
                throw e;
            }
        }
    }

    int size() {
        return entries.size();
    }

    private void sweepIfDue() {
        if (sinceSweep.incrementAndGet() < SWEEP_EVERY) {
            return;
        }
        sinceSweep.set(0);
        long now = clock.millis();
        entries.values().removeIf(e -> e.expiresAtMs() <= now && e.result().isDone());
    }
}

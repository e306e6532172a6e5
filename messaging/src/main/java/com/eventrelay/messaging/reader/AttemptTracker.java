/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.eventrelay.messaging.reader;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Retry counts per event id, bounded in size. The least recently touched id is evicted first;
 * an evicted count falls back to the broker's delivery-count header.
 */
final class AttemptTracker {

    private final Map<String, Integer> retries;

    AttemptTracker(int maxEntries) {
        this.retries = new LinkedHashMap<>(16, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, Integer> eldest) {
                return size() > maxEntries;
            }
        };
    }

    /** Highest of the tracked count and the given broker-side counts. */
    synchronized int current(String eventId, int... observed) {
        int attempts = retries.getOrDefault(eventId, 0);
        for (int value : observed) {
            attempts = Math.max(attempts, value);
        }
        return attempts;
    }

    synchronized void record(String eventId, int attempts) {
        retries.put(eventId, attempts);
    }

    synchronized void forget(String eventId) {
        retries.remove(eventId);
    }

    synchronized int size() {
        return retries.size();
    }
}

/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.eventrelay.messaging.retry;

import com.eventrelay.common.model.RegisterConfig;

import java.util.concurrent.ThreadLocalRandom;

/**
 * Capped exponential backoff.
 *
 * <p>Ceiling formula: {@code baseDelay * 2^(attempt-1)}, capped at {@code maxDelay}. With
 * {@link Jitter#FULL} the delay is drawn uniformly from {@code [0, ceiling]}; with
 * {@link Jitter#NONE} it is the ceiling itself, so successive delays never decrease.</p>
 */
public final class BackoffPolicy {

    public enum Jitter { NONE, FULL }

    private final long baseDelayMs;
    private final long maxDelayMs;
    private final Jitter jitter;

    public BackoffPolicy(long baseDelayMs, long maxDelayMs, Jitter jitter) {
        if (baseDelayMs < 0) {
            throw new IllegalArgumentException("baseDelayMs must be >= 0, got: " + baseDelayMs);
        }
        if (maxDelayMs < baseDelayMs) {
            throw new IllegalArgumentException("maxDelayMs must be >= baseDelayMs, got: " + maxDelayMs);
        }
        this.baseDelayMs = baseDelayMs;
        this.maxDelayMs = maxDelayMs;
        this.jitter = jitter;
    }

    public static BackoffPolicy fromConfig(RegisterConfig config, Jitter jitter) {
        return new BackoffPolicy(config.getBackoffBaseMs(), config.getBackoffMaxMs(), jitter);
    }

    /** Upper bound of the delay before retry number {@code attempt} (1-based); 0 for attempt <= 0. */
    public long ceilingMs(int attempt) {
        if (attempt <= 0) {
            return 0L;
        }
        long expDelay;
        if (attempt >= 63) {
            expDelay = Long.MAX_VALUE;
        } else {
            long shift = 1L << (attempt - 1);
            // shift beyond max/base would overflow the multiplication
            expDelay = (baseDelayMs != 0 && shift > maxDelayMs / baseDelayMs)
                    ? Long.MAX_VALUE : baseDelayMs * shift;
        }
        return Math.min(maxDelayMs, expDelay);
    }

    public long delayMs(int attempt) {
        long ceiling = ceilingMs(attempt);
        if (jitter == Jitter.NONE || ceiling == 0) {
            return ceiling;
        }
        return ThreadLocalRandom.current().nextLong(ceiling + 1);
    }

    public long getBaseDelayMs() { return baseDelayMs; }
    public long getMaxDelayMs() { return maxDelayMs; }
    public Jitter getJitter() { return jitter; }
}

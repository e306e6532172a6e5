/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.eventrelay.messaging.retry;

import com.eventrelay.common.model.RegisterConfig;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class BackoffPolicyTest {

    @Test
    void ceilingDoublesUntilCapped() {
        BackoffPolicy policy = new BackoffPolicy(100, 1000, BackoffPolicy.Jitter.NONE);

        assertEquals(100, policy.ceilingMs(1));
        assertEquals(200, policy.ceilingMs(2));
        assertEquals(400, policy.ceilingMs(3));
        assertEquals(800, policy.ceilingMs(4));
        assertEquals(1000, policy.ceilingMs(5));
        assertEquals(1000, policy.ceilingMs(6));
    }

    @Test
    void nonPositiveAttemptHasNoDelay() {
        BackoffPolicy policy = new BackoffPolicy(100, 1000, BackoffPolicy.Jitter.FULL);

        assertEquals(0, policy.ceilingMs(0));
        assertEquals(0, policy.delayMs(-3));
    }

    @Test
    void withoutJitterDelaysNeverDecrease() {
        BackoffPolicy policy = new BackoffPolicy(200, 30_000, BackoffPolicy.Jitter.NONE);

        long previous = 0;
        for (int attempt = 1; attempt <= 20; attempt++) {
            long delay = policy.delayMs(attempt);
            assertTrue(delay >= previous, "attempt " + attempt + " went from " + previous + " to " + delay);
            assertTrue(delay <= 30_000);
            previous = delay;
        }
    }

    @Test
    void fullJitterStaysWithinCeiling() {
        BackoffPolicy policy = new BackoffPolicy(100, 5000, BackoffPolicy.Jitter.FULL);

        for (int i = 0; i < 200; i++) {
            long delay = policy.delayMs(4);
            assertTrue(delay >= 0 && delay <= 800, "Expected delay in [0, 800], got: " + delay);
        }
    }

    @Test
    void handlesAttemptCountAtOverflowBoundary() {
        BackoffPolicy policy = new BackoffPolicy(100, 60_000, BackoffPolicy.Jitter.NONE);

        assertEquals(60_000, policy.ceilingMs(31));
        assertEquals(60_000, policy.ceilingMs(63));
        assertEquals(60_000, policy.ceilingMs(Integer.MAX_VALUE));
    }

    @Test
    void zeroBaseDelayReturnsZero() {
        BackoffPolicy policy = new BackoffPolicy(0, 1000, BackoffPolicy.Jitter.FULL);

        assertEquals(0, policy.delayMs(1));
        assertEquals(0, policy.delayMs(10));
    }

    @Test
    void rejectsInvertedBounds() {
        assertThrows(IllegalArgumentException.class, () -> new BackoffPolicy(500, 100, BackoffPolicy.Jitter.NONE));
        assertThrows(IllegalArgumentException.class, () -> new BackoffPolicy(-1, 100, BackoffPolicy.Jitter.NONE));
    }

    @Test
    void readsBoundsFromConfig() {
        RegisterConfig config = new RegisterConfig();
        config.setBackoffBaseMs(25);
        config.setBackoffMaxMs(75);

        BackoffPolicy policy = BackoffPolicy.fromConfig(config, BackoffPolicy.Jitter.NONE);

        assertEquals(25, policy.delayMs(1));
        assertEquals(50, policy.delayMs(2));
        assertEquals(75, policy.delayMs(3));
    }
}

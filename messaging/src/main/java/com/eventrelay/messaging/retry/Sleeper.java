/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.eventrelay.messaging.retry;

/** Blocks the calling thread between retries. Replaced in tests to record delays. */
@FunctionalInterface
public interface Sleeper {

    Sleeper SYSTEM = millis -> {
        if (millis > 0) {
            Thread.sleep(millis);
        }
    };

    void sleep(long millis) throws InterruptedException;
}

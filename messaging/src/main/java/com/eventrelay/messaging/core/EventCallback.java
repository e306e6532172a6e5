/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.eventrelay.messaging.core;

import com.eventrelay.common.model.RelayEvent;

/**
 * Consumer-side handler for relayed events.
 *
 * <p>Runs synchronously before the delivery is acknowledged, so a crash mid-callback leads to
 * redelivery. Implementations must therefore be idempotent, keyed on {@link RelayEvent#getId()};
 * {@link RelayEvent#getAttemptCount()} tells how many times the event was handed back before.</p>
 */
@FunctionalInterface
public interface EventCallback {
    ConsumeOutcome onEvent(RelayEvent event);
}

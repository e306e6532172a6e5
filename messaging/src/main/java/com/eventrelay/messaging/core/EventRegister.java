/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.eventrelay.messaging.core;

import com.eventrelay.common.exception.PublishException;
import com.eventrelay.common.exception.ReadEventException;
import com.eventrelay.common.model.RelayEvent;

/**
 * The two operations business code needs to relay events through a broker.
 * Broker detail (queue names, bindings, routing keys) lives in configuration, not here.
 */
public interface EventRegister extends AutoCloseable {

    /**
     * Durably enqueue an event. Returns once the broker confirmed it; the event will then be
     * delivered at least once. Re-registering an id seen within the dedup window returns the
     * earlier {@link Ack} without enqueueing again. When more callers publish at once than there
     * are pooled channels, a call waits up to {@code connection_timeout_ms} for a free channel;
     * a pool still exhausted after that counts as UNREACHABLE.
     *
     * @throws IllegalArgumentException if the payload is empty
     * @throws PublishException         with reason UNREACHABLE, REJECTED or TIMEOUT
     */
    Ack registerEvent(RelayEvent event);

    /**
     * Start consuming events, handing each to {@code callback} and acknowledging according to
     * its {@link ConsumeOutcome}.
     *
     * @throws ReadEventException    if the consumer cannot be started
     * @throws IllegalStateException if this register already has an active subscription
     */
    Subscription readEvents(EventCallback callback);

    /** Cancel subscriptions, fail in-flight publishes, release the connection. */
    @Override
    void close();
}

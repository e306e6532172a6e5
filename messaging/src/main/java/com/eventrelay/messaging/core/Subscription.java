/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.eventrelay.messaging.core;

import java.time.Duration;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Handle on an active {@link EventRegister#readEvents} consumer.
 */
public interface Subscription {

    /** Queue this subscription consumes from. */
    String queueName();

    /** True until cancelled or failed. */
    boolean isActive();

    /**
     * Stop accepting deliveries, let the in-flight callback finish, then release the channel.
     * Calling it more than once is a no-op.
     */
    void cancel();

    /** The error that ended this subscription, if it ended with one. */
    Optional<Throwable> terminalError();

    /**
     * Register a listener for the terminal error. Invoked immediately if the subscription
     * has already failed. A failed subscription is not revived: callers re-subscribe.
     */
    void onTerminalError(Consumer<Throwable> listener);

    /** @return true if the subscription finished within the timeout */
    boolean awaitTermination(Duration timeout) throws InterruptedException;
}

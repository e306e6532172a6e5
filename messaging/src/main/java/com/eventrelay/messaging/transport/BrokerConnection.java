/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.eventrelay.messaging.transport;

import java.io.IOException;
import java.util.function.Consumer;

/**
 * A live broker connection that multiplexes {@link BrokerChannel}s.
 */
public interface BrokerConnection extends AutoCloseable {

    BrokerChannel createChannel() throws IOException;

    boolean isOpen();

    /** Notified once when the connection closes, whoever initiated it. */
    void addShutdownListener(Consumer<BrokerShutdown> listener);

    /** Close quietly; errors are logged, never thrown. */
    @Override
    void close();
}

/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.eventrelay.messaging.codec;

import com.eventrelay.common.exception.DecodeException;
import com.eventrelay.common.model.RelayEvent;
import com.eventrelay.messaging.transport.MessageProperties;

/**
 * Converts events to and from the bytes stored on the broker.
 */
public interface EnvelopeCodec {

    /** Header carrying the event's source tag, readable without decoding the body. */
    String SOURCE_TAG_HEADER = "x-source-tag";

    String contentType();

    byte[] encode(RelayEvent event);

    /**
     * @throws DecodeException if the body is not a well-formed envelope
     */
    RelayEvent decode(byte[] body);

    /** Broker-level properties for a publish of {@code event}. */
    MessageProperties properties(RelayEvent event);
}

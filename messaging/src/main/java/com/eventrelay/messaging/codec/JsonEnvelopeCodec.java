/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.eventrelay.messaging.codec;

import com.eventrelay.common.exception.DecodeException;
import com.eventrelay.common.model.RelayEvent;
import com.eventrelay.common.util.JsonUtil;
import com.eventrelay.messaging.transport.MessageProperties;

import java.io.IOException;
import java.util.HashMap;
import java.util.Map;

/**
 * Default codec: a {@link WireEnvelope} serialized with the shared Jackson mapper.
 */
public class JsonEnvelopeCodec implements EnvelopeCodec {

    public static final String CONTENT_TYPE = "application/json";

    @Override
    public String contentType() {
        return CONTENT_TYPE;
    }

    @Override
    public byte[] encode(RelayEvent event) {
        return JsonUtil.toJsonBytes(new WireEnvelope(event.getId(), event.getSourceTag(), event.getCreatedAt(),
                event.getAttemptCount(), event.getPayload()));
    }

    @Override
    public RelayEvent decode(byte[] body) {
        if (body == null || body.length == 0) {
            throw new DecodeException("Empty message body");
        }
        WireEnvelope envelope;
        try {
            envelope = JsonUtil.fromJsonBytes(body, WireEnvelope.class);
        } catch (IOException e) {
            throw new DecodeException("Malformed envelope: " + e.getMessage(), e);
        }
        if (envelope == null) {
            throw new DecodeException("Envelope is null");
        }
        if (envelope.getId() == null || envelope.getId().isBlank()) {
            throw new DecodeException("Envelope has no id");
        }
        if (envelope.getPayload() == null || envelope.getPayload().length == 0) {
            throw new DecodeException("Envelope " + envelope.getId() + " has an empty payload");
        }
        if (envelope.getAttemptCount() < 0) {
            throw new DecodeException("Envelope " + envelope.getId() + " has negative attempt_count "
                    + envelope.getAttemptCount());
        }
        return new RelayEvent(envelope.getId(), envelope.getPayload(), envelope.getCreatedAt(),
                envelope.getAttemptCount(), envelope.getSourceTag());
    }

    @Override
    public MessageProperties properties(RelayEvent event) {
        Map<String, Object> headers = new HashMap<>();
        if (event.getSourceTag() != null) {
            headers.put(SOURCE_TAG_HEADER, event.getSourceTag());
        }
        return new MessageProperties(event.getId(), CONTENT_TYPE, event.getCreatedAt(), true, headers);
    }
}

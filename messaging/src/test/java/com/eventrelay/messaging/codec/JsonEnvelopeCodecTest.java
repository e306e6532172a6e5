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
import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Base64;

import static org.junit.jupiter.api.Assertions.*;

class JsonEnvelopeCodecTest {

    private final JsonEnvelopeCodec codec = new JsonEnvelopeCodec();

    @Test
    void encodesSnakeCaseEnvelopeWithBase64Payload() throws Exception {
        byte[] payload = {0, 1, 2, (byte) 0xff};
        RelayEvent event = new RelayEvent("evt-7", payload, Instant.parse("2025-03-01T10:15:30Z"), 2, "billing");

        JsonNode json = JsonUtil.mapper().readTree(codec.encode(event));

        assertEquals("evt-7", json.get("id").asText());
        assertEquals("billing", json.get("source_tag").asText());
        assertEquals("2025-03-01T10:15:30Z", json.get("created_at").asText());
        assertEquals(2, json.get("attempt_count").asInt());
        assertEquals(Base64.getEncoder().encodeToString(payload), json.get("payload").asText());
    }

    @Test
    void decodeRestoresEvent() {
        RelayEvent event = new RelayEvent("evt-7", "body".getBytes(StandardCharsets.UTF_8),
                Instant.parse("2025-03-01T10:15:30Z"), 1, "billing");

        RelayEvent decoded = codec.decode(codec.encode(event));

        assertEquals(event, decoded);
    }

    @Test
    void rejectsMalformedJson() {
        DecodeException e = assertThrows(DecodeException.class,
                () -> codec.decode("{\"id\": ".getBytes(StandardCharsets.UTF_8)));
        assertEquals("RELAY_DECODE", e.getErrorCode());
    }

    @Test
    void rejectsEmptyBody() {
        assertThrows(DecodeException.class, () -> codec.decode(new byte[0]));
    }

    @Test
    void rejectsMissingId() {
        byte[] body = "{\"source_tag\":\"s\",\"payload\":\"AQI=\"}".getBytes(StandardCharsets.UTF_8);

        assertThrows(DecodeException.class, () -> codec.decode(body));
    }

    @Test
    void rejectsEmptyPayload() {
        byte[] body = "{\"id\":\"evt-1\",\"payload\":\"\"}".getBytes(StandardCharsets.UTF_8);

        assertThrows(DecodeException.class, () -> codec.decode(body));
    }

    @Test
    void rejectsNegativeAttemptCount() {
        byte[] body = "{\"id\":\"evt-1\",\"attempt_count\":-1,\"payload\":\"AQI=\"}".getBytes(StandardCharsets.UTF_8);

        assertThrows(DecodeException.class, () -> codec.decode(body));
    }

    @Test
    void propertiesCarryIdAndSourceTag() {
        RelayEvent event = RelayEvent.of("evt-9", "inventory", new byte[]{1});

        MessageProperties properties = codec.properties(event);

        assertEquals("evt-9", properties.messageId());
        assertEquals(JsonEnvelopeCodec.CONTENT_TYPE, properties.contentType());
        assertTrue(properties.persistent());
        assertEquals(event.getCreatedAt(), properties.timestamp());
        assertEquals("inventory", properties.headerString(EnvelopeCodec.SOURCE_TAG_HEADER));
    }
}

/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.eventrelay.messaging.register;

import com.eventrelay.common.model.RelayEvent;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/** Content-derived event ids: equal source tag and payload yield the same id. */
public final class EventIds {

    private EventIds() {}

    /** Lower-case hex SHA-256 of {@code sourceTag || 0x00 || payload}. */
    public static String derive(RelayEvent event) {
        MessageDigest digest;
        try {
            digest = MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
        if (event.getSourceTag() != null) {
            digest.update(event.getSourceTag().getBytes(StandardCharsets.UTF_8));
        }
        digest.update((byte) 0);
        digest.update(event.getPayload());
        return HexFormat.of().formatHex(digest.digest());
    }
}

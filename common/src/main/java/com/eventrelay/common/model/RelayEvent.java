/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.eventrelay.common.model;

import java.time.Instant;
import java.util.Arrays;
import java.util.Objects;

/**
 * A discrete domain event moving through the relay.
 *
 * <p>The payload is opaque to the relay and immutable once the event is built: it is copied
 * on the way in and on the way out. The {@code id} identifies the logical event and stays the
 * same across redeliveries; only {@code attemptCount} changes, through {@link #withAttemptCount}.</p>
 */
public final class RelayEvent {

    private final String id;
    private final byte[] payload;
    private final Instant createdAt;
    private final int attemptCount;
    private final String sourceTag;

    public RelayEvent(String id, byte[] payload, Instant createdAt, int attemptCount, String sourceTag) {
        if (attemptCount < 0) {
            throw new IllegalArgumentException("attemptCount must be >= 0, got: " + attemptCount);
        }
        this.id = id;
        this.payload = payload == null ? new byte[0] : payload.clone();
        this.createdAt = createdAt == null ? Instant.now() : createdAt;
        this.attemptCount = attemptCount;
        this.sourceTag = sourceTag;
    }

    /** New event with no id; the register derives one from the source tag and payload. */
    public static RelayEvent of(String sourceTag, byte[] payload) {
        return new RelayEvent(null, payload, Instant.now(), 0, sourceTag);
    }

    public static RelayEvent of(String id, String sourceTag, byte[] payload) {
        return new RelayEvent(id, payload, Instant.now(), 0, sourceTag);
    }

    public String getId() { return id; }
    public byte[] getPayload() { return payload.clone(); }
    public int getPayloadSize() { return payload.length; }
    public Instant getCreatedAt() { return createdAt; }
    public int getAttemptCount() { return attemptCount; }
    public String getSourceTag() { return sourceTag; }

    public RelayEvent withId(String newId) {
        return new RelayEvent(newId, payload, createdAt, attemptCount, sourceTag);
    }

    public RelayEvent withAttemptCount(int attempts) {
        return new RelayEvent(id, payload, createdAt, attempts, sourceTag);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RelayEvent other)) return false;
        return attemptCount == other.attemptCount
                && Objects.equals(id, other.id)
                && Arrays.equals(payload, other.payload)
                && Objects.equals(createdAt, other.createdAt)
                && Objects.equals(sourceTag, other.sourceTag);
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(id, createdAt, attemptCount, sourceTag);
        return 31 * result + Arrays.hashCode(payload);
    }

    @Override
    public String toString() {
        return "RelayEvent{id='" + id + "', source='" + sourceTag + "', attempt=" + attemptCount
                + ", payloadBytes=" + payload.length + "}";
    }
}

/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.eventrelay.messaging.codec;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * JSON body of a message on the work queue. The payload is base64-encoded by Jackson.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class WireEnvelope {

    @JsonProperty("id")
    private String id;

    @JsonProperty("source_tag")
    private String sourceTag;

    @JsonProperty("created_at")
    private Instant createdAt;

    @JsonProperty("attempt_count")
    private int attemptCount;

    @JsonProperty("payload")
    private byte[] payload;

    public WireEnvelope() {}

    public WireEnvelope(String id, String sourceTag, Instant createdAt, int attemptCount, byte[] payload) {
        this.id = id;
        this.sourceTag = sourceTag;
        this.createdAt = createdAt;
        this.attemptCount = attemptCount;
        this.payload = payload;
    }

    public String getId() { return id; }
    public void setId(String id) { this.id = id; }
    public String getSourceTag() { return sourceTag; }
    public void setSourceTag(String sourceTag) { this.sourceTag = sourceTag; }
    public Instant getCreatedAt() { return createdAt; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }
    public int getAttemptCount() { return attemptCount; }
    public void setAttemptCount(int attemptCount) { this.attemptCount = attemptCount; }
    public byte[] getPayload() { return payload; }
    public void setPayload(byte[] payload) { this.payload = payload; }
}

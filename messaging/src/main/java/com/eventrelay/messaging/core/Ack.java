/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.eventrelay.messaging.core;

import java.time.Instant;

/**
 * Proof that the broker durably accepted an event.
 *
 * @param eventId         id the event was published under
 * @param queue           queue the event was routed to
 * @param publishSequence publisher-confirm sequence number on the publishing channel
 * @param confirmedAt     when the confirm arrived
 */
public record Ack(String eventId, String queue, long publishSequence, Instant confirmedAt) {}

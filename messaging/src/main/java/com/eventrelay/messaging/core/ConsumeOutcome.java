/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.eventrelay.messaging.core;

/**
 * Recovery decision returned by an {@link EventCallback} for one delivery.
 */
public enum ConsumeOutcome {
    /** Processing succeeded: acknowledge and remove from the queue. */
    ACK,
    /** Transient failure: requeue, subject to the attempt cap. */
    RETRY_LATER,
    /** Permanent failure: move to the dead-letter queue and acknowledge the original. */
    QUARANTINE
}

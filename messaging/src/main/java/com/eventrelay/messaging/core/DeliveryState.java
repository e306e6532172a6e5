/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.eventrelay.messaging.core;

/**
 * Broker-side fate of one delivered message instance. Each instance leaves
 * {@link #UNACKNOWLEDGED} exactly once; a redelivery is a new instance.
 */
public enum DeliveryState {
    UNACKNOWLEDGED,
    ACKNOWLEDGED,
    REJECTED_REQUEUE,
    REJECTED_DISCARD
}

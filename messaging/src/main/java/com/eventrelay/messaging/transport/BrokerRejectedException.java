/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.eventrelay.messaging.transport;

import java.io.IOException;

/**
 * The broker answered a publish with a nack or returned it as unroutable.
 * Retrying the same message will not help.
 */
public class BrokerRejectedException extends IOException {
    public BrokerRejectedException(String message) {
        super(message);
    }
}

/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.eventrelay.messaging.transport;

/**
 * Why a connection or channel closed.
 *
 * @param cause                  underlying signal, never null
 * @param connectionLevel        true when the whole connection went away
 * @param initiatedByApplication true when our own code asked for the close
 */
public record BrokerShutdown(Throwable cause, boolean connectionLevel, boolean initiatedByApplication) {}

/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.resilientbroker.messaging.consume;

/** What to do with a failed message when no dead-letter sink is configured. */
public enum ExhaustionAction {
    /** Acknowledge and drop it. */
    ACK,
    /** Reject it without requeue, letting a broker-side dead-letter exchange pick it up. */
    REJECT
}

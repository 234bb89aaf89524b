/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.resilientbroker.messaging.core;

/**
 * Connection lifecycle states.
 *
 * <p>The supervisor moves between {@link #CONNECTING} and {@link #OPEN} and ends in
 * {@link #CLOSED}. A single logical connection additionally passes through
 * {@link #CLOSING} while it is being torn down.</p>
 */
public enum ConnectionState {
    CONNECTING,
    OPEN,
    CLOSING,
    CLOSED
}

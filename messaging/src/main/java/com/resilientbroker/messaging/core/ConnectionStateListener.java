/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.resilientbroker.messaging.core;

/**
 * Callback for supervisor state transitions. Called on supervisor threads,
 * outside any lock; implementations must be thread-safe and must not block.
 */
@FunctionalInterface
public interface ConnectionStateListener {
    /**
     * @param previous   state before the transition
     * @param current    state after the transition
     * @param generation generation of the current connection (0 before the first connect)
     * @param cause      failure that triggered the transition, or {@code null}
     */
    void onStateChange(ConnectionState previous, ConnectionState current, long generation, Throwable cause);
}

/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.resilientbroker.messaging.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Logs supervisor transitions using the client name as prefix.
 */
public class LoggingConnectionStateListener implements ConnectionStateListener {

    private static final Logger log = LoggerFactory.getLogger(LoggingConnectionStateListener.class);

    private final String clientName;

    public LoggingConnectionStateListener(String clientName) {
        this.clientName = clientName;
    }

    @Override
    public void onStateChange(ConnectionState previous, ConnectionState current, long generation, Throwable cause) {
        if (current == ConnectionState.CONNECTING && previous == ConnectionState.OPEN) {
            if (cause != null) {
                log.warn("[{}] connection to the broker was lost, recovering: {}", clientName, cause.getMessage());
            } else {
                log.warn("[{}] connection to the broker was lost, recovering", clientName);
            }
        } else if (current == ConnectionState.OPEN && generation > 1) {
            log.info("[{}] connection to the broker was recovered (generation {})", clientName, generation);
        } else if (current == ConnectionState.OPEN) {
            log.info("[{}] connection to the broker is established", clientName);
        } else if (current == ConnectionState.CLOSED) {
            log.info("[{}] connection to the broker is closed", clientName);
        }
    }
}

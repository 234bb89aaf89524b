/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.resilientbroker.common.exception;

/**
 * The broker connection is being (re)established and cannot serve requests yet.
 * Retryable.
 */
public class ConnectionNotReadyException extends BrokerClientException {
    public ConnectionNotReadyException(String message) {
        super("BRK_NOT_READY", message);
    }

    public ConnectionNotReadyException(String message, Throwable cause) {
        super("BRK_NOT_READY", message, cause);
    }
}

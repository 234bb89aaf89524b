/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.resilientbroker.common.exception;

/**
 * Raised when an operation is attempted on a client that has been shut down.
 */
public class ClientClosedException extends BrokerClientException {
    public ClientClosedException() {
        super("BRK_CLIENT_CLOSED", "Broker client is closed");
    }

    public ClientClosedException(String message) {
        super("BRK_CLIENT_CLOSED", message);
    }
}

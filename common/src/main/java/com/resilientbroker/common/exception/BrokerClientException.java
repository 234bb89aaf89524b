/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.resilientbroker.common.exception;

/**
 * Base exception for all broker client errors.
 */
public class BrokerClientException extends RuntimeException {
    private final String errorCode;

    public BrokerClientException(String message) {
        super(message);
        this.errorCode = "BRK_GENERIC";
    }

    public BrokerClientException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public BrokerClientException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public String getErrorCode() { return errorCode; }
}

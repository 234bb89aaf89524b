/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.resilientbroker.common.exception;

/**
 * A non-retryable checked failure, surfaced without further attempts.
 */
public class OperationFailedException extends BrokerClientException {
    private final int attempts;

    public OperationFailedException(int attempts, Throwable cause) {
        super("BRK_OPERATION_FAILED", "Operation failed on attempt " + attempts + ": " + cause.getMessage(), cause);
        this.attempts = attempts;
    }

    public int getAttempts() { return attempts; }
}

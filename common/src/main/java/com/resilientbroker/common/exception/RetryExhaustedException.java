/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.resilientbroker.common.exception;

/**
 * All retry attempts were consumed without success. The last failure is the cause.
 */
public class RetryExhaustedException extends BrokerClientException {
    private final int attempts;

    public RetryExhaustedException(int attempts, Throwable lastError) {
        super("BRK_RETRY_EXHAUSTED",
              "Gave up after " + attempts + " attempt(s): " + describe(lastError), lastError);
        this.attempts = attempts;
    }

    public int getAttempts() { return attempts; }

    private static String describe(Throwable t) {
        if (t == null) return "unknown error";
        return t.getMessage() != null ? t.getMessage() : t.getClass().getSimpleName();
    }
}

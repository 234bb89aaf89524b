/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.resilientbroker.common.exception;

/**
 * A message could not be written to the dead-letter destination.
 * The original delivery must stay unacknowledged.
 */
public class DeadLetterException extends BrokerClientException {
    public DeadLetterException(String message, Throwable cause) {
        super("BRK_DEAD_LETTER", message, cause);
    }
}

/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.resilientbroker.common.exception;

public class InvalidRequestException extends BrokerClientException {
    public InvalidRequestException(String message) {
        super("BRK_INVALID_REQUEST", message);
    }
}
